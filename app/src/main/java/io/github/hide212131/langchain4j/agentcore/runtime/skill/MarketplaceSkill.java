package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.util.Objects;
import java.util.Optional;

/**
 * スキル一覧に表示する 1 件分の情報。
 */
public record MarketplaceSkill(String name, String displayTitle, String description, String category,
        String dirName, String dirPath) {

    static final int DISPLAY_TITLE_LENGTH = 50;

    public MarketplaceSkill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(displayTitle, "displayTitle");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(dirName, "dirName");
        Objects.requireNonNull(dirPath, "dirPath");
    }

    public Optional<String> categoryValue() {
        return Optional.ofNullable(category);
    }

    /** 説明の先頭 50 文字に "..." を付けた表示用タイトル。 */
    static String displayTitle(String description) {
        int end = description.codePointCount(0, description.length()) > DISPLAY_TITLE_LENGTH
                ? description.offsetByCodePoints(0, DISPLAY_TITLE_LENGTH)
                : description.length();
        return description.substring(0, end) + "...";
    }
}
