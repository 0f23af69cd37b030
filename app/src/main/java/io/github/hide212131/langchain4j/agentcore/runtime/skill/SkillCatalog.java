package io.github.hide212131.langchain4j.agentcore.runtime.skill;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * スキルディレクトリ直下の各スキルを一覧化する。解析できないスキルは警告に回して続行する。
 */
public final class SkillCatalog {

    private SkillCatalog() {
        throw new AssertionError("インスタンス化できません");
    }

    public static LoadResult list(Path skillsDirectory) {
        Objects.requireNonNull(skillsDirectory, "skillsDirectory");
        if (!Files.isDirectory(skillsDirectory)) {
            return new LoadResult(List.of(), List.of());
        }
        List<MarketplaceSkill> skills = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Path> directories;
        try (Stream<Path> entries = Files.list(skillsDirectory)) {
            directories = entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read skills directory: " + ex.getMessage(), ex);
        }
        for (Path directory : directories) {
            Path manifest = directory.resolve(SkillLoader.MANIFEST);
            if (!Files.exists(manifest)) {
                continue;
            }
            try {
                ParsedSkill parsed = SkillManifestParser.parse(Files.readString(manifest, StandardCharsets.UTF_8));
                skills.add(new MarketplaceSkill(parsed.name(), MarketplaceSkill.displayTitle(parsed.description()),
                        parsed.description(), parsed.category(), directory.getFileName().toString(),
                        directory.toString()));
            } catch (SkillParseException ex) {
                warnings.add("Failed to parse SKILL.md in " + directory + ": " + ex.getMessage());
            } catch (IOException ex) {
                warnings.add("Failed to read SKILL.md in " + directory + ": " + ex.getMessage());
            }
        }
        return new LoadResult(List.copyOf(skills), List.copyOf(warnings));
    }

    /** スキルディレクトリ直下を {@link SkillLoader#load} でまとめて読み込む。 */
    public static List<LoadedSkill> loadAll(Path skillsDirectory, List<String> warnings) {
        Objects.requireNonNull(warnings, "warnings");
        List<LoadedSkill> loaded = new ArrayList<>();
        LoadResult listed = list(skillsDirectory);
        warnings.addAll(listed.warnings());
        for (MarketplaceSkill entry : listed.skills()) {
            try {
                loaded.add(SkillLoader.load(Path.of(entry.dirPath())));
            } catch (IllegalArgumentException | IllegalStateException | SkillParseException ex) {
                warnings.add("Failed to load skill " + entry.dirName() + ": " + ex.getMessage());
            }
        }
        return List.copyOf(loaded);
    }

    public record LoadResult(List<MarketplaceSkill> skills, List<String> warnings) {
    }
}
