package io.github.hide212131.langchain4j.agentcore.runtime.tool;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.hide212131.langchain4j.agentcore.runtime.permission.PermissionRequest;
import java.util.Optional;

/**
 * モデルから呼び出せるツール。引数と結果はどちらも JSON 由来の値で受け渡す。
 */
public interface Tool {

    String name();

    String description();

    /** 引数の JSON Schema。 */
    JsonNode parametersSchema();

    /**
     * ツールを実行し、モデルへ返す文字列を得る。承認が必要な操作はツール自身が
     * {@link ToolContext#requirePermission} を呼ぶ。
     *
     * @throws ToolException 引数不正・承認拒否・実行失敗の場合
     */
    String execute(JsonNode args, ToolContext context);

    default boolean requiresApproval() {
        return true;
    }

    /** 結果が長くなりやすく、履歴へ入れる前に要約・切り詰めが必要か。 */
    default boolean needsSummarization(JsonNode args, String result) {
        return false;
    }

    /** 同じ引数なら同じ結果を返すとみなせるか。 */
    default boolean cacheable() {
        return false;
    }

    /**
     * この引数での実行に必要な承認。キャッシュ済みの結果を返すときも同じ承認を求めるため、
     * 承認が必要なツールはこれを返さない限りキャッシュされない。
     *
     * @throws ToolException 引数が不正な場合
     */
    default Optional<PermissionRequest> permissionRequest(JsonNode args) {
        return Optional.empty();
    }
}
