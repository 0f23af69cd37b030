package io.github.hide212131.langchain4j.agentcore.runtime.planning;

/**
 * LLM の応答から JSON 本体を切り出す。
 */
public final class JsonFrames {

    private JsonFrames() {
        throw new AssertionError("インスタンス化できません");
    }

    /**
     * 最初の '{' から最後の '}' までを返す。波括弧の組が見つからなければ前後の空白を除いた全文を返す。
     */
    public static String extract(String text) {
        if (text == null) {
            return "";
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end >= start) {
            return text.substring(start, end + 1);
        }
        return text.trim();
    }
}
