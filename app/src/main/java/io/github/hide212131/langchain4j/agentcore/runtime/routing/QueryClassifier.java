package io.github.hide212131.langchain4j.agentcore.runtime.routing;

import io.github.hide212131.langchain4j.agentcore.runtime.VisibilityLog;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionException;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionProvider;
import io.github.hide212131.langchain4j.agentcore.runtime.provider.CompletionRequest;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * 問い合わせを SIMPLE / COMPLEX に振り分ける。
 *
 * <p>
 * まず小文字化した文字列に対して COMPLEX のマーカーを部分一致で調べ、次に SIMPLE のマーカーを調べる。
 * どちらにも当たらなければ LLM に 1 語で答えさせる。LLM の失敗や曖昧な応答は COMPLEX に倒す。
 */
public final class QueryClassifier {

    static final List<String> COMPLEX_MARKERS = List.of("create", "write", "make", "build", "generate", "implement",
            "edit", "modify", "change", "update", "fix", "refactor", "delete", "remove", "run", "execute", "install",
            "file", "folder", "directory", "code", "script", "search for", "find", "list files", "read file", "commit",
            "push", "pull", "deploy", "test", "debug", "compile", "lint");

    static final List<String> SIMPLE_MARKERS = List.of("hello", "hi", "hey", "good morning", "good afternoon",
            "good evening", "how are you", "what's up", "thanks", "thank you", "bye", "goodbye", "what is", "what are",
            "who is", "who are", "why is", "why are", "explain", "tell me about", "describe", "define", "can you help",
            "help me understand");

    static final String CLASSIFIER_PREAMBLE = """
            You are a query classifier. Classify the user's query into one of two categories:

            SIMPLE - Queries that can be answered with just conversation/knowledge:
            - Greetings and small talk
            - General knowledge questions
            - Explanations and definitions
            - Opinions and advice
            - Simple Q&A

            COMPLEX - Queries that require tools, file operations, or multi-step execution:
            - Creating, editing, or deleting files
            - Running commands or scripts
            - Searching codebases
            - Building or deploying software
            - Any task requiring system access

            Respond with ONLY one word: "SIMPLE" or "COMPLEX\"""";

    private static final VisibilityLog LOG = VisibilityLog.forClass(QueryClassifier.class);

    private final CompletionProvider provider;

    public QueryClassifier(CompletionProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public QueryClass classify(String query) {
        Objects.requireNonNull(query, "query");
        Optional<QueryClass> matched = matchMarkers(query);
        if (matched.isPresent()) {
            return matched.get();
        }
        return classifyWithModel(query);
    }

    /** マーカー一覧だけで判定する。どちらにも当たらなければ空。 */
    static Optional<QueryClass> matchMarkers(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        for (String marker : COMPLEX_MARKERS) {
            if (lower.contains(marker)) {
                LOG.debug("-", "-", "routing", "marker", "COMPLEX と判定しました: " + marker);
                return Optional.of(QueryClass.COMPLEX);
            }
        }
        for (String marker : SIMPLE_MARKERS) {
            if (lower.contains(marker)) {
                LOG.debug("-", "-", "routing", "marker", "SIMPLE と判定しました: " + marker);
                return Optional.of(QueryClass.SIMPLE);
            }
        }
        return Optional.empty();
    }

    private QueryClass classifyWithModel(String query) {
        String reply;
        try {
            reply = provider.complete(CompletionRequest.of(CLASSIFIER_PREAMBLE, query));
        } catch (CompletionException ex) {
            LOG.warn("-", "-", "routing", "llm", "分類に失敗したため COMPLEX として扱います", query, ex);
            return QueryClass.COMPLEX;
        }
        QueryClass result = reply != null && reply.trim().toUpperCase(Locale.ROOT).contains("SIMPLE")
                ? QueryClass.SIMPLE
                : QueryClass.COMPLEX;
        LOG.info("-", "-", "routing", "llm", "LLM による分類", query, result.name());
        return result;
    }
}
