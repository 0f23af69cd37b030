package io.github.hide212131.langchain4j.agentcore.runtime.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import java.util.List;

/**
 * 外部 API を使わずに分類・計画・ツール呼び出しの流れを一通り返すモデル。
 */
final class DryRunChatModel implements ChatModel {

    static final String PLAN_REPLY = "{\"tasks\":[{\"id\":\"1\",\"description\":\"List the workspace files\","
            + "\"dependencies\":[]}]}";
    static final String TOOL_REPLY = "{\"tool\": \"filesystem\", \"args\": {\"operation\": \"list_dir\", \"path\": \".\"}}";

    @Override
    public ChatResponse doChat(ChatRequest request) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(reply(request.messages())))
                .tokenUsage(new TokenUsage(0, 0, 0))
                .build();
    }

    private static String reply(List<ChatMessage> messages) {
        String system = "";
        String lastUser = "";
        for (ChatMessage message : messages) {
            if (message instanceof SystemMessage systemMessage) {
                system = systemMessage.text();
            } else if (message instanceof UserMessage userMessage && userMessage.hasSingleText()) {
                lastUser = userMessage.singleText();
            }
        }
        if (system.contains("\"SIMPLE\" or \"COMPLEX\"")) {
            return "COMPLEX";
        }
        if (system.contains("\"tasks\"")) {
            return PLAN_REPLY;
        }
        if (lastUser.startsWith("Tool '")) {
            return "Dry run finished. The last tool returned:\n" + lastUser;
        }
        if (system.contains("\"tool\"")) {
            return TOOL_REPLY;
        }
        return "dry-run: " + lastUser;
    }
}
