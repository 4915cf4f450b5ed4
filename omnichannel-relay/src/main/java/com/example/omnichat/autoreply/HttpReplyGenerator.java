package com.example.omnichat.autoreply;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.MessageRole;
import java.time.Instant;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Calls the reply-generation service: {@code POST {endpoint}} with the conversation history, expecting
 * {@code {"text": "...", "model": "..."}} back.
 */
public class HttpReplyGenerator implements ReplyGenerator {

    private final RestClient restClient;
    private final String endpoint;

    public HttpReplyGenerator(RestClient restClient, String endpoint) {
        this.restClient = restClient;
        this.endpoint = endpoint;
    }

    @Override
    public GeneratedReply generate(String companyId, String conversationId, List<ChatMessage> recentMessages) {
        List<HistoryEntry> history = recentMessages.stream()
                .map(message -> new HistoryEntry(message.getRole(), message.getText(), message.getCreatedAt()))
                .toList();
        return restClient.post()
                .uri(endpoint)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(new GenerationRequest(companyId, conversationId, history))
                .retrieve()
                .body(GeneratedReply.class);
    }

    record GenerationRequest(String companyId, String conversationId, List<HistoryEntry> messages) {}

    record HistoryEntry(MessageRole role, String text, Instant createdAt) {}
}
