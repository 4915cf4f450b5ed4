package com.example.omnichat.autoreply;

import com.example.omnichat.domain.ChatMessage;
import java.util.List;

/**
 * Stand-in used when no generation endpoint is configured.
 */
public class DisabledReplyGenerator implements ReplyGenerator {

    @Override
    public GeneratedReply generate(String companyId, String conversationId, List<ChatMessage> recentMessages) {
        throw new IllegalStateException("Reply generation is not configured");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
