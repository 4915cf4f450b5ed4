package com.example.omnichat.autoreply;

import com.example.omnichat.domain.ChatMessage;
import java.util.List;

/**
 * Produces a reply for a conversation from its recent history. Retrieval and model selection live
 * behind this interface.
 */
public interface ReplyGenerator {

    GeneratedReply generate(String companyId, String conversationId, List<ChatMessage> recentMessages);

    default boolean isEnabled() {
        return true;
    }
}
