package com.example.omnichat.dto;

import lombok.Data;

/**
 * Body of socket events that only name a conversation.
 */
@Data
public class ConversationRef {

    private String conversationId;

    private String companyId;
}
