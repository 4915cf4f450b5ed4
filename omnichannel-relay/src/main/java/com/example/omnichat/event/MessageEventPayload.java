package com.example.omnichat.event;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageEventPayload implements Serializable {

    private String conversationId;
    private ChatMessage message;
    private Conversation conversation;
}
