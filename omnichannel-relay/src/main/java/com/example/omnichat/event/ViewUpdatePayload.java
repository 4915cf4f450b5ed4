package com.example.omnichat.event;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViewUpdatePayload implements Serializable {

    private ViewUpdateType type;
    private String conversationId;
    private Conversation conversation;
    private ChatMessage message;
}
