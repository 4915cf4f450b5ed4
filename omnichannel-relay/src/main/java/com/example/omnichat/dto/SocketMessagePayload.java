package com.example.omnichat.dto;

import com.example.omnichat.domain.Attachment;
import lombok.Data;

@Data
public class SocketMessagePayload {

    private String conversationId;

    private String text;

    private Attachment attachment;
}
