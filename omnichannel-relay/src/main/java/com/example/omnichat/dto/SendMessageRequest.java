package com.example.omnichat.dto;

import com.example.omnichat.domain.Attachment;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    @Size(max = 4096)
    private String text;

    private Attachment attachment;
}
