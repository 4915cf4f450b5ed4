package com.example.omnichat.dto;

import com.example.omnichat.domain.Attachment;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class WidgetMessageRequest {

    @NotBlank
    @Size(max = 128)
    private String sessionId;

    @Size(max = 4096)
    private String text;

    private Attachment attachment;

    private String name;

    private String pageUrl;
}
