package com.example.omnichat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class WidgetSessionRequest {

    @NotBlank
    @Size(max = 128)
    private String sessionId;

    private String name;

    private String userAgent;

    private String pageUrl;
}
