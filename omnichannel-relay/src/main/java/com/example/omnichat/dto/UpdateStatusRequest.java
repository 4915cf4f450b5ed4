package com.example.omnichat.dto;

import com.example.omnichat.domain.ConversationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateStatusRequest {

    @NotNull
    private ConversationStatus status;
}
