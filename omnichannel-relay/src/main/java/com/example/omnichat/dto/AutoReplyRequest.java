package com.example.omnichat.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AutoReplyRequest {

    @NotNull
    private Boolean enabled;

    /**
     * Connection endpoint only: also apply the flag to the connection's active conversations.
     */
    private boolean applyToOpen;
}
