package com.example.omnichat.connection;

import com.example.omnichat.domain.Channel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

@Data
public class RegisterConnectionRequest {

    @NotNull
    private Channel channel;

    /**
     * Facebook page id, Instagram account id, Telegram bot username or widget public key.
     */
    @NotBlank
    private String externalId;

    private String displayName;

    private boolean autoReplyDefault;

    private Map<String, String> credentials = new HashMap<>();
}
