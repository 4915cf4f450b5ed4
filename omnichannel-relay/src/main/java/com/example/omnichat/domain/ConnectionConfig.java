package com.example.omnichat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig implements Serializable {

    public static final String ACCESS_TOKEN = "accessToken";
    public static final String BOT_TOKEN = "botToken";
    public static final String WEBHOOK_SECRET = "webhookSecret";

    private String id;
    private String companyId;
    private Channel channel;
    private String externalId;
    private String displayName;
    private boolean autoReplyDefault;
    private boolean active;
    private Instant createdAt;

    @ToString.Exclude
    private Map<String, String> credentials;

    public String credential(String name) {
        return credentials != null ? credentials.get(name) : null;
    }
}
