package com.example.omnichat.event;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PresencePayload implements Serializable {

    private String conversationId;
    private String sessionId;
    private Instant at;
}
