package com.example.omnichat.channel;

import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.Channel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

/**
 * A customer message normalised by a channel adapter. This is also the record format of the inbound
 * Kafka topic.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage implements Serializable {

    private Channel channel;
    private String connectionId;
    private String customerIdentifier;
    private String customerName;
    private String text;

    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();

    private String platformMessageId;
    private Instant receivedAt;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    /**
     * Partition key: one customer's messages stay ordered on one partition.
     */
    @JsonIgnore
    public String identityKey() {
        return "%s:%s:%s".formatted(channel, connectionId, customerIdentifier);
    }

    /**
     * {@code channel:connectionId:platformMessageId}, or {@code null} when the platform gave no id.
     */
    @JsonIgnore
    public String dedupKey() {
        if (!StringUtils.hasText(platformMessageId)) {
            return null;
        }
        return "%s:%s:%s".formatted(channel, connectionId, platformMessageId);
    }

    @JsonIgnore
    public Attachment firstAttachment() {
        return attachments == null || attachments.isEmpty() ? null : attachments.get(0);
    }
}
