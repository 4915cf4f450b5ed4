package com.example.omnichat.persistence;

import com.example.omnichat.domain.Channel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "connection_configs",
        uniqueConstraints =
                @UniqueConstraint(name = "uk_connection_configs_external", columnNames = {"channel", "external_id"}),
        indexes = @Index(name = "idx_connection_configs_company", columnList = "company_id"))
public class ConnectionConfigEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Column(name = "company_id", nullable = false, updatable = false, length = 64)
    private String companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, updatable = false, length = 32)
    private Channel channel;

    @Column(name = "external_id", nullable = false, length = 191)
    private String externalId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "auto_reply_default", nullable = false)
    private boolean autoReplyDefault;

    @Column(name = "active", nullable = false)
    private boolean active;

    /**
     * AES-GCM encrypted JSON object of channel secrets.
     */
    @Column(name = "credentials_enc", columnDefinition = "text")
    private String credentialsEnc;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
