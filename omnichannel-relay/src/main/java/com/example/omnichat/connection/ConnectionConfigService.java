package com.example.omnichat.connection;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.persistence.ConnectionConfigEntity;
import com.example.omnichat.persistence.ConnectionConfigEntityMapper;
import com.example.omnichat.persistence.ConnectionConfigJpaRepository;
import com.example.omnichat.service.ConversationStore;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionConfigService {

    private final ConnectionConfigJpaRepository repository;
    private final ConnectionConfigEntityMapper mapper;
    private final ConversationStore conversationStore;
    private final Clock clock;

    @Transactional
    public ConnectionConfig register(String companyId, RegisterConnectionRequest request) {
        String externalId = request.getExternalId().trim();
        if (repository.existsByChannelAndExternalId(request.getChannel(), externalId)) {
            throw ServiceException.conflict(
                    "%s connection %s is already registered".formatted(request.getChannel(), externalId),
                    "connection_exists");
        }
        Map<String, String> credentials = request.getCredentials() != null ? new HashMap<>(request.getCredentials()) : new HashMap<>();
        requireCredentials(request.getChannel(), credentials);
        if (request.getChannel() == Channel.TELEGRAM && !StringUtils.hasText(credentials.get(ConnectionConfig.WEBHOOK_SECRET))) {
            credentials.put(ConnectionConfig.WEBHOOK_SECRET, UUID.randomUUID().toString().replace("-", ""));
        }
        ConnectionConfig connection = ConnectionConfig.builder()
                .id(UUID.randomUUID().toString())
                .companyId(companyId)
                .channel(request.getChannel())
                .externalId(externalId)
                .displayName(StringUtils.hasText(request.getDisplayName()) ? request.getDisplayName() : externalId)
                .autoReplyDefault(request.isAutoReplyDefault())
                .active(true)
                .credentials(credentials)
                .createdAt(clock.instant())
                .build();
        repository.save(mapper.toEntity(connection));
        log.info("Registered {} connection {} for company {}", connection.getChannel(), connection.getId(), companyId);
        return connection;
    }

    @Transactional(readOnly = true)
    public List<ConnectionConfig> listForCompany(String companyId) {
        return repository.findByCompanyIdOrderByCreatedAtAsc(companyId).stream()
                .map(mapper::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<ConnectionConfig> findActive(String connectionId) {
        if (!StringUtils.hasText(connectionId)) {
            return Optional.empty();
        }
        return repository.findById(connectionId).filter(ConnectionConfigEntity::isActive).map(mapper::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<ConnectionConfig> findActiveByExternalId(Channel channel, String externalId) {
        if (!StringUtils.hasText(externalId)) {
            return Optional.empty();
        }
        return repository.findByChannelAndExternalIdAndActiveTrue(channel, externalId).map(mapper::toDomain);
    }

    public ConnectionConfig require(String connectionId) {
        return findActive(connectionId).orElseThrow(() -> ServiceException.notFound("Connection", connectionId));
    }

    /**
     * Changes the auto-reply default for new conversations and, when {@code applyToOpen} is set, for the
     * connection's active conversations as well.
     */
    @Transactional
    public ConnectionConfig updateAutoReplyDefault(
            String companyId, String connectionId, boolean enabled, boolean applyToOpen) {
        ConnectionConfigEntity entity = repository
                .findById(connectionId)
                .filter(candidate -> candidate.getCompanyId().equals(companyId))
                .orElseThrow(() -> ServiceException.notFound("Connection", connectionId));
        entity.setAutoReplyDefault(enabled);
        repository.save(entity);
        if (applyToOpen) {
            int changed = conversationStore.updateAutoReplyForConnection(connectionId, enabled);
            log.info("Auto-reply {} on {} open conversations of connection {}",
                    enabled ? "enabled" : "disabled", changed, connectionId);
        }
        return mapper.toDomain(entity);
    }

    private void requireCredentials(Channel channel, Map<String, String> credentials) {
        String required = switch (channel) {
            case FACEBOOK, INSTAGRAM -> ConnectionConfig.ACCESS_TOKEN;
            case TELEGRAM -> ConnectionConfig.BOT_TOKEN;
            case WIDGET -> null;
        };
        if (required != null && !StringUtils.hasText(credentials.get(required))) {
            throw new IllegalArgumentException("%s connections require the %s credential".formatted(channel, required));
        }
    }
}
