package com.example.omnichat.persistence;

import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.service.ConversationPage;
import com.example.omnichat.service.ConversationStore;
import com.example.omnichat.service.PageCursor;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ConversationJpaRepository conversationJpaRepository;
    private final ConversationEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findById(String conversationId) {
        if (!StringUtils.hasText(conversationId)) {
            return Optional.empty();
        }
        return conversationJpaRepository.findById(conversationId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Conversation> findOpenByIdentity(ConversationIdentity identity) {
        return conversationJpaRepository
                .findFirstByChannelAndConnectionIdAndCustomerIdentifierAndStatusInOrderByLastMessageAtDesc(
                        identity.channel(),
                        identity.connectionId(),
                        identity.customerIdentifier(),
                        ConversationStatus.ACTIVE)
                .map(mapper::toDomain);
    }

    @Override
    @Transactional
    public Conversation insert(Conversation conversation) {
        Instant now = now();
        Conversation normalized = conversation.toBuilder()
                .createdAt(truncate(conversation.getCreatedAt(), now))
                .updatedAt(truncate(conversation.getUpdatedAt(), now))
                .lastMessageAt(truncate(conversation.getLastMessageAt(), now))
                .build();
        ConversationEntity saved = conversationJpaRepository.saveAndFlush(mapper.toEntity(normalized));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional
    public Conversation update(Conversation conversation) {
        ConversationEntity entity = conversationJpaRepository
                .findById(conversation.getId())
                .orElseThrow(() -> ServiceException.notFound("Conversation", conversation.getId()));
        mapper.applyMutableFields(conversation.toBuilder().updatedAt(now()).build(), entity);
        return mapper.toDomain(conversationJpaRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public Optional<Conversation> updateCustomerProfile(
            String conversationId, String customerName, Map<String, Object> attributes) {
        int updated = conversationJpaRepository.updateCustomerProfile(
                conversationId, customerName, mapper.writeJson(attributes), ConversationStatus.ACTIVE, now());
        if (updated == 0) {
            return Optional.empty();
        }
        return conversationJpaRepository.findById(conversationId).map(mapper::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public ConversationPage listForCompany(
            String companyId, Set<ConversationStatus> statuses, String cursor, int limit) {
        Set<ConversationStatus> filter = CollectionUtils.isEmpty(statuses)
                ? EnumSet.allOf(ConversationStatus.class)
                : statuses;
        PageRequest page = PageRequest.of(0, limit + 1);
        PageCursor position = PageCursor.decode(cursor);
        List<ConversationEntity> rows = position == null
                ? conversationJpaRepository.findPageForCompany(companyId, filter, page)
                : conversationJpaRepository.findPageForCompanyAfter(
                        companyId, filter, position.timestamp(), position.id(), page);

        List<Conversation> conversations = rows.stream().limit(limit).map(mapper::toDomain).toList();
        String nextCursor = null;
        if (rows.size() > limit) {
            Conversation last = conversations.get(conversations.size() - 1);
            nextCursor = PageCursor.encode(last.getLastMessageAt(), last.getId());
        }
        return new ConversationPage(conversations, nextCursor);
    }

    @Override
    @Transactional
    public boolean markRead(String conversationId) {
        return conversationJpaRepository.resetUnread(conversationId, now()) > 0;
    }

    @Override
    @Transactional
    public int updateAutoReplyForConnection(String connectionId, boolean enabled) {
        return conversationJpaRepository.updateAutoReplyForConnection(
                connectionId, enabled, ConversationStatus.ACTIVE, now());
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private Instant truncate(Instant value, Instant fallback) {
        return value != null ? value.truncatedTo(ChronoUnit.MILLIS) : fallback;
    }
}
