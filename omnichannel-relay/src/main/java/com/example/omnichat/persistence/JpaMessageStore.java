package com.example.omnichat.persistence;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.DeliveryStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.service.MessageDraft;
import com.example.omnichat.service.MessagePage;
import com.example.omnichat.service.MessageStore;
import com.example.omnichat.service.PageCursor;
import com.example.omnichat.service.exception.ConversationClosedException;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaMessageStore implements MessageStore {

    private final MessageJpaRepository messageJpaRepository;
    private final ConversationJpaRepository conversationJpaRepository;
    private final MessageEntityMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public ChatMessage append(String conversationId, MessageDraft draft) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        int updated = draft.getRole() == MessageRole.USER
                ? conversationJpaRepository.recordCustomerMessage(
                        conversationId,
                        MessageRole.USER,
                        now,
                        ConversationStatus.SNOOZED,
                        ConversationStatus.OPEN,
                        ConversationStatus.CLOSED)
                : conversationJpaRepository.recordReply(conversationId, draft.getRole(), now, ConversationStatus.CLOSED);
        if (updated == 0) {
            if (conversationJpaRepository.existsById(conversationId)) {
                throw new ConversationClosedException(conversationId);
            }
            throw ServiceException.notFound("Conversation", conversationId);
        }
        // The row lock taken above is held until commit, so this read and the insert are ordered
        // with every other append to the conversation.
        Instant createdAt = conversationJpaRepository.findLastMessageAt(conversationId).orElse(now);
        MessageEntity saved = messageJpaRepository.saveAndFlush(mapper.toEntity(conversationId, draft, createdAt));
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public MessagePage listPage(String conversationId, String cursor, int limit) {
        PageRequest page = PageRequest.of(0, limit + 1);
        PageCursor position = PageCursor.decode(cursor);
        List<MessageEntity> rows = position == null
                ? messageJpaRepository.findLatest(conversationId, page)
                : messageJpaRepository.findBefore(conversationId, position.timestamp(), position.numericId(), page);

        List<ChatMessage> messages = rows.stream().limit(limit).map(mapper::toDomain).toList();
        String nextCursor = null;
        if (rows.size() > limit) {
            ChatMessage last = messages.get(messages.size() - 1);
            nextCursor = PageCursor.encode(last.getCreatedAt(), last.getId());
        }
        return new MessagePage(messages, nextCursor);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessage> recent(String conversationId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<ChatMessage> newestFirst = new ArrayList<>(messageJpaRepository
                .findLatest(conversationId, PageRequest.of(0, limit))
                .stream()
                .map(mapper::toDomain)
                .toList());
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    @Transactional(readOnly = true)
    public int countUnread(String conversationId) {
        return conversationJpaRepository
                .findUnreadCount(conversationId)
                .orElseThrow(() -> ServiceException.notFound("Conversation", conversationId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessage> findById(Long messageId) {
        if (messageId == null) {
            return Optional.empty();
        }
        return messageJpaRepository.findById(messageId).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public Optional<ChatMessage> updateDelivery(
            Long messageId, DeliveryStatus status, String platformMessageId, String deliveryError) {
        return messageJpaRepository.findById(messageId).map(entity -> {
            entity.setDeliveryStatus(status);
            if (StringUtils.hasText(platformMessageId)) {
                entity.setPlatformMessageId(platformMessageId);
            }
            entity.setDeliveryError(status == DeliveryStatus.FAILED ? truncateError(deliveryError) : null);
            return mapper.toDomain(messageJpaRepository.saveAndFlush(entity));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByDedupKey(String dedupKey) {
        return StringUtils.hasText(dedupKey) && messageJpaRepository.existsByDedupKey(dedupKey);
    }

    private String truncateError(String error) {
        if (error == null || error.length() <= 1024) {
            return error;
        }
        return error.substring(0, 1024);
    }
}
