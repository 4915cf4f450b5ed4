package com.example.omnichat.service;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.DeliveryStatus;
import java.util.List;
import java.util.Optional;

/**
 * Append-only message log. Every append also moves the owning conversation's activity counters in the
 * same transaction: a customer message increments the unread count, an agent or bot message resets it.
 */
public interface MessageStore {

    /**
     * @throws com.example.omnichat.service.exception.ServiceException when the conversation does not exist
     * @throws org.springframework.dao.DataIntegrityViolationException when the draft's dedup key was
     *     already stored
     */
    ChatMessage append(String conversationId, MessageDraft draft);

    /**
     * Page of messages newest first. The cursor is the {@code nextCursor} of the previous page.
     */
    MessagePage listPage(String conversationId, String cursor, int limit);

    /**
     * Most recent messages in chronological order.
     */
    List<ChatMessage> recent(String conversationId, int limit);

    int countUnread(String conversationId);

    Optional<ChatMessage> findById(Long messageId);

    Optional<ChatMessage> updateDelivery(
            Long messageId, DeliveryStatus status, String platformMessageId, String deliveryError);

    boolean existsByDedupKey(String dedupKey);
}
