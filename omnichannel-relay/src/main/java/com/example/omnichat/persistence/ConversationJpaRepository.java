package com.example.omnichat.persistence;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.MessageRole;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ConversationJpaRepository extends JpaRepository<ConversationEntity, String> {

    Optional<ConversationEntity> findFirstByChannelAndConnectionIdAndCustomerIdentifierAndStatusInOrderByLastMessageAtDesc(
            Channel channel, String connectionId, String customerIdentifier, Collection<ConversationStatus> statuses);

    @Query(
            "select c from ConversationEntity c "
                    + "where c.companyId = :companyId and c.status in (:statuses) "
                    + "order by c.lastMessageAt desc, c.id desc")
    List<ConversationEntity> findPageForCompany(
            @Param("companyId") String companyId,
            @Param("statuses") Collection<ConversationStatus> statuses,
            Pageable pageable);

    @Query(
            "select c from ConversationEntity c "
                    + "where c.companyId = :companyId and c.status in (:statuses) "
                    + "and (c.lastMessageAt < :at or (c.lastMessageAt = :at and c.id < :id)) "
                    + "order by c.lastMessageAt desc, c.id desc")
    List<ConversationEntity> findPageForCompanyAfter(
            @Param("companyId") String companyId,
            @Param("statuses") Collection<ConversationStatus> statuses,
            @Param("at") Instant at,
            @Param("id") String id,
            Pageable pageable);

    /**
     * Moves activity counters for a customer message and wakes a snoozed conversation. The update takes
     * the row lock, so concurrent appends to one conversation are serialised here. Closed conversations
     * are not touched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c set "
                    + "c.lastMessageAt = case when c.lastMessageAt < :now then :now else c.lastMessageAt end, "
                    + "c.lastMessageRole = :role, "
                    + "c.unreadCount = c.unreadCount + 1, "
                    + "c.status = case when c.status = :snoozed then :open else c.status end, "
                    + "c.updatedAt = :now "
                    + "where c.id = :id and c.status <> :closed")
    int recordCustomerMessage(
            @Param("id") String id,
            @Param("role") MessageRole role,
            @Param("now") Instant now,
            @Param("snoozed") ConversationStatus snoozed,
            @Param("open") ConversationStatus open,
            @Param("closed") ConversationStatus closed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c set "
                    + "c.lastMessageAt = case when c.lastMessageAt < :now then :now else c.lastMessageAt end, "
                    + "c.lastMessageRole = :role, "
                    + "c.unreadCount = 0, "
                    + "c.updatedAt = :now "
                    + "where c.id = :id and c.status <> :closed")
    int recordReply(
            @Param("id") String id,
            @Param("role") MessageRole role,
            @Param("now") Instant now,
            @Param("closed") ConversationStatus closed);

    /**
     * Customer profile refresh from inbound traffic. Only the profile columns are written, and only while
     * the conversation is active, so a concurrent close or auto-reply toggle is never overwritten.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c set c.customerName = :name, c.attributes = :attributes, c.updatedAt = :now "
                    + "where c.id = :id and c.status in (:statuses)")
    int updateCustomerProfile(
            @Param("id") String id,
            @Param("name") String name,
            @Param("attributes") String attributes,
            @Param("statuses") Collection<ConversationStatus> statuses,
            @Param("now") Instant now);

    @Query("select c.lastMessageAt from ConversationEntity c where c.id = :id")
    Optional<Instant> findLastMessageAt(@Param("id") String id);

    @Query("select c.unreadCount from ConversationEntity c where c.id = :id")
    Optional<Integer> findUnreadCount(@Param("id") String id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update ConversationEntity c set c.unreadCount = 0, c.updatedAt = :now where c.id = :id")
    int resetUnread(@Param("id") String id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "update ConversationEntity c set c.autoReplyEnabled = :enabled, c.updatedAt = :now "
                    + "where c.connectionId = :connectionId and c.status in (:statuses) "
                    + "and c.autoReplyEnabled <> :enabled")
    int updateAutoReplyForConnection(
            @Param("connectionId") String connectionId,
            @Param("enabled") boolean enabled,
            @Param("statuses") Collection<ConversationStatus> statuses,
            @Param("now") Instant now);
}
