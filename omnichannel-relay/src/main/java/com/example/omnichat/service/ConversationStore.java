package com.example.omnichat.service;

import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.domain.ConversationStatus;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface ConversationStore {

    Optional<Conversation> findById(String conversationId);

    /**
     * Newest OPEN or SNOOZED conversation for the identity, by last activity. Closed conversations are
     * never returned.
     */
    Optional<Conversation> findOpenByIdentity(ConversationIdentity identity);

    /**
     * Inserts a new conversation.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when another active conversation
     *     already exists for the same identity
     */
    Conversation insert(Conversation conversation);

    /**
     * Persists status, auto-reply flag and customer profile. Activity counters ({@code lastMessageAt},
     * {@code lastMessageRole}, {@code unreadCount}) belong to the message store and are left untouched.
     */
    Conversation update(Conversation conversation);

    /**
     * Writes only the customer name and attribute bag, and only while the conversation is OPEN or
     * SNOOZED.
     *
     * @return the updated conversation, or empty when it is missing or already closed
     */
    Optional<Conversation> updateCustomerProfile(String conversationId, String customerName, Map<String, Object> attributes);

    ConversationPage listForCompany(String companyId, Set<ConversationStatus> statuses, String cursor, int limit);

    /**
     * @return {@code true} when the conversation exists
     */
    boolean markRead(String conversationId);

    /**
     * Sets the auto-reply flag on every active conversation of a connection.
     *
     * @return number of conversations changed
     */
    int updateAutoReplyForConnection(String connectionId, boolean enabled);
}
