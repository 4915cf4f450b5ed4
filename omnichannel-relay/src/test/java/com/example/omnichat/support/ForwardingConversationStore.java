package com.example.omnichat.support;

import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.service.ConversationPage;
import com.example.omnichat.service.ConversationStore;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Delegates every call; tests override the calls they need to interleave with.
 */
public class ForwardingConversationStore implements ConversationStore {

    private final ConversationStore delegate;

    public ForwardingConversationStore(ConversationStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Conversation> findById(String conversationId) {
        return delegate.findById(conversationId);
    }

    @Override
    public Optional<Conversation> findOpenByIdentity(ConversationIdentity identity) {
        return delegate.findOpenByIdentity(identity);
    }

    @Override
    public Conversation insert(Conversation conversation) {
        return delegate.insert(conversation);
    }

    @Override
    public Conversation update(Conversation conversation) {
        return delegate.update(conversation);
    }

    @Override
    public Optional<Conversation> updateCustomerProfile(
            String conversationId, String customerName, Map<String, Object> attributes) {
        return delegate.updateCustomerProfile(conversationId, customerName, attributes);
    }

    @Override
    public ConversationPage listForCompany(String companyId, Set<ConversationStatus> statuses, String cursor, int limit) {
        return delegate.listForCompany(companyId, statuses, cursor, limit);
    }

    @Override
    public boolean markRead(String conversationId) {
        return delegate.markRead(conversationId);
    }

    @Override
    public int updateAutoReplyForConnection(String connectionId, boolean enabled) {
        return delegate.updateAutoReplyForConnection(connectionId, enabled);
    }
}
