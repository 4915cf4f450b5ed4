package com.example.omnichat.channel;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.service.CustomerDetails;
import java.util.Optional;

/**
 * Outbound half of a channel integration. Implementations report platform errors through
 * {@link DeliveryResult#failed(String)} rather than throwing.
 */
public interface ChannelAdapter {

    Channel channel();

    DeliveryResult send(ConnectionConfig connection, OutboundMessage message);

    /**
     * Best-effort profile lookup for a customer seen for the first time.
     */
    default Optional<CustomerDetails> lookupCustomer(ConnectionConfig connection, String customerIdentifier) {
        return Optional.empty();
    }
}
