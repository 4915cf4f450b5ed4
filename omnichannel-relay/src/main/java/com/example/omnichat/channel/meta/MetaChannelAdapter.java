package com.example.omnichat.channel.meta;

import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.channel.OutboundMessage;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.service.CustomerDetails;
import java.util.Map;
import java.util.Optional;
import org.springframework.util.StringUtils;

/**
 * Send path shared by Messenger and Instagram: both go through {@code /me/messages} with the
 * connection's page access token.
 */
public abstract class MetaChannelAdapter implements ChannelAdapter {

    protected final MetaGraphClient graphClient;

    protected MetaChannelAdapter(MetaGraphClient graphClient) {
        this.graphClient = graphClient;
    }

    @Override
    public DeliveryResult send(ConnectionConfig connection, OutboundMessage message) {
        String accessToken = connection.credential(ConnectionConfig.ACCESS_TOKEN);
        if (!StringUtils.hasText(accessToken)) {
            return DeliveryResult.failed("Connection %s has no access token".formatted(connection.getId()));
        }
        return graphClient.sendMessage(accessToken, message.recipient(), message.text(), message.attachment());
    }

    @Override
    public Optional<CustomerDetails> lookupCustomer(ConnectionConfig connection, String customerIdentifier) {
        String accessToken = connection.credential(ConnectionConfig.ACCESS_TOKEN);
        if (!StringUtils.hasText(accessToken)) {
            return Optional.empty();
        }
        Map<String, Object> profile = graphClient.fetchProfile(accessToken, customerIdentifier, profileFields());
        return profile.isEmpty() ? Optional.empty() : Optional.ofNullable(toCustomer(profile));
    }

    protected abstract String profileFields();

    protected abstract CustomerDetails toCustomer(Map<String, Object> profile);

    protected static String text(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof String string && StringUtils.hasText(string) ? string : null;
    }
}
