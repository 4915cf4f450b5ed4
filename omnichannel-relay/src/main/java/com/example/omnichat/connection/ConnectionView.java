package com.example.omnichat.connection;

import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/**
 * Connection as shown to agents. Secrets are left out, except the Telegram webhook secret which is
 * returned once at registration so it can be handed to {@code setWebhook}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionView(
        String id,
        String companyId,
        Channel channel,
        String externalId,
        String displayName,
        boolean autoReplyDefault,
        boolean active,
        Instant createdAt,
        String webhookSecret) {

    public static ConnectionView of(ConnectionConfig connection) {
        return new ConnectionView(
                connection.getId(),
                connection.getCompanyId(),
                connection.getChannel(),
                connection.getExternalId(),
                connection.getDisplayName(),
                connection.isAutoReplyDefault(),
                connection.isActive(),
                connection.getCreatedAt(),
                null);
    }

    public static ConnectionView registered(ConnectionConfig connection) {
        ConnectionView view = of(connection);
        if (connection.getChannel() != Channel.TELEGRAM) {
            return view;
        }
        return new ConnectionView(
                view.id(),
                view.companyId(),
                view.channel(),
                view.externalId(),
                view.displayName(),
                view.autoReplyDefault(),
                view.active(),
                view.createdAt(),
                connection.credential(ConnectionConfig.WEBHOOK_SECRET));
    }
}
