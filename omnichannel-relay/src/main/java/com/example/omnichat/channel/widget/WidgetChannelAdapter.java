package com.example.omnichat.channel.widget;

import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.channel.OutboundMessage;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import org.springframework.stereotype.Component;

/**
 * Widget customers read replies from the conversation room, which already received the message when it
 * was stored.
 */
@Component
public class WidgetChannelAdapter implements ChannelAdapter {

    @Override
    public Channel channel() {
        return Channel.WIDGET;
    }

    @Override
    public DeliveryResult send(ConnectionConfig connection, OutboundMessage message) {
        return DeliveryResult.sent(null);
    }
}
