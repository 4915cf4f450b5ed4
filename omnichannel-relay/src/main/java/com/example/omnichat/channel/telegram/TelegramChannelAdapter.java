package com.example.omnichat.channel.telegram;

import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.channel.OutboundMessage;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class TelegramChannelAdapter implements ChannelAdapter {

    private final TelegramBotClient botClient;

    public TelegramChannelAdapter(TelegramBotClient botClient) {
        this.botClient = botClient;
    }

    @Override
    public Channel channel() {
        return Channel.TELEGRAM;
    }

    @Override
    public DeliveryResult send(ConnectionConfig connection, OutboundMessage message) {
        String botToken = connection.credential(ConnectionConfig.BOT_TOKEN);
        if (!StringUtils.hasText(botToken)) {
            return DeliveryResult.failed("Connection %s has no bot token".formatted(connection.getId()));
        }
        return botClient.send(botToken, message.recipient(), message.text(), message.attachment());
    }
}
