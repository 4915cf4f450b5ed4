package com.example.omnichat.channel;

import com.example.omnichat.domain.Channel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdapterRegistry {

    private final Map<Channel, ChannelAdapter> adapters = new EnumMap<>(Channel.class);

    public ChannelAdapterRegistry(List<ChannelAdapter> adapters) {
        for (ChannelAdapter adapter : adapters) {
            ChannelAdapter previous = this.adapters.put(adapter.channel(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.channel());
            }
        }
    }

    public ChannelAdapter forChannel(Channel channel) {
        ChannelAdapter adapter = adapters.get(channel);
        if (adapter == null) {
            throw new IllegalStateException("No channel adapter for " + channel);
        }
        return adapter;
    }
}
