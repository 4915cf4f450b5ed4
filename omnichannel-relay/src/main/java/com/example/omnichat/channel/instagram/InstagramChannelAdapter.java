package com.example.omnichat.channel.instagram;

import com.example.omnichat.channel.meta.MetaChannelAdapter;
import com.example.omnichat.channel.meta.MetaGraphClient;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.service.CustomerDetails;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class InstagramChannelAdapter extends MetaChannelAdapter {

    static final String HANDLE_ATTRIBUTE = "instagramHandle";

    public InstagramChannelAdapter(MetaGraphClient graphClient) {
        super(graphClient);
    }

    @Override
    public Channel channel() {
        return Channel.INSTAGRAM;
    }

    @Override
    protected String profileFields() {
        return "name,username";
    }

    @Override
    protected CustomerDetails toCustomer(Map<String, Object> profile) {
        String name = text(profile, "name");
        String username = text(profile, "username");
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (username != null) {
            attributes.put(HANDLE_ATTRIBUTE, username);
        }
        if (name == null && attributes.isEmpty()) {
            return null;
        }
        return new CustomerDetails(name != null ? name : username, attributes);
    }
}
