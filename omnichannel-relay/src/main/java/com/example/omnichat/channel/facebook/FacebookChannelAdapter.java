package com.example.omnichat.channel.facebook;

import com.example.omnichat.channel.meta.MetaChannelAdapter;
import com.example.omnichat.channel.meta.MetaGraphClient;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.service.CustomerDetails;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

@Component
public class FacebookChannelAdapter extends MetaChannelAdapter {

    public FacebookChannelAdapter(MetaGraphClient graphClient) {
        super(graphClient);
    }

    @Override
    public Channel channel() {
        return Channel.FACEBOOK;
    }

    @Override
    protected String profileFields() {
        return "first_name,last_name";
    }

    @Override
    protected CustomerDetails toCustomer(Map<String, Object> profile) {
        StringJoiner name = new StringJoiner(" ");
        String first = text(profile, "first_name");
        String last = text(profile, "last_name");
        if (first != null) {
            name.add(first);
        }
        if (last != null) {
            name.add(last);
        }
        return name.length() == 0 ? null : new CustomerDetails(name.toString(), Map.of());
    }
}
