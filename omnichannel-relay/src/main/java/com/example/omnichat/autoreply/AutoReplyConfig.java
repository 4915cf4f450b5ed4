package com.example.omnichat.autoreply;

import com.example.omnichat.config.OmnichatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Slf4j
@Configuration
public class AutoReplyConfig {

    @Bean
    public ReplyGenerator replyGenerator(OmnichatProperties properties, RestClient.Builder restClientBuilder) {
        OmnichatProperties.AutoReply config = properties.getAutoReply();
        if (!StringUtils.hasText(config.getEndpoint())) {
            log.info("omnichat.auto-reply.endpoint not set; automatic replies are disabled");
            return new DisabledReplyGenerator();
        }
        int timeoutMillis = (int) config.getTimeout().toMillis();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Math.min(timeoutMillis, 5000));
        requestFactory.setReadTimeout(timeoutMillis);
        RestClient restClient = restClientBuilder.requestFactory(requestFactory).build();
        return new HttpReplyGenerator(restClient, config.getEndpoint());
    }
}
