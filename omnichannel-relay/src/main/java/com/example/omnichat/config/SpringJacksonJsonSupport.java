package com.example.omnichat.config;

import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Socket.IO frames use the same date and unknown-field handling as the REST API, so a message pushed
 * over a socket and the same message fetched over HTTP look identical to the client.
 */
public class SpringJacksonJsonSupport extends JacksonJsonSupport {

    public SpringJacksonJsonSupport(ObjectMapper baseMapper) {
        super(new JavaTimeModule());

        if (!baseMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)) {
            this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
        if (!baseMapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)) {
            this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        }
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
    }
}
