package com.example.omnichat.persistence;

import com.example.omnichat.connection.CredentialCipher;
import com.example.omnichat.domain.ConnectionConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collections;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Component
@RequiredArgsConstructor
public class ConnectionConfigEntityMapper {

    private static final TypeReference<Map<String, String>> CREDENTIALS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final CredentialCipher cipher;

    public ConnectionConfigEntity toEntity(ConnectionConfig connection) {
        ConnectionConfigEntity entity = new ConnectionConfigEntity();
        entity.setId(connection.getId());
        entity.setCompanyId(connection.getCompanyId());
        entity.setChannel(connection.getChannel());
        entity.setExternalId(connection.getExternalId());
        entity.setDisplayName(connection.getDisplayName());
        entity.setAutoReplyDefault(connection.isAutoReplyDefault());
        entity.setActive(connection.isActive());
        entity.setCredentialsEnc(sealCredentials(connection.getCredentials()));
        entity.setCreatedAt(connection.getCreatedAt());
        return entity;
    }

    public ConnectionConfig toDomain(ConnectionConfigEntity entity) {
        return ConnectionConfig.builder()
                .id(entity.getId())
                .companyId(entity.getCompanyId())
                .channel(entity.getChannel())
                .externalId(entity.getExternalId())
                .displayName(entity.getDisplayName())
                .autoReplyDefault(entity.isAutoReplyDefault())
                .active(entity.isActive())
                .credentials(openCredentials(entity.getCredentialsEnc()))
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private String sealCredentials(Map<String, String> credentials) {
        if (CollectionUtils.isEmpty(credentials)) {
            return null;
        }
        try {
            return cipher.encrypt(objectMapper.writeValueAsString(credentials));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize connection credentials", e);
        }
    }

    private Map<String, String> openCredentials(String sealed) {
        if (!StringUtils.hasText(sealed)) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(cipher.decrypt(sealed), CREDENTIALS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored connection credentials are not valid JSON", e);
        }
    }
}
