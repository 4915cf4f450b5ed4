package com.example.omnichat.channel.meta;

import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Attachment;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Graph API calls used by the Facebook and Instagram adapters.
 */
@Slf4j
@Component
public class MetaGraphClient {

    private static final int MAX_ERROR_LENGTH = 500;

    private final RestClient restClient;
    private final String version;

    public MetaGraphClient(RestClient.Builder restClientBuilder, OmnichatProperties properties) {
        OmnichatProperties.Meta meta = properties.getChannels().getMeta();
        this.restClient = restClientBuilder.baseUrl(meta.getGraphBaseUrl()).build();
        this.version = meta.getGraphVersion();
    }

    /**
     * Sends text and, when present, an attachment as a second message. The id of the last accepted
     * message is returned.
     */
    public DeliveryResult sendMessage(String accessToken, String recipientId, String text, Attachment attachment) {
        try {
            String messageId = null;
            if (StringUtils.hasText(text)) {
                messageId = post(accessToken, new SendRequest(new Recipient(recipientId), SendBody.text(text)));
            }
            if (attachment != null && StringUtils.hasText(attachment.getUrl())) {
                messageId = post(accessToken, new SendRequest(new Recipient(recipientId), SendBody.attachment(attachment)));
            }
            return DeliveryResult.sent(messageId);
        } catch (RestClientResponseException ex) {
            return DeliveryResult.failed("Graph API %d: %s".formatted(ex.getStatusCode().value(), abbreviate(ex.getResponseBodyAsString())));
        } catch (RestClientException ex) {
            return DeliveryResult.failed("Graph API unreachable: " + ex.getMessage());
        }
    }

    /**
     * Best-effort profile lookup. Returns an empty map when the platform refuses.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> fetchProfile(String accessToken, String userId, String fields) {
        try {
            Map<String, Object> profile = restClient.get()
                    .uri("/{version}/{userId}?fields={fields}&access_token={token}", version, userId, fields, accessToken)
                    .retrieve()
                    .body(Map.class);
            return profile != null ? profile : Map.of();
        } catch (RestClientException ex) {
            log.debug("Profile lookup for {} failed: {}", userId, ex.getMessage());
            return Map.of();
        }
    }

    private String post(String accessToken, SendRequest request) {
        SendResponse response = restClient.post()
                .uri("/{version}/me/messages?access_token={token}", version, accessToken)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(SendResponse.class);
        return response != null ? response.messageId() : null;
    }

    private static String abbreviate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH) + "...";
    }

    record Recipient(String id) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendRequest(Recipient recipient, SendBody message, @JsonProperty("messaging_type") String messagingType) {

        SendRequest(Recipient recipient, SendBody message) {
            this(recipient, message, "RESPONSE");
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendBody(String text, AttachmentBody attachment) {

        static SendBody text(String text) {
            return new SendBody(text, null);
        }

        static SendBody attachment(Attachment attachment) {
            return new SendBody(null, new AttachmentBody(
                    attachmentType(attachment.getContentType()), new AttachmentPayload(attachment.getUrl(), true)));
        }

        private static String attachmentType(String contentType) {
            if (contentType == null) {
                return "file";
            }
            if (contentType.startsWith("image")) {
                return "image";
            }
            if (contentType.startsWith("video")) {
                return "video";
            }
            if (contentType.startsWith("audio")) {
                return "audio";
            }
            return "file";
        }
    }

    record AttachmentBody(String type, AttachmentPayload payload) {}

    record AttachmentPayload(String url, @JsonProperty("is_reusable") boolean reusable) {}

    record SendResponse(@JsonProperty("recipient_id") String recipientId, @JsonProperty("message_id") String messageId) {}
}
