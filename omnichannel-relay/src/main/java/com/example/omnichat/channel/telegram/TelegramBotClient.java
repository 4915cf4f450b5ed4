package com.example.omnichat.channel.telegram;

import com.example.omnichat.channel.DeliveryResult;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Attachment;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Bot API send methods. Attachments that are images go out with {@code sendPhoto}, everything else with
 * {@code sendDocument}; the message text becomes the caption.
 */
@Slf4j
@Component
public class TelegramBotClient {

    private static final int MAX_ERROR_LENGTH = 500;

    private final RestClient restClient;

    public TelegramBotClient(RestClient.Builder restClientBuilder, OmnichatProperties properties) {
        this.restClient = restClientBuilder.baseUrl(properties.getChannels().getTelegram().getApiBaseUrl()).build();
    }

    public DeliveryResult send(String botToken, String chatId, String text, Attachment attachment) {
        try {
            BotResponse response;
            if (attachment != null && StringUtils.hasText(attachment.getUrl())) {
                String caption = StringUtils.hasText(text) ? text : null;
                if (attachment.getContentType() != null && attachment.getContentType().startsWith("image")) {
                    response = call(botToken, "sendPhoto", new MediaRequest(chatId, attachment.getUrl(), null, caption));
                } else {
                    response = call(botToken, "sendDocument", new MediaRequest(chatId, null, attachment.getUrl(), caption));
                }
            } else {
                response = call(botToken, "sendMessage", new TextRequest(chatId, text));
            }
            if (response == null || !response.ok()) {
                return DeliveryResult.failed("Telegram rejected message: "
                        + (response != null ? response.description() : "empty response"));
            }
            return DeliveryResult.sent(response.result() != null ? String.valueOf(response.result().messageId()) : null);
        } catch (RestClientResponseException ex) {
            return DeliveryResult.failed("Telegram %d: %s".formatted(ex.getStatusCode().value(), abbreviate(ex.getResponseBodyAsString())));
        } catch (RestClientException ex) {
            log.warn("Telegram API unreachable: {}", ex.getMessage());
            return DeliveryResult.failed("Telegram unreachable: " + ex.getMessage());
        }
    }

    /**
     * The token goes into the path as is: its ':' is legal there and Telegram expects it unencoded.
     */
    private BotResponse call(String botToken, String method, Object request) {
        return restClient.post()
                .uri("/bot" + botToken + "/{method}", method)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(BotResponse.class);
    }

    private static String abbreviate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH) + "...";
    }

    record TextRequest(@JsonProperty("chat_id") String chatId, String text) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MediaRequest(@JsonProperty("chat_id") String chatId, String photo, String document, String caption) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record BotResponse(boolean ok, SentMessage result, String description) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SentMessage(@JsonProperty("message_id") Long messageId) {}
}
