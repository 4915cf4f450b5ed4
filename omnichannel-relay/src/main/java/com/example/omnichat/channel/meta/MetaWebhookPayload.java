package com.example.omnichat.channel.meta;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Messenger Platform webhook envelope, shared by Facebook pages ({@code object = page}) and Instagram
 * professional accounts ({@code object = instagram}).
 */
@Data
public class MetaWebhookPayload {

    private String object;

    private List<Entry> entry = new ArrayList<>();

    @Data
    public static class Entry {

        /**
         * Page id or Instagram account id the events were sent to.
         */
        private String id;

        private Long time;

        private List<MessagingEvent> messaging = new ArrayList<>();
    }

    @Data
    public static class MessagingEvent {

        private Party sender;

        private Party recipient;

        private Long timestamp;

        private Message message;
    }

    @Data
    public static class Party {

        private String id;
    }

    @Data
    public static class Message {

        private String mid;

        private String text;

        @JsonProperty("is_echo")
        private boolean echo;

        private List<Attachment> attachments = new ArrayList<>();
    }

    @Data
    public static class Attachment {

        private String type;

        private AttachmentPayload payload;
    }

    @Data
    public static class AttachmentPayload {

        private String url;
    }
}
