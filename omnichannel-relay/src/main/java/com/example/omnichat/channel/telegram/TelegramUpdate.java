package com.example.omnichat.channel.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * The subset of a Bot API {@code Update} the relay reads.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramUpdate {

    @JsonProperty("update_id")
    private Long updateId;

    private Message message;

    @JsonProperty("edited_message")
    private Message editedMessage;

    /**
     * The new message, or the edited one when the update is an edit.
     */
    public Message effectiveMessage() {
        return message != null ? message : editedMessage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {

        @JsonProperty("message_id")
        private Long messageId;

        /**
         * Unix seconds.
         */
        private Long date;

        private Chat chat;

        private User from;

        private String text;

        private String caption;

        private List<PhotoSize> photo = new ArrayList<>();

        private Document document;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Chat {

        private Long id;

        private String type;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {

        private Long id;

        @JsonProperty("first_name")
        private String firstName;

        @JsonProperty("last_name")
        private String lastName;

        private String username;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PhotoSize {

        @JsonProperty("file_id")
        private String fileId;

        @JsonProperty("file_size")
        private Long fileSize;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Document {

        @JsonProperty("file_id")
        private String fileId;

        @JsonProperty("mime_type")
        private String mimeType;

        @JsonProperty("file_size")
        private Long fileSize;
    }
}
