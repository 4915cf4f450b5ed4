package com.example.omnichat.channel.widget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.omnichat.domain.Attachment;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.dto.WidgetMessageRequest;
import com.example.omnichat.dto.WidgetMessageResponse;
import com.example.omnichat.dto.WidgetSessionResponse;
import com.example.omnichat.service.exception.ServiceException;
import com.example.omnichat.support.RelayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WidgetServiceTest {

    private RelayFixture fixture;
    private WidgetService widgetService;

    @BeforeEach
    void setUp() {
        fixture = new RelayFixture();
        fixture.addConnection("widget-1", Channel.WIDGET, false);
        fixture.addConnection("tg-1", Channel.TELEGRAM, false);
        widgetService = fixture.widgetService;
    }

    @Test
    void freshSessionHasNoConversation() {
        WidgetSessionResponse session = widgetService.session("widget-1", "session-1");

        assertThat(session.conversation()).isNull();
        assertThat(session.messages()).isEmpty();
        assertThat(session.heartbeatIntervalSeconds()).isEqualTo(30);
    }

    @Test
    void sessionResumesItsConversationWithHistory() {
        WidgetMessageResponse posted = widgetService.postMessage("widget-1", message("session-1", "Hello", null), "Mozilla/5.0");

        WidgetSessionResponse session = widgetService.session("widget-1", "session-1");

        assertThat(session.conversation().getId()).isEqualTo(posted.conversationId());
        assertThat(session.conversation().getAttributes())
                .containsEntry("sessionId", "session-1")
                .containsEntry("userAgent", "Mozilla/5.0")
                .containsEntry("pageUrl", "https://shop.example/cart");
        assertThat(session.messages()).extracting(ChatMessage::getText).containsExactly("Hello");
        assertThat(widgetService.session("widget-1", "session-2").conversation()).isNull();
    }

    @Test
    void attachmentOnlyMessageIsAccepted() {
        Attachment photo = Attachment.builder().url("https://cdn.example/p.png").contentType("image/png").build();

        WidgetMessageResponse posted = widgetService.postMessage("widget-1", message("session-1", null, photo), null);

        assertThat(posted.message().getAttachment()).isEqualTo(photo);
    }

    @Test
    void emptyMessageAndMissingSessionAreRejected() {
        assertThatThrownBy(() -> widgetService.postMessage("widget-1", message("session-1", " ", null), null))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("empty_message");
        assertThatThrownBy(() -> widgetService.postMessage("widget-1", message(" ", "hi", null), null))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("invalid_session");
    }

    @Test
    void onlyActiveWidgetConnectionsAcceptMessages() {
        assertThatThrownBy(() -> widgetService.postMessage("tg-1", message("session-1", "hi", null), null))
                .isInstanceOf(ServiceException.class)
                .extracting("errorCode")
                .isEqualTo("not_found");
        assertThatThrownBy(() -> widgetService.session("missing", "session-1"))
                .isInstanceOf(ServiceException.class);
    }

    @Test
    void socketJoinIsLimitedToTheSessionsOwnConversation() {
        String conversationId = widgetService.postMessage("widget-1", message("session-1", "hi", null), null).conversationId();

        assertThat(widgetService.findSessionConversation("widget-1", "session-1", conversationId)).isPresent();
        assertThat(widgetService.findSessionConversation("widget-1", "session-2", conversationId)).isEmpty();
        assertThat(widgetService.findSessionConversation("widget-2", "session-1", conversationId)).isEmpty();
    }

    private WidgetMessageRequest message(String sessionId, String text, Attachment attachment) {
        WidgetMessageRequest request = new WidgetMessageRequest();
        request.setSessionId(sessionId);
        request.setText(text);
        request.setAttachment(attachment);
        request.setPageUrl("https://shop.example/cart");
        return request;
    }
}
