package com.example.omnichat.autoreply;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.domain.MessageRole;
import com.example.omnichat.domain.MessageSender;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.service.ConversationStore;
import com.example.omnichat.service.MessageStore;
import com.example.omnichat.service.OutboundMessageService;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Decides whether a customer message gets an automatic reply and, if so, generates it on the
 * auto-reply executor under a hard timeout. A failed or late generation produces nothing and is never
 * retried; the typing indicator is always cleared. A conversation closed while its reply was being
 * generated gets no reply.
 */
@Slf4j
@Component
public class AutoResponderGate {

    static final String DEFAULT_BOT_NAME = "Assistant";

    private final ReplyGenerator replyGenerator;
    private final MessageStore messageStore;
    private final ConversationStore conversationStore;
    private final OutboundMessageService outboundMessageService;
    private final ConversationEventPublisher eventPublisher;
    private final Executor executor;
    private final Duration timeout;
    private final int historyWindow;

    public AutoResponderGate(
            ReplyGenerator replyGenerator,
            MessageStore messageStore,
            ConversationStore conversationStore,
            OutboundMessageService outboundMessageService,
            ConversationEventPublisher eventPublisher,
            @Qualifier("autoReplyExecutor") Executor executor,
            OmnichatProperties properties) {
        this.replyGenerator = replyGenerator;
        this.messageStore = messageStore;
        this.conversationStore = conversationStore;
        this.outboundMessageService = outboundMessageService;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.timeout = properties.getAutoReply().getTimeout();
        this.historyWindow = properties.getAutoReply().getHistoryWindow();
    }

    public boolean shouldRespond(Conversation conversation, ChatMessage inbound) {
        return conversation.isAutoReplyEnabled()
                && inbound.getRole() == MessageRole.USER
                && conversation.getStatus() != ConversationStatus.CLOSED;
    }

    /**
     * Returns immediately. The future completes with the stored bot message, or empty when no reply was
     * produced; it never completes exceptionally.
     */
    public CompletableFuture<Optional<ChatMessage>> maybeRespond(Conversation conversation, ChatMessage inbound) {
        if (!shouldRespond(conversation, inbound)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!replyGenerator.isEnabled()) {
            log.debug("Auto-reply requested for conversation {} but no generator is configured", conversation.getId());
            return CompletableFuture.completedFuture(Optional.empty());
        }

        eventPublisher.typingStarted(conversation);
        CompletableFuture<GeneratedReply> generation;
        try {
            generation = CompletableFuture.supplyAsync(() -> generate(conversation), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Auto-reply for conversation {} skipped: executor saturated", conversation.getId());
            eventPublisher.typingStopped(conversation);
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return generation
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((reply, error) -> complete(conversation, reply, error));
    }

    private GeneratedReply generate(Conversation conversation) {
        List<ChatMessage> history = messageStore.recent(conversation.getId(), historyWindow);
        return replyGenerator.generate(conversation.getCompanyId(), conversation.getId(), history);
    }

    private Optional<ChatMessage> complete(Conversation conversation, GeneratedReply reply, Throwable error) {
        try {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                if (cause instanceof TimeoutException) {
                    log.warn("Auto-reply for conversation {} timed out after {}", conversation.getId(), timeout);
                } else {
                    log.warn("Auto-reply for conversation {} failed: {}", conversation.getId(), cause.toString());
                }
                return Optional.empty();
            }
            if (reply == null || !StringUtils.hasText(reply.text())) {
                log.warn("Auto-reply for conversation {} came back empty", conversation.getId());
                return Optional.empty();
            }
            Optional<Conversation> current = conversationStore.findById(conversation.getId())
                    .filter(latest -> latest.getStatus() != ConversationStatus.CLOSED);
            if (current.isEmpty()) {
                log.info("Auto-reply for conversation {} dropped: conversation closed during generation",
                        conversation.getId());
                return Optional.empty();
            }
            MessageSender bot = MessageSender.builder()
                    .name(DEFAULT_BOT_NAME)
                    .model(reply.model())
                    .build();
            return Optional.of(outboundMessageService.sendReply(current.get(), MessageRole.BOT, bot, reply.text().trim(), null));
        } catch (RuntimeException ex) {
            log.warn("Storing auto-reply for conversation {} failed", conversation.getId(), ex);
            return Optional.empty();
        } finally {
            eventPublisher.typingStopped(conversation);
        }
    }
}
