package com.example.omnichat.channel.telegram;

import com.example.omnichat.channel.InboundMessageQueue;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/webhooks/telegram")
public class TelegramWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final ConnectionConfigService connectionConfigService;
    private final InboundMessageQueue inboundMessageQueue;
    private final Clock clock;

    public TelegramWebhookController(
            ConnectionConfigService connectionConfigService, InboundMessageQueue inboundMessageQueue, Clock clock) {
        this.connectionConfigService = connectionConfigService;
        this.inboundMessageQueue = inboundMessageQueue;
        this.clock = clock;
    }

    /**
     * Answers 200 for anything that authenticates, including updates the relay ignores, so Telegram does
     * not redeliver them.
     */
    @PostMapping("/{connectionId}")
    public ResponseEntity<Void> receive(
            @PathVariable String connectionId,
            @RequestHeader(name = SECRET_HEADER, required = false) String secret,
            @RequestBody TelegramUpdate update) {
        Optional<ConnectionConfig> connection = connectionConfigService.findActive(connectionId)
                .filter(config -> config.getChannel() == Channel.TELEGRAM);
        if (connection.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (!secretMatches(connection.get().credential(ConnectionConfig.WEBHOOK_SECRET), secret)) {
            log.warn("Rejected Telegram update for connection {} with bad secret", connectionId);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        TelegramUpdateMapper.toInboundMessage(connection.get(), update, clock.instant())
                .ifPresent(inboundMessageQueue::enqueue);
        return ResponseEntity.ok().build();
    }

    private boolean secretMatches(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }
}
