package com.example.omnichat.channel.instagram;

import com.example.omnichat.channel.meta.MetaWebhookHandler;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Channel;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/webhooks/instagram")
public class InstagramWebhookController {

    private final MetaWebhookHandler webhookHandler;
    private final OmnichatProperties properties;

    public InstagramWebhookController(MetaWebhookHandler webhookHandler, OmnichatProperties properties) {
        this.webhookHandler = webhookHandler;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<String> verify(
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.verify_token", required = false) String verifyToken,
            @RequestParam(name = "hub.challenge", required = false) String challenge) {
        return webhookHandler.verifySubscription(mode, verifyToken, challenge)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.FORBIDDEN).build());
    }

    @PostMapping
    public ResponseEntity<Void> receive(
            @RequestBody byte[] body,
            @RequestHeader(name = "X-Hub-Signature-256", required = false) String signature) {
        String appSecret = properties.getChannels().getInstagram().getAppSecret();
        if (!webhookHandler.isAuthentic(body, signature, appSecret)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        webhookHandler.handle(Channel.INSTAGRAM, body);
        return ResponseEntity.ok().build();
    }
}
