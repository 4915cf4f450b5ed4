package com.example.omnichat.controller;

import com.example.omnichat.auth.AgentPrincipal;
import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationStatus;
import com.example.omnichat.dto.AutoReplyRequest;
import com.example.omnichat.dto.SendMessageRequest;
import com.example.omnichat.dto.UpdateCustomerRequest;
import com.example.omnichat.dto.UpdateStatusRequest;
import com.example.omnichat.service.ConversationPage;
import com.example.omnichat.service.ConversationService;
import com.example.omnichat.service.MessagePage;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/conversations")
@SecurityRequirement(name = "agentToken")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    /**
     * Company inbox, most recently active first. Without a status filter OPEN and SNOOZED are listed.
     */
    @GetMapping
    public ResponseEntity<ConversationPage> listConversations(
            @Parameter(hidden = true) AgentPrincipal agent,
            @RequestParam(name = "status", required = false) List<ConversationStatus> statuses,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit) {
        Set<ConversationStatus> filter = statuses == null || statuses.isEmpty()
                ? ConversationStatus.ACTIVE
                : EnumSet.copyOf(statuses);
        return ResponseEntity.ok(conversationService.listConversations(agent.companyId(), filter, cursor, limit));
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<Conversation> getConversation(
            @Parameter(hidden = true) AgentPrincipal agent, @PathVariable String conversationId) {
        return ResponseEntity.ok(conversationService.getConversation(agent.companyId(), conversationId));
    }

    @GetMapping("/{conversationId}/messages")
    public ResponseEntity<MessagePage> getMessages(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(conversationService.listMessages(agent.companyId(), conversationId, cursor, limit));
    }

    @PostMapping("/{conversationId}/messages")
    public ResponseEntity<ChatMessage> postMessage(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @Valid @RequestBody SendMessageRequest request) {
        return ResponseEntity.ok(
                conversationService.sendAgentMessage(agent, conversationId, request.getText(), request.getAttachment()));
    }

    @PostMapping("/{conversationId}/messages/{messageId}/retry")
    public ResponseEntity<ChatMessage> retryMessage(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @PathVariable Long messageId) {
        return ResponseEntity.ok(conversationService.retryDelivery(agent, conversationId, messageId));
    }

    @PatchMapping("/{conversationId}/status")
    public ResponseEntity<Conversation> updateStatus(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @Valid @RequestBody UpdateStatusRequest request) {
        return ResponseEntity.ok(conversationService.updateStatus(agent.companyId(), conversationId, request.getStatus()));
    }

    @PatchMapping("/{conversationId}/auto-reply")
    public ResponseEntity<Conversation> updateAutoReply(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @Valid @RequestBody AutoReplyRequest request) {
        return ResponseEntity.ok(conversationService.setAutoReply(agent.companyId(), conversationId, request.getEnabled()));
    }

    @PostMapping("/{conversationId}/read")
    public ResponseEntity<Conversation> markRead(
            @Parameter(hidden = true) AgentPrincipal agent, @PathVariable String conversationId) {
        return ResponseEntity.ok(conversationService.markRead(agent.companyId(), conversationId));
    }

    @PatchMapping("/{conversationId}/customer")
    public ResponseEntity<Conversation> updateCustomer(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String conversationId,
            @Valid @RequestBody UpdateCustomerRequest request) {
        return ResponseEntity.ok(conversationService.updateCustomer(agent.companyId(), conversationId, request));
    }
}
