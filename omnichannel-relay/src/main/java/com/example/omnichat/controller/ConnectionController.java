package com.example.omnichat.controller;

import com.example.omnichat.auth.AgentPrincipal;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.connection.ConnectionView;
import com.example.omnichat.connection.RegisterConnectionRequest;
import com.example.omnichat.dto.AutoReplyRequest;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/connections")
@SecurityRequirement(name = "agentToken")
public class ConnectionController {

    private final ConnectionConfigService connectionConfigService;

    public ConnectionController(ConnectionConfigService connectionConfigService) {
        this.connectionConfigService = connectionConfigService;
    }

    @PostMapping
    public ResponseEntity<ConnectionView> register(
            @Parameter(hidden = true) AgentPrincipal agent,
            @Valid @RequestBody RegisterConnectionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ConnectionView.registered(connectionConfigService.register(agent.companyId(), request)));
    }

    @GetMapping
    public ResponseEntity<List<ConnectionView>> list(@Parameter(hidden = true) AgentPrincipal agent) {
        return ResponseEntity.ok(connectionConfigService.listForCompany(agent.companyId()).stream()
                .map(ConnectionView::of)
                .toList());
    }

    @PatchMapping("/{connectionId}/auto-reply")
    public ResponseEntity<ConnectionView> updateAutoReply(
            @Parameter(hidden = true) AgentPrincipal agent,
            @PathVariable String connectionId,
            @Valid @RequestBody AutoReplyRequest request) {
        return ResponseEntity.ok(ConnectionView.of(connectionConfigService.updateAutoReplyDefault(
                agent.companyId(), connectionId, request.getEnabled(), request.isApplyToOpen())));
    }
}
