package com.example.omnichat.channel.widget;

import com.example.omnichat.dto.WidgetMessageRequest;
import com.example.omnichat.dto.WidgetMessageResponse;
import com.example.omnichat.dto.WidgetSessionRequest;
import com.example.omnichat.dto.WidgetSessionResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/widget/{connectionId}")
public class WidgetController {

    private final WidgetService widgetService;

    public WidgetController(WidgetService widgetService) {
        this.widgetService = widgetService;
    }

    @PostMapping("/session")
    public ResponseEntity<WidgetSessionResponse> openSession(
            @PathVariable String connectionId,
            @Valid @RequestBody WidgetSessionRequest request) {
        return ResponseEntity.ok(widgetService.session(connectionId, request.getSessionId()));
    }

    @PostMapping("/messages")
    public ResponseEntity<WidgetMessageResponse> postMessage(
            @PathVariable String connectionId,
            @Valid @RequestBody WidgetMessageRequest request,
            @RequestHeader(name = HttpHeaders.USER_AGENT, required = false) String userAgent) {
        return ResponseEntity.ok(widgetService.postMessage(connectionId, request, userAgent));
    }

    @GetMapping("/messages")
    public ResponseEntity<WidgetSessionResponse> getMessages(
            @PathVariable String connectionId,
            @RequestParam String sessionId) {
        return ResponseEntity.ok(widgetService.session(connectionId, sessionId));
    }
}
