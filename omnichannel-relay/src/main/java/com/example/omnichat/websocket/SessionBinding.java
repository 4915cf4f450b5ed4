package com.example.omnichat.websocket;

import com.example.omnichat.auth.AgentPrincipal;
import java.time.Instant;

/**
 * What a socket authenticated as during the handshake. Stored as a client attribute; widget bindings
 * also remember the conversation they went online in so a disconnect can be reported.
 */
public class SessionBinding {

    public enum Role {
        AGENT,
        WIDGET
    }

    private final Role role;
    private final AgentPrincipal agent;
    private final String connectionId;
    private final String sessionId;
    private final Instant connectedAt;
    private volatile String conversationId;

    private SessionBinding(Role role, AgentPrincipal agent, String connectionId, String sessionId, Instant connectedAt) {
        this.role = role;
        this.agent = agent;
        this.connectionId = connectionId;
        this.sessionId = sessionId;
        this.connectedAt = connectedAt;
    }

    public static SessionBinding agent(AgentPrincipal agent, Instant connectedAt) {
        return new SessionBinding(Role.AGENT, agent, null, null, connectedAt);
    }

    public static SessionBinding widget(String connectionId, String sessionId, Instant connectedAt) {
        return new SessionBinding(Role.WIDGET, null, connectionId, sessionId, connectedAt);
    }

    public boolean isAgent() {
        return role == Role.AGENT;
    }

    public Role getRole() {
        return role;
    }

    public AgentPrincipal getAgent() {
        return agent;
    }

    public String getCompanyId() {
        return agent != null ? agent.companyId() : null;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public String getConversationId() {
        return conversationId;
    }

    public void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }
}
