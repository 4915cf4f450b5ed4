package com.example.omnichat.auth;

import com.example.omnichat.domain.MessageSender;

/**
 * Authenticated dashboard agent. Every agent belongs to exactly one company.
 */
public record AgentPrincipal(String agentId, String companyId, String name, String photoUrl) {

    public MessageSender asSender() {
        return MessageSender.builder().id(agentId).name(name).photoUrl(photoUrl).build();
    }
}
