package com.example.omnichat.realtime;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.omnichat.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Room-scoped fan-out across every relay node. Membership lives in each node's socket server; events
 * are published once to a Redis topic and every node, including the publisher, re-emits them to its
 * local members of the room. Delivery is best effort. Nodes
 * running without a socket server only publish.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomEventBus {

    private final RedissonClient redissonClient;
    private final ObjectProvider<SocketIOServer> socketIOServer;
    private final RedisKeyFactory keyFactory;
    private final ObjectMapper objectMapper;

    private RTopic topic;
    private int listenerId;

    @PostConstruct
    public void subscribe() {
        topic = redissonClient.getTopic(keyFactory.roomTopic(), new TypedJsonJacksonCodec(RoomEnvelope.class, objectMapper));
        listenerId = topic.addListener(RoomEnvelope.class, (channel, envelope) -> deliverLocally(envelope));
    }

    @PreDestroy
    public void shutdown() {
        if (topic != null) {
            topic.removeListener(listenerId);
        }
    }

    public void join(SocketIOClient client, String room) {
        client.joinRoom(room);
    }

    public void leave(SocketIOClient client, String room) {
        client.leaveRoom(room);
    }

    public void publish(String room, String event, Object payload) {
        try {
            topic.publish(new RoomEnvelope(room, event, payload));
            log.debug("Published {} to {}", event, room);
        } catch (RuntimeException ex) {
            log.warn("Dropping {} for room {}: broker publish failed: {}", event, room, ex.getMessage());
        }
    }

    void deliverLocally(RoomEnvelope envelope) {
        SocketIOServer server = socketIOServer.getIfAvailable();
        if (server == null) {
            return;
        }
        try {
            server.getRoomOperations(envelope.getRoom()).sendEvent(envelope.getEvent(), envelope.getPayload());
        } catch (RuntimeException ex) {
            log.warn("Failed to emit {} to local room {}", envelope.getEvent(), envelope.getRoom(), ex);
        }
    }
}
