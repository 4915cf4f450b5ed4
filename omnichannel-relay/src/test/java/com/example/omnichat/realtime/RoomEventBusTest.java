package com.example.omnichat.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.corundumstudio.socketio.BroadcastOperations;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.service.RedisKeyFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.Codec;
import org.springframework.beans.factory.ObjectProvider;

class RoomEventBusTest {

    private final RedissonClient redissonClient = mock(RedissonClient.class);
    private final RTopic topic = mock(RTopic.class);
    private final SocketIOServer server = mock(SocketIOServer.class);
    private final BroadcastOperations room = mock(BroadcastOperations.class);

    @SuppressWarnings("unchecked")
    private final ObjectProvider<SocketIOServer> serverProvider = mock(ObjectProvider.class);

    private RoomEventBus bus;

    @BeforeEach
    void setUp() {
        when(redissonClient.getTopic(eq("omnichat:rooms"), any(Codec.class))).thenReturn(topic);
        when(server.getRoomOperations(anyString())).thenReturn(room);
        bus = new RoomEventBus(redissonClient, serverProvider, new RedisKeyFactory(new OmnichatProperties()), new ObjectMapper());
        bus.subscribe();
    }

    @Test
    void publishGoesThroughTheSharedTopic() {
        bus.publish("company:acme", "message:new", Map.of("id", 1));

        ArgumentCaptor<RoomEnvelope> envelope = ArgumentCaptor.forClass(RoomEnvelope.class);
        verify(topic).publish(envelope.capture());
        assertThat(envelope.getValue().getRoom()).isEqualTo("company:acme");
        assertThat(envelope.getValue().getEvent()).isEqualTo("message:new");
        verifyNoInteractions(server);
    }

    @Test
    @SuppressWarnings("unchecked")
    void topicMessagesAreEmittedToLocalRoomMembers() {
        when(serverProvider.getIfAvailable()).thenReturn(server);
        ArgumentCaptor<MessageListener<RoomEnvelope>> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(topic).addListener(eq(RoomEnvelope.class), listener.capture());

        Map<String, Object> payload = Map.of("conversationId", "c1");
        listener.getValue().onMessage("omnichat:rooms", new RoomEnvelope("conversation:c1", "message:new", payload));

        verify(server).getRoomOperations("conversation:c1");
        verify(room).sendEvent("message:new", payload);
    }

    @Test
    void nodesWithoutSocketServerOnlyPublish() {
        assertThatCode(() -> bus.deliverLocally(new RoomEnvelope("company:acme", "message:new", null)))
                .doesNotThrowAnyException();
        verifyNoInteractions(server);
    }

    @Test
    void brokerFailureDoesNotReachTheCaller() {
        when(topic.publish(any())).thenThrow(new IllegalStateException("redis down"));

        assertThatCode(() -> bus.publish("company:acme", "message:new", null)).doesNotThrowAnyException();
    }
}
