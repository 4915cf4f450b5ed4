package com.example.omnichat.support;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.example.omnichat.autoreply.AutoResponderGate;
import com.example.omnichat.autoreply.DisabledReplyGenerator;
import com.example.omnichat.autoreply.ReplyGenerator;
import com.example.omnichat.channel.ChannelAdapter;
import com.example.omnichat.channel.ChannelAdapterRegistry;
import com.example.omnichat.channel.widget.WidgetChannelAdapter;
import com.example.omnichat.channel.widget.WidgetService;
import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.connection.ConnectionConfigService;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.event.ConversationEventPublisher;
import com.example.omnichat.realtime.RoomEventBus;
import com.example.omnichat.service.ConversationResolver;
import com.example.omnichat.service.ConversationService;
import com.example.omnichat.service.InboundMessageProcessor;
import com.example.omnichat.service.OutboundMessageService;
import com.example.omnichat.service.RedisKeyFactory;
import com.example.omnichat.service.exception.ServiceException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * The inbound and outbound pipeline wired over in-memory stores. Room events are captured by a mocked
 * {@link RoomEventBus}.
 */
public class RelayFixture {

    public static final String COMPANY = "acme";

    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T09:00:00Z"));
    public final OmnichatProperties properties = new OmnichatProperties();
    public final InMemoryConversationStore conversationStore = new InMemoryConversationStore();
    public final InMemoryMessageStore messageStore = new InMemoryMessageStore(conversationStore, clock);
    public final RoomEventBus roomEventBus = mock(RoomEventBus.class);
    public final ConversationEventPublisher eventPublisher = new ConversationEventPublisher(roomEventBus);
    public final ConnectionConfigService connectionConfigService = mock(ConnectionConfigService.class);
    public final LocalLocks locks = new LocalLocks();
    public final RedisKeyFactory keyFactory = new RedisKeyFactory(properties);

    private final Map<String, ConnectionConfig> connections = new HashMap<>();

    public ChannelAdapterRegistry adapterRegistry;
    public OutboundMessageService outboundMessageService;
    public AutoResponderGate autoResponderGate;
    public ConversationResolver resolver;
    public InboundMessageProcessor processor;
    public ConversationService conversationService;
    public WidgetService widgetService;

    public RelayFixture() {
        this(new DisabledReplyGenerator(), Runnable::run, List.of());
    }

    public RelayFixture(ReplyGenerator replyGenerator, Executor executor, List<ChannelAdapter> extraAdapters) {
        lenient().when(connectionConfigService.findActive(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(connections.get(invocation.<String>getArgument(0))));
        lenient().when(connectionConfigService.require(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(connections.get(invocation.<String>getArgument(0)))
                        .orElseThrow(() -> ServiceException.notFound("Connection", invocation.getArgument(0))));

        List<ChannelAdapter> adapters = new ArrayList<>(extraAdapters);
        adapters.add(new WidgetChannelAdapter());
        adapterRegistry = new ChannelAdapterRegistry(adapters);
        outboundMessageService = new OutboundMessageService(
                messageStore, conversationStore, connectionConfigService, adapterRegistry, eventPublisher);
        autoResponderGate = new AutoResponderGate(
                replyGenerator, messageStore, conversationStore, outboundMessageService, eventPublisher, executor, properties);
        resolver = new ConversationResolver(conversationStore, locks.client(), keyFactory, properties);
        processor = new InboundMessageProcessor(
                connectionConfigService, resolver, messageStore, conversationStore, eventPublisher,
                autoResponderGate, adapterRegistry, clock);
        conversationService = new ConversationService(
                conversationStore, messageStore, outboundMessageService, eventPublisher,
                locks.client(), keyFactory, properties, clock);
        widgetService = new WidgetService(
                connectionConfigService, conversationStore, messageStore, processor, properties, clock);
    }

    public ConnectionConfig addConnection(String id, Channel channel, boolean autoReplyDefault) {
        ConnectionConfig connection = ConnectionConfig.builder()
                .id(id)
                .companyId(COMPANY)
                .channel(channel)
                .externalId(id + "-external")
                .displayName(id)
                .autoReplyDefault(autoReplyDefault)
                .active(true)
                .credentials(Map.of(ConnectionConfig.ACCESS_TOKEN, "token", ConnectionConfig.BOT_TOKEN, "bot"))
                .createdAt(clock.instant())
                .build();
        connections.put(id, connection);
        return connection;
    }
}
