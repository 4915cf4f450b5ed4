package com.example.omnichat.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.omnichat.config.OmnichatProperties;
import com.example.omnichat.domain.Channel;
import com.example.omnichat.domain.ConnectionConfig;
import com.example.omnichat.domain.Conversation;
import com.example.omnichat.domain.ConversationIdentity;
import com.example.omnichat.service.ConversationResolver;
import com.example.omnichat.service.CustomerDetails;
import com.example.omnichat.service.RedisKeyFactory;
import com.example.omnichat.support.ForwardingConversationStore;
import com.example.omnichat.support.MutableClock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Every resolver commits its own work here, as in production, so the unique open-identity constraint
 * is the only thing keeping customers to one active conversation.
 */
@DataJpaTest
@Import(PersistenceTestConfig.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ConcurrentConversationResolveTest {

    private static final int RESOLVERS = 5;

    @Autowired
    private JpaConversationStore store;

    @Autowired
    private ConversationJpaRepository conversationJpaRepository;

    @Autowired
    private MutableClock clock;

    @AfterEach
    void cleanUp() {
        conversationJpaRepository.deleteAll();
    }

    @Test
    void expiredLockLeavesTheUniqueConstraintToPickOneWinner() throws Exception {
        // a lock whose lease has run out: every caller gets straight in
        RedissonClient redisson = mock(RedissonClient.class);
        when(redisson.getLock(anyString())).thenReturn(mock(RLock.class));
        OmnichatProperties properties = new OmnichatProperties();
        ConversationResolver resolver =
                new ConversationResolver(racingStore(), redisson, new RedisKeyFactory(properties), properties);
        ConnectionConfig connection = ConnectionConfig.builder()
                .id("tg-1")
                .companyId("acme")
                .channel(Channel.TELEGRAM)
                .active(true)
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(RESOLVERS);
        List<ConversationResolver.Resolution> resolutions = new ArrayList<>();
        try {
            List<Future<ConversationResolver.Resolution>> futures = new ArrayList<>();
            for (int i = 0; i < RESOLVERS; i++) {
                futures.add(pool.submit(() ->
                        resolver.resolve(connection, "1001", CustomerDetails.empty(), clock.instant())));
            }
            for (Future<ConversationResolver.Resolution> future : futures) {
                resolutions.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(resolutions).filteredOn(ConversationResolver.Resolution::isNew).hasSize(1);
        assertThat(resolutions)
                .extracting(resolution -> resolution.conversation().getId())
                .containsOnly(resolutions.get(0).conversation().getId());
        assertThat(conversationJpaRepository.count()).isEqualTo(1);
        assertThat(store.findOpenByIdentity(new ConversationIdentity(Channel.TELEGRAM, "tg-1", "1001")))
                .map(Conversation::getId)
                .contains(resolutions.get(0).conversation().getId());
    }

    /**
     * Holds every resolver's first lookup until all of them have seen no conversation, then lets the
     * inserts through one at a time so the losers hit a committed row.
     */
    private ForwardingConversationStore racingStore() {
        CyclicBarrier allLookedUp = new CyclicBarrier(RESOLVERS);
        Set<Thread> waited = ConcurrentHashMap.newKeySet();
        Object insertTurn = new Object();
        return new ForwardingConversationStore(store) {
            @Override
            public Optional<Conversation> findOpenByIdentity(ConversationIdentity identity) {
                Optional<Conversation> found = super.findOpenByIdentity(identity);
                if (waited.add(Thread.currentThread())) {
                    try {
                        allLookedUp.await(10, TimeUnit.SECONDS);
                    } catch (Exception ex) {
                        throw new IllegalStateException("Resolvers did not meet", ex);
                    }
                }
                return found;
            }

            @Override
            public Conversation insert(Conversation conversation) {
                synchronized (insertTurn) {
                    return super.insert(conversation);
                }
            }
        };
    }
}
