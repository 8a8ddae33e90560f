package com.linlay.chatgateway.memory;

import com.linlay.chatgateway.MutableClock;
import com.linlay.chatgateway.config.SessionProperties;
import com.linlay.chatgateway.service.UpstreamApiException;
import com.linlay.chatgateway.service.UpstreamChatClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationSessionStoreTest {

    private UpstreamChatClient upstreamChatClient;
    private MutableClock clock;
    private ConversationSessionStore store;

    @BeforeEach
    void setUp() {
        upstreamChatClient = mock(UpstreamChatClient.class);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        SessionProperties properties = new SessionProperties();
        properties.setMaxActiveSessions(2);
        properties.setTtlSeconds(60);
        store = new ConversationSessionStore(upstreamChatClient, properties, clock);
    }

    @Test
    void createAtCapacityShouldEvictLeastRecentlyUsedOnly() {
        when(upstreamChatClient.createConversation(any()))
                .thenReturn(Mono.just("c1"), Mono.just("c2"), Mono.just("c3"));

        store.create(null).block();
        clock.advance(Duration.ofSeconds(1));
        store.create(null).block();
        clock.advance(Duration.ofSeconds(1));
        store.touch("c1");
        clock.advance(Duration.ofSeconds(1));

        String created = store.create(null).block();

        assertThat(created).isEqualTo("c3");
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find("c1")).isPresent();
        assertThat(store.find("c2")).isEmpty();
        assertThat(store.find("c3")).isPresent();
    }

    @Test
    void lazilyRegisteredIdsShouldRespectCapacity() {
        store.resolveOrCreate("a", false, null).block();
        clock.advance(Duration.ofSeconds(1));
        store.resolveOrCreate("b", false, null).block();
        clock.advance(Duration.ofSeconds(1));
        store.touch("c");

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.find("a")).isEmpty();
    }

    @Test
    void idleSessionShouldExpireAfterTtl() {
        when(upstreamChatClient.createConversation(any())).thenReturn(Mono.just("c1"));
        store.create(null).block();

        clock.advance(Duration.ofSeconds(61));

        assertThat(store.find("c1")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void touchShouldResetExpiryWindowAndCountMessages() {
        when(upstreamChatClient.createConversation(any())).thenReturn(Mono.just("c1"));
        store.create(null).block();

        clock.advance(Duration.ofSeconds(50));
        store.touch("c1");
        clock.advance(Duration.ofSeconds(50));
        store.touch("c1");

        assertThat(store.find("c1")).get()
                .satisfies(session -> {
                    assertThat(session.messageCount()).isEqualTo(2);
                    assertThat(session.lastUsedAt()).isEqualTo(Instant.parse("2026-01-01T00:01:40Z"));
                });
    }

    @Test
    void suppliedIdShouldBeReturnedWithoutUpstreamCall() {
        String resolved = store.resolveOrCreate("  existing-id ", false, "BSL").block();

        assertThat(resolved).isEqualTo("existing-id");
        assertThat(store.find("existing-id")).isPresent();
        verify(upstreamChatClient, never()).createConversation(any());
    }

    @Test
    void forceNewShouldExpireStaleEntriesBeforeCreating() {
        when(upstreamChatClient.createConversation("BSL")).thenReturn(Mono.just("fresh"));
        store.resolveOrCreate("old", false, null).block();
        clock.advance(Duration.ofSeconds(120));

        String resolved = store.resolveOrCreate("old", true, "BSL").block();

        assertThat(resolved).isEqualTo("fresh");
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find("old")).isEmpty();
    }

    @Test
    void failedCreateShouldRegisterNothing() {
        when(upstreamChatClient.createConversation(any()))
                .thenReturn(Mono.error(new UpstreamApiException("Conversation create error: 500", 500)));

        assertThatThrownBy(() -> store.resolveOrCreate(null, false, null).block())
                .isInstanceOf(UpstreamApiException.class);
        assertThat(store.size()).isZero();
    }
}
