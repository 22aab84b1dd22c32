package com.prudhvi.event_stream.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prudhvi.event_stream.auth.AuthContext;
import com.prudhvi.event_stream.auth.AuthSnapshot;
import com.prudhvi.event_stream.auth.AuthorizationException;
import com.prudhvi.event_stream.auth.AuthorizationProvider;
import com.prudhvi.event_stream.capability.CapabilityMatcher;
import com.prudhvi.event_stream.capability.CapabilityRule;
import com.prudhvi.event_stream.capability.RuleConditions;
import com.prudhvi.event_stream.event.BusEvent;
import com.prudhvi.event_stream.event.DomainEventType;
import com.prudhvi.event_stream.event.EventName;
import com.prudhvi.event_stream.event.EventRecord;
import com.prudhvi.event_stream.event.ScopeType;
import com.prudhvi.event_stream.registry.InMemoryConnectionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SseConnection Tests")
class SseConnectionTest {

    private static final AuthContext CONTEXT = new AuthContext("tenant-1", "token-1");

    @Mock
    private AuthorizationProvider authorizationProvider;

    private InMemoryConnectionRegistry registry;
    private RecordingChannel channel;
    private SseFrameEncoder frames;

    @BeforeEach
    void setUp() {
        registry = new InMemoryConnectionRegistry(Duration.ofSeconds(60));
        channel = new RecordingChannel();
        frames = new SseFrameEncoder(new ObjectMapper());
    }

    private SseConnection connectionOn(RecordingChannel target) {
        CapabilityMatcher subscriptions = CapabilityMatcher.compile(List.of(
                new CapabilityRule(ScopeType.SECRETS, EventName.SECRET_CREATED, RuleConditions.anyPathIn(null))));
        return new SseConnection(ScopeType.SECRETS, CONTEXT, subscriptions, target,
                authorizationProvider, registry, frames);
    }

    private static AuthSnapshot snapshot(String principalId) {
        return new AuthSnapshot(principalId, "tenant-1", CapabilityMatcher.none());
    }

    private static BusEvent secretCreated() {
        return BusEvent.single("tenant-1", DomainEventType.SECRET_CREATE,
                EventRecord.of("prod", "/app"), Instant.parse("2024-06-01T12:00:00Z"));
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        void appliesSnapshotAndRegistersConnection() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);

            connection.open();

            assertThat(connection.isOpen()).isTrue();
            assertThat(connection.auth().principalId()).isEqualTo("user-1");
            assertThat(connection.principalId()).isEqualTo("user-1");
            assertThat(registry.countActive("tenant-1", "user-1")).isEqualTo(1);
            assertThat(channel.frames()).containsExactly(": connected\n\n");
        }

        @Test
        void authorizationFailurePropagatesAndNothingIsActivated() {
            when(authorizationProvider.fetch(CONTEXT)).thenThrow(new AuthorizationException("revoked"));
            SseConnection connection = connectionOn(channel);

            assertThatThrownBy(connection::open).isInstanceOf(AuthorizationException.class);

            assertThat(connection.isOpen()).isFalse();
            assertThat(connection.send(secretCreated())).isFalse();
            assertThat(registry.countActive("tenant-1", "user-1")).isZero();
            assertThat(channel.frames()).isEmpty();
        }

        @Test
        void authIsGuardedUntilOpen() {
            SseConnection connection = connectionOn(channel);

            assertThatThrownBy(connection::auth)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("before open");
        }

        @Test
        void cannotBeOpenedTwice() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            assertThatThrownBy(connection::open).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("send and ping")
    class SendAndPing {

        @Test
        void sendQueuesEncodedFrame() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            assertThat(connection.send(secretCreated())).isTrue();

            assertThat(channel.framesNamed("secret:created")).hasSize(1);
        }

        @Test
        void backpressureDropsFrameWithoutBlocking() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            RecordingChannel stuck = RecordingChannel.rejectingAll();
            SseConnection connection = connectionOn(stuck);
            connection.open();

            assertThat(connection.send(secretCreated())).isFalse();
            assertThat(connection.send(secretCreated())).isFalse();

            assertThat(connection.droppedFrames()).isEqualTo(2);
            assertThat(connection.isOpen()).isTrue();
        }

        @Test
        void pingBeforeOpenDoesNothing() {
            SseConnection connection = connectionOn(channel);

            connection.ping();

            assertThat(channel.frames()).isEmpty();
            verify(authorizationProvider, never()).fetch(any());
        }

        @Test
        void pingWritesKeepAliveAndRenewsLiveness() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            registry.advance(Duration.ofSeconds(50));
            connection.ping();
            registry.advance(Duration.ofSeconds(50));

            assertThat(channel.framesNamed("ping")).hasSize(1);
            assertThat(registry.countActive("tenant-1", "user-1")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        void successfulRefreshSwapsSnapshot() {
            AuthSnapshot first = snapshot("user-1");
            AuthSnapshot second = snapshot("user-1");
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(first, second);
            SseConnection connection = connectionOn(channel);
            connection.open();

            connection.refresh();

            assertThat(connection.auth()).isSameAs(second);
            assertThat(connection.isOpen()).isTrue();
        }

        @Test
        void revocationSendsOneErrorFrameAndClosesGracefully() {
            when(authorizationProvider.fetch(CONTEXT))
                    .thenReturn(snapshot("user-1"))
                    .thenThrow(new AuthorizationException("token expired"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            connection.refresh();

            assertThat(channel.framesNamed("error")).hasSize(1);
            assertThat(channel.frames().get(channel.frames().size() - 1)).contains("token expired");
            assertThat(channel.completions()).isEqualTo(1);
            assertThat(channel.error()).isNull();
            assertThat(connection.isClosed()).isTrue();
            assertThat(connection.state()).isEqualTo(SseConnection.State.CLOSED);
        }

        @Test
        void revocationErrorFrameIsWrittenEvenWhenBufferIsFull() {
            RecordingChannel full = new RecordingChannel(1);
            when(authorizationProvider.fetch(CONTEXT))
                    .thenReturn(snapshot("user-1"))
                    .thenThrow(new AuthorizationException("access revoked"));
            SseConnection connection = connectionOn(full);
            connection.open();
            assertThat(connection.send(secretCreated())).isFalse();

            connection.refresh();

            assertThat(full.framesNamed("error")).hasSize(1);
            assertThat(full.frames().get(full.frames().size() - 1)).contains("access revoked");
            assertThat(full.completions()).isEqualTo(1);
            assertThat(connection.isClosed()).isTrue();
        }

        @Test
        void unexpectedFailureTearsStreamDownWithTransportError() {
            IllegalStateException outage = new IllegalStateException("permission store down");
            when(authorizationProvider.fetch(CONTEXT))
                    .thenReturn(snapshot("user-1"))
                    .thenThrow(outage);
            SseConnection connection = connectionOn(channel);
            connection.open();

            connection.refresh();

            assertThat(channel.error()).isSameAs(outage);
            assertThat(channel.framesNamed("error")).isEmpty();
            assertThat(channel.completions()).isZero();
            assertThat(connection.isClosed()).isTrue();
        }

        @Test
        void refreshAfterCloseIsNoop() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();
            connection.close();

            connection.refresh();

            verify(authorizationProvider).fetch(CONTEXT);
        }
    }

    @Nested
    @DisplayName("close")
    class Close {

        @Test
        void closeIsIdempotent() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            connection.close();
            connection.close();

            assertThat(channel.completions()).isEqualTo(1);
            assertThat(connection.send(secretCreated())).isFalse();
        }

        @Test
        void peerDisconnectClosesConnection() {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();

            channel.disconnect();
            connection.close();

            assertThat(connection.isClosed()).isTrue();
            assertThat(channel.completions()).isZero();
        }

        @Test
        void closeRacingWithSendNeverThrows() throws Exception {
            when(authorizationProvider.fetch(CONTEXT)).thenReturn(snapshot("user-1"));
            SseConnection connection = connectionOn(channel);
            connection.open();
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?> sender = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1_000; i++) {
                        connection.send(secretCreated());
                    }
                    return null;
                });
                Future<?> closer = pool.submit(() -> {
                    start.await();
                    connection.close();
                    connection.close();
                    return null;
                });
                start.countDown();

                sender.get(5, TimeUnit.SECONDS);
                closer.get(5, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertThat(connection.isClosed()).isTrue();
            assertThat(channel.completions()).isEqualTo(1);
        }
    }
}
