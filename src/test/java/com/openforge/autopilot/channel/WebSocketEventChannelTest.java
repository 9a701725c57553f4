package com.openforge.autopilot.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.config.AppConfig;
import com.openforge.autopilot.event.SessionEvent;
import com.openforge.autopilot.session.SessionSnapshot;
import com.openforge.autopilot.session.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketEventChannelTest {

    @Mock private WebSocketSession wsSession;

    private final ObjectMapper objectMapper = AppConfig.jsonMapper();
    private final SessionSnapshot state = new SessionSnapshot(
            "s-1", SessionStatus.RUNNING, "file my ITR", 1, "1", null, Instant.now());

    private WebSocketEventChannel channel;

    @BeforeEach
    void setUp() {
        lenient().when(wsSession.getId()).thenReturn("ws-1");
        lenient().when(wsSession.isOpen()).thenReturn(true);
        channel = new WebSocketEventChannel(wsSession, objectMapper);
    }

    @Test
    void sendWritesOneCompleteJsonFrame() throws Exception {
        boolean sent = channel.send(SessionEvent.statusUpdate(state, "hello"));

        assertThat(sent).isTrue();
        verify(wsSession).sendMessage(argThat(m -> {
            try {
                JsonNode json = objectMapper.readTree(((TextMessage) m).getPayload());
                return json.get("type").asText().equals("status_update")
                        && json.get("message").asText().equals("hello")
                        && json.get("session_id").asText().equals("s-1");
            } catch (IOException e) {
                return false;
            }
        }));
    }

    @Test
    void concurrentProducersNeverInterleaveAndKeepTheirOwnOrder() throws Exception {
        int producers = 6;
        int perProducer = 50;
        List<String> payloads = new CopyOnWriteArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        doAnswer(invocation -> {
            if (inFlight.incrementAndGet() > 1) overlapped.set(true);
            TextMessage message = invocation.getArgument(0);
            payloads.add(message.getPayload());
            Thread.yield();
            inFlight.decrementAndGet();
            return null;
        }).when(wsSession).sendMessage(any());

        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch go = new CountDownLatch(1);
        for (int p = 0; p < producers; p++) {
            int producer = p;
            pool.execute(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                for (int i = 0; i < perProducer; i++) {
                    channel.send(SessionEvent.statusUpdate(state, "p" + producer + "-" + i));
                }
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(overlapped).isFalse();
        assertThat(payloads).hasSize(producers * perProducer);

        Map<String, List<Integer>> byProducer = new HashMap<>();
        for (String payload : payloads) {
            String marker = objectMapper.readTree(payload).get("message").asText();
            String[] parts = marker.split("-");
            byProducer.computeIfAbsent(parts[0], k -> new ArrayList<>()).add(Integer.parseInt(parts[1]));
        }
        assertThat(byProducer).hasSize(producers);
        byProducer.values().forEach(seq -> assertThat(seq).isSorted().hasSize(perProducer));
    }

    @Test
    void sendsAfterCloseAreDropped() throws Exception {
        channel.close();

        boolean sent = channel.send(SessionEvent.statusUpdate(state, "too late"));

        assertThat(sent).isFalse();
        assertThat(channel.isOpen()).isFalse();
        verify(wsSession, never()).sendMessage(any());
        verify(wsSession).close(CloseStatus.NORMAL);
    }

    @Test
    void closeIsIdempotent() throws Exception {
        channel.close();
        channel.close();

        verify(wsSession, times(1)).close(CloseStatus.NORMAL);
    }

    @Test
    void transportFailureIsReportedAsFalseNotThrown() throws Exception {
        doThrow(new IOException("Broken pipe")).when(wsSession).sendMessage(any());

        assertThat(channel.send(SessionEvent.statusUpdate(state, "x"))).isFalse();
    }

    @Test
    void closedTransportIsNotWritten() throws Exception {
        when(wsSession.isOpen()).thenReturn(false);

        assertThat(channel.send(SessionEvent.statusUpdate(state, "x"))).isFalse();
        verify(wsSession, never()).sendMessage(any());
    }
}
