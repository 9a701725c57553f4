package com.openforge.autopilot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.agent.AgentAdapter;
import com.openforge.autopilot.session.SessionRegistry;
import com.openforge.autopilot.support.FakeBrowserAgent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AutopilotApplicationTest {

    @LocalServerPort private int port;

    @Autowired private TestRestTemplate rest;
    @Autowired private ObjectMapper     objectMapper;
    @Autowired private SessionRegistry  registry;

    @MockBean private AgentAdapter agentAdapter;

    @Test
    void healthEndpointAnswers() throws Exception {
        ResponseEntity<String> response = rest.getForEntity("/api/v1/automation/health", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode body = objectMapper.readTree(response.getBody());
        assertThat(body.get("status").asText()).isEqualTo("healthy");
        assertThat(body.has("active_sessions")).isTrue();
    }

    @Test
    void websocketSessionLifecycle() throws Exception {
        when(agentAdapter.initialize(any())).thenReturn(new FakeBrowserAgent());
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        TextWebSocketHandler client = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession session, TextMessage message) {
                frames.add(message.getPayload());
            }
        };

        WebSocketSession ws = new StandardWebSocketClient()
                .execute(client, "ws://localhost:" + port + "/api/v1/automation/ws")
                .get(10, TimeUnit.SECONDS);

        JsonNode connection = objectMapper.readTree(frames.poll(10, TimeUnit.SECONDS));
        assertThat(connection.get("type").asText()).isEqualTo("connection");
        assertThat(connection.get("status").asText()).isEqualTo("connected");
        String sessionId = connection.get("session_id").asText();
        assertThat(registry.contains(sessionId)).isTrue();

        ResponseEntity<String> listed = rest.getForEntity("/api/v1/automation/sessions/" + sessionId, String.class);
        assertThat(listed.getStatusCode()).isEqualTo(HttpStatus.OK);

        ws.sendMessage(new TextMessage("{\"type\":\"stop_task\"}"));
        JsonNode stopped = objectMapper.readTree(frames.poll(10, TimeUnit.SECONDS));
        assertThat(stopped.get("type").asText()).isEqualTo("status_update");
        assertThat(stopped.get("message").asText()).isEqualTo("No automation task is running");

        ws.close(CloseStatus.NORMAL);
        await().atMost(Duration.ofSeconds(10)).until(() -> !registry.contains(sessionId));
        assertThat(rest.getForEntity("/api/v1/automation/sessions/" + sessionId, String.class).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }
}
