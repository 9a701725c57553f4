package com.openforge.autopilot.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.autopilot.config.AppConfig;
import com.openforge.autopilot.session.SessionSnapshot;
import com.openforge.autopilot.session.SessionStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SessionEventTest {

    private final ObjectMapper objectMapper = AppConfig.jsonMapper();

    private final SessionSnapshot connected = new SessionSnapshot(
            "s-1", SessionStatus.CONNECTED, null, 0, null, null, Instant.now());

    @Test
    void stateFieldsAreAlwaysWrittenEvenWhenNull() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                SessionEvent.connection(connected, List.of("tax_filing"))));

        assertThat(json.get("type").asText()).isEqualTo("connection");
        assertThat(json.get("status").asText()).isEqualTo("connected");
        assertThat(json.get("session_id").asText()).isEqualTo("s-1");
        assertThat(json.get("step_count").asInt()).isZero();
        assertThat(json.has("current_task")).isTrue();
        assertThat(json.get("current_task").isNull()).isTrue();
        assertThat(json.get("current_step").isNull()).isTrue();
        assertThat(json.get("error").isNull()).isTrue();
        assertThat(json.get("capabilities").get(0).asText()).isEqualTo("tax_filing");
    }

    @Test
    void optionalFieldsAreOmittedWhenAbsent() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                SessionEvent.statusUpdate(connected, "hello")));

        assertThat(json.has("url")).isFalse();
        assertThat(json.has("screenshot")).isFalse();
        assertThat(json.has("error_type")).isFalse();
        assertThat(json.has("details")).isFalse();
    }

    @Test
    void timestampIsIso8601() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                SessionEvent.typing(connected)));

        assertThat(Instant.parse(json.get("timestamp").asText())).isNotNull();
    }

    @Test
    void errorEventCarriesCategoryAndDetails() throws Exception {
        SessionSnapshot failed = new SessionSnapshot(
                "s-1", SessionStatus.ERROR, "file my ITR", 3, "3", "browser died", Instant.now());

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(
                SessionEvent.error(failed, "browser died", "browser", false,
                        Map.of("exception", "BrowserException"))));

        assertThat(json.get("type").asText()).isEqualTo("error");
        assertThat(json.get("error_type").asText()).isEqualTo("browser");
        assertThat(json.get("recoverable").asBoolean()).isFalse();
        assertThat(json.get("error").asText()).isEqualTo("browser died");
        assertThat(json.get("details").get("exception").asText()).isEqualTo("BrowserException");
        assertThat(json.get("current_task").asText()).isEqualTo("file my ITR");
    }

    @Test
    void stepStartCarriesTheCurrentStepLabel() {
        SessionSnapshot running = new SessionSnapshot(
                "s-1", SessionStatus.RUNNING, "file my ITR", 2, "2", null, Instant.now());

        SessionEvent event = SessionEvent.stepStart(running, "https://portal.example", "Login");

        assertThat(event.message()).isEqualTo("Starting step 2");
        assertThat(event.step()).isEqualTo("2");
        assertThat(event.url()).isEqualTo("https://portal.example");
    }
}
