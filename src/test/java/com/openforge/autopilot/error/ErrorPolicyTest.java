package com.openforge.autopilot.error;

import com.openforge.autopilot.agent.AgentInitializationException;
import com.openforge.autopilot.agent.AgentRunException;
import com.openforge.autopilot.agent.BrowserException;
import com.openforge.autopilot.channel.MessageParseException;
import com.openforge.autopilot.reply.ReplyGenerationException;
import com.openforge.autopilot.telemetry.CaptureException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorPolicyTest {

    private final ErrorPolicy policy = ErrorPolicy.defaults();

    @Test
    void classifiesEachFailureByItsType() {
        assertThat(policy.classify(new MessageParseException("bad", "x"), null)).isEqualTo(ErrorType.MESSAGE);
        assertThat(policy.classify(new ReplyGenerationException("down", null), null)).isEqualTo(ErrorType.CHAT);
        assertThat(policy.classify(new CaptureException("busy", null), null)).isEqualTo(ErrorType.SCREENSHOT);
        assertThat(policy.classify(new AgentInitializationException("no chromium", null), null)).isEqualTo(ErrorType.AGENT);
        assertThat(policy.classify(new AgentRunException("stuck"), null)).isEqualTo(ErrorType.AUTOMATION);
        assertThat(policy.classify(new BrowserException("gone", null), null)).isEqualTo(ErrorType.BROWSER);
    }

    @Test
    void foreignFailuresUseTheFallbackOrConnection() {
        assertThat(policy.classify(new IllegalStateException(), ErrorType.CHAT)).isEqualTo(ErrorType.CHAT);
        assertThat(policy.classify(new IllegalStateException(), null)).isEqualTo(ErrorType.CONNECTION);
    }

    @Test
    void defaultFatalSetIsAgentAndBrowser() {
        assertThat(EnumSet.allOf(ErrorType.class)).filteredOn(policy::isFatal)
                .containsExactlyInAnyOrder(ErrorType.AGENT, ErrorType.BROWSER);
    }

    @Test
    void recoverableTypesAreNeverFatal() {
        ErrorPolicy everything = new ErrorPolicy(EnumSet.allOf(ErrorType.class));

        assertThat(everything.isFatal(ErrorType.MESSAGE)).isFalse();
        assertThat(everything.isFatal(ErrorType.CHAT)).isFalse();
        assertThat(everything.isFatal(ErrorType.SCREENSHOT)).isFalse();
        assertThat(everything.isFatal(ErrorType.AUTOMATION)).isTrue();
    }

    @Test
    void emptyFatalSetTearsNothingDown() {
        ErrorPolicy none = new ErrorPolicy(EnumSet.noneOf(ErrorType.class));

        assertThat(none.isFatal(ErrorType.BROWSER)).isFalse();
    }
}
