package com.openforge.autopilot.session;

import com.openforge.autopilot.agent.AgentAdapter;
import com.openforge.autopilot.channel.EventChannel;
import com.openforge.autopilot.channel.InboundMessageParser;
import com.openforge.autopilot.config.AutomationProperties;
import com.openforge.autopilot.intent.IntentClassifier;
import com.openforge.autopilot.reply.ConversationHistoryRegistry;
import com.openforge.autopilot.reply.ReplyGenerator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Opens a {@link SessionOrchestrator} for every new client connection.
 */
@Component
public class SessionOrchestratorFactory {

    private final SessionOrchestrator.Collaborators collaborators;

    @Autowired
    public SessionOrchestratorFactory(SessionRegistry registry,
                                      AgentAdapter agentAdapter,
                                      InboundMessageParser parser,
                                      IntentClassifier classifier,
                                      ReplyGenerator replyGenerator,
                                      ConversationHistoryRegistry histories,
                                      AutomationProperties properties,
                                      @Qualifier("automationExecutor") ExecutorService automationExecutor,
                                      @Qualifier("telemetryExecutor") ExecutorService telemetryExecutor,
                                      Clock clock) {
        this.collaborators = new SessionOrchestrator.Collaborators(
                registry, agentAdapter, parser, classifier, replyGenerator, histories,
                properties.errorPolicy(), properties, automationExecutor, telemetryExecutor, clock);
    }

    SessionOrchestratorFactory(SessionOrchestrator.Collaborators collaborators) {
        this.collaborators = collaborators;
    }

    /**
     * Allocates a fresh session id and opens the session on {@code channel}.
     *
     * @throws com.openforge.autopilot.agent.AgentInitializationException when the agent cannot
     *         be started; the client has been told and the channel is closed
     */
    public SessionOrchestrator open(EventChannel channel) {
        String sessionId = UUID.randomUUID().toString();
        SessionOrchestrator orchestrator = new SessionOrchestrator(
                new AutomationSession(sessionId, collaborators.clock()), channel, collaborators);
        orchestrator.open();
        return orchestrator;
    }
}
