package com.piperplatform.orchestrator.session;

import com.piperplatform.orchestrator.ai.AnswerSimilarityChecker;
import com.piperplatform.orchestrator.logger.SafetyGateFlowLogger;
import com.piperplatform.orchestrator.pipeline.SafetyGatePipeline;
import jakarta.annotation.PreDestroy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open sessions by id. Sessions share nothing but the stateless pipeline.
 */
@Component
public class SessionRegistry {

    private final Map<String, SafetyGateSession> sessions = new ConcurrentHashMap<>();

    private final SafetyGatePipeline   pipeline;
    private final AnswerSimilarityChecker similarityChecker;
    private final SafetyGateFlowLogger flowLogger;
    private final Clock                clock;
    private final Scheduler            scheduler;

    public SessionRegistry(SafetyGatePipeline pipeline, AnswerSimilarityChecker similarityChecker,
                           SafetyGateFlowLogger flowLogger, Clock clock,
                           @Qualifier("safetyGateScheduler") Scheduler scheduler) {
        this.pipeline   = pipeline;
        this.similarityChecker = similarityChecker;
        this.flowLogger = flowLogger;
        this.clock      = clock;
        this.scheduler  = scheduler;
    }

    public SafetyGateSession open() {
        String id = UUID.randomUUID().toString();
        SafetyGateSession session = new SafetyGateSession(id, pipeline, similarityChecker, flowLogger, clock, scheduler);
        sessions.put(id, session);
        flowLogger.logStage(SafetyGateFlowLogger.SESSION_OPENED, id);
        return session;
    }

    /**
     * @throws SessionNotFoundException when no open session has this id
     */
    public SafetyGateSession get(String sessionId) {
        SafetyGateSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public void close(String sessionId) {
        SafetyGateSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        session.close();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        sessions.values().forEach(SafetyGateSession::close);
        sessions.clear();
    }
}
