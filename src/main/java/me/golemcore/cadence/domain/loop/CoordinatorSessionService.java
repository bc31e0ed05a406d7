package me.golemcore.cadence.domain.loop;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.cadence.domain.model.ActionRequest;
import me.golemcore.cadence.domain.model.TurnResult;
import me.golemcore.cadence.domain.service.ActionPlanner;
import me.golemcore.cadence.domain.service.ResponseComposer;
import me.golemcore.cadence.infrastructure.config.CadenceProperties;
import me.golemcore.cadence.port.outbound.ActionProviderPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Entry point for coordinator conversations. Keeps one
 * {@link CoordinatorAgent} per session id and serializes the turns of each
 * session, while different sessions run concurrently.
 *
 * <p>
 * Sessions end on {@link #close(String)} or after
 * {@code cadence.sessions.idle-timeout-minutes} without activity; a background
 * thread sweeps idle sessions every
 * {@code cadence.sessions.eviction-interval-minutes}. A later message for a
 * closed session starts a fresh agent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CoordinatorSessionService {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private final ActionPlanner planner;
    private final ActionProviderPort actionProvider;
    private final ResponseComposer responseComposer;
    private final CadenceProperties properties;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    private final ScheduledExecutorService evictionExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "session-eviction");
        t.setDaemon(true);
        return t;
    });

    @PostConstruct
    void init() {
        long interval = properties.getSessions().getEvictionIntervalMinutes();
        evictionExecutor.scheduleAtFixedRate(this::evictIdleSessions, interval, interval, TimeUnit.MINUTES);
    }

    @PreDestroy
    void destroy() {
        evictionExecutor.shutdownNow();
        try {
            evictionExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public TurnResult handleMessage(String sessionId, String message, Map<String, Object> context) {
        return withAgent(sessionId, agent -> agent.handleMessage(message, context));
    }

    public TurnResult approvePending(String sessionId, int index) {
        return withAgent(sessionId, agent -> agent.approvePending(index));
    }

    public ActionRequest rejectPending(String sessionId, int index) {
        return withAgent(sessionId, agent -> agent.rejectPending(index));
    }

    public List<ActionRequest> getPendingActions(String sessionId) {
        Session session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            return session.agent.getPendingActions();
        }
    }

    public void reset(String sessionId) {
        Session session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            return;
        }
        synchronized (session) {
            session.agent.reset();
        }
        log.info("[Executor] Session {} reset", sessionId);
    }

    /**
     * Ends a session and releases its history, resolution memory and pending
     * actions. Waits for a turn in progress to finish.
     *
     * @return false when no such session was open
     */
    public boolean close(String sessionId) {
        Session session = sessionId != null ? sessions.get(sessionId) : null;
        if (session == null) {
            return false;
        }
        synchronized (session) {
            boolean removed = sessions.remove(sessionId, session);
            if (removed) {
                log.info("[Executor] Session {} closed", sessionId);
            }
            return removed;
        }
    }

    /**
     * Closes every session idle for longer than the configured timeout.
     *
     * @return number of sessions closed
     */
    public int evictIdleSessions() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getSessions().getIdleTimeoutMinutes()));
        int evicted = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            synchronized (session) {
                if (session.lastActivity.isBefore(cutoff) && sessions.remove(entry.getKey(), session)) {
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("[Executor] Evicted {} idle session(s)", evicted);
        }
        return evicted;
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    private <T> T withAgent(String sessionId, Function<CoordinatorAgent, T> turn) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        while (true) {
            Session session = sessions.computeIfAbsent(sessionId, this::newSession);
            synchronized (session) {
                // closed or evicted while this caller waited for the lock
                if (sessions.get(sessionId) != session) {
                    continue;
                }
                session.lastActivity = clock.instant();
                return turn.apply(session.agent);
            }
        }
    }

    private Session newSession(String sessionId) {
        log.debug("[Executor] New session {}", sessionId);
        CoordinatorAgent agent = new CoordinatorAgent(sessionId, planner, actionProvider, responseComposer,
                properties.getPlanner().getHistoryLimit());
        return new Session(agent, clock.instant());
    }

    private static final class Session {
        private final CoordinatorAgent agent;
        private Instant lastActivity;

        private Session(CoordinatorAgent agent, Instant lastActivity) {
            this.agent = agent;
            this.lastActivity = lastActivity;
        }
    }
}
