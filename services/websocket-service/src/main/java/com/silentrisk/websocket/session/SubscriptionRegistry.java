package com.silentrisk.websocket.session;

import com.silentrisk.common.config.SilentRiskProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tracks open WebSocket sessions and the tasks each one follows.
 *
 * <p>Two indexes are kept in step: session to tasks, and task to sessions.
 * Sets that become empty are removed so {@link #stats()} only reports tasks
 * with live subscribers. Per-session changes run inside the session's entry
 * of the session index, and per-task changes inside the task's entry of the
 * task index, so concurrent subscribe and remove calls leave no stale entry.
 * Sessions are wrapped in a
 * {@link ConcurrentWebSocketSessionDecorator} because broadcasts for different
 * tasks can reach the same session from several threads.
 */
@Slf4j
@Component
public class SubscriptionRegistry {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> tasksBySession = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> sessionsByTask = new ConcurrentHashMap<>();
    private final SilentRiskProperties.Websocket settings;

    public SubscriptionRegistry(SilentRiskProperties properties, MeterRegistry meterRegistry) {
        this.settings = properties.getWebsocket();
        Gauge.builder("silentrisk.ws.connections", sessions, Map::size)
                .description("Open WebSocket connections")
                .register(meterRegistry);
    }

    /**
     * @return false when the connection limit is reached and the session was not registered
     */
    public synchronized boolean register(WebSocketSession session) {
        if (sessions.size() >= settings.getMaxConnections()) {
            log.warn("Connection limit reached ({}), rejecting session {}", settings.getMaxConnections(), session.getId());
            return false;
        }
        tasksBySession.put(session.getId(), ConcurrentHashMap.newKeySet());
        sessions.put(session.getId(), new ConcurrentWebSocketSessionDecorator(
                session, (int) settings.getSendTimeLimit().toMillis(), settings.getSendBufferSizeLimit()));
        log.info("WebSocket connected: sessionId={}, total={}", session.getId(), sessions.size());
        return true;
    }

    /**
     * Subscribing twice to the same task is a no-op. Runs under the session's
     * entry lock, so it cannot interleave with {@link #remove(String)}.
     *
     * @return false when the session is not registered
     */
    public boolean subscribe(String sessionId, String taskId) {
        Set<String> tasks = tasksBySession.computeIfPresent(sessionId, (id, current) -> {
            current.add(taskId);
            sessionsByTask.compute(taskId, (key, ids) -> {
                Set<String> subscribers = ids != null ? ids : ConcurrentHashMap.newKeySet();
                subscribers.add(sessionId);
                return subscribers;
            });
            return current;
        });
        if (tasks == null) {
            return false;
        }
        log.debug("Session {} subscribed to task {}", sessionId, taskId);
        return true;
    }

    public void unsubscribe(String sessionId, String taskId) {
        tasksBySession.computeIfPresent(sessionId, (id, current) -> {
            current.remove(taskId);
            detach(taskId, sessionId);
            return current;
        });
        log.debug("Session {} unsubscribed from task {}", sessionId, taskId);
    }

    /**
     * Drops the session and every subscription it held. Safe to call more than once.
     */
    public void remove(String sessionId) {
        tasksBySession.computeIfPresent(sessionId, (id, tasks) -> {
            tasks.forEach(taskId -> detach(taskId, sessionId));
            return null;
        });
        WebSocketSession removed = sessions.remove(sessionId);
        if (removed != null) {
            log.info("WebSocket disconnected: sessionId={}, total={}", sessionId, sessions.size());
        }
    }

    /**
     * Snapshot of the sessions subscribed to a task.
     */
    public List<WebSocketSession> subscribers(String taskId) {
        Set<String> ids = sessionsByTask.get(taskId);
        if (ids == null) {
            return Collections.emptyList();
        }
        return ids.stream()
                .map(sessions::get)
                .filter(Objects::nonNull)
                .toList();
    }

    public Optional<WebSocketSession> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public int connectionCount() {
        return sessions.size();
    }

    public SubscriptionStats stats() {
        Map<String, Integer> perTask = new TreeMap<>();
        sessionsByTask.forEach((taskId, ids) -> perTask.put(taskId, ids.size()));
        int totalSubscriptions = tasksBySession.values().stream().mapToInt(Set::size).sum();
        return SubscriptionStats.builder()
                .totalConnections(sessions.size())
                .totalSubscriptions(totalSubscriptions)
                .tasksWithSubscribers(perTask.size())
                .connectionsPerTask(perTask)
                .build();
    }

    private void detach(String taskId, String sessionId) {
        sessionsByTask.computeIfPresent(taskId, (key, ids) -> {
            ids.remove(sessionId);
            return ids.isEmpty() ? null : ids;
        });
    }
}
