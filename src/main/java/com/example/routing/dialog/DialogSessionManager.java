package com.example.routing.dialog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Owns the live dialogs, one engine per conversation id. Turns for the same
 * conversation run under that conversation's lock; different conversations
 * never contend. Sessions are dropped when they reach a terminal phase, are
 * reset, or sit idle longer than the TTL.
 */
public class DialogSessionManager {

    private static final Logger log = LoggerFactory.getLogger(DialogSessionManager.class);

    static final class Session {
        final GuidedDialogEngine engine;
        final ReentrantLock lock = new ReentrantLock();
        volatile Instant lastAccess;

        Session(GuidedDialogEngine engine, Instant now) {
            this.engine = engine;
            this.lastAccess = now;
        }
    }

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Supplier<GuidedDialogEngine> engineFactory;
    private final Duration ttl;
    private final Clock clock;

    public DialogSessionManager(Supplier<GuidedDialogEngine> engineFactory, Duration ttl, Clock clock) {
        this.engineFactory = engineFactory;
        this.ttl = ttl;
        this.clock = clock;
    }

    public DialogResponse start(String text) {
        return start(UUID.randomUUID().toString(), text);
    }

    /** Starts a conversation under the given id, replacing any session already held for it. */
    public DialogResponse start(String conversationId, String text) {
        Session session = new Session(engineFactory.get(), clock.instant());
        Session previous = sessions.put(conversationId, session);
        if (previous != null) {
            log.info("Replacing existing dialog session {}", conversationId);
        }
        return withLock(conversationId, session, engine -> engine.startDialog(text, conversationId));
    }

    public DialogResponse respond(String conversationId, String text) {
        return withLock(conversationId, require(conversationId), engine -> engine.processResponse(text));
    }

    public Map<String, Object> summary(String conversationId) {
        Session session = require(conversationId);
        session.lock.lock();
        try {
            return session.engine.summary();
        } finally {
            session.lock.unlock();
        }
    }

    /** Drops the conversation. Returns false when no such session exists. */
    public boolean reset(String conversationId) {
        Session session = sessions.remove(conversationId);
        if (session == null) {
            return false;
        }
        session.lock.lock();
        try {
            session.engine.reset();
        } finally {
            session.lock.unlock();
        }
        return true;
    }

    public boolean contains(String conversationId) {
        return sessions.containsKey(conversationId);
    }

    public int activeSessions() {
        return sessions.size();
    }

    /** Removes sessions idle past the TTL. Sessions mid-turn are left for the next sweep. */
    @Scheduled(fixedDelayString = "${app.router.dialog.sweep-interval:PT1M}")
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.lastAccess.isAfter(cutoff) || !session.lock.tryLock()) {
                continue;
            }
            try {
                if (sessions.remove(entry.getKey(), session)) {
                    session.engine.reset();
                    removed++;
                }
            } finally {
                session.lock.unlock();
            }
        }
        if (removed > 0) {
            log.info("Expired {} idle dialog sessions ({} active)", removed, sessions.size());
        }
        return removed;
    }

    private Session require(String conversationId) {
        Session session = sessions.get(conversationId);
        if (session == null) {
            throw new DialogStateException(DialogStateException.Reason.NOT_FOUND,
                "Unknown conversation: " + conversationId);
        }
        return session;
    }

    private DialogResponse withLock(String conversationId, Session session,
                                    Function<GuidedDialogEngine, DialogResponse> turn) {
        session.lock.lock();
        try {
            session.lastAccess = clock.instant();
            DialogResponse response = turn.apply(session.engine);
            if (response.phase().isTerminal()) {
                sessions.remove(conversationId, session);
                log.debug("Dialog {} finished in phase {}", conversationId, response.phase().value());
            }
            return response;
        } finally {
            session.lock.unlock();
        }
    }
}
