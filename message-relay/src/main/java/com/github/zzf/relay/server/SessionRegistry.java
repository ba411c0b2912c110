package com.github.zzf.relay.server;

import static java.util.stream.Collectors.toUnmodifiableList;

import io.netty.channel.Channel;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * <pre>
 * id -> active session
 *
 * register / remove hold the write lock, snapshots hold the read lock.
 * no lock is held while writing to a socket: callers iterate the snapshot.
 *
 * ids come from an 8-bit counter starting at 1. after 255 it wraps to 1 and skips the ids
 * still in use. 0 is never assigned.
 * </pre>
 */
@Slf4j
public class SessionRegistry {

    public static final int NO_EXCLUSION = 0;
    public static final int MIN_ID = 1;
    public static final int MAX_ID = 0xFF;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final Map<Integer, ServerSession> sessions = new HashMap<>();
    // guarded by lock.writeLock()
    private int nextId = MIN_ID;

    /**
     * admit a freshly accepted connection as an ACTIVE session
     *
     * @param channel the accepted channel
     * @return the registered session
     * @throws RegistryFullException if all ids are taken
     */
    public ServerSession register(Channel channel) {
        lock.writeLock().lock();
        try {
            int id = allocateId();
            ServerSession session = new DefaultServerSession(id, channel, this);
            sessions.put(id, session);
            log.debug("Session({}) registered -> sessions: {}", id, sessions.size());
            return session;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int allocateId() {
        if (sessions.size() >= MAX_ID) {
            throw new RegistryFullException("no free session id, sessions: " + sessions.size());
        }
        // terminates: at least one id is free
        while (true) {
            int candidate = nextId;
            nextId = candidate == MAX_ID ? MIN_ID : candidate + 1;
            if (!sessions.containsKey(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * snapshot of the active sessions except one
     *
     * @param excludeId id to leave out, {@link #NO_EXCLUSION} leaves out nobody
     * @return immutable snapshot
     */
    public List<ServerSession> lookupAllExcept(int excludeId) {
        lock.readLock().lock();
        try {
            return sessions.values().stream()
                .filter(s -> s.id() != excludeId)
                .filter(ServerSession::isActive)
                .collect(toUnmodifiableList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public ServerSession get(int id) {
        lock.readLock().lock();
        try {
            return sessions.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * tear the session bound to the id down, see {@link ServerSession#close(CloseReason)}.
     * <p>idempotent</p>
     *
     * @return true if a session was removed
     */
    public boolean remove(int id) {
        ServerSession session = get(id);
        // close() leaves the registry through remove(ServerSession)
        return session != null && session.close(CloseReason.EVICTED);
    }

    /**
     * remove the session only if the id is still bound to it, an id reused after wraparound is
     * left alone
     */
    boolean remove(ServerSession session) {
        lock.writeLock().lock();
        try {
            boolean removed = sessions.remove(session.id(), session);
            if (removed) {
                log.debug("Session({}) removed -> sessions: {}", session.id(), sessions.size());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * close every registered session
     *
     * @return number of sessions closed by this call
     */
    public int closeAll(CloseReason reason) {
        int closed = 0;
        for (ServerSession session : lookupAllExcept(NO_EXCLUSION)) {
            if (session.close(reason)) {
                closed += 1;
            }
        }
        return closed;
    }

}
