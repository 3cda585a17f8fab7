package com.rebenew.musicParty.queuesync.core;

import com.rebenew.musicParty.queuesync.error.SessionNotFoundException;
import com.rebenew.musicParty.queuesync.model.SessionSnapshot;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Una sesión viva: su estado, su canal de difusión y su único escritor.
 *
 * Todas las mutaciones pasan por {@link #execute(Function)}, que las serializa en
 * orden de llegada con un lock justo. La difusión ocurre dentro del lock, así que
 * todos los miembros ven los eventos en el orden en que se aplicaron.
 * Las lecturas usan {@link #latestSnapshot()} sin bloquear.
 */
public class LiveSession {
    private final SessionState state;
    private final BroadcastChannel channel;
    private final ReentrantLock lock = new ReentrantLock(true);

    private volatile SessionSnapshot latest;
    private volatile boolean closed = false;
    private final AtomicBoolean dismantled = new AtomicBoolean(false);
    private final long createdAt = System.currentTimeMillis();

    // protegidos por el lock
    private ScheduledFuture<?> teardownTask;
    private ScheduledFuture<?> trackEndTask;
    private long trackEndGeneration;

    public LiveSession(SessionState state, BroadcastChannel channel) {
        this.state = state;
        this.channel = channel;
        this.latest = state.snapshot();
    }

    /**
     * Ejecuta una operación como único escritor. Tras aplicarla verifica las
     * invariantes y publica el snapshot nuevo.
     *
     * @throws SessionNotFoundException si la sesión ya fue desmontada
     * @throws IllegalStateException si la operación rompió una invariante; la sesión queda cerrada
     */
    public <T> T execute(Function<LiveSession, T> operation) {
        lock.lock();
        try {
            if (closed) {
                throw new SessionNotFoundException(state.getSessionId());
            }
            long before = state.getVersion();
            try {
                T result = operation.apply(this);
                state.verifyInvariants();
                return result;
            } catch (IllegalStateException e) {
                closed = true;
                throw e;
            } finally {
                if (!closed && state.getVersion() != before) {
                    latest = state.snapshot();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marca la sesión como cerrada si se cumple la condición, bajo el lock.
     */
    public boolean closeIf(Function<SessionState, Boolean> condition) {
        lock.lock();
        try {
            if (closed || !Boolean.TRUE.equals(condition.apply(state))) {
                return false;
            }
            closed = true;
            cancelTeardown();
            cancelTrackEnd();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cierre incondicional (fallo de invariante o apagado del servidor).
     */
    public void forceClose() {
        lock.lock();
        try {
            closed = true;
            cancelTeardown();
            cancelTrackEnd();
        } finally {
            lock.unlock();
        }
    }

    // true solo la primera vez: conexiones, host e historial se liberan una única vez
    boolean markDismantled() {
        return dismantled.compareAndSet(false, true);
    }

    // ==================== TIMERS ====================

    void armTeardown(ScheduledFuture<?> task) {
        cancelTeardown();
        teardownTask = task;
    }

    boolean cancelTeardown() {
        ScheduledFuture<?> task = teardownTask;
        teardownTask = null;
        if (task != null && !task.isDone()) {
            task.cancel(false);
            return true;
        }
        return false;
    }

    /**
     * Invalida el timer de fin de track vigente y devuelve la generación del siguiente.
     * Debe llamarse con el lock tomado.
     */
    public long rearmTrackEnd() {
        cancelTrackEnd();
        return trackEndGeneration;
    }

    public void scheduleTrackEnd(ScheduledFuture<?> task) {
        trackEndTask = task;
    }

    // Un timer que ya estaba esperando el lock cuando se canceló no coincide
    public boolean isTrackEndCurrent(long generation) {
        return trackEndGeneration == generation;
    }

    public void cancelTrackEnd() {
        trackEndGeneration++;
        ScheduledFuture<?> task = trackEndTask;
        trackEndTask = null;
        if (task != null && !task.isDone()) {
            task.cancel(false);
        }
    }

    // ==================== ACCESO ====================

    public SessionState state() {
        return state;
    }

    public BroadcastChannel channel() {
        return channel;
    }

    public SessionSnapshot latestSnapshot() {
        return latest;
    }

    public String sessionId() {
        return state.getSessionId();
    }

    public boolean isClosed() {
        return closed;
    }

    public long getCreatedAt() {
        return createdAt;
    }
}
