package com.sceneit.engine.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.io.SceneItConfig;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.storyboard.Storyboard;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Single-writer editing session around a {@link Storyboard}.
 *
 * Structural commands may be submitted from any thread. They travel through an
 * LMAX Disruptor ring buffer to one consumer thread, the only thread that ever
 * mutates the storyboard, so the storyboard itself needs no locking.
 *
 * Submission is asynchronous: each method returns the command id at once and
 * the outcome is delivered later to the
 * {@link StoryboardCommandHandler.CommandOutcomeCallback}.
 *
 * Lifecycle:
 * - The constructor returns only once the consumer thread is running.
 * - Submissions hold the read side of a lock while they publish; {@link #close()}
 * takes the write side. Every command accepted before close is in the ring
 * buffer when the drain starts, and every later submission fails with
 * {@link IllegalStateException}.
 *
 * While the session is open the storyboard belongs to the consumer thread.
 * Read it only after {@link #close()}, which drains every pending command.
 */
public final class StoryboardSession implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(StoryboardSession.class);
    private static final long START_TIMEOUT_SECONDS = 10;

    private final Storyboard storyboard;
    private final Disruptor<StoryboardCommand> disruptor;
    private final RingBuffer<StoryboardCommand> ringBuffer;
    private final AtomicLong nextCommandId = new AtomicLong();
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private boolean closed;

    public StoryboardSession(Storyboard storyboard, StoryboardCommandHandler.CommandOutcomeCallback callback) {
        this(storyboard, callback, storyboard.config());
    }

    public StoryboardSession(Storyboard storyboard, StoryboardCommandHandler.CommandOutcomeCallback callback,
            SceneItConfig config) {
        this.storyboard = storyboard;
        this.disruptor = new Disruptor<>(
                StoryboardCommand::new,
                config.getRingBufferSize(),
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        StoryboardCommandHandler handler = new StoryboardCommandHandler(storyboard,
                callback != null ? callback : LOGGING_CALLBACK);
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        awaitConsumer(handler);
        log.info("Storyboard session started (ring buffer size {})", ringBuffer.getBufferSize());
    }

    private void awaitConsumer(StoryboardCommandHandler handler) {
        boolean started;
        try {
            started = handler.awaitStart(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disruptor.halt();
            throw new IllegalStateException("Interrupted while starting storyboard session", e);
        }
        if (!started) {
            disruptor.halt();
            throw new IllegalStateException(
                    "Storyboard consumer thread did not start within " + START_TIMEOUT_SECONDS + "s");
        }
    }

    public Storyboard storyboard() {
        return storyboard;
    }

    public int bufferSize() {
        return ringBuffer.getBufferSize();
    }

    public long setSceneAsRoot(Id<Scene> scene) {
        lifecycle.readLock().lock();
        try {
            long id = nextId();
            ringBuffer.publishEvent((cmd, seq, s, cid) -> cmd.setRoot(s, cid), scene, id);
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public long linkScenes(Id<Scene> from, Id<Scene> dest) {
        lifecycle.readLock().lock();
        try {
            long id = nextId();
            ringBuffer.publishEvent((cmd, seq, f, d, cid) -> cmd.setLink(f, d, cid), from, dest, id);
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public long unlinkScenes(Id<Scene> from, Id<Scene> dest) {
        lifecycle.readLock().lock();
        try {
            long id = nextId();
            ringBuffer.publishEvent((cmd, seq, f, d, cid) -> cmd.setUnlink(f, d, cid), from, dest, id);
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public long moveScene(Id<Scene> scene, Id<Scene> from, Id<Scene> dest) {
        lifecycle.readLock().lock();
        try {
            long id = nextId();
            long sequence = ringBuffer.next();
            try {
                ringBuffer.get(sequence).setMove(scene, from, dest, id);
            } finally {
                ringBuffer.publish(sequence);
            }
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public long deleteScene(Id<Scene> scene) {
        lifecycle.readLock().lock();
        try {
            long id = nextId();
            ringBuffer.publishEvent((cmd, seq, s, cid) -> cmd.setDelete(s, cid), scene, id);
            return id;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    // caller holds the read lock
    private long nextId() {
        if (closed)
            throw new IllegalStateException("Storyboard session is closed");
        return nextCommandId.incrementAndGet();
    }

    /**
     * Waits until every published command has been applied, then stops the
     * consumer thread. Submissions already in progress on other threads are
     * published first.
     */
    @Override
    public void close() {
        lifecycle.writeLock().lock();
        try {
            if (closed)
                return;
            closed = true;
        } finally {
            lifecycle.writeLock().unlock();
        }
        disruptor.shutdown();
        log.info("Storyboard session closed after {} commands", nextCommandId.get());
    }

    private static final StoryboardCommandHandler.CommandOutcomeCallback LOGGING_CALLBACK =
            new StoryboardCommandHandler.CommandOutcomeCallback() {
                @Override
                public void onApplied(long commandId, StoryboardCommand.Type type) {
                    log.debug("Command {} {} applied", commandId, type);
                }

                @Override
                public void onRejected(long commandId, StoryboardCommand.Type type, StoryboardException error) {
                    log.warn("Command {} {} rejected: {}", commandId, type, error.getMessage());
                }

                @Override
                public void onFailed(long commandId, StoryboardCommand.Type type, RuntimeException error) {
                    log.error("Command {} {} failed", commandId, type, error);
                }
            };
}
