package com.sceneit.engine.wiring;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.storyboard.Storyboard;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Disruptor EventHandler that applies {@link StoryboardCommand}s to a single
 * {@link Storyboard}.
 *
 * This is the bridge between the ring buffer and the storyboard. It runs on
 * one dedicated consumer thread, which makes it the storyboard's only writer:
 * commands from any number of producer threads are applied strictly one after
 * another, in publication order.
 *
 * Every command produces exactly one outcome on the
 * {@link CommandOutcomeCallback}: applied, or rejected with the
 * {@link StoryboardException}. Unexpected failures are logged and reported as
 * well; they never kill the consumer thread.
 *
 * The consumer thread releases {@link #awaitStart} once it is running. A
 * processor halted before that point never handles anything, so the session
 * waits for it before accepting commands.
 */
public final class StoryboardCommandHandler implements EventHandler<StoryboardCommand>, LifecycleAware {
    private static final Logger log = LogManager.getLogger(StoryboardCommandHandler.class);

    private final Storyboard storyboard;
    private final CommandOutcomeCallback callback;
    private final CountDownLatch started = new CountDownLatch(1);

    public StoryboardCommandHandler(Storyboard storyboard, CommandOutcomeCallback callback) {
        this.storyboard = storyboard;
        this.callback = callback;
    }

    @Override
    public void onEvent(StoryboardCommand command, long sequence, boolean endOfBatch) {
        try {
            execute(command);
            callback.onApplied(command.commandId(), command.type());
        } catch (StoryboardException e) {
            callback.onRejected(command.commandId(), command.type(), e);
        } catch (RuntimeException e) {
            log.error("Error processing {} at sequence {}: {}", command, sequence, e.getMessage(), e);
            callback.onFailed(command.commandId(), command.type(), e);
        } finally {
            command.clear();
        }
    }

    @Override
    public void onStart() {
        log.debug("Storyboard command consumer started on {}", Thread.currentThread().getName());
        started.countDown();
    }

    @Override
    public void onShutdown() {
        log.debug("Storyboard command consumer stopped");
    }

    /**
     * @return {@code false} if the consumer thread did not start within the
     *         timeout.
     */
    public boolean awaitStart(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    private void execute(StoryboardCommand command) {
        switch (command.type()) {
            case SET_ROOT -> storyboard.setSceneAsRoot(command.scene());
            case LINK -> storyboard.linkScenes(command.from(), command.dest());
            case UNLINK -> storyboard.unlinkScenes(command.from(), command.dest());
            case MOVE -> storyboard.moveScene(command.scene(), command.from(), command.dest());
            case DELETE -> storyboard.deleteScene(command.scene());
            default -> throw new IllegalStateException("Unhandled command type: " + command.type());
        }
    }

    /**
     * Receives the outcome of each command, on the consumer thread.
     */
    public interface CommandOutcomeCallback {

        void onApplied(long commandId, StoryboardCommand.Type type);

        /**
         * The storyboard refused the command; it changed nothing.
         */
        void onRejected(long commandId, StoryboardCommand.Type type, StoryboardException error);

        /**
         * The command failed for a reason other than a structural rule, e.g. a
         * misbehaving listener.
         */
        default void onFailed(long commandId, StoryboardCommand.Type type, RuntimeException error) {
        }
    }
}
