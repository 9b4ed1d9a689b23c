package com.cortexplatform.core.orchestration;

import com.cortexplatform.core.event.ConversationKey;
import com.cortexplatform.core.event.Event;
import reactor.core.Disposable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestration state of one conversation: the current phase, the in-flight run and the inputs
 * waiting behind it.
 *
 * <p>{@code busy} and the queue are only touched inside the owning map's {@code compute}
 * callbacks, which serializes them per conversation.
 */
final class ConversationRunner {

    private final ConversationKey key;
    private final Deque<Event> pending = new ArrayDeque<>();
    private volatile OrchestrationPhase phase = OrchestrationPhase.IDLE;
    private final AtomicReference<Disposable.Swap> current = new AtomicReference<>();
    private boolean busy;

    ConversationRunner(ConversationKey key) {
        this.key = key;
    }

    ConversationKey key() {
        return key;
    }

    OrchestrationPhase phase() {
        return phase;
    }

    /**
     * @return the previous phase
     */
    OrchestrationPhase phase(OrchestrationPhase next) {
        OrchestrationPhase previous = this.phase;
        this.phase = next;
        return previous;
    }

    boolean isBusy() {
        return busy;
    }

    void markBusy() {
        busy = true;
    }

    void markIdle() {
        busy = false;
    }

    /**
     * Queue an input behind the in-flight run.
     *
     * @return the input evicted to make room, or {@code null}
     */
    Event enqueue(Event input, int capacity) {
        Event evicted = null;
        if (pending.size() >= capacity) {
            evicted = pending.pollFirst();
        }
        pending.addLast(input);
        return evicted;
    }

    Event pollPending() {
        return pending.pollFirst();
    }

    void attach(Disposable.Swap run) {
        current.set(run);
    }

    void detach(Disposable.Swap run) {
        current.compareAndSet(run, null);
    }

    /**
     * Output bookkeeping of one run. Partial and terminal outputs of the reply are published
     * through it, so a run cancelled after its first partial can still close the message, and
     * nothing is published for the reply once it is closed.
     */
    static final class ReplyStream {

        private final String id;
        private boolean open;
        private boolean closed;

        ReplyStream(String id) {
            this.id = id;
        }

        String id() {
            return id;
        }

        synchronized void partial(Runnable publish) {
            if (closed) {
                return;
            }
            publish.run();
            open = true;
        }

        synchronized void complete(Runnable publish) {
            if (closed) {
                return;
            }
            closed = true;
            open = false;
            publish.run();
        }

        /**
         * Close the reply without a terminal output.
         *
         * @return true if partials were published and no terminal output followed them
         */
        synchronized boolean abandon() {
            boolean unterminated = open && !closed;
            closed = true;
            open = false;
            return unterminated;
        }
    }

    /**
     * Dispose the in-flight run.
     *
     * @return true if a run was disposed
     */
    boolean cancelCurrent() {
        Disposable.Swap run = current.get();
        if (run == null || run.isDisposed()) {
            return false;
        }
        run.dispose();
        return true;
    }
}
