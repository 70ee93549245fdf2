package com.statecore.engine.events;

import com.statecore.core.model.StateChangeNotice;
import com.statecore.core.model.StateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Outbound stream of committed changes.
 *
 * Notices are dispatched asynchronously after commit, fire-and-forget.
 * With a single dispatch thread subscribers see notices in commit order.
 * A failing subscriber is logged and does not affect other subscribers or the commit.
 */
public class StateChangeStream implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateChangeStream.class);

    private final List<Consumer<StateChangeNotice>> subscribers = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public StateChangeStream(int dispatchThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "statecore-events-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.dispatcher = dispatchThreads == 1
            ? Executors.newSingleThreadExecutor(threads)
            : Executors.newFixedThreadPool(dispatchThreads, threads);
    }

    /**
     * Register a subscriber.
     *
     * @return handle that unsubscribes when closed
     */
    public Subscription subscribe(Consumer<StateChangeNotice> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Queue notices for the given committed events.
     */
    public void publish(List<StateEvent> events) {
        if (subscribers.isEmpty() || events.isEmpty()) {
            return;
        }
        List<StateChangeNotice> notices = events.stream().map(StateEvent::toNotice).toList();
        try {
            dispatcher.execute(() -> dispatch(notices));
        } catch (RejectedExecutionException e) {
            log.warn("Change stream closed; dropped {} notices", notices.size());
        }
    }

    private void dispatch(List<StateChangeNotice> notices) {
        for (StateChangeNotice notice : notices) {
            for (Consumer<StateChangeNotice> subscriber : subscribers) {
                try {
                    subscriber.accept(notice);
                } catch (RuntimeException e) {
                    log.warn("Subscriber failed on {}:{} v{}: {}",
                        notice.entityType().code(), notice.entityId(), notice.version(), e.getMessage());
                }
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @Override
    public void close() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Change stream did not drain in time; {} subscribers may miss notices", subscribers.size());
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
    }

    /**
     * Handle returned by {@link #subscribe}.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
