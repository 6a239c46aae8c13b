package com.example.tieredcache.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe router with priority ordering and a bounded history.
 *
 * <p>Every {@code emit} enqueues its event and, unless another call is already draining,
 * drains the queue on the calling thread: the highest priority event goes first, and events
 * of equal priority go in publication order. The handlers of one event run concurrently on
 * the dispatch executor and are all awaited before the next event is taken. A handler that
 * throws is logged; it never affects its siblings or the emitter.
 *
 * <p>The queue lock is never held while handlers run, so a handler may emit again. Such an
 * event is picked up by the drain already in progress before the outer {@code emit} returns.
 * An {@code emit} from another thread during a drain returns as soon as its event is queued.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_SIZE = 100;

    private static final Comparator<EventEnvelope> DISPATCH_ORDER =
        Comparator.comparingInt((EventEnvelope e) -> e.getPriority().getWeight()).reversed()
            .thenComparingLong(EventEnvelope::getSequence);

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    private final ReentrantLock queueLock = new ReentrantLock();
    private final PriorityQueue<EventEnvelope> pending = new PriorityQueue<>(DISPATCH_ORDER);
    private final ArrayDeque<EventEnvelope> history = new ArrayDeque<>();
    private boolean draining;
    private long eventCounter;

    private final int maxHistorySize;
    private final Executor dispatchExecutor;
    private final Clock clock;

    /** Bus that runs handlers on the emitting thread. */
    public EventBus() {
        this(DEFAULT_HISTORY_SIZE, Runnable::run);
    }

    public EventBus(int maxHistorySize, Executor dispatchExecutor) {
        this(maxHistorySize, dispatchExecutor, Clock.systemUTC());
    }

    public EventBus(int maxHistorySize, Executor dispatchExecutor, Clock clock) {
        if (maxHistorySize <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + maxHistorySize);
        }
        this.maxHistorySize = maxHistorySize;
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Subscription on(String eventType, EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        // wrap so that registering the same lambda twice yields two removable registrations
        return register(eventType, handler::handle);
    }

    private Subscription register(String eventType, EventHandler registration) {
        Objects.requireNonNull(eventType, "eventType");
        List<EventHandler> list = registrations(eventType);
        list.add(registration);
        log.debug("Registered handler for event: {}", eventType);

        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false) && list.remove(registration)) {
                log.debug("Unregistered handler for event: {}", eventType);
            }
        };
    }

    private List<EventHandler> registrations(String eventType) {
        return handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
    }

    /**
     * Payload-only subscription: the listener receives {@link EventEnvelope#getData()} cast
     * to the topic's payload type.
     */
    public <T> Subscription on(EventType<T> eventType, Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        return on(eventType.getName(), event -> listener.accept(eventType.cast(event.getData())));
    }

    /**
     * Registers a handler that unsubscribes itself after its first invocation that
     * completes without throwing.
     */
    public Subscription once(String eventType, EventHandler handler) {
        Objects.requireNonNull(handler, "handler");
        return register(eventType, new OnceHandler(registrations(eventType), handler));
    }

    /** Removes itself from its topic's list, so it never depends on the returned subscription. */
    private static final class OnceHandler implements EventHandler {

        private final List<EventHandler> list;
        private final EventHandler delegate;
        private final AtomicBoolean fired = new AtomicBoolean();

        OnceHandler(List<EventHandler> list, EventHandler delegate) {
            this.list = list;
            this.delegate = delegate;
        }

        @Override
        public void handle(EventEnvelope event) throws Exception {
            if (fired.get()) {
                return;
            }
            delegate.handle(event);
            if (fired.compareAndSet(false, true)) {
                list.remove(this);
            }
        }
    }

    public void emit(String eventType, Object data) {
        emit(eventType, data, EventPriority.NORMAL);
    }

    public void emit(String eventType, Object data, EventPriority priority) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(priority, "priority");

        queueLock.lock();
        try {
            EventEnvelope event = new EventEnvelope(++eventCounter, eventType, data, priority, clock.instant());
            pending.add(event);
            history.addLast(event);
            while (history.size() > maxHistorySize) {
                history.removeFirst();
            }
            if (draining) {
                return;
            }
            draining = true;
        } finally {
            queueLock.unlock();
        }
        drain();
    }

    public <T> void emit(EventType<T> eventType, T data) {
        emit(eventType, data, EventPriority.NORMAL);
    }

    public <T> void emit(EventType<T> eventType, T data, EventPriority priority) {
        emit(eventType.getName(), eventType.cast(data), priority);
    }

    private void drain() {
        boolean finished = false;
        try {
            EventEnvelope next;
            while ((next = pollOrFinish()) != null) {
                dispatch(next);
            }
            finished = true;
        } finally {
            if (!finished) {
                queueLock.lock();
                try {
                    draining = false;
                } finally {
                    queueLock.unlock();
                }
            }
        }
    }

    /** Takes the next event, or clears the draining flag when the queue is empty. */
    private EventEnvelope pollOrFinish() {
        queueLock.lock();
        try {
            EventEnvelope next = pending.poll();
            if (next == null) {
                draining = false;
            }
            return next;
        } finally {
            queueLock.unlock();
        }
    }

    private void dispatch(EventEnvelope event) {
        List<EventHandler> registered = handlers.get(event.getType());
        if (registered == null || registered.isEmpty()) {
            log.debug("Dispatching event: {} (priority: {}) to 0 handlers", event.getType(), event.getPriority());
            return;
        }
        List<EventHandler> snapshot = new ArrayList<>(registered);
        log.debug("Dispatching event: {} (priority: {}) to {} handlers",
            event.getType(), event.getPriority(), snapshot.size());

        List<CompletableFuture<Void>> running = new ArrayList<>(snapshot.size());
        for (EventHandler handler : snapshot) {
            try {
                running.add(CompletableFuture.runAsync(() -> invoke(handler, event), dispatchExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("Dispatch executor rejected handler for {}; dropping it", event.getType(), e);
            }
        }
        CompletableFuture.allOf(running.toArray(new CompletableFuture<?>[0])).join();
    }

    private void invoke(EventHandler handler, EventEnvelope event) {
        try {
            handler.handle(event);
        } catch (Throwable t) {
            log.error("Error in event handler for {}", event.getType(), t);
        }
    }

    /** The whole history, oldest first. */
    public List<EventEnvelope> getHistory() {
        queueLock.lock();
        try {
            return new ArrayList<>(history);
        } finally {
            queueLock.unlock();
        }
    }

    /** The newest {@code count} events, oldest first. A non-positive count returns everything. */
    public List<EventEnvelope> getHistory(int count) {
        List<EventEnvelope> all = getHistory();
        if (count <= 0 || count >= all.size()) {
            return all;
        }
        return new ArrayList<>(all.subList(all.size() - count, all.size()));
    }

    public int getPendingCount() {
        queueLock.lock();
        try {
            return pending.size();
        } finally {
            queueLock.unlock();
        }
    }

    /** Drops events that have not been dispatched yet. */
    public void clearQueue() {
        queueLock.lock();
        try {
            pending.clear();
        } finally {
            queueLock.unlock();
        }
        log.warn("Event queue cleared");
    }

    public void clearHistory() {
        queueLock.lock();
        try {
            history.clear();
        } finally {
            queueLock.unlock();
        }
        log.debug("Event history cleared");
    }

    public EventBusStatistics getStatistics() {
        Map<String, Integer> byEvent = new HashMap<>();
        int total = 0;
        for (Map.Entry<String, List<EventHandler>> e : handlers.entrySet()) {
            int n = e.getValue().size();
            byEvent.put(e.getKey(), n);
            total += n;
        }
        queueLock.lock();
        try {
            return new EventBusStatistics(total, pending.size(), history.size(), byEvent);
        } finally {
            queueLock.unlock();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    /**
     * Drops every handler, the pending queue and the history. The dispatch executor is
     * owned by the caller and left running.
     */
    public void close() {
        handlers.clear();
        queueLock.lock();
        try {
            pending.clear();
            history.clear();
        } finally {
            queueLock.unlock();
        }
        log.info("Event bus disposed");
    }
}
