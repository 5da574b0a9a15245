package dao.solana.svol.event;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Async publish/subscribe between schedule execution and whoever renders progress.
 * <p>
 * One dispatcher thread takes events FIFO from an unbounded queue and fans each one out to all
 * matching handlers on a handler pool, waiting for them before taking the next event.
 * A failing handler is logged and skipped; it never stops delivery or reaches the publisher.
 */
@Slf4j
@Component
public class EventBus {

    private static final int DEFAULT_HANDLER_THREADS = 4;

    private final BlockingQueue<TransferEvent> queue = new LinkedBlockingQueue<>();
    private final Map<EventType, List<EventHandler>> handlers = new ConcurrentHashMap<>();
    private final List<EventHandler> allEventHandlers = new CopyOnWriteArrayList<>();
    private final ExecutorService handlerPool;
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private Thread dispatcher;

    public EventBus() {
        this(DEFAULT_HANDLER_THREADS);
    }

    public EventBus(int handlerThreads) {
        AtomicInteger seq = new AtomicInteger();
        this.handlerPool = Executors.newFixedThreadPool(Math.max(1, handlerThreads), r -> {
            Thread t = new Thread(r, "event-handler-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (running) return;
            running = true;
            dispatcher = new Thread(this::dispatchLoop, "event-dispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();
            log.info("Event bus started");
        }
    }

    /**
     * Stops dispatching and waits for in-flight handlers. Nothing is delivered after this returns;
     * events still queued are discarded.
     */
    public void stop() {
        Thread toJoin;
        synchronized (lifecycleLock) {
            if (!running) return;
            running = false;
            toJoin = dispatcher;
            dispatcher = null;
        }
        toJoin.interrupt();
        try {
            toJoin.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int dropped = queue.size();
        queue.clear();
        log.info("Event bus stopped (discarded {} queued events)", dropped);
    }

    @PreDestroy
    public void shutdown() {
        stop();
        handlerPool.shutdown();
        try {
            if (!handlerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                handlerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public void publish(TransferEvent event) {
        if (!running) {
            log.debug("Event bus not running, dropping {} event", event.type());
            return;
        }
        queue.offer(event);
    }

    public Subscription subscribe(EventType type, EventHandler handler) {
        List<EventHandler> list = handlers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        list.add(handler);
        log.debug("Subscribed to {} events", type);
        return () -> list.remove(handler);
    }

    public Subscription subscribeAll(EventHandler handler) {
        allEventHandlers.add(handler);
        return () -> allEventHandlers.remove(handler);
    }

    private void dispatchLoop() {
        while (running) {
            TransferEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                break;
            }
            dispatch(event);
        }
        log.debug("Event dispatcher exiting");
    }

    private void dispatch(TransferEvent event) {
        List<EventHandler> targets = new ArrayList<>(handlers.getOrDefault(event.type(), List.of()));
        targets.addAll(allEventHandlers);
        if (targets.isEmpty()) return;

        List<CompletableFuture<Void>> inFlight = new ArrayList<>(targets.size());
        for (EventHandler handler : targets) {
            inFlight.add(CompletableFuture.runAsync(() -> invoke(handler, event), handlerPool));
        }
        // join() ignores interrupts, so a stop() arriving now still lets these finish
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
    }

    private void invoke(EventHandler handler, TransferEvent event) {
        try {
            handler.handle(event);
        } catch (Exception e) {
            log.error("Event handler failed for {} (schedule={}): {}", event.type(), event.scheduleId(), e.getMessage(), e);
        }
    }
}
