package io.specwatch.core.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Watch-mode driver.
 * <p>
 * A single loop thread takes {@link FileChangeEvent}s from a queue, drains bursts and
 * coalesces them by path, then hands the batch to a single worker thread. If the previous
 * batch is still being processed it is cancelled (interrupted) and its events are carried
 * into the new batch, so no change is lost. Every rerun handed to the {@link SpecRunner}
 * is reported to the {@link WatchListener} as succeeded, failed or cancelled. Snapshots
 * and dependency stamps become current only after a successful rerun, so a cancelled
 * dependency rerun is detected again when its event is carried forward.
 */
public final class WatchOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WatchOrchestrator.class);

    private final WatchEventProcessor processor;
    private final SpecChangeTracker tracker;
    private final SpecRunner runner;
    private final WatchListener listener;
    private final Duration debounce;

    private final BlockingQueue<FileChangeEvent> queue = new LinkedBlockingQueue<>();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "specwatch-worker");
        t.setDaemon(true);
        return t;
    });
    private final Object lock = new Object();

    private volatile boolean running;
    private Thread loopThread;
    private InFlight inFlight;

    private record InFlight(Future<?> future, List<FileChangeEvent> events) {}

    public WatchOrchestrator(WatchEventProcessor processor, SpecChangeTracker tracker,
                             SpecRunner runner, WatchListener listener, Duration debounce) {
        this.processor = processor;
        this.tracker = tracker;
        this.runner = runner;
        this.listener = listener;
        this.debounce = debounce;
    }

    /** Primes change tracking on the worker and starts consuming events. */
    public void start() {
        synchronized (lock) {
            if (running) {
                throw new IllegalStateException("Watch already started");
            }
            running = true;
            worker.submit(this::prime);
            loopThread = new Thread(this::loop, "specwatch-loop");
            loopThread.setDaemon(true);
            loopThread.start();
        }
        log.info("Watching for changes (debounce {} ms)", debounce.toMillis());
    }

    public void submit(FileChangeEvent event) {
        queue.add(event);
    }

    public boolean isRunning() {
        return running;
    }

    private void prime() {
        try {
            processor.prime();
        } catch (CancellationException e) {
            log.info("Priming cancelled");
        } catch (RuntimeException e) {
            log.warn("Priming failed, first changes will run in full: {}", e.getMessage());
        }
    }

    private void loop() {
        try {
            while (running) {
                FileChangeEvent first = queue.take();
                Map<Path, FileChangeEvent> batch = new LinkedHashMap<>();
                coalesce(batch, first);
                drain(batch);
                dispatch(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("Watch loop stopped");
    }

    private void drain(Map<Path, FileChangeEvent> batch) throws InterruptedException {
        List<FileChangeEvent> burst = new ArrayList<>();
        queue.drainTo(burst);
        burst.forEach(e -> coalesce(batch, e));
        long millis = debounce.toMillis();
        if (millis > 0) {
            FileChangeEvent next;
            while ((next = queue.poll(millis, TimeUnit.MILLISECONDS)) != null) {
                coalesce(batch, next);
            }
        }
    }

    private void dispatch(Map<Path, FileChangeEvent> batch) {
        synchronized (lock) {
            Map<Path, FileChangeEvent> events = batch;
            if (inFlight != null && !inFlight.future().isDone()) {
                inFlight.future().cancel(true);
                Map<Path, FileChangeEvent> merged = new LinkedHashMap<>();
                inFlight.events().forEach(e -> coalesce(merged, e));
                batch.values().forEach(e -> coalesce(merged, e));
                events = merged;
                log.info("Superseded in-flight watch iteration; carrying {} change(s) into the next one",
                        inFlight.events().size());
            }
            List<FileChangeEvent> snapshot = List.copyOf(events.values());
            inFlight = new InFlight(worker.submit(() -> runIteration(snapshot)), snapshot);
        }
    }

    private static void coalesce(Map<Path, FileChangeEvent> batch, FileChangeEvent event) {
        batch.merge(event.path(), event, FileChangeEvent::merge);
    }

    /** Processes one coalesced batch on the calling thread. */
    void runIteration(List<FileChangeEvent> events) {
        List<WatchAction> actions = new ArrayList<>();
        try {
            for (FileChangeEvent event : events) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Superseded");
                }
                actions.add(processor.process(event));
            }
        } catch (CancellationException e) {
            log.info("Watch iteration cancelled before any rerun started");
            return;
        } catch (RuntimeException e) {
            log.error("Watch iteration failed", e);
            listener.onNotice("Watch iteration failed: " + e.getMessage());
            return;
        }

        for (WatchAction action : plan(actions)) {
            if (action.isSkip()) {
                record(action);
                listener.onNotice(action.message());
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Watch iteration cancelled before rerun: {}", action.message());
                return;
            }
            listener.onAction(action);
            RunOutcome outcome = execute(action);
            listener.onOutcome(action, outcome);
            if (outcome == RunOutcome.SUCCEEDED) {
                record(action);
            } else if (outcome == RunOutcome.CANCELLED) {
                log.info("Rerun cancelled: {}", action.message());
                return;
            }
        }
    }

    /** Folds everything into one full run when any change requires it. */
    static List<WatchAction> plan(List<WatchAction> actions) {
        WatchAction runAll = null;
        Map<Path, SpecSnapshot> snapshots = new LinkedHashMap<>();
        Map<Path, String> stamps = new LinkedHashMap<>();
        List<WatchAction> skips = new ArrayList<>();
        for (WatchAction action : actions) {
            if (action.type() == WatchActionType.RUN_ALL && runAll == null) {
                runAll = action;
            }
            if (action.isSkip()) {
                skips.add(action);
            } else {
                snapshots.putAll(action.snapshotsToRecord());
                stamps.putAll(action.dependencyStampsToRecord());
            }
        }
        if (runAll == null) {
            return actions;
        }
        List<WatchAction> planned = new ArrayList<>(skips);
        planned.add(WatchAction.runAll(runAll.message(), snapshots).withDependencyStamps(stamps));
        return planned;
    }

    private RunOutcome execute(WatchAction action) {
        RunOutcome outcome;
        try {
            outcome = runner.run(action);
        } catch (RuntimeException e) {
            log.error("Rerun failed: {}", action.message(), e);
            outcome = RunOutcome.FAILED;
        }
        if (Thread.currentThread().isInterrupted()) {
            outcome = RunOutcome.CANCELLED;
        }
        return outcome;
    }

    private void record(WatchAction action) {
        action.snapshotsToRecord().forEach(tracker::recordState);
        action.dependencyStampsToRecord().forEach(tracker::recordDependency);
    }

    @Override
    public void close() {
        running = false;
        Thread loop;
        synchronized (lock) {
            loop = loopThread;
        }
        if (loop != null) {
            loop.interrupt();
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Watch worker did not stop within 5 seconds");
            }
            if (loop != null) {
                loop.join(TimeUnit.SECONDS.toMillis(5));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Watch stopped");
    }
}
