package de.htwsaar.mediavault.core.pool;

import de.htwsaar.mediavault.common.logging.TaskLogContext;
import de.htwsaar.mediavault.core.dedup.DedupEngine;
import de.htwsaar.mediavault.core.dedup.DownloadTask;
import de.htwsaar.mediavault.core.dedup.TaskResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verarbeitet eine Task-Liste mit fester Parallelität.
 *
 * <p>Die Ratenbegrenzung liegt in Prober und Fetcher, daher zählt jede einzelne Anfrage. Ein Task,
 * der mit einer Exception endet, wird als Fehlschlag gemeldet; der Lauf geht weiter.</p>
 */
public final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final DedupEngine engine;
    private final int workers;

    public WorkerPool(DedupEngine engine, int workers) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        this.workers = workers;
    }

    public RunReport run(List<DownloadTask> tasks) {
        return run(tasks, r -> {});
    }

    /**
     * Verarbeitet alle Tasks und wartet, bis jeder abgeschlossen ist.
     *
     * @param tasks    Tasks
     * @param listener wird pro Ergebnis im aufrufenden Thread benachrichtigt
     * @return Ergebnisse und Zähler
     */
    public RunReport run(List<DownloadTask> tasks, Consumer<TaskResult> listener) {
        Objects.requireNonNull(tasks, "tasks");
        Objects.requireNonNull(listener, "listener");
        List<TaskResult> results = new ArrayList<>(tasks.size());
        if (tasks.isEmpty()) {
            return new RunReport(results, engine.stats().snapshot());
        }

        AtomicInteger seq = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, tasks.size()), r -> {
            Thread t = new Thread(r, "mediavault-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        CompletionService<TaskResult> completion = new ExecutorCompletionService<>(executor);
        Map<Future<TaskResult>, DownloadTask> submitted = new HashMap<>();

        try {
            for (DownloadTask task : tasks) {
                submitted.put(completion.submit(() -> runOne(task)), task);
            }
            log.debug("Submitted {} task(s) to {} worker(s)", tasks.size(), Math.min(workers, tasks.size()));

            for (int i = 0; i < tasks.size(); i++) {
                Future<TaskResult> done = completion.take();
                TaskResult result;
                try {
                    result = done.get();
                } catch (ExecutionException e) {
                    DownloadTask task = submitted.get(done);
                    log.error("[{}] Worker failed", task.id(), e.getCause());
                    result = engine.crashed(task, e.getCause());
                }
                results.add(result);
                listener.accept(result);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted, {} of {} task(s) finished", results.size(), tasks.size());
        } finally {
            executor.shutdownNow();
        }
        return new RunReport(results, engine.stats().snapshot());
    }

    private TaskResult runOne(DownloadTask task) {
        return TaskLogContext.callWithTask(task.id(), () -> {
            try {
                return engine.process(task);
            } catch (RuntimeException e) {
                log.error("[{}] Task crashed", task.id(), e);
                return engine.crashed(task, e);
            }
        });
    }
}
