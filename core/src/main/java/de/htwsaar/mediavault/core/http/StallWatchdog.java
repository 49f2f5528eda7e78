package de.htwsaar.mediavault.core.http;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bricht Body-Reads ab, die länger als {@code readTimeout} keine Daten liefern.
 *
 * <p>Der {@link java.net.http.HttpClient} kennt nur einen Timeout bis zu den Response-Headern.
 * Ein stockender Body würde einen Worker sonst unbegrenzt blockieren. Der Watchdog schließt bei
 * Stillstand den Stream und unterbricht den lesenden Thread; der Read endet dann mit einer
 * {@link IOException}.</p>
 *
 * <p>Wer {@link Guard#progress()} nie aufruft, bekommt eine feste Frist ab {@link #watch}.</p>
 */
public final class StallWatchdog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StallWatchdog.class);

    private final ScheduledExecutorService scheduler;
    private final long readTimeoutNanos;
    private final LongSupplier nanoTime;

    public StallWatchdog(long readTimeoutMillis) {
        this(readTimeoutMillis, System::nanoTime);
    }

    StallWatchdog(long readTimeoutMillis, LongSupplier nanoTime) {
        if (readTimeoutMillis < 1) {
            throw new IllegalArgumentException("readTimeoutMillis must be >= 1: " + readTimeoutMillis);
        }
        this.readTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(readTimeoutMillis);
        this.nanoTime = nanoTime;
        AtomicInteger seq = new AtomicInteger();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "http-watchdog-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Startet die Überwachung eines Streams für den aktuellen Thread.
     *
     * @param stream wird bei Stillstand geschlossen
     * @return Handle; muss nach dem Lesen geschlossen werden
     */
    public Guard watch(Closeable stream) {
        Guard guard = new Guard(stream, Thread.currentThread());
        long period = Math.max(1, TimeUnit.NANOSECONDS.toMillis(readTimeoutNanos) / 4);
        guard.future = scheduler.scheduleAtFixedRate(guard::check, period, period, TimeUnit.MILLISECONDS);
        return guard;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    /** Überwachung eines einzelnen Reads. */
    public final class Guard implements AutoCloseable {
        private final Closeable stream;
        private final Thread reader;
        private ScheduledFuture<?> future;
        private long lastProgress = nanoTime.getAsLong();
        private boolean active = true;
        private boolean stalled;

        private Guard(Closeable stream, Thread reader) {
            this.stream = stream;
            this.reader = reader;
        }

        public synchronized void progress() {
            lastProgress = nanoTime.getAsLong();
        }

        public synchronized boolean stalled() {
            return stalled;
        }

        private synchronized void check() {
            if (!active || stalled) return;
            if (nanoTime.getAsLong() - lastProgress < readTimeoutNanos) return;
            stalled = true;
            // Interrupt vor close(): der blockierte Read endet sofort
            reader.interrupt();
            try {
                stream.close();
            } catch (IOException e) {
                log.debug("Closing stalled stream failed: {}", e.toString());
            }
        }

        @Override
        public void close() {
            boolean wasStalled;
            synchronized (this) {
                active = false;
                wasStalled = stalled;
            }
            if (future != null) {
                future.cancel(false);
            }
            if (wasStalled) {
                // Interrupt des Watchdogs nicht an den Worker weitergeben
                Thread.interrupted();
            }
        }
    }
}
