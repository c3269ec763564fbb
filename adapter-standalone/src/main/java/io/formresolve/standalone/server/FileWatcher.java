package io.formresolve.standalone.server;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Watches the schemas directory and fires a reload callback once the schema files have been quiet
 * for the debounce period. Only {@code *.yaml} and {@code *.yml} entries count as changes; a burst
 * of edits results in one callback.
 *
 * <p>
 * The poll loop runs on a daemon thread; the callback runs on a single-thread scheduler, so two
 * reloads never overlap.
 */
public final class FileWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(FileWatcher.class);

    private final Path schemasDir;
    private final int debounceMs;
    private final Runnable reloadCallback;
    private final AtomicBoolean running = new AtomicBoolean();

    // Guarded by this.
    private final Set<String> changedFiles = new TreeSet<>();
    private ScheduledFuture<?> pendingReload;

    private WatchService watchService;
    private ScheduledExecutorService debouncer;
    private Thread pollThread;

    /**
     * @param schemasDir     directory holding the schema files
     * @param debounceMs     quiet period before the callback fires
     * @param reloadCallback invoked once per burst of schema file changes
     */
    public FileWatcher(Path schemasDir, int debounceMs, Runnable reloadCallback) {
        this.schemasDir = schemasDir;
        this.debounceMs = debounceMs;
        this.reloadCallback = reloadCallback;
    }

    /**
     * Registers the directory and starts polling on a daemon thread. Calling it twice is a no-op.
     *
     * @throws IOException if the directory cannot be registered
     */
    public void start() throws IOException {
        if (running.getAndSet(true)) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            schemasDir.register(
                    watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            running.set(false);
            throw e;
        }

        debouncer = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "schema-watcher-debounce"));
        pollThread = daemon(this::poll, "schema-watcher");
        pollThread.start();
        LOG.info("Watching schemas directory {} (debounce={}ms)", schemasDir, debounceMs);
    }

    /** Stops polling, drops any pending reload and releases the watch service. */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        debouncer.shutdownNow();
        pollThread.interrupt();
        try {
            watchService.close();
        } catch (IOException e) {
            LOG.warn("Failed to close watch service for {}", schemasDir, e);
        }
        LOG.info("Stopped watching {}", schemasDir);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void poll() {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    // Events were lost; the rescan covers whatever changed.
                    markChanged("*");
                } else if (event.context() instanceof Path changed && isSchemaFile(changed)) {
                    markChanged(changed.toString());
                }
            }
            if (!key.reset()) {
                LOG.warn("Schemas directory {} is no longer watchable", schemasDir);
                return;
            }
        }
    }

    private synchronized void markChanged(String fileName) {
        if (!running.get()) {
            return;
        }
        changedFiles.add(fileName);
        if (pendingReload != null) {
            pendingReload.cancel(false);
        }
        pendingReload = debouncer.schedule(this::fireReload, debounceMs, TimeUnit.MILLISECONDS);
    }

    private void fireReload() {
        Set<String> batch;
        synchronized (this) {
            batch = new TreeSet<>(changedFiles);
            changedFiles.clear();
            pendingReload = null;
        }
        LOG.info("Schema files changed: {}", batch);
        try {
            reloadCallback.run();
        } catch (RuntimeException e) {
            LOG.error("Reload after schema change failed", e);
        }
    }

    static boolean isSchemaFile(Path fileName) {
        String name = fileName.getFileName().toString();
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static Thread daemon(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        return thread;
    }
}
