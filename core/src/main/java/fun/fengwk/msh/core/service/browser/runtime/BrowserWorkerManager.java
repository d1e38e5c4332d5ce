package fun.fengwk.msh.core.service.browser.runtime;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import fun.fengwk.msh.core.service.browser.BrowserProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of worker threads, each owning one browser process. Tasks wait in a bounded queue;
 * workers are started on demand up to the configured maximum and retire after idling.
 *
 * <p>Playwright objects are not thread safe, so a browser never leaves the worker that
 * launched it. A worker relaunches its browser when it disconnects or after
 * {@link BrowserProperties#getBrowserRecycleAfterTasks()} tasks.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserWorkerManager {

    private final BrowserProperties browserProperties;
    private final BrowserSessionFactory browserSessionFactory;
    private final BlockingQueue<QueuedTask<?>> pendingTasks;
    private final Semaphore workerSlots;
    private final int minWorkers;
    private final Set<Thread> workerThreads = ConcurrentHashMap.newKeySet();
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final AtomicInteger waitingWorkers = new AtomicInteger();
    private volatile boolean closed;

    @Autowired
    public BrowserWorkerManager(BrowserProperties browserProperties) {
        this(browserProperties, launcher(browserProperties));
    }

    BrowserWorkerManager(BrowserProperties browserProperties, BrowserSessionFactory browserSessionFactory) {
        this.browserProperties = browserProperties;
        this.browserSessionFactory = browserSessionFactory;
        this.pendingTasks = new LinkedBlockingQueue<>(Math.max(1, browserProperties.getRequestQueueCapacity()));
        this.minWorkers = Math.max(0, browserProperties.getWorkerPoolMinSize());
        this.workerSlots = new Semaphore(Math.max(Math.max(1, minWorkers), browserProperties.getWorkerPoolMaxSize()));
        for (int i = 0; i < minWorkers; i++) {
            tryStartWorker();
        }
    }

    /**
     * Queue a task for the next free worker.
     *
     * @return future completed with the task result, or exceptionally when the queue stays
     * full past the offer timeout, the pool is closed or the task fails
     */
    public <T> CompletableFuture<T> submit(BrowserSessionTask<T> task) {
        QueuedTask<T> queued = new QueuedTask<>(task);
        if (closed) {
            queued.future.completeExceptionally(new IllegalStateException("worker pool is shutting down"));
            return queued.future;
        }
        try {
            if (!pendingTasks.offer(queued, browserProperties.getQueueOfferTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("browser task rejected, reason=queue full, pending={}, workers={}",
                    pendingTasks.size(), liveWorkers.get());
                queued.future.completeExceptionally(new IllegalStateException("worker pool is busy"));
                return queued.future;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            queued.future.completeExceptionally(new IllegalStateException("browser task submission interrupted", ex));
            return queued.future;
        }
        if (waitingWorkers.get() == 0) {
            tryStartWorker();
        }
        return queued.future;
    }

    int pendingTasks() {
        return pendingTasks.size();
    }

    int liveWorkers() {
        return liveWorkers.get();
    }

    @PreDestroy
    public void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        failPending(new IllegalStateException("worker pool is shutting down"));
        workerThreads.forEach(Thread::interrupt);
        log.info("browser worker pool closed, workers={}", liveWorkers.get());
    }

    private void tryStartWorker() {
        if (closed || !workerSlots.tryAcquire()) {
            return;
        }
        int workerId = workerSeq.incrementAndGet();
        liveWorkers.incrementAndGet();
        Thread thread = new Thread(new Worker(workerId), "msh-browser-worker-" + workerId);
        thread.setDaemon(true);
        workerThreads.add(thread);
        thread.start();
    }

    private void failPending(RuntimeException cause) {
        List<QueuedTask<?>> drained = new ArrayList<>();
        pendingTasks.drainTo(drained);
        for (QueuedTask<?> queued : drained) {
            queued.future.completeExceptionally(cause);
        }
    }

    private boolean mayRetire(long idleSinceMs) {
        long idleTtlMs = browserProperties.getWorkerIdleTtlMs();
        return idleTtlMs > 0
            && System.currentTimeMillis() - idleSinceMs >= idleTtlMs
            && liveWorkers.get() > minWorkers
            && pendingTasks.isEmpty();
    }

    private static final class QueuedTask<T> {

        private final BrowserSessionTask<T> task;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private QueuedTask(BrowserSessionTask<T> task) {
            this.task = task;
        }

        private void runOn(Browser browser) {
            try {
                future.complete(task.execute(browser));
            } catch (Exception ex) {
                future.completeExceptionally(ex);
            }
        }

    }

    private final class Worker implements Runnable {

        private final int workerId;
        private BrowserSession session;
        private int tasksOnSession;

        private Worker(int workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            try {
                serve();
            } catch (RuntimeException ex) {
                log.warn("browser worker stopped, id={}, error={}", workerId, ex.getMessage());
                // nobody else is left to pick up the queue
                if (liveWorkers.get() == 1) {
                    failPending(new IllegalStateException("browser worker unavailable: " + ex.getMessage(), ex));
                }
            } finally {
                closeSession();
                liveWorkers.decrementAndGet();
                workerThreads.remove(Thread.currentThread());
                workerSlots.release();
                if (!closed && !pendingTasks.isEmpty() && waitingWorkers.get() == 0) {
                    tryStartWorker();
                }
            }
        }

        private void serve() {
            long pollMs = Math.max(1L, browserProperties.getWorkerRefreshIntervalMs());
            long idleSince = System.currentTimeMillis();
            while (!closed) {
                QueuedTask<?> queued;
                waitingWorkers.incrementAndGet();
                try {
                    queued = pendingTasks.poll(pollMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                } finally {
                    waitingWorkers.decrementAndGet();
                }
                if (queued == null) {
                    if (mayRetire(idleSince)) {
                        log.debug("browser worker retired, id={}", workerId);
                        return;
                    }
                    continue;
                }
                if (queued.future.isDone()) {
                    // abandoned by its submitter while queued
                    continue;
                }
                Browser browser;
                try {
                    browser = browser();
                } catch (RuntimeException ex) {
                    queued.future.completeExceptionally(
                        new IllegalStateException("browser worker unavailable: " + ex.getMessage(), ex));
                    throw ex;
                }
                queued.runOn(browser);
                tasksOnSession++;
                idleSince = System.currentTimeMillis();
            }
        }

        private Browser browser() {
            int recycleAfter = browserProperties.getBrowserRecycleAfterTasks();
            boolean worn = recycleAfter > 0 && tasksOnSession >= recycleAfter;
            if (session != null && (worn || !session.browser().isConnected())) {
                log.info("browser relaunched, id={}, tasks={}, reason={}", workerId, tasksOnSession,
                    worn ? "recycle" : "disconnected");
                closeSession();
            }
            if (session == null) {
                session = browserSessionFactory.create();
                tasksOnSession = 0;
            }
            return session.browser();
        }

        private void closeSession() {
            if (session == null) {
                return;
            }
            try {
                session.close();
            } catch (RuntimeException ex) {
                log.debug("browser close failed, id={}, error={}", workerId, ex.getMessage());
            }
            session = null;
        }

    }

    private static BrowserSessionFactory launcher(BrowserProperties browserProperties) {
        return () -> {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions().setHeadless(browserProperties.isHeadless());
            if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
                options.setArgs(browserProperties.getLaunchArgs());
            }
            if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
                options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
            }
            if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
                options.setChannel(browserProperties.getBrowserChannel());
            }
            if (StringUtils.hasText(browserProperties.getExecutablePath())) {
                options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
            }
            Playwright playwright = Playwright.create();
            try {
                return new BrowserSession(playwright, playwright.chromium().launch(options));
            } catch (RuntimeException ex) {
                playwright.close();
                throw ex;
            }
        };
    }

    interface BrowserSessionFactory {

        BrowserSession create();

    }

    record BrowserSession(Playwright playwright, Browser browser) implements AutoCloseable {

        @Override
        public void close() {
            try {
                browser.close();
            } finally {
                playwright.close();
            }
        }

    }

}
