package io.routeflow.core.pipeline;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed pool of payload workers. Each submitted payload is processed start to finish by one worker; different
 * payloads run concurrently.
 */
public final class PipelineRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineRunner.class);
    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final ExecutorService workers;

    public PipelineRunner(int workerThreads) {
        if (workerThreads <= 0) {
            throw new IllegalArgumentException("workerThreads must be positive, got: " + workerThreads);
        }
        this.workers = Executors.newFixedThreadPool(workerThreads, new WorkerThreadFactory());
    }

    public static PipelineRunner create(PipelineSettings settings) {
        return new PipelineRunner(settings.workerThreads());
    }

    /** Queues a payload for processing on the given pipeline. */
    public CompletableFuture<BatchResult> submit(MessagePipeline pipeline, String raw, Map<String, Object> sourceMap) {
        return CompletableFuture.supplyAsync(() -> pipeline.processBatch(raw, sourceMap), workers);
    }

    /** Stops accepting payloads and waits briefly for in-flight ones. */
    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("runner.shutdown_timeout timeoutMs={}", SHUTDOWN_TIMEOUT_MS);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "routeflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
