package group.cloudtrailsource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one wave of tasks concurrently and joins them all before returning.
 *
 * Every task of a wave runs to completion even when a sibling fails. Results come back in
 * task order. If any task failed, the failure of the lowest-index task is thrown with the
 * others attached as suppressed exceptions.
 */
public class FanOut {

    private FanOut() {
    }

    public static <T> List<T> runWave(String subsystem, List<? extends Callable<T>> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(tasks.size(), new WaveThreadFactory(subsystem));
        try {
            List<Future<T>> futures = executor.invokeAll(tasks);

            List<T> results = new ArrayList<>(futures.size());
            RuntimeException firstFailure = null;
            for (Future<T> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    RuntimeException failure = asRuntimeException(subsystem, e.getCause());
                    if (firstFailure == null) {
                        firstFailure = failure;
                    } else {
                        firstFailure.addSuppressed(failure);
                    }
                    results.add(null);
                }
            }

            if (firstFailure != null) {
                throw firstFailure;
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(SourceException.Kind.IO, subsystem, "interrupted while waiting for workers", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static RuntimeException asRuntimeException(String subsystem, Throwable cause) {
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new SourceException(SourceException.Kind.IO, subsystem, String.valueOf(cause.getMessage()), cause);
    }

    private static class WaveThreadFactory implements ThreadFactory {
        private final ThreadFactory defaultFactory = Executors.defaultThreadFactory();
        private final AtomicInteger counter = new AtomicInteger();
        private final String namePrefix;

        WaveThreadFactory(String subsystem) {
            this.namePrefix = "cloudtrail-" + subsystem;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = defaultFactory.newThread(r);
            thread.setName(namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
