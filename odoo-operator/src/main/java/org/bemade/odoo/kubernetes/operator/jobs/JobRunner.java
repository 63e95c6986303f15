/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.jobs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs job workflows on a bounded pool. Each execution is cancelled once it exceeds the job timeout,
 * and its staging directory is removed when its worker exits.
 */
public class JobRunner implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobRunner.class);

    private final ExecutorService workers;
    private final ScheduledExecutorService watchdog;
    private final Path workDir;
    private final Duration jobTimeout;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    /**
     * A submitted workflow. It is done once its worker has left the workflow, or once it has been
     * cancelled before a worker picked it up.
     */
    public static final class Execution {

        private final Future<JobOutcome> future;
        private final AtomicBoolean timedOut;
        private final Duration timeout;
        private final ExitLatch exit;

        private Execution(Future<JobOutcome> future, AtomicBoolean timedOut, Duration timeout, ExitLatch exit) {
            this.future = future;
            this.timedOut = timedOut;
            this.timeout = timeout;
            this.exit = exit;
        }

        public boolean isDone() {
            return exit.exited() && future.isDone();
        }

        /**
         * @return the outcome of a finished workflow
         * @throws ExecutionException if the workflow failed, with the workflow's exception as cause
         * @throws TimeoutException if the workflow was cancelled for exceeding the job timeout
         * @throws CancellationException if the workflow was cancelled
         * @throws IllegalStateException if the workflow has not finished
         */
        public JobOutcome outcome() throws ExecutionException, TimeoutException {
            if (!isDone()) {
                throw new IllegalStateException("The workflow has not finished");
            }
            try {
                return future.get();
            }
            catch (CancellationException e) {
                if (timedOut.get()) {
                    throw new TimeoutException("The job exceeded its timeout of " + timeout);
                }
                throw e;
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }

        private void cancel() {
            future.cancel(true);
            // a workflow cancelled before it started never reaches its worker's exit
            exit.claimExit();
        }
    }

    /**
     * Runs the exit action once, either from the worker that ran the workflow or from whoever
     * cancelled the workflow before a worker started it.
     */
    private static final class ExitLatch {
        private final AtomicBoolean owned = new AtomicBoolean();
        private final Runnable onExit;
        private volatile boolean exited;

        private ExitLatch(Runnable onExit) {
            this.onExit = onExit;
        }

        /**
         * @return true if the caller now owns the exit and must call {@link #exit()}
         */
        boolean own() {
            return owned.compareAndSet(false, true);
        }

        void claimExit() {
            if (own()) {
                exit();
            }
        }

        void exit() {
            try {
                onExit.run();
            }
            catch (RuntimeException e) {
                LOGGER.warn("Job exit action failed: {}", e.getMessage(), e);
            }
            finally {
                exited = true;
            }
        }

        boolean exited() {
            return exited;
        }
    }

    public JobRunner(int workerThreads, Path workDir, Duration jobTimeout) {
        this.workers = Executors.newFixedThreadPool(workerThreads, daemonThreads("job-worker-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("job-watchdog-"));
        this.workDir = Objects.requireNonNull(workDir);
        this.jobTimeout = Objects.requireNonNull(jobTimeout);
    }

    /**
     * Submits a workflow, unless one is already known under {@code key}.
     *
     * @param key identifies the job across reconciliations
     * @return the execution for {@code key}
     */
    public Execution submit(String key, JobWorkflow workflow) {
        return submit(key, workflow, () -> {
        });
    }

    /**
     * Submits a workflow, unless one is already known under {@code key}.
     *
     * @param key identifies the job across reconciliations
     * @param onExit run once the workflow's worker has exited, even after a cancellation or timeout,
     * or once the workflow has been cancelled before it started
     * @return the execution for {@code key}
     */
    public Execution submit(String key, JobWorkflow workflow, Runnable onExit) {
        return executions.computeIfAbsent(key, k -> {
            Path stagingDir = stagingDir(k);
            var timedOut = new AtomicBoolean();
            var exit = new ExitLatch(onExit);
            Future<JobOutcome> future = workers.submit(() -> {
                if (!exit.own()) {
                    throw new CancellationException("Job " + k + " was cancelled before it started");
                }
                try {
                    Files.createDirectories(stagingDir);
                    return workflow.run(stagingDir);
                }
                finally {
                    deleteRecursively(stagingDir);
                    exit.exit();
                }
            });
            var execution = new Execution(future, timedOut, jobTimeout, exit);
            watchdog.schedule(() -> {
                if (!execution.isDone()) {
                    LOGGER.warn("Job {} exceeded its timeout of {}, cancelling it", k, jobTimeout);
                    timedOut.set(true);
                    execution.cancel();
                }
            }, jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return execution;
        });
    }

    public Optional<Execution> find(String key) {
        return Optional.ofNullable(executions.get(key));
    }

    /**
     * Forgets a finished execution.
     */
    public void remove(String key) {
        executions.remove(key);
    }

    /**
     * Interrupts the execution for {@code key}, if any, and forgets it. A worker that is still running
     * removes its staging directory when it exits.
     */
    public void cancel(String key) {
        Execution execution = executions.remove(key);
        if (execution == null) {
            deleteRecursively(stagingDir(key));
        }
        else if (!execution.isDone()) {
            LOGGER.info("Cancelling job {}", key);
            execution.cancel();
        }
    }

    Path stagingDir(String key) {
        return workDir.resolve(key.replaceAll("[^A-Za-z0-9.-]", "_"));
    }

    static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                }
                catch (IOException e) {
                    LOGGER.warn("Unable to delete staging file {}: {}", path, e.getMessage());
                }
            });
        }
        catch (IOException e) {
            LOGGER.warn("Unable to delete staging directory {}: {}", dir, e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        watchdog.shutdownNow();
        workers.shutdownNow();
    }
}
