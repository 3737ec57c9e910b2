package com.metagov.process;

import com.metagov.errors.MetagovException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One pass of the periodic poll: calls {@link GovernanceProcessEngine#update(long)} on every pending
 * process using a bounded pool. The scheduler that calls {@link #runOnce()} lives outside the core.
 */
public final class ProcessUpdateSweep {

    private static final Logger log = LoggerFactory.getLogger(ProcessUpdateSweep.class);

    private final GovernanceProcessEngine engine;
    private final ExecutorService pool;

    public ProcessUpdateSweep(GovernanceProcessEngine engine, int parallelism) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1: " + parallelism);
        }
        AtomicInteger threads = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "metagov-process-sweep-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Updates all pending processes and waits for them.
     *
     * @return number of processes that completed during this pass
     */
    public int runOnce() {
        List<GovernanceProcess> pending = engine.pendingProcesses();
        if (pending.isEmpty()) {
            return 0;
        }
        log.debug("Sweeping {} pending process(es)", pending.size());
        List<Future<Boolean>> futures = new ArrayList<>(pending.size());
        for (GovernanceProcess process : pending) {
            futures.add(pool.submit(() -> engine.update(process.getId()).getStatus().isTerminal()));
        }
        int completed = 0;
        for (int i = 0; i < futures.size(); i++) {
            try {
                if (futures.get(i).get()) {
                    completed++;
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof MetagovException) {
                    log.debug("Skipping process {}: {}", pending.get(i).getId(), cause.getMessage());
                } else {
                    log.error("Update of process {} failed", pending.get(i).getId(), cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Sweep interrupted after {} of {} process(es)", i, futures.size());
                break;
            }
        }
        return completed;
    }

    public void shutdown() {
        pool.shutdownNow();
    }
}
