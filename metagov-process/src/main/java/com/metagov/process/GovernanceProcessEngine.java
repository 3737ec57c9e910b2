package com.metagov.process;

import com.metagov.errors.InvalidParametersException;
import com.metagov.errors.MetagovException;
import com.metagov.errors.NotFoundException;
import com.metagov.errors.NotSupportedException;
import com.metagov.errors.PluginInternalException;
import com.metagov.errors.ProcessNotFoundException;
import com.metagov.plugin.PluginContext;
import com.metagov.plugin.PluginDescriptor;
import com.metagov.plugin.PluginInstance;
import com.metagov.plugin.PluginInstanceManager;
import com.metagov.plugin.ProcessDefinition;
import com.metagov.plugin.ProcessStatus;
import com.metagov.schema.Parameters;
import com.metagov.state.KeyValueStateStore;
import com.metagov.state.StateStoreRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle driver for governance processes: {@code created -> pending -> completed}.
 * <p>
 * A start runs the type's start hook under a bounded timeout after the row and its state store are
 * created; if the hook fails or times out both are deleted before the error is returned, so a failed
 * start leaves nothing behind. The row is saved as soon as the hook returns. If the platform accepted
 * the start but that save is lost, the external process exists without a local row; the caller may see
 * the same vote started twice on retry.
 * <p>
 * Close, webhook and update calls for one process are serialized on a per-process lock. On a completed
 * process they are no-ops. Failures raised by the integration are recorded in the process {@code errors};
 * close rethrows them, webhook and update do not. Not-supported and not-found errors are never recorded.
 */
public final class GovernanceProcessEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceProcessEngine.class);

    @FunctionalInterface
    private interface Hook {
        void run(ProcessDefinition definition, EngineProcessContext context) throws Exception;
    }

    private final PluginInstanceManager instances;
    private final StateStoreRepository stateStores;
    private final MeterRegistry meters;
    private final Duration startTimeout;
    private final ProcessRepository repository = new ProcessRepository();
    private final Map<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final ExecutorService startExecutor;

    public GovernanceProcessEngine(PluginInstanceManager instances, StateStoreRepository stateStores,
                                   MeterRegistry meters, Duration startTimeout) {
        this.instances = Objects.requireNonNull(instances, "instances");
        this.stateStores = Objects.requireNonNull(stateStores, "stateStores");
        this.meters = Objects.requireNonNull(meters, "meters");
        this.startTimeout = startTimeout != null ? startTimeout : Duration.ofSeconds(30);
        AtomicInteger threads = new AtomicInteger();
        this.startExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "metagov-process-start-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        instances.addDeletionListener(this::deleteProcessesOf);
    }

    /**
     * Starts a process and returns it.
     *
     * @throws ProcessNotFoundException   if the plugin has no such process type
     * @throws InvalidParametersException if the parameters do not match the input schema
     * @throws PluginInternalException    if the start hook failed or timed out
     */
    public GovernanceProcess startProcess(PluginInstance instance, String processName, String callbackUrl,
                                          Map<String, Object> parameters) {
        return tryStart(instance, processName, callbackUrl, parameters).orThrow();
    }

    /**
     * Starts a process. Lookup and parameter errors are thrown since nothing has been created yet;
     * failures of the start hook are returned with the process already rolled back.
     */
    public StartResult tryStart(PluginInstance instance, String processName, String callbackUrl,
                                Map<String, Object> parameters) {
        Objects.requireNonNull(instance, "instance");
        ProcessDefinition definition = definitionOf(instance, processName);
        Parameters params = Parameters.coerce(parameters, definition.getInputSchema(),
                instance.getPluginName() + "." + processName);
        PluginContext plugin = instances.contextFor(instance);

        KeyValueStateStore state = stateStores.create();
        GovernanceProcess process = new GovernanceProcess(ids.incrementAndGet(), processName, instance.getId(),
                instance.getPluginName(), instance.getCommunity(), callbackUrl, state.getId());
        ReentrantLock lock = lockFor(process.getId());
        lock.lock();
        try {
            repository.insert(process);
            EngineProcessContext context = new EngineProcessContext(process.copy(), repository, state, plugin);
            RuntimeException failure = runStart(definition, context, params);
            if (failure != null) {
                repository.delete(process.getId());
                stateStores.delete(state.getId());
                locks.remove(process.getId());
                counter("metagov.process.start.failed", process).increment();
                log.warn("Start of {} failed; process rolled back: {}", process, failure.getMessage());
                return StartResult.failed(failure);
            }
            context.save();
            GovernanceProcess started = context.snapshot();
            counter("metagov.process.started", started).increment();
            log.info("Started {}", started);
            return StartResult.started(started);
        } finally {
            lock.unlock();
        }
    }

    private RuntimeException runStart(ProcessDefinition definition, EngineProcessContext context, Parameters params) {
        Future<?> future = startExecutor.submit(() -> {
            definition.start(context, params);
            return null;
        });
        try {
            future.get(startTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return null;
        } catch (TimeoutException e) {
            future.cancel(true);
            return new PluginInternalException("start_timeout",
                    "Start of " + definition.getName() + " timed out after " + startTimeout.toMillis() + " ms",
                    null, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                return (RuntimeException) cause;
            }
            return new PluginInternalException("Start of " + definition.getName() + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new PluginInternalException("Start of " + definition.getName() + " was interrupted", e);
        }
    }

    /**
     * Closes the process through its type's close hook.
     *
     * @throws NotSupportedException if the type cannot be closed
     * @throws MetagovException      if the hook failed; the error is also recorded
     */
    public GovernanceProcess close(long processId) {
        return runHook(processId, "close", ProcessDefinition::close, true);
    }

    /** Hands an inbound webhook to the process. Plugin failures are recorded, not thrown. */
    public GovernanceProcess receiveWebhook(long processId, Map<String, Object> payload) {
        Map<String, Object> body = payload != null ? payload : Map.of();
        return runHook(processId, "webhook", (d, c) -> d.receiveWebhook(c, body), false);
    }

    /** Polls the process. Plugin failures are recorded, not thrown. */
    public GovernanceProcess update(long processId) {
        return runHook(processId, "update", ProcessDefinition::update, false);
    }

    private GovernanceProcess runHook(long processId, String hookName, Hook hook, boolean rethrow) {
        ReentrantLock lock = lockFor(processId);
        lock.lock();
        try {
            GovernanceProcess process = repository.find(processId)
                    .orElseThrow(() -> new ProcessNotFoundException("Process " + processId + " not found"));
            if (process.getStatus().isTerminal()) {
                log.debug("Ignoring {} on completed {}", hookName, process);
                return process;
            }
            PluginInstance instance = instances.findById(process.getPluginInstanceId())
                    .orElseThrow(() -> new ProcessNotFoundException("Plugin of process " + processId + " no longer exists"));
            ProcessDefinition definition = definitionOf(instance, process.getName());
            EngineProcessContext context = new EngineProcessContext(process, repository,
                    stateStores.get(process.getStateId()), instances.contextFor(instance));
            try {
                hook.run(definition, context);
            } catch (Exception e) {
                PluginInternalException failure = asPluginFailure(e, hookName, process);
                if (failure == null) {
                    throw (RuntimeException) e;
                }
                context.setErrors(failure.toErrorPayload());
                context.save();
                log.warn("{} of {} failed; error recorded: {}", hookName, process, failure.getMessage());
                if (rethrow) {
                    throw e instanceof MetagovException ? (MetagovException) e : failure;
                }
                return context.snapshot();
            }
            context.save();
            GovernanceProcess after = context.snapshot();
            if (after.getStatus().isTerminal()) {
                counter("metagov.process.completed", after).increment();
                log.info("Completed {} with outcome {}", after, after.getOutcome());
            }
            return after;
        } finally {
            lock.unlock();
        }
    }

    /** null when the exception is a caller-facing error that must propagate unrecorded. */
    private static PluginInternalException asPluginFailure(Exception e, String hookName, GovernanceProcess process) {
        if (e instanceof PluginInternalException) {
            return (PluginInternalException) e;
        }
        if (e instanceof NotSupportedException || e instanceof NotFoundException) {
            return null;
        }
        String code = e instanceof InvalidParametersException ? "invalid_parameters" : PluginInternalException.DEFAULT_CODE;
        return new PluginInternalException(code, hookName + " of " + process + " failed: " + e.getMessage(), null, e);
    }

    /**
     * Hands a webhook for the plugin instance to every non-completed process of it. Each process decides
     * whether the payload is meant for it.
     *
     * @return number of processes that received the payload
     */
    public int routeWebhook(PluginInstance instance, Map<String, Object> payload) {
        int n = 0;
        for (GovernanceProcess process : repository.list(p -> p.getPluginInstanceId() == instance.getId()
                && !p.getStatus().isTerminal())) {
            try {
                receiveWebhook(process.getId(), payload);
                n++;
            } catch (ProcessNotFoundException e) {
                log.debug("Process {} disappeared while routing webhook", process.getId());
            } catch (MetagovException e) {
                log.warn("Webhook for {} was not delivered to {}: {}", instance, process, e.getMessage());
            }
        }
        return n;
    }

    /**
     * Returns the process if it belongs to the instance and has the given type.
     *
     * @throws ProcessNotFoundException otherwise
     */
    public GovernanceProcess getProcess(PluginInstance instance, String processName, long processId) {
        return repository.find(processId)
                .filter(p -> p.getPluginInstanceId() == instance.getId() && p.getName().equals(processName))
                .orElseThrow(() -> new ProcessNotFoundException(
                        "No " + instance.getPluginName() + "." + processName + " process with id " + processId));
    }

    public GovernanceProcess getProcess(long processId) {
        return repository.find(processId)
                .orElseThrow(() -> new ProcessNotFoundException("Process " + processId + " not found"));
    }

    /** Processes of the instance; all types when {@code processName} is null. */
    public List<GovernanceProcess> listProcesses(PluginInstance instance, String processName) {
        return repository.list(p -> p.getPluginInstanceId() == instance.getId()
                && (processName == null || p.getName().equals(processName)));
    }

    /** Processes in {@code pending}, for the update scheduler. */
    public List<GovernanceProcess> pendingProcesses() {
        return repository.list(p -> p.getStatus() == ProcessStatus.PENDING);
    }

    public int processCount() {
        return repository.size();
    }

    private void deleteProcessesOf(PluginInstance instance) {
        for (GovernanceProcess process : repository.list(p -> p.getPluginInstanceId() == instance.getId())) {
            ReentrantLock lock = lockFor(process.getId());
            lock.lock();
            try {
                repository.delete(process.getId());
                stateStores.delete(process.getStateId());
            } finally {
                lock.unlock();
                locks.remove(process.getId());
            }
            log.info("Deleted {} with {}", process, instance);
        }
    }

    private ProcessDefinition definitionOf(PluginInstance instance, String processName) {
        PluginDescriptor descriptor = instances.getRegistry().get(instance.getPluginName());
        return descriptor.getProcess(processName).orElseThrow(() -> new ProcessNotFoundException(
                "Plugin " + instance.getPluginName() + " has no process type '" + processName + "'"));
    }

    private ReentrantLock lockFor(long processId) {
        return locks.computeIfAbsent(processId, k -> new ReentrantLock());
    }

    private Counter counter(String name, GovernanceProcess process) {
        return meters.counter(name, "plugin", process.getPluginName(), "process", process.getName());
    }

    /** Stops the start worker threads; starts still running are interrupted. */
    public void shutdown() {
        startExecutor.shutdownNow();
    }
}
