package com.enterprise.taskworker.pool;

import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.NamedThreadFactory;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.exception.PoolStartException;
import com.enterprise.taskworker.exception.UnknownTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Slot table, backlog, watchdog and outcome delivery shared by every strategy.
 * Subclasses only decide what a {@link SlotWorker} is.
 * <p>
 * All slot and backlog state is guarded by one lock. Outcomes are handed to a single
 * callback thread so listeners never run under the lock or on a worker thread.
 */
public abstract class AbstractExecutionPool implements ExecutionPool {

    private static final Logger logger = LoggerFactory.getLogger(AbstractExecutionPool.class);

    protected final TaskRegistry registry;
    private final PoolStrategy strategy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final Map<String, Execution> executions = new HashMap<>();
    private final Deque<Execution> backlog = new ArrayDeque<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final WorkerEvents workerEvents = new WorkerEvents();

    private Slot[] slots = new Slot[0];
    private WorkerConfig.PoolConfig config;
    private int concurrency;
    private volatile boolean shuttingDown = false;
    private CompletableFuture<Void> shutdownFuture;

    private ScheduledExecutorService watchdog;
    private ExecutorService supervisor;
    private ExecutorService callbackExecutor;
    // callbacks raised inside submit(), handed to the callback thread once the lock is released
    private final List<Runnable> heldCallbacks = new ArrayList<>();
    private boolean holdingCallbacks = false;

    protected AbstractExecutionPool(PoolStrategy strategy, TaskRegistry registry) {
        this.strategy = strategy;
        this.registry = registry;
    }

    /**
     * Create the worker for a slot. Called at start and whenever a slot is recycled.
     */
    protected abstract SlotWorker createWorker(int slotId, SlotWorker.Listener listener);

    /**
     * Fail fast if this strategy cannot run with the given configuration
     */
    protected void checkAvailable(WorkerConfig.PoolConfig config) throws PoolStartException {
    }

    protected int effectiveConcurrency(WorkerConfig.PoolConfig config) {
        return config.getConcurrency();
    }

    /**
     * Whether maxTasksPerChild / maxMemoryPerChild recycling applies
     */
    protected boolean supportsRecycling() {
        return true;
    }

    protected WorkerConfig.PoolConfig config() {
        return config;
    }

    @Override
    public void start(WorkerConfig.PoolConfig config) throws PoolStartException {
        Objects.requireNonNull(config, "Pool configuration is required");
        if (config.getConcurrency() <= 0) {
            throw new IllegalArgumentException("Concurrency must be greater than 0");
        }
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Pool already started");
        }

        List<SlotWorker> started = new ArrayList<>();
        try {
            checkAvailable(config);
            this.config = config;
            this.concurrency = effectiveConcurrency(config);
            this.watchdog = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("pool-watchdog-", true));
            this.supervisor = Executors.newCachedThreadPool(new NamedThreadFactory("pool-supervisor-", true));
            this.callbackExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("pool-callback-", true));

            Slot[] created = new Slot[concurrency];
            for (int i = 0; i < concurrency; i++) {
                SlotWorker worker = createWorker(i, workerEvents);
                worker.start();
                started.add(worker);
                created[i] = new Slot(i, worker);
            }

            lock.lock();
            try {
                this.slots = created;
            } finally {
                lock.unlock();
            }
        } catch (PoolStartException | RuntimeException e) {
            logger.error("Failed to start {} pool: {}", strategy, e.getMessage());
            started.forEach(SlotWorker::kill);
            shutdownExecutors();
            running.set(false);
            throw e;
        }

        long interval = config.getWatchdogInterval().toMillis();
        watchdog.scheduleWithFixedDelay(this::runWatchdog, interval, interval, TimeUnit.MILLISECONDS);

        logger.info("{} pool started with concurrency={}, maxTasksPerChild={}, softTimeLimit={}, hardTimeLimit={}",
                   strategy, concurrency, config.getMaxTasksPerChild(),
                   config.getSoftTimeLimit(), config.getHardTimeLimit());
    }

    @Override
    public void submit(TaskRequest request, Consumer<TaskOutcome> onComplete) {
        Objects.requireNonNull(request, "Request is required");
        Objects.requireNonNull(onComplete, "Completion callback is required");

        TaskDefinition definition;
        try {
            definition = registry.lookup(request.getTaskName());
        } catch (UnknownTaskException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }

        List<Runnable> released;
        lock.lock();
        try {
            if (!running.get() || shuttingDown) {
                throw new IllegalStateException("The " + strategy + " pool is not accepting work");
            }
            holdingCallbacks = true;
            if (executions.containsKey(request.getId())) {
                throw new IllegalArgumentException("Request " + request.getId() + " is already in the pool");
            }

            Execution execution = new Execution(request, definition,
                TimeLimits.soft(request, definition, config), TimeLimits.hard(request, definition, config), onComplete);

            Slot free = findFreeSlot();
            if (free != null) {
                executions.put(request.getId(), execution);
                assign(free, execution);
            } else if (backlog.size() < concurrency) {
                executions.put(request.getId(), execution);
                backlog.addLast(execution);
                logger.debug("All {} slots busy, queued {}", concurrency, request);
            } else {
                throw new RejectedExecutionException("Pool backlog is full (" + backlog.size() + " waiting)");
            }
        } finally {
            holdingCallbacks = false;
            released = new ArrayList<>(heldCallbacks);
            heldCallbacks.clear();
            lock.unlock();
        }
        released.forEach(callbackExecutor::execute);
    }

    @Override
    public void restartSlot(int slotId) {
        lock.lock();
        try {
            Slot slot = slotById(slotId);
            if (slot.restarting) {
                return;
            }
            if (slot.current != null) {
                slot.recyclePending = true;
                logger.debug("Slot {} will be recycled after {}", slotId, slot.current);
            } else {
                replaceWorker(slot, false);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean terminate(String requestId) {
        lock.lock();
        try {
            Execution execution = executions.get(requestId);
            if (execution == null) {
                return false;
            }

            if (backlog.remove(execution)) {
                deliver(execution, TaskOutcome.workerLost("Request " + requestId + " terminated before it started", 0));
                return true;
            }

            Slot slot = slotById(execution.getSlotId());
            TaskOutcome outcome = execution.isHardDeadlinePassed(System.nanoTime())
                ? TaskOutcome.timeout("Hard time limit of " + execution.getHardTimeLimit().toMillis() + "ms exceeded",
                                      execution.elapsedMillis())
                : TaskOutcome.workerLost("Request " + requestId + " was terminated", execution.elapsedMillis());

            logger.info("Terminating {} on slot {}", execution, slot.id);
            slot.current = null;
            deliver(execution, outcome);
            replaceWorker(slot, true);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CompletableFuture<Void> shutdown(Duration gracePeriod) {
        lock.lock();
        try {
            if (shutdownFuture != null) {
                return shutdownFuture;
            }
            shuttingDown = true;
            stateChanged.signalAll();
            if (!running.get()) {
                shutdownFuture = CompletableFuture.completedFuture(null);
            } else {
                logger.info("Shutting down {} pool with grace period {}", strategy, gracePeriod);
                shutdownFuture = CompletableFuture.runAsync(() -> drainAndStop(gracePeriod));
            }
            return shutdownFuture;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<SlotInfo> slots() {
        lock.lock();
        try {
            List<SlotInfo> infos = new ArrayList<>(slots.length);
            for (Slot slot : slots) {
                Execution current = slot.current;
                SlotWorker worker = slot.worker;
                OptionalLong pid = worker != null ? worker.pid() : OptionalLong.empty();
                infos.add(new SlotInfo(
                    slot.id,
                    current != null ? current.getRequestId() : null,
                    current != null ? current.getRequest().getTaskName() : null,
                    current != null ? current.getStartedAt() : null,
                    slot.completed,
                    pid.isPresent() ? pid.getAsLong() : null,
                    slot.lastMemory,
                    worker != null && worker.isAlive()));
            }
            return infos;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int concurrency() {
        return concurrency;
    }

    @Override
    public PoolStrategy strategy() {
        return strategy;
    }

    @Override
    public int activeCount() {
        lock.lock();
        try {
            return executions.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !shuttingDown;
    }

    // Everything below runs with the lock held unless noted

    private Slot findFreeSlot() {
        for (Slot slot : slots) {
            if (slot.current == null && slot.worker != null && !slot.restarting) {
                return slot;
            }
        }
        return null;
    }

    private Slot slotById(int slotId) {
        if (slotId < 0 || slotId >= slots.length) {
            throw new IllegalArgumentException("No such slot: " + slotId);
        }
        return slots[slotId];
    }

    private Slot slotOf(SlotWorker worker) {
        for (Slot slot : slots) {
            if (slot.worker == worker) {
                return slot;
            }
        }
        return null;
    }

    private void assign(Slot slot, Execution execution) {
        slot.current = execution;
        execution.markStarted(slot.id);
        try {
            slot.worker.run(execution);
            logger.debug("Started {} on slot {}", execution, slot.id);
        } catch (IOException | RuntimeException e) {
            logger.error("Slot {} could not accept {}", slot.id, execution, e);
            slot.current = null;
            deliver(execution, TaskOutcome.workerLost("Worker for slot " + slot.id + " failed: " + e.getMessage(), 0));
            replaceWorker(slot, true);
        }
    }

    private void drainBacklog() {
        Slot free;
        while (!backlog.isEmpty() && (free = findFreeSlot()) != null) {
            assign(free, backlog.pollFirst());
        }
    }

    private void deliver(Execution execution, TaskOutcome outcome) {
        if (!execution.markDelivered()) {
            return;
        }
        executions.remove(execution.getRequestId());
        stateChanged.signalAll();
        Runnable callback = () -> {
            try {
                execution.getCallback().accept(outcome);
            } catch (RuntimeException e) {
                logger.error("Outcome callback for {} failed", execution, e);
            }
        };
        if (holdingCallbacks) {
            heldCallbacks.add(callback);
        } else {
            callbackExecutor.execute(callback);
        }
    }

    private boolean needsRecycle(Slot slot, OptionalLong memory) {
        if (slot.recyclePending) {
            return true;
        }
        if (!supportsRecycling() || shuttingDown) {
            return false;
        }
        Integer maxTasks = config.getMaxTasksPerChild();
        if (maxTasks != null && slot.completedByWorker >= maxTasks) {
            logger.info("Slot {} reached {} tasks, recycling", slot.id, maxTasks);
            return true;
        }
        Long maxMemory = config.getMaxMemoryPerChild();
        if (maxMemory != null && memory.isPresent() && memory.getAsLong() > maxMemory) {
            logger.info("Slot {} uses {} bytes (limit {}), recycling", slot.id, memory.getAsLong(), maxMemory);
            return true;
        }
        return false;
    }

    /**
     * Retire the slot's worker and start a replacement off the lock
     */
    private void replaceWorker(Slot slot, boolean kill) {
        SlotWorker old = slot.worker;
        slot.worker = null;
        slot.recyclePending = false;
        slot.completedByWorker = 0;
        long generation = ++slot.generation;

        if (old != null) {
            if (kill) {
                old.kill();
            } else {
                supervisor.execute(old::stop);
            }
        }

        if (shuttingDown) {
            slot.restarting = false;
            return;
        }
        slot.restarting = true;
        supervisor.execute(() -> startReplacement(slot, generation));
    }

    // Runs on a supervisor thread, without the lock
    private void startReplacement(Slot slot, long generation) {
        SlotWorker worker = createWorker(slot.id, workerEvents);
        try {
            worker.start();
        } catch (PoolStartException | RuntimeException e) {
            logger.error("Could not restart worker for slot {}, retrying", slot.id, e);
            try {
                watchdog.schedule(() -> supervisor.execute(() -> startReplacement(slot, generation)),
                                  config.getWatchdogInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException shutdown) {
                logger.debug("Pool shut down, not retrying slot {}", slot.id);
            }
            return;
        }

        boolean installed = false;
        lock.lock();
        try {
            if (!shuttingDown && slot.generation == generation) {
                slot.worker = worker;
                slot.restarting = false;
                installed = true;
                logger.debug("Slot {} has a new worker", slot.id);
                drainBacklog();
                stateChanged.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (!installed) {
            worker.stop();
        }
    }

    private void runWatchdog() {
        lock.lock();
        try {
            long now = System.nanoTime();
            for (Slot slot : slots) {
                SlotWorker worker = slot.worker;
                if (worker == null) {
                    continue;
                }
                Execution execution = slot.current;

                if (!worker.isAlive()) {
                    logger.warn("Worker for slot {} is no longer alive", slot.id);
                    slot.current = null;
                    if (execution != null) {
                        deliver(execution, TaskOutcome.workerLost(
                            "Worker for slot " + slot.id + " died while running " + execution, execution.elapsedMillis()));
                    }
                    replaceWorker(slot, true);

                } else if (execution != null && execution.isHardDeadlinePassed(now)) {
                    logger.warn("{} exceeded its hard time limit of {}ms, killing slot {}",
                               execution, execution.getHardTimeLimit().toMillis(), slot.id);
                    slot.current = null;
                    deliver(execution, TaskOutcome.timeout(
                        "Hard time limit of " + execution.getHardTimeLimit().toMillis() + "ms exceeded",
                        execution.elapsedMillis()));
                    replaceWorker(slot, true);

                } else if (execution != null && execution.isSoftDeadlinePassed(now) && execution.markSoftSignalled()) {
                    logger.info("{} exceeded its soft time limit of {}ms", execution, execution.getSoftTimeLimit().toMillis());
                    worker.signalSoftTimeout(execution);
                }
            }
            drainBacklog();
        } catch (RuntimeException e) {
            logger.error("Watchdog pass failed", e);
        } finally {
            lock.unlock();
        }
    }

    // Runs on a shutdown thread
    private void drainAndStop(Duration gracePeriod) {
        List<SlotWorker> idleWorkers = new ArrayList<>();
        lock.lock();
        try {
            long deadline = System.nanoTime() + gracePeriod.toNanos();
            long remaining;
            while (!executions.isEmpty() && (remaining = deadline - System.nanoTime()) > 0) {
                stateChanged.awaitNanos(remaining);
            }

            if (!executions.isEmpty()) {
                logger.warn("{} requests still in the {} pool after {}, terminating them",
                           executions.size(), strategy, gracePeriod);
            }
            for (Slot slot : slots) {
                Execution execution = slot.current;
                if (execution != null) {
                    slot.current = null;
                    deliver(execution, TaskOutcome.workerLost(
                        "Pool shut down while " + execution + " was running", execution.elapsedMillis()));
                    if (slot.worker != null) {
                        slot.worker.kill();
                        slot.worker = null;
                    }
                }
            }
            for (Execution execution : new ArrayList<>(backlog)) {
                deliver(execution, TaskOutcome.workerLost("Pool shut down before " + execution + " started", 0));
            }
            backlog.clear();

            for (Slot slot : slots) {
                if (slot.worker != null) {
                    idleWorkers.add(slot.worker);
                    slot.worker = null;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while draining the {} pool", strategy);
        } finally {
            lock.unlock();
        }

        idleWorkers.forEach(SlotWorker::stop);
        shutdownExecutors();
        running.set(false);
        logger.info("{} pool shutdown completed", strategy);
    }

    private void shutdownExecutors() {
        if (watchdog != null) {
            watchdog.shutdownNow();
        }
        if (supervisor != null) {
            supervisor.shutdown();
        }
        if (callbackExecutor != null) {
            callbackExecutor.shutdown();
            try {
                if (!callbackExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Outcome callbacks did not finish, forcing shutdown");
                    callbackExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                callbackExecutor.shutdownNow();
            }
        }
    }

    private final class WorkerEvents implements SlotWorker.Listener {

        @Override
        public void completed(SlotWorker worker, Execution execution, TaskOutcome outcome) {
            lock.lock();
            try {
                Slot slot = slotOf(worker);
                if (slot == null || slot.current != execution) {
                    logger.debug("Ignoring late outcome for {} from a retired worker", execution);
                    return;
                }
                slot.current = null;
                slot.completed++;
                slot.completedByWorker++;
                deliver(execution, outcome);

                OptionalLong memory = worker.memoryUsage();
                if (memory.isPresent()) {
                    slot.lastMemory = memory.getAsLong();
                }
                if (needsRecycle(slot, memory)) {
                    replaceWorker(slot, false);
                }
                drainBacklog();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void died(SlotWorker worker, String detail) {
            lock.lock();
            try {
                Slot slot = slotOf(worker);
                if (slot == null) {
                    return;
                }
                logger.warn("Worker for slot {} died: {}", slot.id, detail);
                Execution execution = slot.current;
                slot.current = null;
                if (execution != null) {
                    deliver(execution, TaskOutcome.workerLost(detail, execution.elapsedMillis()));
                }
                replaceWorker(slot, true);
            } finally {
                lock.unlock();
            }
        }
    }

    private static final class Slot {
        private final int id;
        private SlotWorker worker;
        private Execution current;
        private long completed;
        private long completedByWorker;
        private Long lastMemory;
        private boolean recyclePending;
        private boolean restarting;
        private long generation;

        private Slot(int id, SlotWorker worker) {
            this.id = id;
            this.worker = worker;
        }
    }
}
