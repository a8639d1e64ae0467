package com.enterprise.taskworker.dispatch;

import com.enterprise.taskworker.backend.ResultBackend;
import com.enterprise.taskworker.backend.TaskResultRecord;
import com.enterprise.taskworker.backend.TaskState;
import com.enterprise.taskworker.broker.Broker;
import com.enterprise.taskworker.broker.BrokerMessage;
import com.enterprise.taskworker.broker.TaskMessage;
import com.enterprise.taskworker.config.WorkerConfig;
import com.enterprise.taskworker.core.AckMode;
import com.enterprise.taskworker.core.ExceptionInfo;
import com.enterprise.taskworker.core.ExponentialBackoff;
import com.enterprise.taskworker.core.NamedThreadFactory;
import com.enterprise.taskworker.core.RateLimit;
import com.enterprise.taskworker.core.RetryPolicy;
import com.enterprise.taskworker.core.TaskDefinition;
import com.enterprise.taskworker.core.TaskOutcome;
import com.enterprise.taskworker.core.TaskRegistry;
import com.enterprise.taskworker.core.TaskRequest;
import com.enterprise.taskworker.dlq.DeadLetterEntry;
import com.enterprise.taskworker.dlq.DeadLetterQueue;
import com.enterprise.taskworker.dlq.RejectionReason;
import com.enterprise.taskworker.exception.BrokerUnavailableException;
import com.enterprise.taskworker.exception.MalformedMessageException;
import com.enterprise.taskworker.exception.UnknownTaskException;
import com.enterprise.taskworker.monitoring.MetricsCollector;
import com.enterprise.taskworker.pool.ExecutionPool;
import com.enterprise.taskworker.pool.TimeLimits;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Coordinates broker, tracking and pool on a single loop thread.
 * <p>
 * A consumer thread pulls messages (bounded by the prefetch window) and posts them to the
 * loop; pool outcomes and revokes are posted the same way. Timers for etas, retries,
 * rate-limit rechecks and the overdue sweep are owned by the loop, which waits on its event
 * queue no longer than the next timer. Tracking state is therefore only touched by one thread.
 */
public class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private static final Duration MIN_RATE_RECHECK = Duration.ofMillis(1);

    private final TaskRegistry registry;
    private final ExecutionPool pool;
    private final Broker broker;
    private final ResultBackend resultBackend;
    private final DeadLetterQueue deadLetterQueue;
    private final MetricsCollector metrics;
    private final WorkerConfig.DispatcherConfig config;
    private final WorkerConfig.PoolConfig poolConfig;
    private final Clock clock;

    private final LinkedBlockingQueue<Runnable> events = new LinkedBlockingQueue<>();
    private Semaphore prefetchCredits;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile boolean consuming = false;
    private volatile boolean loopRunning = false;
    private volatile boolean brokerAvailable = true;
    private volatile BrokerStatusListener brokerStatusListener = new BrokerStatusListener() { };

    // loop-owned state
    private final RequestTracker tracker = new RequestTracker();
    private final PriorityQueue<ScheduledAction> timers = new PriorityQueue<>(
        Comparator.comparing((ScheduledAction a) -> a.due).thenComparingLong(a -> a.sequence));
    private final Deque<String> eligible = new ArrayDeque<>();
    private final Deque<Settlement> pendingSettlements = new ArrayDeque<>();
    private final Map<String, Instant> revokedIds = new LinkedHashMap<>();
    private final Map<String, RateLimiter> rateLimiters = new HashMap<>();
    private final Set<String> rateRechecksArmed = new HashSet<>();
    private long timerSequence = 0;
    private boolean stopping = false;

    // snapshots for other threads
    private volatile int trackedCount = 0;
    private volatile int dispatchedCount = 0;
    private volatile int pendingSettlementCount = 0;
    private final AtomicLong processedOutcomes = new AtomicLong(0);

    private Thread loopThread;
    private Thread consumerThread;
    private ExecutorService resultWriter;

    public Dispatcher(TaskRegistry registry, ExecutionPool pool, Broker broker, ResultBackend resultBackend,
                      DeadLetterQueue deadLetterQueue, MetricsCollector metrics, WorkerConfig config) {
        this(registry, pool, broker, resultBackend, deadLetterQueue, metrics, config, Clock.systemUTC());
    }

    public Dispatcher(TaskRegistry registry, ExecutionPool pool, Broker broker, ResultBackend resultBackend,
                      DeadLetterQueue deadLetterQueue, MetricsCollector metrics, WorkerConfig config, Clock clock) {
        this.registry = registry;
        this.pool = pool;
        this.broker = broker;
        this.resultBackend = resultBackend != null ? resultBackend : ResultBackend.disabled();
        this.deadLetterQueue = deadLetterQueue;
        this.metrics = metrics;
        this.config = config.getDispatcherConfig();
        this.poolConfig = config.getPoolConfig();
        this.clock = clock;
    }

    /**
     * Start the loop and consumer threads. The pool must already be started.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatcher already started");
        }
        if (!pool.isRunning()) {
            throw new IllegalStateException("Execution pool must be started before the dispatcher");
        }
        prefetchCredits = new Semaphore(pool.concurrency() * config.getPrefetchMultiplier());
        resultWriter = Executors.newSingleThreadExecutor(new NamedThreadFactory("result-writer-", true));
        loopRunning = true;
        consuming = true;
        schedule(now().plus(poolConfig.getWatchdogInterval()), this::sweep);

        loopThread = new Thread(this::runLoop, "task-dispatcher");
        loopThread.start();
        consumerThread = new Thread(this::consume, "broker-consumer");
        consumerThread.setDaemon(true);
        consumerThread.start();

        logger.info("Dispatcher started: prefetch={}, retryMode={}, pool={} x{}",
                   prefetchCredits.availablePermits(), config.getRetryMode(), pool.strategy(), pool.concurrency());
    }

    /**
     * Revoke a request. Safe to call from any thread.
     */
    public void revoke(String requestId) {
        post(() -> onRevoke(requestId));
    }

    /**
     * Stop consuming, requeue what has not started, let the pool drain within the grace
     * period, settle the outcomes and exit. Calling it again returns the same future.
     */
    public CompletableFuture<Void> stop(Duration gracePeriod) {
        if (!started.get()) {
            terminated.complete(null);
            return terminated;
        }
        if (!stopRequested.compareAndSet(false, true)) {
            return terminated;
        }
        logger.info("Stopping dispatcher with grace period {}", gracePeriod);

        CompletableFuture<Void> consumingStopped = new CompletableFuture<>();
        post(() -> {
            onStopConsuming();
            consumingStopped.complete(null);
        });
        consumingStopped
            .thenCompose(ignored -> pool.shutdown(gracePeriod))
            .whenComplete((ignored, error) -> {
                if (error != null) {
                    logger.error("Pool shutdown failed", error);
                }
                post(this::onShutdown);
            });
        return terminated;
    }

    public CompletableFuture<Void> awaitTermination() {
        return terminated;
    }

    public void setBrokerStatusListener(BrokerStatusListener listener) {
        this.brokerStatusListener = listener;
    }

    public boolean isRunning() {
        return loopRunning && !stopRequested.get();
    }

    public boolean isBrokerAvailable() {
        return brokerAvailable;
    }

    public int getTrackedCount() {
        return trackedCount;
    }

    public int getDispatchedCount() {
        return dispatchedCount;
    }

    public int getPendingSettlementCount() {
        return pendingSettlementCount;
    }

    public long getProcessedOutcomes() {
        return processedOutcomes.get();
    }

    private void post(Runnable event) {
        events.add(event);
    }

    private Instant now() {
        return clock.instant();
    }

    // ---------------------------------------------------------------- consumer thread

    private void consume() {
        int failures = 0;
        long pollMillis = config.getPollTimeout().toMillis();
        while (consuming) {
            boolean handedOff = false;
            boolean acquired = false;
            try {
                acquired = prefetchCredits.tryAcquire(pollMillis, TimeUnit.MILLISECONDS);
                if (!acquired) {
                    continue;
                }
                Optional<BrokerMessage> message = broker.receive(config.getPollTimeout());
                if (failures > 0) {
                    failures = 0;
                    brokerAvailable = true;
                    logger.info("Broker connection restored");
                    brokerStatusListener.brokerRecovered();
                }
                if (message.isPresent()) {
                    BrokerMessage delivery = message.get();
                    post(() -> onMessageReceived(delivery));
                    handedOff = true;
                }
            } catch (BrokerUnavailableException e) {
                brokerAvailable = false;
                metrics.recordBrokerError();
                Duration delay = ExponentialBackoff.nextDelay(
                    failures, config.getBrokerBackoffBase(), config.getBrokerBackoffMax(), true);
                failures++;
                logger.warn("Broker unavailable ({}), retrying in {}ms", e.getMessage(), delay.toMillis());
                brokerStatusListener.brokerUnavailable(e);
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                logger.error("Unexpected error while consuming", e);
            } finally {
                if (acquired && !handedOff) {
                    prefetchCredits.release();
                }
            }
            if (Thread.interrupted() && !consuming) {
                break;
            }
        }
        logger.debug("Consumer thread exiting");
    }

    // ---------------------------------------------------------------- loop thread

    private void runLoop() {
        logger.debug("Dispatcher loop running");
        while (loopRunning) {
            try {
                Runnable event = events.poll(millisUntilNextTimer(), TimeUnit.MILLISECONDS);
                while (event != null) {
                    runSafely(event);
                    event = loopRunning ? events.poll() : null;
                }
                if (!loopRunning) {
                    break;
                }
                fireDueTimers();
                retryPendingSettlements();
                publishSnapshots();
            } catch (InterruptedException e) {
                logger.warn("Dispatcher loop interrupted");
                Thread.currentThread().interrupt();
                break;
            }
        }

        if (resultWriter != null) {
            resultWriter.shutdown();
            try {
                if (!resultWriter.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Result writer did not finish, forcing shutdown");
                    resultWriter.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                resultWriter.shutdownNow();
            }
        }
        loopRunning = false;
        logger.info("Dispatcher stopped");
        terminated.complete(null);
    }

    private void runSafely(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            logger.error("Dispatcher event failed", e);
        }
    }

    private long millisUntilNextTimer() {
        long cap = config.getPollTimeout().toMillis();
        ScheduledAction next = timers.peek();
        if (next == null) {
            return cap;
        }
        long untilDue = Duration.between(now(), next.due).toMillis();
        return Math.max(0, Math.min(cap, untilDue));
    }

    private void schedule(Instant due, Runnable action) {
        timers.add(new ScheduledAction(due, timerSequence++, action));
    }

    private void fireDueTimers() {
        Instant now = now();
        ScheduledAction next;
        while ((next = timers.peek()) != null && !next.due.isAfter(now)) {
            timers.poll();
            runSafely(next.action);
        }
    }

    private void publishSnapshots() {
        trackedCount = tracker.size();
        dispatchedCount = tracker.countInState(RequestState.DISPATCHED);
        pendingSettlementCount = pendingSettlements.size();
        metrics.updateTrackedRequests(trackedCount);
        metrics.updateDispatchedRequests(dispatchedCount);
        metrics.updatePendingSettlements(pendingSettlementCount);
    }

    // ---------------------------------------------------------------- events

    private void onMessageReceived(BrokerMessage delivery) {
        metrics.recordMessageReceived();
        if (stopping) {
            logger.debug("Returning delivery {} received while stopping", delivery.getDeliveryTag());
            settle(new Settlement(delivery.getDeliveryTag(), null, false, true));
            prefetchCredits.release();
            return;
        }

        TaskRequest request;
        try {
            request = delivery.toRequest();
        } catch (MalformedMessageException e) {
            logger.error("Rejecting malformed message {}: {}", delivery.getDeliveryTag(), e.getMessage());
            settle(new Settlement(delivery.getDeliveryTag(), delivery.getMessage().getId(), false, false));
            prefetchCredits.release();
            return;
        }

        if (tracker.isLive(request.getId())) {
            logger.warn("Rejecting duplicate delivery of live request {}", request);
            settle(new Settlement(delivery.getDeliveryTag(), request.getId(), false, false));
            prefetchCredits.release();
            return;
        }

        TaskDefinition definition;
        try {
            definition = registry.lookup(request.getTaskName());
        } catch (UnknownTaskException e) {
            logger.error("Rejecting {}: no task registered under that name", request);
            rejectUntracked(request, RejectionReason.UNKNOWN_TASK, "Unknown task " + request.getTaskName(), ExceptionInfo.from(e));
            return;
        }
        if (!config.getAcceptContent().contains(request.getContentType())) {
            logger.error("Rejecting {}: content type {} is not accepted", request, request.getContentType());
            rejectUntracked(request, RejectionReason.CONTENT_REFUSED, "Content type " + request.getContentType() + " is not accepted",
                ExceptionInfo.from(new MalformedMessageException("Refused content type " + request.getContentType())));
            return;
        }

        TrackedRequest entry = tracker.track(request, definition);
        entry.setHoldsPrefetchCredit(true);
        logger.debug("Received {}{}", request, request.isRedelivered() ? " (redelivered)" : "");
        admit(entry);
    }

    /**
     * RECEIVED entry: reject if revoked or expired, hold until its eta, otherwise make it eligible
     */
    private void admit(TrackedRequest entry) {
        Instant now = now();
        TaskRequest request = entry.getRequest();

        if (isRevoked(request.getId(), now)) {
            entry.markRevoked();
            reject(entry, RejectionReason.REVOKED, "Revoked", TaskState.REVOKED);
            metrics.recordRevoked(request.getTaskName());
            return;
        }
        if (request.isExpired(now)) {
            logger.info("{} expired at {}", request, request.getExpires());
            reject(entry, RejectionReason.EXPIRED, "Expired at " + request.getExpires(), TaskState.REVOKED);
            return;
        }
        if (!request.isDue(now)) {
            logger.debug("Holding {} until its eta {}", request, request.getEta());
            releaseCredit(entry);
            String id = request.getId();
            schedule(request.getEta(), () -> onEtaDue(id));
            return;
        }

        entry.transitionTo(RequestState.ELIGIBLE);
        eligible.addLast(entry.getId());
        dispatchEligible();
    }

    private void onEtaDue(String requestId) {
        tracker.get(requestId)
            .filter(entry -> entry.getState() == RequestState.RECEIVED)
            .ifPresent(this::admit);
    }

    private void onRetryDue(String requestId) {
        Optional<TrackedRequest> found = tracker.get(requestId);
        if (found.isEmpty() || found.get().getState() != RequestState.RETRY_SCHEDULED) {
            return;
        }
        TrackedRequest entry = found.get();
        entry.markRetryDue();
        logger.debug("Retry of {} is due", entry);
        admit(entry);
    }

    /**
     * Dispatch ELIGIBLE entries in arrival order while the pool has room.
     * Concurrency is checked before the rate limit so a permit is only taken when a slot is free.
     */
    private void dispatchEligible() {
        if (stopping) {
            return;
        }
        Iterator<String> it = eligible.iterator();
        while (it.hasNext()) {
            if (tracker.countInState(RequestState.DISPATCHED) >= pool.concurrency()) {
                return;
            }
            String id = it.next();
            Optional<TrackedRequest> found = tracker.get(id);
            if (found.isEmpty() || found.get().getState() != RequestState.ELIGIBLE) {
                it.remove();
                continue;
            }
            TrackedRequest entry = found.get();

            if (entry.getRequest().isExpired(now())) {
                it.remove();
                reject(entry, RejectionReason.EXPIRED, "Expired at " + entry.getRequest().getExpires(), TaskState.REVOKED);
                continue;
            }

            RateLimiter limiter = rateLimiterFor(entry.getDefinition());
            if (limiter != null && !limiter.acquirePermission()) {
                armRateRecheck(entry.getDefinition(), limiter);
                continue;
            }

            it.remove();
            if (!dispatch(entry)) {
                eligible.addFirst(id);
                return;
            }
        }
    }

    private boolean dispatch(TrackedRequest entry) {
        TaskRequest request = entry.getRequest();
        String id = request.getId();
        try {
            pool.submit(request, outcome -> post(() -> onOutcome(id, outcome)));
        } catch (RejectedExecutionException | IllegalStateException e) {
            logger.debug("Pool cannot take {} right now: {}", request, e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            logger.error("Pool refused {}", request, e);
            reject(entry, RejectionReason.POOL_REFUSED, "Pool refused the request: " + e.getMessage(), TaskState.FAILURE);
            return true;
        }

        Instant now = now();
        Duration hardLimit = TimeLimits.hard(request, entry.getDefinition(), poolConfig);
        entry.markDispatched(now, hardLimit != null ? now.plus(hardLimit) : null);
        logger.debug("Dispatched {}", entry);

        if (entry.getDefinition().getAckMode() == AckMode.EARLY) {
            settle(entry, true, false);
        }
        return true;
    }

    private void onOutcome(String requestId, TaskOutcome outcome) {
        processedOutcomes.incrementAndGet();
        Optional<TrackedRequest> found = tracker.get(requestId);
        if (found.isEmpty() || found.get().getState() != RequestState.DISPATCHED) {
            logger.warn("Ignoring outcome {} for request {} which is not dispatched", outcome.getKind(), requestId);
            return;
        }
        TrackedRequest entry = found.get();
        TaskDefinition definition = entry.getDefinition();
        TaskRequest request = entry.getRequest();
        metrics.recordOutcome(request.getTaskName(), outcome);
        if (outcome.getError() != null) {
            entry.setLastError(outcome.getError());
        }

        try {
            if (entry.isRevoked()) {
                logger.info("{} revoked while running ({})", request, outcome.getKind());
                reject(entry, RejectionReason.REVOKED, "Revoked", TaskState.REVOKED);
                metrics.recordRevoked(request.getTaskName());
                return;
            }

            switch (outcome.getKind()) {
                case SUCCESS:
                    entry.transitionTo(RequestState.ACKED);
                    if (!entry.isSettled()) {
                        settle(entry, true, false);
                    }
                    if (!definition.isIgnoreResult()) {
                        storeResult(TaskResultRecord.success(request.getId(), request.getTaskName(),
                            outcome.getResult(), request.getRetries(), outcome.getRuntimeMs(), config.getHostname()));
                    }
                    logger.info("{} succeeded in {}ms", request, outcome.getRuntimeMs());
                    finish(entry);
                    break;

                case FAILURE:
                    if (outcome.isRejectRequested()) {
                        logger.info("{} asked to be rejected (requeue={})", request, outcome.isRequeue());
                        String detail = "Rejected by handler: " + outcome.getError().getMessage();
                        if (outcome.isRequeue()) {
                            requeue(entry, detail);
                        } else {
                            reject(entry, RejectionReason.HANDLER_REJECTED, detail, TaskState.REJECTED);
                        }
                    } else {
                        retryOrReject(entry, outcome);
                    }
                    break;

                case TIMEOUT:
                    if (definition.isRetryOnTimeout()) {
                        retryOrReject(entry, outcome);
                    } else {
                        reject(entry, RejectionReason.TIME_LIMIT_EXCEEDED, "Time limit exceeded", TaskState.FAILURE);
                    }
                    break;

                case WORKER_LOST:
                    if (definition.isRejectOnWorkerLost() && definition.getAckMode() == AckMode.LATE) {
                        logger.warn("Worker lost while running {}, requeueing", request);
                        requeue(entry, "Worker lost");
                    } else {
                        retryOrReject(entry, outcome);
                    }
                    break;

                default:
                    throw new IllegalStateException("Unhandled outcome " + outcome.getKind());
            }
        } finally {
            dispatchEligible();
        }
    }

    private void retryOrReject(TrackedRequest entry, TaskOutcome outcome) {
        TaskRequest request = entry.getRequest();
        RetryPolicy policy = entry.getDefinition().getRetryPolicy();
        ExceptionInfo error = outcome.getError();
        int retries = request.getRetries();

        if (!outcome.isRetryRequested() && !policy.isRetryable(error)) {
            logger.error("{} failed with non-retryable {}: {}", request, error.getType(), error.getMessage());
            reject(entry, RejectionReason.NOT_RETRYABLE, "Non-retryable failure: " + error.getType(), TaskState.FAILURE);
            return;
        }
        if (policy.isExhausted(retries)) {
            logger.error("{} failed after {} retries: {}", request, retries, error);
            reject(entry, RejectionReason.RETRIES_EXHAUSTED, "Max retries (" + policy.getMaxRetries() + ") exceeded", TaskState.FAILURE);
            return;
        }

        Duration delay = outcome.isRetryRequested() && outcome.getRetryCountdown() != null
            ? outcome.getRetryCountdown()
            : policy.getRetryDelay(retries);
        scheduleRetry(entry, delay, error);
    }

    private void scheduleRetry(TrackedRequest entry, Duration delay, ExceptionInfo error) {
        TaskRequest request = entry.getRequest();
        entry.transitionTo(RequestState.RETRY_SCHEDULED);
        metrics.recordRetry(request.getTaskName());
        storeResult(TaskResultRecord.of(request.getId(), request.getTaskName(), TaskState.RETRY, error,
            request.getRetries(), 0, config.getHostname()));
        logger.warn("{} failed ({}), retry {} in {}ms", request, error != null ? error.getType() : "unknown",
                   request.getRetries() + 1, delay.toMillis());

        Instant due = now().plus(delay);
        if (config.getRetryMode() == RetryMode.REQUEUE_TO_BROKER || stopping) {
            if (requeueToBroker(entry, request.withRetries(request.getRetries() + 1).withEta(due))) {
                return;
            }
            if (stopping) {
                returnUnpublished(entry);
                return;
            }
        }

        releaseCredit(entry);
        String id = request.getId();
        schedule(due, () -> onRetryDue(id));
    }

    /**
     * Publish the next attempt as a new message and settle the current delivery
     */
    private boolean requeueToBroker(TrackedRequest entry, TaskRequest next) {
        if (!republish(next)) {
            return false;
        }
        if (!entry.isSettled()) {
            settle(entry, true, false);
        }
        finish(entry);
        return true;
    }

    private void onRevoke(String requestId) {
        Instant now = now();
        revokedIds.put(requestId, now.plus(config.getRevokedExpiry()));

        Optional<TrackedRequest> found = tracker.get(requestId);
        if (found.isEmpty()) {
            logger.info("Revoked unknown request {}; it will be rejected on arrival", requestId);
            return;
        }
        TrackedRequest entry = found.get();
        entry.markRevoked();
        switch (entry.getState()) {
            case DISPATCHED:
                logger.info("Revoking running request {}", entry);
                entry.markTerminateRequested();
                if (!pool.terminate(requestId)) {
                    logger.debug("{} finished before it could be terminated", entry);
                }
                break;
            case RECEIVED:
            case ELIGIBLE:
            case RETRY_SCHEDULED:
                logger.info("Revoking {} before it ran", entry);
                reject(entry, RejectionReason.REVOKED, "Revoked", TaskState.REVOKED);
                metrics.recordRevoked(entry.getRequest().getTaskName());
                dispatchEligible();
                break;
            default:
                break;
        }
    }

    private boolean isRevoked(String requestId, Instant now) {
        Instant expiry = revokedIds.get(requestId);
        return expiry != null && expiry.isAfter(now);
    }

    private void sweep() {
        Instant now = now();
        Duration grace = poolConfig.getWatchdogInterval();
        for (TrackedRequest entry : tracker.overdue(now, grace)) {
            if (!entry.isTerminateRequested()) {
                logger.warn("{} passed its hard deadline {} without an outcome, terminating", entry, entry.getHardDeadline());
                entry.markTerminateRequested();
                pool.terminate(entry.getId());
            }
        }
        revokedIds.values().removeIf(expiry -> !expiry.isAfter(now));
        if (!stopping) {
            schedule(now.plus(poolConfig.getWatchdogInterval()), this::sweep);
        }
    }

    private void onStopConsuming() {
        stopping = true;
        consuming = false;
        if (consumerThread != null) {
            consumerThread.interrupt();
        }

        int requeued = 0;
        for (TrackedRequest entry : new ArrayList<>(tracker.all())) {
            switch (entry.getState()) {
                case RECEIVED:
                case ELIGIBLE:
                    requeue(entry, "Worker stopping");
                    requeued++;
                    break;
                case RETRY_SCHEDULED:
                    requeueRetry(entry);
                    requeued++;
                    break;
                default:
                    break;
            }
        }
        eligible.clear();
        logger.info("Stopped consuming; returned {} undispatched requests to the broker", requeued);
    }

    private void requeueRetry(TrackedRequest entry) {
        TaskRequest next = entry.getRequest().withRetries(entry.getRequest().getRetries() + 1);
        if (!requeueToBroker(entry, next)) {
            returnUnpublished(entry);
        }
    }

    // The retry could not be published: requeue the original delivery, or dead-letter it if it was acked early
    private void returnUnpublished(TrackedRequest entry) {
        if (entry.isSettled()) {
            logger.error("{} was acked early and cannot be returned to the broker", entry);
            reject(entry, RejectionReason.UNDELIVERABLE, "Worker stopping; delivery already acked and retry not published",
                TaskState.REJECTED);
        } else {
            requeue(entry, "Worker stopping");
        }
    }

    private void onShutdown() {
        for (TrackedRequest entry : new ArrayList<>(tracker.all())) {
            logger.warn("{} still tracked at shutdown, returning it to the broker", entry);
            if (entry.getState() == RequestState.RETRY_SCHEDULED) {
                requeueRetry(entry);
            } else if (entry.isSettled()) {
                tracker.remove(entry.getId());
            } else {
                entry.markSettled();
                pendingSettlements.addLast(new Settlement(entry.getRequest().getDeliveryTag(), entry.getId(), false, true));
                tracker.remove(entry.getId());
            }
        }
        retryPendingSettlements();
        if (!pendingSettlements.isEmpty()) {
            logger.error("{} acks/rejects could not be delivered before shutdown; the broker will redeliver them",
                        pendingSettlements.size());
        }
        publishSnapshots();
        loopRunning = false;
    }

    // ---------------------------------------------------------------- settlement

    /**
     * Terminal rejection: the delivery is rejected without requeue (unless already acked),
     * a dead letter is written and {@code state} recorded.
     */
    private void reject(TrackedRequest entry, RejectionReason reason, String detail, TaskState state) {
        TaskRequest request = entry.getRequest();
        entry.transitionTo(RequestState.REJECTED);
        eligible.remove(entry.getId());
        if (!entry.isSettled()) {
            settle(entry, false, false);
        }
        metrics.recordRejected(request.getTaskName());
        writeDeadLetter(request, reason, detail, entry.getLastError());
        logger.warn("Rejected {}: {}", request, detail);
        storeResult(TaskResultRecord.of(request.getId(), request.getTaskName(), state, entry.getLastError(),
            request.getRetries(), 0, config.getHostname()));
        finish(entry);
    }

    /**
     * Give the request back to the broker. A delivery that was acked early is published again;
     * if that fails too the request is dead-lettered as undeliverable.
     */
    private void requeue(TrackedRequest entry, String why) {
        TaskRequest request = entry.getRequest();
        if (entry.isSettled() && !republish(request)) {
            logger.error("{} was acked early and could not be returned to the broker ({})", request, why);
            reject(entry, RejectionReason.UNDELIVERABLE, why + "; delivery already acked and requeue failed",
                TaskState.REJECTED);
            return;
        }
        entry.transitionTo(RequestState.REJECTED);
        eligible.remove(entry.getId());
        if (!entry.isSettled()) {
            settle(entry, false, true);
        }
        metrics.recordRequeued(request.getTaskName());
        logger.debug("Returned {} to the broker: {}", request, why);
        finish(entry);
    }

    private boolean republish(TaskRequest request) {
        try {
            broker.publish(TaskMessage.fromRequest(request));
            return true;
        } catch (BrokerUnavailableException | UnsupportedOperationException e) {
            logger.warn("Could not publish {} to the broker: {}", request, e.getMessage());
            return false;
        }
    }

    private void rejectUntracked(TaskRequest request, RejectionReason reason, String detail, ExceptionInfo error) {
        settle(new Settlement(request.getDeliveryTag(), request.getId(), false, false));
        prefetchCredits.release();
        metrics.recordRejected(request.getTaskName());
        writeDeadLetter(request, reason, detail, error);
        storeResult(TaskResultRecord.of(request.getId(), request.getTaskName(), TaskState.REJECTED, error,
            request.getRetries(), 0, config.getHostname()));
    }

    private void finish(TrackedRequest entry) {
        tracker.remove(entry.getId());
        releaseCredit(entry);
    }

    private void releaseCredit(TrackedRequest entry) {
        if (entry.holdsPrefetchCredit()) {
            entry.setHoldsPrefetchCredit(false);
            prefetchCredits.release();
        }
    }

    private void settle(TrackedRequest entry, boolean ack, boolean requeue) {
        entry.markSettled();
        settle(new Settlement(entry.getRequest().getDeliveryTag(), entry.getId(), ack, requeue));
    }

    private void settle(Settlement settlement) {
        if (!pendingSettlements.isEmpty()) {
            pendingSettlements.addLast(settlement);
            return;
        }
        if (!trySettle(settlement)) {
            pendingSettlements.addLast(settlement);
        }
    }

    private boolean trySettle(Settlement settlement) {
        try {
            if (settlement.ack) {
                broker.ack(settlement.deliveryTag);
            } else {
                broker.reject(settlement.deliveryTag, settlement.requeue);
            }
            return true;
        } catch (BrokerUnavailableException e) {
            metrics.recordBrokerError();
            logger.warn("Could not {} delivery {} of {}: {}; will retry", settlement.describe(),
                       settlement.deliveryTag, settlement.requestId, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            logger.error("Broker refused to {} delivery {} of {}", settlement.describe(),
                        settlement.deliveryTag, settlement.requestId, e);
            return true;
        }
    }

    private void retryPendingSettlements() {
        while (!pendingSettlements.isEmpty()) {
            if (!trySettle(pendingSettlements.peekFirst())) {
                return;
            }
            pendingSettlements.pollFirst();
        }
    }

    // ---------------------------------------------------------------- side effects off the loop

    private void storeResult(TaskResultRecord record) {
        resultWriter.execute(() -> {
            try {
                resultBackend.storeResult(record.getRequestId(), record);
            } catch (Exception e) {
                logger.warn("Could not store {} for {}: {}", record.getState(), record.getRequestId(), e.toString());
            }
        });
    }

    private void writeDeadLetter(TaskRequest request, RejectionReason reason, String detail, ExceptionInfo error) {
        if (deadLetterQueue == null) {
            return;
        }
        metrics.recordMovedToDlq(request.getTaskName(), detail);
        DeadLetterEntry entry = DeadLetterEntry.create(request, reason, detail, error);
        resultWriter.execute(() -> {
            if (deadLetterQueue.add(entry)) {
                metrics.updateDlqSize(deadLetterQueue.size());
            }
        });
    }

    // ---------------------------------------------------------------- rate limiting

    private RateLimiter rateLimiterFor(TaskDefinition definition) {
        RateLimit limit = definition.getRateLimit();
        if (limit == null) {
            return null;
        }
        return rateLimiters.computeIfAbsent(definition.getName(), name -> RateLimiter.of("task-" + name,
            RateLimiterConfig.custom()
                .limitForPeriod(limit.getLimit())
                .limitRefreshPeriod(limit.getPeriod())
                .timeoutDuration(Duration.ZERO)
                .build()));
    }

    private void armRateRecheck(TaskDefinition definition, RateLimiter limiter) {
        if (rateRechecksArmed.add(definition.getName())) {
            Duration wait = untilNextPermission(limiter, definition.getRateLimit());
            logger.debug("Rate limit reached for {}, rechecking in {}", definition.getName(), wait);
            schedule(now().plus(wait), () -> {
                rateRechecksArmed.remove(definition.getName());
                dispatchEligible();
            });
        }
    }

    private static Duration untilNextPermission(RateLimiter limiter, RateLimit limit) {
        if (limiter instanceof AtomicRateLimiter) {
            long nanos = ((AtomicRateLimiter) limiter).getDetailedMetrics().getNanosToWait();
            return Duration.ofNanos(Math.max(nanos, MIN_RATE_RECHECK.toNanos()));
        }
        return limit.getPeriod();
    }

    /**
     * Notified from the consumer thread when the broker connection drops or comes back
     */
    public interface BrokerStatusListener {

        default void brokerUnavailable(BrokerUnavailableException cause) {
        }

        default void brokerRecovered() {
        }
    }

    private static final class ScheduledAction {
        private final Instant due;
        private final long sequence;
        private final Runnable action;

        private ScheduledAction(Instant due, long sequence, Runnable action) {
            this.due = due;
            this.sequence = sequence;
            this.action = action;
        }
    }

    private static final class Settlement {
        private final long deliveryTag;
        private final String requestId;
        private final boolean ack;
        private final boolean requeue;

        private Settlement(long deliveryTag, String requestId, boolean ack, boolean requeue) {
            this.deliveryTag = deliveryTag;
            this.requestId = requestId;
            this.ack = ack;
            this.requeue = requeue;
        }

        private String describe() {
            return ack ? "ack" : requeue ? "requeue" : "reject";
        }
    }
}
