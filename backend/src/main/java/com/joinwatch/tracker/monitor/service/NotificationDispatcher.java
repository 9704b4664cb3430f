package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.http.PlatformStatus;
import com.joinwatch.tracker.monitor.model.DeliveryOutcome;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.NotificationMarker;
import com.joinwatch.tracker.monitor.model.RetryDecision;
import com.joinwatch.tracker.monitor.persistence.JoinJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns admitted join records into outbound notifications. A single consumer drains the queue,
 * so at most one send is in flight. Every queued id is already persisted as pending, so the
 * in-memory queue can be dropped at any time and is rebuilt from the store.
 */
@Service
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final int RELOAD_BATCH_SIZE = 500;

    private final JoinJdbcRepository repository;
    private final PlatformClient platformClient;
    private final SnapshotValidator validator;
    private final JoinNotificationFormatter formatter;
    private final RateBudget rateBudget;
    private final DeliveryRetryPolicy retryPolicy;
    private final DeliveryFailureNotifier failureNotifier;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MonitorProperties properties;
    private final Duration window;
    private final BlockingQueue<Long> queue = new LinkedBlockingQueue<>();
    private final Set<Long> queued = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private Thread consumer;
    private ScheduledExecutorService retryScanner;

    public NotificationDispatcher(
        JoinJdbcRepository repository,
        PlatformClient platformClient,
        SnapshotValidator validator,
        JoinNotificationFormatter formatter,
        RateBudget rateBudget,
        DeliveryRetryPolicy retryPolicy,
        DeliveryFailureNotifier failureNotifier,
        TransactionTemplate transactionTemplate,
        Clock clock,
        MonitorProperties properties
    ) {
        this.repository = repository;
        this.platformClient = platformClient;
        this.validator = validator;
        this.formatter = formatter;
        this.rateBudget = rateBudget;
        this.retryPolicy = retryPolicy;
        this.failureNotifier = failureNotifier;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.properties = properties;
        this.window = Duration.ofHours(properties.getDedup().getWindowHours());
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDispatch().isWorkerEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            running.set(true);
            consumer = new Thread(this::consumeLoop, "notification-dispatcher");
            consumer.setDaemon(true);
            consumer.start();
            retryScanner = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("notification-retry-scan");
                thread.setDaemon(true);
                return thread;
            });
            // first run reloads everything left unsent by a previous process
            retryScanner.scheduleWithFixedDelay(
                this::enqueueDue,
                0,
                properties.getDispatch().getRetryScanIntervalSeconds(),
                TimeUnit.SECONDS
            );
            log.info("Notification dispatcher started");
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (retryScanner != null) {
                retryScanner.shutdownNow();
                retryScanner = null;
            }
            if (consumer != null) {
                consumer.interrupt();
                try {
                    consumer.join(TimeUnit.SECONDS.toMillis(5));
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                consumer = null;
            }
            int dropped = queue.size();
            queue.clear();
            queued.clear();
            log.info("Notification dispatcher stopped; {} queued record(s) stay pending in the store", dropped);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int queueDepth() {
        return queue.size();
    }

    public void enqueue(long joinRecordId) {
        if (queued.add(joinRecordId)) {
            queue.offer(joinRecordId);
        }
    }

    /**
     * Queues every pending or retrying record whose next attempt is due.
     *
     * @return number of ids found due
     */
    public int enqueueDue() {
        try {
            List<Long> due = repository.findDispatchableIds(clock.instant(), RELOAD_BATCH_SIZE);
            for (Long id : due) {
                enqueue(id);
            }
            if (!due.isEmpty()) {
                log.debug("Queued {} due join record(s)", due.size());
            }
            return due.size();
        } catch (DataAccessException e) {
            log.warn("Unable to scan for due join records", e);
            return 0;
        }
    }

    /**
     * Drains the queue on the calling thread. Used when the background consumer is disabled.
     */
    public int drainQueue() {
        int processed = 0;
        Long id;
        while ((id = queue.poll()) != null) {
            queued.remove(id);
            processQueued(id);
            processed++;
        }
        return processed;
    }

    private void consumeLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Long id;
            try {
                id = queue.poll(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (id == null) {
                continue;
            }
            queued.remove(id);
            try {
                processQueued(id);
            } catch (RuntimeException e) {
                log.error("Unexpected failure dispatching join record {}", id, e);
            }
        }
    }

    private void processQueued(long id) {
        JoinRecord record;
        try {
            record = repository.findJoinRecord(id);
        } catch (DataAccessException e) {
            log.warn("Unable to load join record {}; retry scan will pick it up", id, e);
            return;
        }
        if (record == null || !record.deliveryState().isDispatchable()) {
            return;
        }
        if (record.nextAttemptAt() != null && record.nextAttemptAt().isAfter(clock.instant())) {
            return;
        }
        dispatch(record);
    }

    public DeliveryOutcome dispatch(JoinRecord record) {
        Instant now = clock.instant();
        try {
            NotificationMarker marker = repository.findMarkerSince(record.subjectId(), record.communityId(), now.minus(window));
            if (marker != null) {
                repository.markSent(record.id(), record.attempts());
                log.info(
                    "Join record {} already notified at {} by record {}; not sending again",
                    record.id(),
                    marker.sentAt(),
                    marker.joinRecordId()
                );
                return DeliveryOutcome.SENT;
            }

            try {
                validator.validate(record, now);
            } catch (DataValidityException e) {
                repository.markFiltered(record.id(), e.getMessage());
                log.info("Filtered join record {} ({} in {}): {}", record.id(), record.subjectId(), record.communityId(), e.getMessage());
                return DeliveryOutcome.FILTERED;
            }

            int attempts = record.attempts() + 1;
            String target = properties.getNotifications().getTargetUserId();
            if (target == null || target.isBlank()) {
                return handleFailure(record, attempts, PlatformStatus.FORBIDDEN, "no notification target configured");
            }
            Duration maxWait = Duration.ofMillis(properties.getDispatch().getAcquireTimeoutMs());
            if (!rateBudget.tryAcquire(maxWait)) {
                return handleFailure(record, attempts, PlatformStatus.TRANSIENT_ERROR, "send budget exhausted");
            }

            PlatformResponse<String> response = platformClient.sendDirectMessage(target, formatter.format(record, now));
            if (!response.isOk()) {
                return handleFailure(record, attempts, response.status(), response.status() + ": " + response.message());
            }
            Instant sentAt = clock.instant();
            transactionTemplate.executeWithoutResult(status -> {
                repository.insertMarker(record.subjectId(), record.communityId(), sentAt, record.id());
                repository.markSent(record.id(), attempts);
            });
            log.info(
                "Notified join of {} in {} (record {}, attempt {})",
                record.subjectId(),
                record.communityId(),
                record.id(),
                attempts
            );
            return DeliveryOutcome.SENT;
        } catch (DataAccessException e) {
            log.warn("Store unavailable while dispatching join record {}; it stays pending", record.id(), e);
            return DeliveryOutcome.FAILED;
        }
    }

    public PlatformResponse<String> sendTestNotification() {
        String target = properties.getNotifications().getTargetUserId();
        if (target == null || target.isBlank()) {
            return PlatformResponse.failure(PlatformStatus.FORBIDDEN, 0, "no notification target configured");
        }
        if (!rateBudget.tryAcquire(Duration.ofMillis(properties.getDispatch().getAcquireTimeoutMs()))) {
            return PlatformResponse.failure(PlatformStatus.RATE_LIMITED, 0, "send budget exhausted");
        }
        return platformClient.sendDirectMessage(target, formatter.formatTestMessage(clock.instant()));
    }

    private DeliveryOutcome handleFailure(JoinRecord record, int attempts, PlatformStatus status, String reason) {
        RetryDecision decision = retryPolicy.onFailure(attempts, status, clock.instant());
        repository.recordDeliveryFailure(record.id(), decision.nextState(), attempts, decision.nextAttemptAt(), reason);
        if (decision.isPermanent()) {
            failureNotifier.notifyPermanentFailure(record, attempts, reason);
        } else {
            log.warn(
                "Delivery of join record {} failed (attempt {}/{}): {}; next attempt at {}",
                record.id(),
                attempts,
                retryPolicy.getMaxAttempts(),
                reason,
                decision.nextAttemptAt()
            );
        }
        return DeliveryOutcome.FAILED;
    }
}
