package com.relaymail.queue;

import com.relaymail.config.RelayMailProperties;
import com.relaymail.domain.DeliveryLog;
import com.relaymail.domain.OutboundEmail;
import com.relaymail.domain.OutboundEmailStatus;
import com.relaymail.domain.OutboundRecipient;
import com.relaymail.domain.OutboundRecipientStatus;
import com.relaymail.mapper.OutboundEmailMapper;
import com.relaymail.service.DeliveryNotificationService;
import com.relaymail.service.DeliveryResult;
import com.relaymail.service.SmtpDeliveryService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Outbound delivery queue
 * - Polls due emails (QUEUED, retry time passed) every queue-polling-interval-seconds
 * - Delivers up to max-concurrency emails in parallel
 * - Per-recipient status, append-only delivery log
 * - Exponential-backoff retry, FAILED after max-retries
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "relaymail.outbound.enabled", havingValue = "true")
public class DeliveryQueueProcessor {

    private final OutboundEmailMapper outboundEmailMapper;
    private final SmtpDeliveryService deliveryService;
    private final DeliveryNotificationService notificationService;
    private final RelayMailProperties.Outbound options;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Autowired
    public DeliveryQueueProcessor(OutboundEmailMapper outboundEmailMapper,
                                  SmtpDeliveryService deliveryService,
                                  DeliveryNotificationService notificationService,
                                  RelayMailProperties properties,
                                  MeterRegistry meterRegistry) {
        this(outboundEmailMapper, deliveryService, notificationService, properties, meterRegistry, Clock.systemUTC());
    }

    DeliveryQueueProcessor(OutboundEmailMapper outboundEmailMapper,
                           SmtpDeliveryService deliveryService,
                           DeliveryNotificationService notificationService,
                           RelayMailProperties properties,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.outboundEmailMapper = outboundEmailMapper;
        this.deliveryService = deliveryService;
        this.notificationService = notificationService;
        this.options = properties.getOutbound();
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        int requeued = outboundEmailMapper.requeueInterrupted();
        if (requeued > 0) {
            log.warn("Requeued {} emails left in SENDING by a previous run", requeued);
        }
        log.info("Outbound mail delivery processor started with max concurrency {}, relay: {}",
                options.getMaxConcurrency(), options.hasRelayHost() ? options.getRelayHost() : "direct MX");
    }

    @Scheduled(fixedDelayString = "${relaymail.outbound.queue-polling-interval-seconds:15}",
            initialDelayString = "${relaymail.outbound.queue-polling-interval-seconds:15}",
            timeUnit = TimeUnit.SECONDS)
    public void processQueue() {
        try {
            List<OutboundEmail> due = outboundEmailMapper.findDueForDelivery(clock.instant(), options.getMaxConcurrency());
            if (due.isEmpty()) {
                return;
            }
            log.info("Processing {} queued emails for delivery", due.size());

            Flux.fromIterable(due)
                    .flatMap(email -> Mono.fromRunnable(() -> processEmail(email))
                            .subscribeOn(Schedulers.boundedElastic()), options.getMaxConcurrency())
                    .then()
                    .block();
        } catch (RuntimeException e) {
            log.error("Error processing delivery queue", e);
        }
    }

    /**
     * One delivery attempt for one email. Never throws.
     */
    public void processEmail(OutboundEmail email) {
        try {
            email.setRecipients(outboundEmailMapper.findRecipients(email.getId()));
            email.setAttachments(outboundEmailMapper.findAttachments(email.getId()));

            email.setStatus(OutboundEmailStatus.SENDING);
            outboundEmailMapper.update(email);
            notifyStatus(email);

            List<DeliveryResult> results = deliveryService.deliver(email);
            int attemptNumber = email.getRetryCount() + 1;
            for (DeliveryResult result : results) {
                outboundEmailMapper.insertDeliveryLog(toLog(email, result, attemptNumber));
            }

            // The last result for a recipient is its final outcome for this attempt
            Map<String, DeliveryResult> finalResults = new LinkedHashMap<>();
            for (DeliveryResult result : results) {
                finalResults.put(result.recipientId(), result);
            }
            applyRecipientResults(email, finalResults);

            List<DeliveryResult> failed = finalResults.values().stream()
                    .filter(r -> !r.success())
                    .collect(Collectors.toList());

            if (failed.isEmpty()) {
                email.setStatus(OutboundEmailStatus.SENT);
                email.setSentAt(clock.instant());
                email.setNextRetryAt(null);
                email.setLastError(null);
                log.info("Email {} delivered successfully to all recipients", email.getId());
            } else if (failed.size() == finalResults.size()) {
                email.setLastError(failed.get(0).errorMessage());
                handleFailure(email);
            } else {
                email.setStatus(OutboundEmailStatus.PARTIAL_FAILURE);
                email.setSentAt(clock.instant());
                email.setNextRetryAt(null);
                email.setLastError(failed.stream()
                        .map(r -> r.address() + ": " + r.errorMessage())
                        .collect(Collectors.joining("; ")));
                log.warn("Email {} partially delivered. Failed recipients: {}", email.getId(), email.getLastError());
            }

            persist(email);
        } catch (RuntimeException e) {
            log.error("Unexpected error delivering email {}", email.getId(), e);
            email.setLastError(e.getMessage());
            handleFailure(email);
            try {
                persist(email);
            } catch (RuntimeException persistError) {
                log.error("Failed to persist delivery state of email {}", email.getId(), persistError);
            }
        }
    }

    /**
     * Count the failed attempt and either schedule the next one or give up
     */
    void handleFailure(OutboundEmail email) {
        email.setRetryCount(email.getRetryCount() + 1);

        if (email.getRetryCount() >= options.getMaxRetries()) {
            email.setStatus(OutboundEmailStatus.FAILED);
            email.setNextRetryAt(null);
            log.error("Email {} permanently failed after {} attempts", email.getId(), email.getRetryCount());
            return;
        }

        Duration delay = retryDelay(email.getRetryCount());
        email.setNextRetryAt(clock.instant().plus(delay));
        email.setStatus(OutboundEmailStatus.QUEUED);
        for (OutboundRecipient recipient : email.getRecipients()) {
            if (recipient.getStatus() == OutboundRecipientStatus.FAILED) {
                recipient.setStatus(OutboundRecipientStatus.DEFERRED);
            }
        }
        log.warn("Email {} deferred, attempt {}/{}. Next retry at {}",
                email.getId(), email.getRetryCount(), options.getMaxRetries(), email.getNextRetryAt());
    }

    /**
     * min(base * 2^(retryCount-1), max)
     */
    Duration retryDelay(int retryCount) {
        long base = options.getRetryBaseDelaySeconds();
        long max = options.getMaxRetryDelaySeconds();
        int exponent = Math.max(0, retryCount - 1);
        if (exponent >= 62 || base > (max >> exponent)) {
            return Duration.ofSeconds(max);
        }
        return Duration.ofSeconds(Math.min(base << exponent, max));
    }

    private void applyRecipientResults(OutboundEmail email, Map<String, DeliveryResult> finalResults) {
        Instant now = clock.instant();
        for (OutboundRecipient recipient : email.getRecipients()) {
            DeliveryResult result = finalResults.get(recipient.getId());
            if (result == null) {
                continue;
            }
            if (result.success()) {
                recipient.setStatus(OutboundRecipientStatus.SENT);
                recipient.setDeliveredAt(now);
                recipient.setStatusMessage(result.smtpResponse());
            } else {
                recipient.setStatus(OutboundRecipientStatus.FAILED);
                recipient.setStatusMessage(result.errorMessage());
            }
        }
    }

    private void persist(OutboundEmail email) {
        email.getRecipients().forEach(outboundEmailMapper::updateRecipient);
        outboundEmailMapper.update(email);
        meterRegistry.counter("relaymail.delivery.emails", "status", email.getStatus().name()).increment();
        notifyStatus(email);
    }

    private void notifyStatus(OutboundEmail email) {
        try {
            notificationService.notifyDeliveryStatusChanged(email.getUserId(), email.getId(), email.getStatus());
        } catch (RuntimeException e) {
            log.warn("Delivery status notification failed for email {}: {}", email.getId(), e.getMessage());
        }
    }

    private DeliveryLog toLog(OutboundEmail email, DeliveryResult result, int attemptNumber) {
        return DeliveryLog.builder()
                .id(UUID.randomUUID().toString())
                .outboundEmailId(email.getId())
                .recipientId(result.recipientId())
                .recipientAddress(result.address())
                .mxHost(result.mxHost())
                .smtpStatusCode(result.smtpStatusCode())
                .smtpResponse(result.smtpResponse())
                .success(result.success())
                .errorMessage(result.errorMessage())
                .attemptNumber(attemptNumber)
                .attemptedAt(clock.instant())
                .durationMs(result.duration() != null ? result.duration().toMillis() : 0L)
                .build();
    }
}
