package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.cognisync.model.DeadLetterRecord;
import com.cognisync.model.ProcessingStatus;
import com.cognisync.model.SyncConfiguration;
import com.cognisync.model.SyncEvent;
import com.cognisync.repository.SyncConfigurationRepository;
import com.cognisync.repository.SyncEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Applies the outcome of one processing attempt to a leased event.
 *
 *   success                               → COMPLETED, errorMessage cleared
 *   failure, retryCount + 1 >  retryLimit → DEAD_LETTER with dead-letter record
 *   failure, retryCount + 1 <= retryLimit → RETRYING, retryCount + 1,
 *                                           nextAttemptAt = now + retryDelay
 *
 * retryLimit and retryDelay are read from the owning configuration at failure
 * time; if the configuration is gone the configured default limit applies and
 * the retry is immediate.
 *
 * A transition is only written while the event is still PROCESSING under the
 * same lease. If the lease was reclaimed in the meantime the outcome is dropped:
 * the event is already queued again and the next lease will redo the work.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncEventStateMachine {

    private final SyncEventRepository eventRepository;
    private final SyncConfigurationRepository configurationRepository;
    private final PipelineMetrics metrics;
    private final CognisyncProperties properties;

    @Transactional
    public Optional<SyncEvent> onSuccess(SyncEvent leased, String skipReason) {
        Optional<SyncEvent> owned = loadOwned(leased);
        if (owned.isEmpty()) {
            return Optional.empty();
        }
        SyncEvent event = owned.get();
        event.setProcessingStatus(ProcessingStatus.COMPLETED);
        event.setErrorMessage(null);
        event.setSkipReason(skipReason);
        event.setNextAttemptAt(null);
        clearLease(event);

        if (skipReason == null) {
            metrics.incrementEventsSucceeded();
            log.info("Event processed and published successfully: eventId={}", event.getId());
        } else {
            metrics.incrementEventsSkipped();
            log.warn("Event completed without publishing: eventId={}, reason={}", event.getId(), skipReason);
        }
        return Optional.of(eventRepository.save(event));
    }

    @Transactional
    public Optional<SyncEvent> onFailure(SyncEvent leased, Exception failure) {
        Optional<SyncEvent> owned = loadOwned(leased);
        if (owned.isEmpty()) {
            return Optional.empty();
        }
        SyncEvent event = owned.get();
        String error = describe(failure);
        Optional<SyncConfiguration> config = configurationRepository.findById(event.getConfigId());
        int retryLimit = config.map(SyncConfiguration::getRetryLimit)
                .orElse(properties.getRetry().getDefaultLimit());
        int attempts = event.getRetryCount() + 1;
        Instant now = Instant.now();

        if (attempts > retryLimit) {
            event.setProcessingStatus(ProcessingStatus.DEAD_LETTER);
            event.setErrorMessage(error);
            event.setNextAttemptAt(null);
            event.setDeadLetter(DeadLetterRecord.builder()
                    .payload(event.getPayload())
                    .error(error)
                    .failedAt(now)
                    .attempts(attempts)
                    .build());
            metrics.incrementEventsDeadLettered();
            log.error("CRITICAL: Retry limit exceeded, event dead-lettered: eventId={}, attempts={}, retryLimit={}, error={}",
                    event.getId(), attempts, retryLimit, error);
        } else {
            long delayMs = config.map(SyncConfiguration::getRetryDelayMs).orElse(0L);
            event.setProcessingStatus(ProcessingStatus.RETRYING);
            event.setRetryCount(attempts);
            event.setErrorMessage(error);
            event.setNextAttemptAt(now.plus(Duration.ofMillis(Math.max(0L, delayMs))));
            metrics.incrementEventsRetried();
            log.warn("Scheduling retry: eventId={}, attempt={}, retryLimit={}, delayMs={}, error={}",
                    event.getId(), attempts, retryLimit, delayMs, error);
        }
        clearLease(event);
        return Optional.of(eventRepository.save(event));
    }

    private Optional<SyncEvent> loadOwned(SyncEvent leased) {
        Optional<SyncEvent> current = eventRepository.findById(leased.getId());
        if (current.isEmpty()) {
            log.warn("Leased event no longer exists: eventId={}", leased.getId());
            return Optional.empty();
        }
        SyncEvent event = current.get();
        if (event.getProcessingStatus() != ProcessingStatus.PROCESSING
                || !Objects.equals(event.getLeaseOwner(), leased.getLeaseOwner())) {
            log.warn("Lease lost before outcome was recorded: eventId={}, status={}, owner={}",
                    event.getId(), event.getProcessingStatus(), event.getLeaseOwner());
            return Optional.empty();
        }
        return current;
    }

    private static void clearLease(SyncEvent event) {
        event.setLeaseOwner(null);
        event.setLeasedAt(null);
    }

    private static String describe(Exception failure) {
        if (failure == null) {
            return "Unknown error";
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }
}
