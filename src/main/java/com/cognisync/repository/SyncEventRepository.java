package com.cognisync.repository;

import com.cognisync.model.ProcessingStatus;
import com.cognisync.model.SyncEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Database access for SyncEvent rows.
 *
 * Every status transition outside the state machine is a conditional UPDATE
 * keyed on id AND the expected status. Callers read the affected-row count:
 * 1 means this caller won the transition, 0 means someone else got there first.
 * The version column is bumped by hand because bulk JPQL updates bypass @Version.
 */
public interface SyncEventRepository extends JpaRepository<SyncEvent, UUID> {

    @Query("select e from SyncEvent e " +
           "where e.processingStatus in :eligible " +
           "and (e.nextAttemptAt is null or e.nextAttemptAt <= :now) " +
           "order by e.receivedAt asc")
    List<SyncEvent> findLeaseCandidates(@Param("eligible") Collection<ProcessingStatus> eligible,
                                        @Param("now") Instant now,
                                        Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncEvent e set e.processingStatus = com.cognisync.model.ProcessingStatus.PROCESSING, " +
           "e.leaseOwner = :owner, e.leasedAt = :now, e.updatedAt = :now, e.version = e.version + 1 " +
           "where e.id = :id and e.processingStatus = :expected")
    int tryLease(@Param("id") UUID id,
                 @Param("expected") ProcessingStatus expected,
                 @Param("owner") String owner,
                 @Param("now") Instant now);

    // 0 when the lease expired and was reclaimed by another worker
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncEvent e set e.leasedAt = :now, e.updatedAt = :now, e.version = e.version + 1 " +
           "where e.id = :id and e.processingStatus = com.cognisync.model.ProcessingStatus.PROCESSING " +
           "and e.leaseOwner = :owner")
    int renewLease(@Param("id") UUID id,
                   @Param("owner") String owner,
                   @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncEvent e set e.processingStatus = :target, " +
           "e.leaseOwner = null, e.leasedAt = null, e.updatedAt = :now, e.version = e.version + 1 " +
           "where e.id = :id and e.processingStatus = com.cognisync.model.ProcessingStatus.PROCESSING " +
           "and e.leaseOwner = :owner")
    int releaseLease(@Param("id") UUID id,
                     @Param("owner") String owner,
                     @Param("target") ProcessingStatus target,
                     @Param("now") Instant now);

    @Query("select e from SyncEvent e " +
           "where e.processingStatus = com.cognisync.model.ProcessingStatus.PROCESSING " +
           "and e.leasedAt < :cutoff order by e.leasedAt asc")
    List<SyncEvent> findExpiredLeases(@Param("cutoff") Instant cutoff, Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncEvent e set e.processingStatus = :target, " +
           "e.leaseOwner = null, e.leasedAt = null, e.updatedAt = :now, e.version = e.version + 1 " +
           "where e.id = :id and e.processingStatus = com.cognisync.model.ProcessingStatus.PROCESSING " +
           "and e.leasedAt < :cutoff")
    int reclaimExpiredLease(@Param("id") UUID id,
                            @Param("target") ProcessingStatus target,
                            @Param("cutoff") Instant cutoff,
                            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update SyncEvent e set e.processingStatus = com.cognisync.model.ProcessingStatus.PENDING, " +
           "e.retryCount = 0, e.nextAttemptAt = null, e.updatedAt = :now, e.version = e.version + 1 " +
           "where e.id = :id and e.processingStatus = com.cognisync.model.ProcessingStatus.DEAD_LETTER")
    int requeueDeadLetter(@Param("id") UUID id, @Param("now") Instant now);

    List<SyncEvent> findByProcessingStatusOrderByReceivedAtAsc(ProcessingStatus status, Pageable page);
}
