package com.cognisync.repository;

import com.cognisync.model.EntityMapping;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

/**
 * Database access for the idempotency ledger.
 *
 * insertIfAbsent returns 1 when this caller created the mapping and 0 when
 * a row with the same (tenant_id, source, external_id) already exists.
 * A concurrent inserter blocks on the unique index until the winner
 * commits, then sees 0.
 */
public interface EntityMappingRepository extends JpaRepository<EntityMapping, UUID> {

    Optional<EntityMapping> findByTenantIdAndSourceAndExternalId(
            String tenantId, String source, String externalId);

    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO entity_mappings " +
                   "(id, tenant_id, source, external_id, external_type, kg_entity_id, created_at) " +
                   "VALUES (:id, :tenantId, :source, :externalId, :externalType, :kgEntityId, now()) " +
                   "ON CONFLICT (tenant_id, source, external_id) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("tenantId") String tenantId,
                       @Param("source") String source,
                       @Param("externalId") String externalId,
                       @Param("externalType") String externalType,
                       @Param("kgEntityId") UUID kgEntityId);
}
