package com.cognisync.repository;

import com.cognisync.model.SyncConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Read-only lookup of webhook registrations.
 *
 * findByIdAndEnabledTrue(id)
 * → SELECT * FROM sync_configurations WHERE id = ? AND enabled = true
 */
public interface SyncConfigurationRepository extends JpaRepository<SyncConfiguration, UUID> {

    Optional<SyncConfiguration> findByIdAndEnabledTrue(UUID id);
}
