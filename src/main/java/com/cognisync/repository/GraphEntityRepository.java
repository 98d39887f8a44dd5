package com.cognisync.repository;

import com.cognisync.model.GraphEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface GraphEntityRepository extends JpaRepository<GraphEntity, UUID> {
}
