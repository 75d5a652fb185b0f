package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.infrastructure.persistence.entity.DeviceCommandEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * JPA repository for DeviceCommandEntity persistence operations.
 */
@Repository
public interface DeviceCommandJpaRepository extends JpaRepository<DeviceCommandEntity, UUID> {

    List<DeviceCommandEntity> findByDeviceIdOrderByCreatedAtDesc(String deviceId, Pageable pageable);
}
