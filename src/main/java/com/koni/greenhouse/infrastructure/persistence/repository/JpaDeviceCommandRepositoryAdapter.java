package com.koni.greenhouse.infrastructure.persistence.repository;

import com.koni.greenhouse.domain.model.DeviceCommand;
import com.koni.greenhouse.domain.repository.DeviceCommandRepository;
import com.koni.greenhouse.infrastructure.persistence.entity.DeviceCommandEntity;
import io.micrometer.tracing.annotation.ContinueSpan;
import io.micrometer.tracing.annotation.SpanTag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JPA adapter for DeviceCommandRepository.
 * A command without an identifier is inserted; a command with one has its status
 * and error message written back.
 */
@Component
@RequiredArgsConstructor
public class JpaDeviceCommandRepositoryAdapter implements DeviceCommandRepository {

    private final DeviceCommandJpaRepository jpaRepository;

    @Override
    @ContinueSpan(log = "device-command-save")
    public DeviceCommand save(DeviceCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("DeviceCommand cannot be null");
        }

        return StorageFailures.translate("device command save",
                () -> toDomain(jpaRepository.saveAndFlush(toEntity(command))));
    }

    @Override
    @ContinueSpan(log = "device-command-find")
    public Optional<DeviceCommand> findById(UUID id) {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }

        return StorageFailures.translate("device command lookup",
                () -> jpaRepository.findById(id).map(this::toDomain));
    }

    @Override
    @ContinueSpan(log = "device-command-history")
    public List<DeviceCommand> findRecentByDeviceId(@SpanTag("deviceId") String deviceId, int limit) {
        return StorageFailures.translate("device command history",
                () -> jpaRepository.findByDeviceIdOrderByCreatedAtDesc(deviceId, PageRequest.of(0, limit)).stream()
                        .map(this::toDomain)
                        .collect(Collectors.toList()));
    }

    private DeviceCommand toDomain(DeviceCommandEntity entity) {
        return new DeviceCommand(
            entity.getId(),
            entity.getDeviceId(),
            entity.getCommand(),
            entity.getStatus(),
            entity.getErrorMessage(),
            entity.getCreatedAt()
        );
    }

    private DeviceCommandEntity toEntity(DeviceCommand command) {
        return new DeviceCommandEntity(
            command.getId(),
            command.getDeviceId(),
            command.getCommand(),
            command.getStatus(),
            command.getErrorMessage(),
            command.getCreatedAt()
        );
    }
}
