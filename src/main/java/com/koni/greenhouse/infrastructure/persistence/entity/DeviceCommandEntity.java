package com.koni.greenhouse.infrastructure.persistence.entity;

import com.koni.greenhouse.domain.model.CommandStatus;
import com.koni.greenhouse.domain.model.CommandType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for persisting device commands and their delivery status.
 */
@Entity
@Table(
    name = "device_commands",
    indexes = {
        @Index(name = "idx_device_commands_device_id", columnList = "device_id"),
        @Index(name = "idx_device_commands_status", columnList = "status"),
        @Index(name = "idx_device_commands_device_id_created_at", columnList = "device_id, created_at DESC")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceCommandEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "device_id", nullable = false, length = 255)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "command", nullable = false, length = 8)
    private CommandType command;

    @Convert(converter = CommandStatusConverter.class)
    @Column(name = "status", nullable = false, length = 16)
    private CommandStatus status;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = CommandStatus.QUEUED;
        }
    }
}
