package com.koni.greenhouse.infrastructure.persistence.entity;

import com.koni.greenhouse.domain.model.CommandStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link CommandStatus} as its lower-case value ("queued", "published", "error").
 */
@Converter
public class CommandStatusConverter implements AttributeConverter<CommandStatus, String> {

    @Override
    public String convertToDatabaseColumn(CommandStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public CommandStatus convertToEntityAttribute(String value) {
        return value == null ? null : CommandStatus.fromValue(value);
    }
}
