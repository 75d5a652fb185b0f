package com.koni.greenhouse.application.query;

import com.koni.greenhouse.domain.exception.ValidationException;
import com.koni.greenhouse.domain.repository.DeviceCommandRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for a device's command history, newest first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetDeviceCommandsQueryHandler {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final DeviceCommandRepository repository;

    public List<DeviceCommandResponse> handle(GetDeviceCommandsQuery query) {
        if (query.getDeviceId() == null || query.getDeviceId().isBlank()) {
            throw new ValidationException("deviceId", "deviceId is required");
        }
        int limit = query.getLimit() == null ? DEFAULT_LIMIT : query.getLimit();
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "limit must be between 1 and " + MAX_LIMIT);
        }

        List<DeviceCommandResponse> commands = repository.findRecentByDeviceId(query.getDeviceId(), limit).stream()
                .map(DeviceCommandResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} commands for device {}", commands.size(), query.getDeviceId());
        return commands;
    }
}
