package com.koni.greenhouse.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for the most recent commands sent to one device.
 */
@Getter
@AllArgsConstructor
public class GetDeviceCommandsQuery {

    private final String deviceId;
    private final Integer limit;
}
