package com.koni.greenhouse.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for stored sensor readings, newest first.
 * Every filter is optional; dates are ISO-8601 text as received from the client.
 */
@Getter
@AllArgsConstructor
public class GetSensorReadingsQuery {

    private final String deviceId;
    private final String startDate;
    private final String endDate;
    private final Integer limit;
}
