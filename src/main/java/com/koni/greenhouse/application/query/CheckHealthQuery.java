package com.koni.greenhouse.application.query;

/**
 * Query for the composite health of the database and the MQTT broker.
 */
public class CheckHealthQuery {
    // No parameters - probes every dependency
}
