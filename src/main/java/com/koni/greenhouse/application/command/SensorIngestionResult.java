package com.koni.greenhouse.application.command;

import com.koni.greenhouse.domain.model.SensorReading;

/**
 * Outcome of recording a sensor reading: the stored reading and whether this
 * submission created it.
 */
public final class SensorIngestionResult {

    private final boolean isNew;
    private final SensorReading reading;

    private SensorIngestionResult(boolean isNew, SensorReading reading) {
        this.isNew = isNew;
        this.reading = reading;
    }

    public static SensorIngestionResult created(SensorReading reading) {
        return new SensorIngestionResult(true, reading);
    }

    public static SensorIngestionResult existing(SensorReading reading) {
        return new SensorIngestionResult(false, reading);
    }

    public boolean isNew() {
        return isNew;
    }

    public SensorReading getReading() {
        return reading;
    }
}
