package com.koni.greenhouse.domain.model;

/**
 * Commands a greenhouse actuator understands.
 */
public enum CommandType {
    ON,
    OFF
}
