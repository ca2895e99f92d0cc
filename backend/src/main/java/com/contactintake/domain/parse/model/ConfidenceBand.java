package com.contactintake.domain.parse.model;

/**
 * How much review attention a parsed contact needs.
 */
public enum ConfidenceBand {
    HIGH,
    MEDIUM,
    LOW
}
