package dev.shortcuts.analysis;

/**
 * Risk or impact level of a finding.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
