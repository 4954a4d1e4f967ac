package com.company.consolidation.exception;

public class AlertNotFoundException extends RuntimeException {
    public AlertNotFoundException(String alertId) {
        super("Alert not found: " + alertId);
    }
}
