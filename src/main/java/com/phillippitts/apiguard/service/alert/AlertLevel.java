package com.phillippitts.apiguard.service.alert;

/** Alert severity levels. */
public enum AlertLevel {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
