package com.phillippitts.apiguard.service.alert;

/**
 * Spring application event wrapping an {@link Alert} raised by the governance core.
 */
public record AlertRaisedEvent(Alert alert) {
}
