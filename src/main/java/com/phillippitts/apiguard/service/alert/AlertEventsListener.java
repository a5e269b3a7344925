package com.phillippitts.apiguard.service.alert;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Console delivery channel for governance alerts.
 */
@Component
class AlertEventsListener {

    private static final Logger LOG = LogManager.getLogger(AlertEventsListener.class);

    @EventListener
    void onAlert(AlertRaisedEvent event) {
        Alert alert = event.alert();
        LOG.log(toLogLevel(alert.level()), "[{}] {} metadata={}",
                alert.source(), alert.message(), alert.metadata());
    }

    // Package-private for tests
    static Level toLogLevel(AlertLevel level) {
        return switch (level) {
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR -> Level.ERROR;
            case CRITICAL -> Level.FATAL;
        };
    }
}
