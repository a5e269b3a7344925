package com.phillippitts.apiguard.service.alert;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Alert sink that republishes alerts on the Spring event bus as {@link AlertRaisedEvent}.
 *
 * <p>Listener failures are logged and contained here so that a broken delivery channel can never
 * fail the governed call that raised the alert.
 */
public class ApplicationEventAlertSink implements AlertSink {

    private static final Logger LOG = LogManager.getLogger(ApplicationEventAlertSink.class);

    private final ApplicationEventPublisher publisher;

    public ApplicationEventAlertSink(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void deliver(Alert alert) {
        try {
            publisher.publishEvent(new AlertRaisedEvent(alert));
        } catch (RuntimeException ex) {
            LOG.error("Alert delivery failed: source={}, message={}", alert.source(), alert.message(), ex);
        }
    }
}
