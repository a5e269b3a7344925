package com.phillippitts.apiguard.service.breaker;

/**
 * Callback for breaker state changes. Exceptions thrown by listeners are logged and ignored.
 */
@FunctionalInterface
public interface CircuitStateListener {

    void onStateChange(CircuitStateTransition transition);
}
