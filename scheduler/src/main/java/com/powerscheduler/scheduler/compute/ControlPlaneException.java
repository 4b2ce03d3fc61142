package com.powerscheduler.scheduler.compute;

/**
 * Failure reported by the compute control plane (unreachable zone, permission denied, ...).
 */
public class ControlPlaneException extends RuntimeException {

    public ControlPlaneException(String message) {
        super(message);
    }

    public ControlPlaneException(String message, Throwable cause) {
        super(message, cause);
    }
}
