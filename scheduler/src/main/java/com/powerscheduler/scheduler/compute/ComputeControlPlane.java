package com.powerscheduler.scheduler.compute;

import java.util.List;

/**
 * Compute control plane used by discovery and action dispatch (Dependency Inversion Principle).
 * <p>
 * Calls are blocking. Every method may fail with {@link ControlPlaneException}.
 * Action methods return the id of the operation the control plane started; they do
 * not wait for it to finish.
 * </p>
 */
public interface ComputeControlPlane extends AutoCloseable {
    List<ComputeInstance> list(String project, String zone);

    String stop(String project, String zone, String instance);

    String start(String project, String zone, String instance);

    String suspend(String project, String zone, String instance);

    String resume(String project, String zone, String instance);

    @Override
    void close();
}
