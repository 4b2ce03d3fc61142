package com.powerscheduler.scheduler.compute;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.compute.v1.Instance;
import com.google.cloud.compute.v1.InstancesClient;
import com.google.cloud.compute.v1.ListInstancesRequest;
import com.google.cloud.compute.v1.Operation;
import com.google.cloud.compute.v1.ResumeInstanceRequest;
import com.google.cloud.compute.v1.StartInstanceRequest;
import com.google.cloud.compute.v1.StopInstanceRequest;
import com.google.cloud.compute.v1.SuspendInstanceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link ComputeControlPlane} backed by the Google Compute Engine instances API.
 * <p>
 * Uses application default credentials. Actions go through the unary callables so the
 * call returns as soon as the operation is accepted; the operation name is returned.
 * </p>
 */
public class GceComputeControlPlane implements ComputeControlPlane {
    private static final Logger log = LoggerFactory.getLogger(GceComputeControlPlane.class);

    private final InstancesClient client;

    public GceComputeControlPlane() {
        try {
            this.client = InstancesClient.create();
        } catch (IOException e) {
            throw new ControlPlaneException("Failed to create Compute Engine client", e);
        }
        log.info("Compute Engine instances client initialized");
    }

    @Override
    public List<ComputeInstance> list(String project, String zone) {
        ListInstancesRequest request = ListInstancesRequest.newBuilder()
            .setProject(project)
            .setZone(zone)
            .build();

        return call("list instances in zone " + zone, () -> {
            List<ComputeInstance> instances = new ArrayList<>();
            for (Instance instance : client.list(request).iterateAll()) {
                instances.add(new ComputeInstance(instance.getName(), instance.getLabelsMap(), instance.getStatus()));
            }
            return instances;
        });
    }

    @Override
    public String stop(String project, String zone, String instance) {
        StopInstanceRequest request = StopInstanceRequest.newBuilder()
            .setProject(project)
            .setZone(zone)
            .setInstance(instance)
            .build();
        return call("stop " + instance, () -> operationName(client.stopCallable().call(request)));
    }

    @Override
    public String start(String project, String zone, String instance) {
        StartInstanceRequest request = StartInstanceRequest.newBuilder()
            .setProject(project)
            .setZone(zone)
            .setInstance(instance)
            .build();
        return call("start " + instance, () -> operationName(client.startCallable().call(request)));
    }

    @Override
    public String suspend(String project, String zone, String instance) {
        SuspendInstanceRequest request = SuspendInstanceRequest.newBuilder()
            .setProject(project)
            .setZone(zone)
            .setInstance(instance)
            .build();
        return call("suspend " + instance, () -> operationName(client.suspendCallable().call(request)));
    }

    @Override
    public String resume(String project, String zone, String instance) {
        ResumeInstanceRequest request = ResumeInstanceRequest.newBuilder()
            .setProject(project)
            .setZone(zone)
            .setInstance(instance)
            .build();
        return call("resume " + instance, () -> operationName(client.resumeCallable().call(request)));
    }

    private static String operationName(Operation operation) {
        return operation.getName();
    }

    private static <T> T call(String description, Supplier<T> action) {
        try {
            return action.get();
        } catch (ApiException e) {
            throw new ControlPlaneException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
        log.info("Compute Engine instances client closed");
    }
}
