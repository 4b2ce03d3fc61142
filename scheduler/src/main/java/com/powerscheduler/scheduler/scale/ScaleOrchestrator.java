package com.powerscheduler.scheduler.scale;

import com.powerscheduler.core.metrics.MetricsNames;
import com.powerscheduler.core.metrics.MetricsTags;
import com.powerscheduler.core.model.ActionOutcome;
import com.powerscheduler.core.model.ControlOperation;
import com.powerscheduler.core.model.InstanceRef;
import com.powerscheduler.core.model.LabelSelector;
import com.powerscheduler.core.model.ScaleConfig;
import com.powerscheduler.core.model.ScaleIntent;
import com.powerscheduler.core.model.ScaleRequest;
import com.powerscheduler.core.model.ScaleResult;
import com.powerscheduler.core.policy.ActionPolicy;
import com.powerscheduler.core.policy.Decision;
import com.powerscheduler.scheduler.compute.ComputeControlPlane;
import com.powerscheduler.scheduler.config.SchedulerConfig;
import com.powerscheduler.scheduler.discovery.IInstanceDirectory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;

/**
 * Drives one scale request from resolution to aggregated result.
 * <p>
 * <b>Flow:</b>
 * <pre>
 *   reject invalid request (InvalidRequestException)
 *   resolve project (request, else default; missing -> ConfigurationException)
 *   resolve selector and zones (request, else defaults)
 *   discover -> for each instance in order: decide -> skip | dispatch | error
 *   aggregate outcomes
 * </pre>
 * </p>
 * <p>
 * Instances are handled one after another; a failing instance is recorded as an
 * ERROR outcome and the loop continues.
 * </p>
 */
public class ScaleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScaleOrchestrator.class);

    static final String PROJECT_NOT_CONFIGURED = "Project ID not configured";

    private final SchedulerConfig config;
    private final IInstanceDirectory directory;
    private final ComputeControlPlane controlPlane;
    private final MeterRegistry meterRegistry;

    public ScaleOrchestrator(SchedulerConfig config,
                             IInstanceDirectory directory,
                             ComputeControlPlane controlPlane,
                             MeterRegistry meterRegistry) {
        this.config = config;
        this.directory = directory;
        this.controlPlane = controlPlane;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs a request.
     *
     * @return Mono of the aggregated result; errors with {@link InvalidRequestException}
     * for a request with a bad field and with {@link ConfigurationException} when no
     * project id can be resolved (no discovery is attempted in either case)
     */
    public Mono<ScaleResult> run(ScaleRequest request) {
        if (request.isInvalid()) {
            return Mono.error(new InvalidRequestException(request.getInvalidReason()));
        }

        String project = firstNonNull(request.getProjectId(), config.getDefaultProjectId());
        if (project == null) {
            return Mono.error(new ConfigurationException(PROJECT_NOT_CONFIGURED));
        }

        LabelSelector selector = request.getSelector() != null && !request.getSelector().isEmpty()
            ? request.getSelector()
            : config.getDefaultSelector();
        List<String> zones = request.getZones() != null && !request.getZones().isEmpty()
            ? request.getZones()
            : config.getDefaultZones();
        String action = request.getAction();

        log.info("Processing action {} in project {}: selector={}, zones={}",
            action, project, selector == null ? List.of() : selector.getLabels(), zones);

        return directory.discover(project, zones, selector)
            .flatMap(instances -> {
                if (instances.isEmpty()) {
                    log.warn("No instances found matching the specified labels");
                    countRequest("no_instances");
                    return Mono.just(ScaleResult.noInstancesFound());
                }

                return Flux.fromIterable(instances)
                    .concatMap(instance -> apply(project, action, instance))
                    .collectList()
                    .map(ScaleResult::of)
                    .doOnNext(result -> {
                        countRequest("completed");
                        log.info("Action {} finished: processed={}, skipped={}",
                            action, result.getProcessedCount(), result.skippedCount());
                    });
            });
    }

    /**
     * Same as {@link #run(ScaleRequest)} but reports an invalid request or a
     * configuration error as a failed result instead of an error signal.
     */
    public Mono<ScaleResult> handle(ScaleRequest request) {
        return run(request)
            .onErrorResume(InvalidRequestException.class, err -> {
                log.error("Rejected {} request: {}", request.getAction(), err.getMessage());
                countRequest("invalid_request");
                return Mono.just(ScaleResult.failed(err.getMessage()));
            })
            .onErrorResume(ConfigurationException.class, err -> {
                log.error(err.getMessage());
                countRequest("config_error");
                return Mono.just(ScaleResult.failed(err.getMessage()));
            });
    }

    private Mono<ActionOutcome> apply(String project, String action, InstanceRef instance) {
        ScaleIntent intent = ScaleIntent.fromAction(action).orElse(null);
        ScaleConfig scaleConfig = config.getScaleConfig();
        Decision decision = ActionPolicy.decide(action, instance.getState(), scaleConfig);

        ActionOutcome.ActionOutcomeBuilder outcome = ActionOutcome.builder()
            .instance(instance.getName())
            .zone(instance.getZone())
            .action(action)
            .intent(intent);

        return switch (decision.getKind()) {
            case SKIP -> {
                log.info("Instance {} {}, skipping", instance.getName(), decision.getReason());
                yield Mono.just(track(outcome
                    .status(ActionOutcome.Status.SKIPPED)
                    .detail(decision.getReason())
                    .build(), null));
            }
            case UNKNOWN -> {
                log.error("Instance {}: {}", instance.getName(), decision.getReason());
                yield Mono.just(track(outcome
                    .status(ActionOutcome.Status.ERROR)
                    .detail(decision.getReason())
                    .build(), null));
            }
            case PERFORM -> perform(project, instance, decision.getOperation(), outcome);
        };
    }

    private Mono<ActionOutcome> perform(String project,
                                        InstanceRef instance,
                                        ControlOperation operation,
                                        ActionOutcome.ActionOutcomeBuilder outcome) {
        return Mono.fromCallable(() -> Objects.requireNonNullElse(dispatch(operation, project, instance), ""))
            .subscribeOn(Schedulers.boundedElastic())
            .map(operationId -> {
                log.info("{} instance {} in zone {} (operation {})",
                    verb(operation), instance.getName(), instance.getZone(), operationId);
                return outcome.status(ActionOutcome.Status.SUCCESS).detail(operationId).build();
            })
            .onErrorResume(err -> {
                log.error("Error {} instance {}: {}",
                    verb(operation).toLowerCase(), instance.getName(), err.getMessage());
                return Mono.just(outcome.status(ActionOutcome.Status.ERROR).detail(err.getMessage()).build());
            })
            .map(result -> track(result, operation));
    }

    private String dispatch(ControlOperation operation, String project, InstanceRef instance) {
        String zone = instance.getZone();
        String name = instance.getName();
        return switch (operation) {
            case STOP -> controlPlane.stop(project, zone, name);
            case SUSPEND -> controlPlane.suspend(project, zone, name);
            case START -> controlPlane.start(project, zone, name);
            case RESUME -> controlPlane.resume(project, zone, name);
        };
    }

    private ActionOutcome track(ActionOutcome outcome, ControlOperation operation) {
        Counter.builder(MetricsNames.SCHEDULER_ACTIONS_TOTAL)
            .tag(MetricsTags.INTENT, outcome.getIntent() == null ? "unknown" : outcome.getIntent().action())
            .tag(MetricsTags.OPERATION, operation == null ? "none" : operation.tag())
            .tag(MetricsTags.STATUS, outcome.getStatus().name().toLowerCase())
            .register(meterRegistry)
            .increment();
        return outcome;
    }

    private void countRequest(String outcome) {
        Counter.builder(MetricsNames.SCHEDULER_REQUESTS_TOTAL)
            .tag(MetricsTags.OUTCOME, outcome)
            .register(meterRegistry)
            .increment();
    }

    private static String verb(ControlOperation operation) {
        return switch (operation) {
            case STOP -> "Stopping";
            case SUSPEND -> "Suspending";
            case START -> "Starting";
            case RESUME -> "Resuming";
        };
    }

    private static String firstNonNull(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
