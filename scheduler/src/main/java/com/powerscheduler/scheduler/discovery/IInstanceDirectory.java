package com.powerscheduler.scheduler.discovery;

import com.powerscheduler.core.model.InstanceRef;
import com.powerscheduler.core.model.LabelSelector;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Finds instances matching a selector across zones.
 */
public interface IInstanceDirectory {
    /**
     * @return matching instances, in zone order and then listing order; zones that
     * fail to list contribute nothing. Never completes with an error.
     */
    Mono<List<InstanceRef>> discover(String project, List<String> zones, LabelSelector selector);
}
