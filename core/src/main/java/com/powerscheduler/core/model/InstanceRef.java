package com.powerscheduler.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * Instance found by discovery.
 * <p>
 * Name is unique within a zone.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class InstanceRef {
    String name;
    String zone;
    InstanceState state;
}
