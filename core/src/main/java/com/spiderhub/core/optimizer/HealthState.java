package com.spiderhub.core.optimizer;

public enum HealthState {
    HEALTHY,
    DEGRADED
}
