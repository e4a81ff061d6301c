package com.spiderhub.common.model;

public enum EnvelopeStatus {
    OK,
    FAILED,
    TIMED_OUT,
    CANCELLED
}
