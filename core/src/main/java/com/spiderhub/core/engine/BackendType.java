package com.spiderhub.core.engine;

public enum BackendType {
    SCRIPT,
    MODULE,
    RULE
}
