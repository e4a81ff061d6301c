package com.spiderhub.core.cache;

public enum CacheTier {
    MEMORY,
    DISK
}
