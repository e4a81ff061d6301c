package com.spiderhub.core.cache;

import com.spiderhub.common.model.ContentEnvelope;

public sealed interface CacheLookup permits CacheLookup.Hit, CacheLookup.Miss {

    record Hit(ContentEnvelope value, CacheTier tier) implements CacheLookup {
    }

    record Miss() implements CacheLookup {
    }

    Miss MISS = new Miss();

    default boolean isHit() {
        return this instanceof Hit;
    }
}
