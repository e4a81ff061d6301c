package com.spiderhub.api;

import java.util.Collection;
import java.util.Optional;

public interface ModuleHandle {

    String getRef();

    Collection<SpiderProvider> getProviders();

    default Optional<SpiderProvider> find(String name) {
        return getProviders().stream()
                .filter(p -> p.getName().equalsIgnoreCase(name))
                .findFirst();
    }
}
