package com.spiderhub.common.model;

/**
 * The five capabilities every parser exposes, with the backend function that serves each.
 */
public enum OperationType {
    HOME("homeContent"),
    CATEGORY("categoryContent"),
    DETAIL("detailContent"),
    SEARCH("searchContent"),
    PLAYER("playerContent");

    private final String function;

    OperationType(String function) {
        this.function = function;
    }

    public String function() {
        return function;
    }

    public String key() {
        return name().toLowerCase();
    }
}
