package com.spiderhub.core.hook;

/**
 * Base for hooks with a fixed name and priority and a runtime on/off switch.
 */
public abstract class AbstractHook<T extends HookValue<T>> implements Hook<T> {
    private final String name;
    private final int priority;
    private volatile boolean enabled = true;

    protected AbstractHook(String name, int priority) {
        this.name = name;
        this.priority = priority;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String toString() {
        return name + "(" + priority + ")";
    }
}
