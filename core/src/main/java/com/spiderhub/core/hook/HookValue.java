package com.spiderhub.core.hook;

/**
 * A value that travels through a hook chain. Every hook works on its own deep copy.
 */
public interface HookValue<T extends HookValue<T>> {

    T copy();
}
