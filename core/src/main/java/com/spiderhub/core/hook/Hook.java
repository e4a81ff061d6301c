package com.spiderhub.core.hook;

/**
 * Interceptor for one phase of a site call. Lower priority runs first.
 * A hook receives a private copy of the value and may mutate and return it.
 */
public interface Hook<T extends HookValue<T>> {

    String getName();

    int getPriority();

    default boolean isEnabled() {
        return true;
    }

    default boolean matches(HookContext context) {
        return true;
    }

    HookResult<T> execute(T value, HookContext context) throws Exception;
}
