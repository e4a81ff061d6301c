package com.spiderhub.api;

/**
 * Uniform call surface over any parser backend. {@code function} is one of the
 * {@link Spider} method names; the result is that method's JSON text.
 */
public interface Invoker {

    String call(String function, Object... args) throws Exception;

    // Release whatever the backend holds (script context, spider resources).
    default void destroy() {
    }
}
