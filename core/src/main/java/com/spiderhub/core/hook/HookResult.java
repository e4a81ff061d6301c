package com.spiderhub.core.hook;

/**
 * Outcome of a single hook execution.
 */
public sealed interface HookResult<T> permits HookResult.Success, HookResult.Skip, HookResult.Failure, HookResult.Stop {

    // Continue the chain with value.
    record Success<T>(T value) implements HookResult<T> {
    }

    // Hook had nothing to do.
    record Skip<T>(String reason) implements HookResult<T> {
    }

    // Logged; the chain continues with the value the hook received.
    record Failure<T>(String error) implements HookResult<T> {
    }

    // Short-circuit: value is final, remaining hooks do not run.
    record Stop<T>(T value) implements HookResult<T> {
    }

    static <T> HookResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> HookResult<T> skip(String reason) {
        return new Skip<>(reason);
    }

    static <T> HookResult<T> failure(String error) {
        return new Failure<>(error);
    }

    static <T> HookResult<T> stop(T value) {
        return new Stop<>(value);
    }
}
