package com.curvesim.simulator.util;

import java.util.Objects;
import java.util.function.Function;

/**
 * A simple Result type for solves that either succeed or degrade to a fallback value.
 * A degraded result still carries a usable value, so callers must branch on the variant
 * rather than reading the value blindly.
 */
public sealed interface Result<T> {

    T value();

    record Ok<T>(T value) implements Result<T> {}

    record Degraded<T>(T value, String code, String message) implements Result<T> {
        public String code() { return code; }
        public String message() { return message; }
    }

    static <T> Result<T> ok(T value) {
        return new Ok<>(Objects.requireNonNull(value, "value"));
    }

    static <T> Result<T> degraded(T fallback, String code, String message) {
        return new Degraded<>(Objects.requireNonNull(fallback, "fallback"), code, message);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default boolean isDegraded() {
        return this instanceof Degraded;
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Degraded<T> degraded) {
            return new Degraded<>(mapper.apply(degraded.value()), degraded.code(), degraded.message());
        }
        return new Ok<>(mapper.apply(value()));
    }
}
