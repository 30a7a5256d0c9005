package com.deskclaw.automation.node;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of reading one property or capability from a live automation node:
 * either a value, or the reason the value could not be read.
 *
 * @param <T> property type
 */
public sealed interface Readout<T> permits Readout.Ok, Readout.Unavailable {

    boolean isAvailable();

    T orElse(T fallback);

    Optional<T> toOptional();

    <R> Readout<R> map(Function<? super T, ? extends R> mapper);

    <R> Readout<R> flatMap(Function<? super T, Readout<R>> mapper);

    record Ok<T>(T value) implements Readout<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isAvailable() {
            return true;
        }

        @Override
        public T orElse(T fallback) {
            return value;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.of(value);
        }

        @Override
        public <R> Readout<R> map(Function<? super T, ? extends R> mapper) {
            return Readout.of(mapper.apply(value));
        }

        @Override
        public <R> Readout<R> flatMap(Function<? super T, Readout<R>> mapper) {
            Readout<R> next = mapper.apply(value);
            return next != null ? next : Readout.unavailable("mapper returned null");
        }
    }

    record Unavailable<T>(String reason) implements Readout<T> {

        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public T orElse(T fallback) {
            return fallback;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public <R> Readout<R> map(Function<? super T, ? extends R> mapper) {
            return new Unavailable<>(reason);
        }

        @Override
        public <R> Readout<R> flatMap(Function<? super T, Readout<R>> mapper) {
            return new Unavailable<>(reason);
        }
    }

    /**
     * Wrap a value; null becomes {@link Unavailable}.
     */
    static <T> Readout<T> of(T value) {
        return value != null ? new Ok<>(value) : new Unavailable<>("no value");
    }

    static <T> Readout<T> unavailable(String reason) {
        return new Unavailable<>(reason);
    }

    /**
     * Run a driver query, turning any exception it throws into {@link Unavailable}.
     * Intended for adapters that sit directly on a native automation API.
     */
    static <T> Readout<T> attempt(Callable<? extends T> query) {
        try {
            return of(query.call());
        } catch (Exception e) {
            return new Unavailable<>(describe(e));
        }
    }

    /**
     * Call an accessor that is supposed to return a readout but may still throw
     * or return null when the underlying element has gone away.
     */
    static <T> Readout<T> guard(Supplier<Readout<T>> accessor) {
        try {
            Readout<T> result = accessor.get();
            return result != null ? result : new Unavailable<>("accessor returned null");
        } catch (RuntimeException e) {
            return new Unavailable<>(describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank()
                ? e.getClass().getSimpleName() + ": " + message
                : e.getClass().getSimpleName();
    }
}
