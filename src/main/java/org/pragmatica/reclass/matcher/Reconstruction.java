package org.pragmatica.reclass.matcher;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of rebuilding a token occurrence: the instance, or absence when the occurrence did not take part
 * in the match.
 */
public sealed interface Reconstruction<T> {

    boolean isPresent();

    /**
     * The instance, or {@code null} when absent.
     */
    T orNull();

    default Optional<T> toOptional() {
        return Optional.ofNullable(orNull());
    }

    <R> Reconstruction<R> map(Function<? super T, ? extends R> mapper);

    static <T> Reconstruction<T> present(T value) {
        return new Present<>(value);
    }

    static <T> Reconstruction<T> absent() {
        return new Absent<>();
    }

    record Present<T>(T value) implements Reconstruction<T> {
        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public T orNull() {
            return value;
        }

        @Override
        public <R> Reconstruction<R> map(Function<? super T, ? extends R> mapper) {
            return new Present<>(mapper.apply(value));
        }
    }

    record Absent<T>() implements Reconstruction<T> {
        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public T orNull() {
            return null;
        }

        @Override
        public <R> Reconstruction<R> map(Function<? super T, ? extends R> mapper) {
            return new Absent<>();
        }
    }
}
