package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.text.Cursor;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single recognition attempt - either a value with the cursor after it, or a failure.
 */
public sealed interface Match<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Transform the value of a successful match, leaving the cursor as is.
     */
    <R> Match<R> map(Function<? super T, ? extends R> mapper);

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super Success<T>, ? extends R> onSuccess);

    /**
     * Value of a successful match.
     *
     * @throws ParseException if this is a failure
     */
    T unwrap();

    static <T> Match<T> success(T value, Cursor next) {
        return new Success<>(value, next);
    }

    static <T> Match<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    /**
     * Successful match. The value may be {@code null} if a transformation produced it.
     */
    record Success<T>(T value, Cursor next) implements Match<T> {

        public Success {
            Objects.requireNonNull(next, "next");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> Match<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), next);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super Success<T>, ? extends R> onSuccess) {
            return onSuccess.apply(this);
        }

        @Override
        public T unwrap() {
            return value;
        }
    }

    /**
     * Failed match.
     */
    record Failure<T>(ParseError error) implements Match<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> Match<R> map(Function<? super T, ? extends R> mapper) {
            return cast();
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super Success<T>, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }

        @Override
        public T unwrap() {
            throw new ParseException(error);
        }

        /**
         * Same failure, retyped. Failures carry no value, so this is always safe.
         */
        @SuppressWarnings("unchecked")
        public <R> Failure<R> cast() {
            return (Failure<R>) this;
        }
    }
}
