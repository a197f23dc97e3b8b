package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.text.Cursor;
import org.pragmatica.combinator.text.Text;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Atomic recognizers - each one inspects at most a single element.
 *
 * <p>Element recognizers share one failure policy: an exhausted text yields
 * {@link ParseError.EndOfText}, a rejected element yields {@link ParseError.NoMatch}.
 */
public final class Primitives {
    private Primitives() {}

    /**
     * Next element equal to {@code expected}.
     */
    public static <E> Recognizer<E, E> literal(E expected) {
        return new Literal<>(expected);
    }

    /**
     * Next element accepted by {@code predicate}.
     */
    public static <E> Recognizer<E, E> satisfy(Predicate<? super E> predicate) {
        return new Satisfy<>(predicate, "predicate");
    }

    /**
     * Next element accepted by {@code predicate}; {@code description} is used in traces.
     */
    public static <E> Recognizer<E, E> satisfy(Predicate<? super E> predicate, String description) {
        return new Satisfy<>(predicate, description);
    }

    /**
     * Next element within {@code [min, max]}, both inclusive.
     *
     * @throws IllegalArgumentException if {@code min > max}
     */
    public static <E extends Comparable<? super E>> Recognizer<E, E> range(E min, E max) {
        return new Range<>(min, max);
    }

    /**
     * Any single element.
     */
    public static <E> Recognizer<E, E> any() {
        return new Any<>();
    }

    /**
     * Succeeds only at the end of the text.
     */
    public static <E> Recognizer<E, Unit> end() {
        return new End<>();
    }

    /**
     * Always succeeds without consuming input.
     */
    public static <E> Recognizer<E, Unit> epsilon() {
        return new Pure<>(Unit.UNIT);
    }

    /**
     * Always succeeds with {@code value} without consuming input.
     */
    public static <E, T> Recognizer<E, T> pure(T value) {
        return new Pure<>(value);
    }

    static <E> Match<E> accept(Text<E> text, Cursor cursor, Predicate<? super E> condition) {
        var read = text.read(cursor);

        if (read instanceof Match.Success<E> success && !condition.test(success.value())) {
            return Match.failure(ParseError.NO_MATCH);
        }
        return read;
    }

    record Literal<E>(E expected) implements Recognizer<E, E> {
        Literal {
            Objects.requireNonNull(expected, "expected");
        }

        @Override
        public Match<E> recognize(Text<E> text, Cursor cursor) {
            return accept(text, cursor, expected::equals);
        }
    }

    record Satisfy<E>(Predicate<? super E> predicate, String description) implements Recognizer<E, E> {
        Satisfy {
            Objects.requireNonNull(predicate, "predicate");
            Objects.requireNonNull(description, "description");
        }

        @Override
        public Match<E> recognize(Text<E> text, Cursor cursor) {
            return accept(text, cursor, predicate);
        }

        @Override
        public String toString() {
            return "Satisfy[" + description + "]";
        }
    }

    record Range<E extends Comparable<? super E>>(E min, E max) implements Recognizer<E, E> {
        Range {
            Objects.requireNonNull(min, "min");
            Objects.requireNonNull(max, "max");

            if (min.compareTo(max) > 0) {
                throw new IllegalArgumentException("Empty range: " + min + " > " + max);
            }
        }

        @Override
        public Match<E> recognize(Text<E> text, Cursor cursor) {
            return accept(text, cursor, element -> min.compareTo(element) <= 0 && element.compareTo(max) <= 0);
        }
    }

    record Any<E>() implements Recognizer<E, E> {
        @Override
        public Match<E> recognize(Text<E> text, Cursor cursor) {
            return text.read(cursor);
        }
    }

    /**
     * The only recognizer that treats exhaustion as success. The cursor is returned unchanged since
     * nothing follows it.
     */
    record End<E>() implements Recognizer<E, Unit> {
        @Override
        public Match<Unit> recognize(Text<E> text, Cursor cursor) {
            if (text.read(cursor).isSuccess()) {
                return Match.failure(ParseError.NO_MATCH);
            }
            return Match.success(Unit.UNIT, cursor);
        }
    }

    record Pure<E, T>(T value) implements Recognizer<E, T> {
        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            return Match.success(value, cursor);
        }
    }
}
