package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.text.Cursor;
import org.pragmatica.combinator.text.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Structural combinators - the backtracking engine.
 *
 * <p>Backtracking needs no bookkeeping: cursors are values, so a failed attempt leaves nothing to
 * undo and a sibling branch simply starts again from the cursor it was given.
 */
public final class Combinators {
    private Combinators() {}

    /**
     * Apply all parts in order, threading the cursor. Produces the list of part values; fails with the
     * first part failure.
     */
    @SafeVarargs
    public static <E, T> Recognizer<E, List<T>> sequence(Recognizer<E, ? extends T>... parts) {
        return sequence(List.of(parts));
    }

    public static <E, T> Recognizer<E, List<T>> sequence(List<? extends Recognizer<E, ? extends T>> parts) {
        return new Sequence<>(List.copyOf(parts));
    }

    /**
     * Ordered choice. Every branch starts at the same cursor; the first success wins.
     */
    @SafeVarargs
    public static <E, T> Recognizer<E, T> alternative(Recognizer<E, ? extends T>... branches) {
        return alternative(List.of(branches));
    }

    public static <E, T> Recognizer<E, T> alternative(List<? extends Recognizer<E, ? extends T>> branches) {
        return new Alternative<>(List.copyOf(branches));
    }

    /**
     * Zero or more repetitions. Never fails.
     *
     * <p>{@code parser} must consume input whenever it succeeds, otherwise repetition never ends.
     */
    public static <E, T> Recognizer<E, List<T>> many(Recognizer<E, ? extends T> parser) {
        return new Many<>(parser);
    }

    /**
     * Transform the value produced by {@code parser}.
     */
    public static <E, S, T> Recognizer<E, T> apply(Recognizer<E, S> parser, Function<? super S, ? extends T> mapper) {
        return new Apply<>(parser, mapper);
    }

    /**
     * Recognizer resolved at recognition time. Used to close recursive grammars.
     */
    public static <E, T> Recognizer<E, T> lazy(Supplier<? extends Recognizer<E, T>> supplier) {
        return new Lazy<>(supplier);
    }

    /**
     * Labelled recognizer which traces attempts and outcomes at TRACE level.
     */
    public static <E, T> Recognizer<E, T> named(String name, Recognizer<E, T> parser) {
        return new Named<>(name, parser);
    }

    /**
     * Positive lookahead: succeeds with the value of {@code parser} but consumes nothing.
     */
    public static <E, T> Recognizer<E, T> lookahead(Recognizer<E, T> parser) {
        return new Lookahead<>(parser);
    }

    /**
     * Negative lookahead: succeeds, consuming nothing, only if {@code parser} fails.
     */
    public static <E> Recognizer<E, Unit> not(Recognizer<E, ?> parser) {
        return new Not<>(parser);
    }

    @SuppressWarnings("unchecked")
    static <T> Match<T> widen(Match<? extends T> match) {
        return (Match<T>) match;
    }

    record Sequence<E, T>(List<Recognizer<E, ? extends T>> parts) implements Recognizer<E, List<T>> {
        @Override
        public Match<List<T>> recognize(Text<E> text, Cursor cursor) {
            var values = new ArrayList<T>(parts.size());
            var current = cursor;

            for (var part : parts) {
                Match<? extends T> match = part.recognize(text, current);

                if (match.isFailure()) {
                    return ((Match.Failure<? extends T>) match).cast();
                }
                var success = (Match.Success<? extends T>) match;
                values.add(success.value());
                current = success.next();
            }
            return Match.success(Collections.unmodifiableList(values), current);
        }
    }

    record Alternative<E, T>(List<Recognizer<E, ? extends T>> branches) implements Recognizer<E, T> {
        Alternative {
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("Alternative requires at least one branch");
            }
        }

        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            for (var branch : branches) {
                Match<? extends T> match = branch.recognize(text, cursor);

                if (match.isSuccess()) {
                    return widen(match);
                }
            }
            // Exhaustion seen by a losing branch is not reported separately.
            return Match.failure(ParseError.NO_MATCH);
        }
    }

    record Many<E, T>(Recognizer<E, ? extends T> parser) implements Recognizer<E, List<T>> {
        Many {
            Objects.requireNonNull(parser, "parser");
        }

        @Override
        public Match<List<T>> recognize(Text<E> text, Cursor cursor) {
            var values = new ArrayList<T>();
            var current = cursor;

            while (true) {
                Match<? extends T> match = parser.recognize(text, current);

                if (match.isFailure()) {
                    return Match.success(Collections.unmodifiableList(values), current);
                }
                var success = (Match.Success<? extends T>) match;
                values.add(success.value());
                current = success.next();
            }
        }
    }

    record Apply<E, S, T>(Recognizer<E, S> parser, Function<? super S, ? extends T> mapper) implements Recognizer<E, T> {
        Apply {
            Objects.requireNonNull(parser, "parser");
            Objects.requireNonNull(mapper, "mapper");
        }

        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            return parser.recognize(text, cursor).map(mapper);
        }
    }

    record Lazy<E, T>(Supplier<? extends Recognizer<E, T>> supplier) implements Recognizer<E, T> {
        Lazy {
            Objects.requireNonNull(supplier, "supplier");
        }

        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            return Objects.requireNonNull(supplier.get(), "Unresolved recognizer")
                          .recognize(text, cursor);
        }

        @Override
        public String toString() {
            return "Lazy";
        }
    }

    record Named<E, T>(String name, Recognizer<E, T> parser) implements Recognizer<E, T> {
        private static final Logger log = LoggerFactory.getLogger(Named.class);

        Named {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(parser, "parser");
        }

        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            log.trace("{} {}", name, cursor);

            var match = parser.recognize(text, cursor);

            if (log.isTraceEnabled()) {
                log.trace("{} {} -> {}", name, cursor, match);
            }
            return match;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Lookahead<E, T>(Recognizer<E, T> parser) implements Recognizer<E, T> {
        Lookahead {
            Objects.requireNonNull(parser, "parser");
        }

        @Override
        public Match<T> recognize(Text<E> text, Cursor cursor) {
            var match = parser.recognize(text, cursor);

            if (match instanceof Match.Success<T> success) {
                return Match.success(success.value(), cursor);
            }
            return match;
        }
    }

    record Not<E>(Recognizer<E, ?> parser) implements Recognizer<E, Unit> {
        Not {
            Objects.requireNonNull(parser, "parser");
        }

        @Override
        public Match<Unit> recognize(Text<E> text, Cursor cursor) {
            if (parser.recognize(text, cursor).isSuccess()) {
                return Match.failure(ParseError.NO_MATCH);
            }
            return Match.success(Unit.UNIT, cursor);
        }
    }
}
