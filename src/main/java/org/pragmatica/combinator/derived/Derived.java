package org.pragmatica.combinator.derived;

import org.pragmatica.combinator.parser.Combinators;
import org.pragmatica.combinator.parser.Primitives;
import org.pragmatica.combinator.parser.Recognizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Convenience recognizers composed from primitives and structural combinators.
 */
public final class Derived {
    private Derived() {}

    /**
     * Exact character sequence, e.g. a keyword.
     */
    public static Recognizer<Character, String> string(String text) {
        var literals = new ArrayList<Recognizer<Character, Character>>(text.length());

        for (var i = 0; i < text.length(); i++) {
            literals.add(Primitives.literal(text.charAt(i)));
        }
        return join(Combinators.<Character, Character>sequence(literals));
    }

    /**
     * Zero or one occurrence.
     */
    public static <E, T> Recognizer<E, Optional<T>> optional(Recognizer<E, T> parser) {
        Recognizer<E, Optional<T>> present = parser.map(Optional::of);
        Recognizer<E, Optional<T>> absent = Primitives.<E>epsilon().map(unit -> Optional.<T>empty());

        return Combinators.alternative(present, absent);
    }

    /**
     * One or more occurrences. Fails with {@code NoMatch} if the first attempt fails.
     */
    public static <E, T> Recognizer<E, List<T>> many1(Recognizer<E, T> parser) {
        return Combinators.alternative(cons(parser, Combinators.many(parser)));
    }

    /**
     * One or more {@code parser} occurrences delimited by {@code separator}. Separator values are dropped.
     */
    public static <E, T> Recognizer<E, List<T>> separatedBy1(Recognizer<E, T> parser, Recognizer<E, ?> separator) {
        return Combinators.alternative(cons(parser, Combinators.many(skipLeft(separator, parser))));
    }

    /**
     * Zero or more {@code parser} occurrences delimited by {@code separator}.
     */
    public static <E, T> Recognizer<E, List<T>> separatedBy(Recognizer<E, T> parser, Recognizer<E, ?> separator) {
        return Combinators.alternative(separatedBy1(parser, separator), Primitives.<E, List<T>>pure(List.of()));
    }

    /**
     * Any of the given elements, tried in iteration order.
     */
    public static <E> Recognizer<E, E> oneOf(Collection<? extends E> elements) {
        var literals = new ArrayList<Recognizer<E, E>>(elements.size());

        for (var element : elements) {
            literals.add(Primitives.literal(element));
        }
        return Combinators.alternative(literals);
    }

    @SafeVarargs
    public static <E> Recognizer<E, E> oneOf(E... elements) {
        return oneOf(List.of(elements));
    }

    /**
     * Concatenate the string forms of a list of values.
     */
    public static <E> Recognizer<E, String> join(Recognizer<E, ? extends List<?>> parser) {
        return Combinators.apply(parser, Derived::concatenate);
    }

    /**
     * Value of {@code parser} enclosed by {@code open} and {@code close}.
     */
    @SuppressWarnings("unchecked")
    public static <E, T> Recognizer<E, T> between(Recognizer<E, ?> open, Recognizer<E, T> parser, Recognizer<E, ?> close) {
        return Combinators.apply(Combinators.<E, Object>sequence(open, parser, close), values -> (T) values.get(1));
    }

    /**
     * Value of {@code right}, after {@code left} matched.
     */
    @SuppressWarnings("unchecked")
    public static <E, T> Recognizer<E, T> skipLeft(Recognizer<E, ?> left, Recognizer<E, T> right) {
        return Combinators.apply(Combinators.<E, Object>sequence(left, right), values -> (T) values.get(1));
    }

    /**
     * Value of {@code left}, provided {@code right} matches after it.
     */
    @SuppressWarnings("unchecked")
    public static <E, T> Recognizer<E, T> skipRight(Recognizer<E, T> left, Recognizer<E, ?> right) {
        return Combinators.apply(Combinators.<E, Object>sequence(left, right), values -> (T) values.get(0));
    }

    @SuppressWarnings("unchecked")
    private static <E, T> Recognizer<E, List<T>> cons(Recognizer<E, T> head, Recognizer<E, List<T>> tail) {
        return Combinators.apply(Combinators.<E, Object>sequence(head, tail), values -> {
            var rest = (List<T>) values.get(1);
            var all = new ArrayList<T>(rest.size() + 1);

            all.add((T) values.get(0));
            all.addAll(rest);
            return Collections.unmodifiableList(all);
        });
    }

    private static String concatenate(List<?> values) {
        var builder = new StringBuilder();

        for (var value : values) {
            builder.append(value);
        }
        return builder.toString();
    }
}
