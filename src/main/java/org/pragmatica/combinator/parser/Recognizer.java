package org.pragmatica.combinator.parser;

import org.pragmatica.combinator.text.Cursor;
import org.pragmatica.combinator.text.Text;

import java.util.function.Function;

/**
 * Uniform contract of every primitive recognizer and combinator.
 *
 * <p>A recognizer never modifies the text or a cursor; success and failure both return fresh
 * values. Recognizers hold no per-parse state, so one graph may serve many concurrent parses.
 *
 * @param <E> element type of the text
 * @param <T> type of the produced value
 */
@FunctionalInterface
public interface Recognizer<E, T> {

    /**
     * Attempt to recognize input at the cursor.
     *
     * @return produced value with the cursor after the consumed input, or a failure classified as
     * {@link org.pragmatica.combinator.error.ParseError.EndOfText} or
     * {@link org.pragmatica.combinator.error.ParseError.NoMatch}
     */
    Match<T> recognize(Text<E> text, Cursor cursor);

    /**
     * Shortcut for {@link Combinators#apply(Recognizer, Function)}.
     */
    default <R> Recognizer<E, R> map(Function<? super T, ? extends R> mapper) {
        return Combinators.apply(this, mapper);
    }

    /**
     * Two-branch {@link Combinators#alternative(Recognizer[])}.
     */
    default Recognizer<E, T> or(Recognizer<E, ? extends T> other) {
        return Combinators.alternative(this, other);
    }
}
