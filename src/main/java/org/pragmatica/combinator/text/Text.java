package org.pragmatica.combinator.text;

import org.pragmatica.combinator.parser.Match;

/**
 * Cursor-addressed input source.
 *
 * <p>Implementations must be referentially transparent: reading twice at the same cursor returns
 * equal elements and equal successor cursors. Text is never modified by a read.
 *
 * @param <E> element type
 */
public interface Text<E> {

    /**
     * Cursor pointing at the first element.
     */
    Cursor start();

    /**
     * Read the element at the cursor.
     *
     * @return the element and a cursor advanced by one, or a failure with
     * {@link org.pragmatica.combinator.error.ParseError.EndOfText} when the text is exhausted
     */
    Match<E> read(Cursor cursor);
}
