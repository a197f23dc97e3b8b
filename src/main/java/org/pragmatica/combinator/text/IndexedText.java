package org.pragmatica.combinator.text;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.parser.Match;

/**
 * Base for texts addressed by integer offset. Subclasses supply element access only.
 */
public abstract class IndexedText<E> implements Text<E> {

    @Override
    public Cursor start() {
        return Cursor.start();
    }

    @Override
    public Match<E> read(Cursor cursor) {
        var offset = cursor.offset();

        if (!available(offset)) {
            return Match.failure(ParseError.END_OF_TEXT);
        }
        return Match.success(elementAt(offset), cursor.advance());
    }

    protected abstract boolean available(int offset);

    protected abstract E elementAt(int offset);
}
