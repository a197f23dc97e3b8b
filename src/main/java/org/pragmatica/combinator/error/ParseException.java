package org.pragmatica.combinator.error;

import java.util.Objects;

/**
 * Thrown by the throwing parse entry points when recognition fails.
 */
public final class ParseException extends RuntimeException {

    private final ParseError error;

    public ParseException(ParseError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    public boolean isEndOfText() {
        return error instanceof ParseError.EndOfText;
    }

    public boolean isNoMatch() {
        return error instanceof ParseError.NoMatch;
    }
}
