package org.pragmatica.combinator.error;

/**
 * Classified recognition failure.
 *
 * <p>There are exactly two kinds: the text ran out at the attempted read, or an element was
 * available but rejected.
 */
public sealed interface ParseError {

    EndOfText END_OF_TEXT = new EndOfText();
    NoMatch NO_MATCH = new NoMatch();

    String message();

    /**
     * Text exhausted at the attempted read.
     */
    record EndOfText() implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of text";
        }
    }

    /**
     * Input present but not accepted.
     */
    record NoMatch() implements ParseError {
        @Override
        public String message() {
            return "Input does not match";
        }
    }
}
