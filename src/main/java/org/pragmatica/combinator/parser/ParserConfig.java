package org.pragmatica.combinator.parser;

/**
 * Driver configuration options.
 *
 * @param requireEnd accept a result only if the whole text was consumed
 */
public record ParserConfig(
    boolean requireEnd
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        false
    );

    public static final ParserConfig COMPLETE = new ParserConfig(
        true
    );
}
