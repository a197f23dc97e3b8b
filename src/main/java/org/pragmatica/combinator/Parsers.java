package org.pragmatica.combinator;

import org.pragmatica.combinator.error.ParseError;
import org.pragmatica.combinator.error.ParseException;
import org.pragmatica.combinator.parser.Match;
import org.pragmatica.combinator.parser.ParserConfig;
import org.pragmatica.combinator.parser.Recognizer;
import org.pragmatica.combinator.text.StringText;
import org.pragmatica.combinator.text.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for running recognizers against text.
 *
 * <p>Example usage:
 * <pre>{@code
 * var number = Chars.digits().map(Integer::parseInt);
 * var list = Derived.separatedBy1(number, Primitives.literal(','));
 *
 * List<Integer> values = Parsers.parse("1,2,3", list);
 * }</pre>
 */
public final class Parsers {
    private static final Driver DEFAULT = new Driver(ParserConfig.DEFAULT);

    private Parsers() {}

    /**
     * Recognize {@code text} from its start and return the produced value. The final cursor is discarded.
     *
     * @throws ParseException if recognition fails
     */
    public static <E, T> T parse(Text<E> text, Recognizer<E, T> parser) {
        return DEFAULT.parse(text, parser);
    }

    /**
     * Same as {@link #parse(Text, Recognizer)} for an in-memory string.
     */
    public static <T> T parse(String input, Recognizer<Character, T> parser) {
        return DEFAULT.parse(input, parser);
    }

    /**
     * Recognize {@code text} from its start without throwing.
     */
    public static <E, T> Match<T> recognize(Text<E> text, Recognizer<E, T> parser) {
        return DEFAULT.recognize(text, parser);
    }

    /**
     * Driver with custom configuration.
     */
    public static Driver driver(ParserConfig config) {
        return new Driver(Objects.requireNonNull(config, "config"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs recognizers according to a {@link ParserConfig}. Stateless and safe to share.
     */
    public static final class Driver {
        private static final Logger log = LoggerFactory.getLogger(Driver.class);

        private final ParserConfig config;

        private Driver(ParserConfig config) {
            this.config = config;
        }

        public ParserConfig config() {
            return config;
        }

        public <E, T> T parse(Text<E> text, Recognizer<E, T> parser) {
            return recognize(text, parser).unwrap();
        }

        public <T> T parse(String input, Recognizer<Character, T> parser) {
            return parse(StringText.of(input), parser);
        }

        public <E, T> Match<T> recognize(Text<E> text, Recognizer<E, T> parser) {
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(parser, "parser");

            var match = parser.recognize(text, text.start());

            if (match instanceof Match.Success<T> success) {
                if (config.requireEnd() && text.read(success.next()).isSuccess()) {
                    log.debug("Rejecting {} on {}: trailing input at {}", parser, text, success.next());
                    return Match.failure(ParseError.NO_MATCH);
                }
                log.debug("Recognized {} on {}, stopped at {}", parser, text, success.next());
            } else {
                log.debug("Failed {} on {}: {}", parser, text, match);
            }
            return match;
        }
    }

    public static final class Builder {
        private boolean requireEnd = ParserConfig.DEFAULT.requireEnd();

        private Builder() {}

        public Builder requireEnd(boolean enabled) {
            this.requireEnd = enabled;
            return this;
        }

        public Driver build() {
            return driver(new ParserConfig(requireEnd));
        }
    }
}
