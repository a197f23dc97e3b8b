package org.pragmatica.combinator.derived;

import org.pragmatica.combinator.parser.Primitives;
import org.pragmatica.combinator.parser.Recognizer;

import java.math.BigInteger;
import java.util.ArrayList;

/**
 * Character class recognizers.
 */
public final class Chars {
    private Chars() {}

    private static final Recognizer<Character, Character> DIGIT = Primitives.range('0', '9');
    private static final Recognizer<Character, Character> LETTER = Primitives.satisfy(Character::isLetter, "letter");
    private static final Recognizer<Character, Character> WHITESPACE = Primitives.satisfy(Character::isWhitespace, "whitespace");

    private static final Recognizer<Character, String> DIGITS = Derived.join(Derived.many1(DIGIT));
    private static final Recognizer<Character, String> LETTERS = Derived.join(Derived.many1(LETTER));
    private static final Recognizer<Character, String> WHITESPACES = Derived.join(Derived.many1(WHITESPACE));

    /**
     * ASCII decimal digit.
     */
    public static Recognizer<Character, Character> digit() {
        return DIGIT;
    }

    public static Recognizer<Character, Character> letter() {
        return LETTER;
    }

    public static Recognizer<Character, Character> whitespace() {
        return WHITESPACE;
    }

    public static Recognizer<Character, String> digits() {
        return DIGITS;
    }

    public static Recognizer<Character, String> letters() {
        return LETTERS;
    }

    public static Recognizer<Character, String> whitespaces() {
        return WHITESPACES;
    }

    /**
     * Unsigned decimal number of any length.
     */
    public static Recognizer<Character, BigInteger> natural() {
        return DIGITS.map(BigInteger::new);
    }

    /**
     * Any character of {@code chars}.
     */
    public static Recognizer<Character, Character> charIn(String chars) {
        var elements = new ArrayList<Character>(chars.length());

        for (var i = 0; i < chars.length(); i++) {
            elements.add(chars.charAt(i));
        }
        return Derived.oneOf(elements);
    }

    public static Recognizer<Character, String> word(String text) {
        return Derived.string(text);
    }
}
