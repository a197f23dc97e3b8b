package org.pragmatica.combinator.text;

import java.util.Objects;

/**
 * In-memory character text.
 */
public final class StringText extends IndexedText<Character> {

    private final CharSequence input;

    private StringText(CharSequence input) {
        this.input = input;
    }

    public static StringText of(CharSequence input) {
        return new StringText(Objects.requireNonNull(input, "input"));
    }

    public int length() {
        return input.length();
    }

    /**
     * Input consumed between two cursors.
     */
    public String slice(Cursor from, Cursor to) {
        return input.subSequence(from.offset(), to.offset()).toString();
    }

    @Override
    protected boolean available(int offset) {
        return offset < input.length();
    }

    @Override
    protected Character elementAt(int offset) {
        return input.charAt(offset);
    }

    @Override
    public String toString() {
        return "StringText[" + input.length() + " chars]";
    }
}
