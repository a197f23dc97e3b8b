package org.pragmatica.combinator.text;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Character text decoded lazily from a {@link Reader}.
 *
 * <p>Characters are pulled into an append-only buffer as reads reach them, so a cursor obtained
 * earlier keeps reading the same character. The reader is read at most once per character and is
 * never closed by this class. Not thread-safe: share a recognizer graph, not a {@code ReaderText}.
 */
public final class ReaderText extends IndexedText<Character> {

    private static final int CHUNK = 4096;

    private final Reader reader;
    private final StringBuilder buffer = new StringBuilder();
    private boolean exhausted;

    private ReaderText(Reader reader) {
        this.reader = reader;
    }

    public static ReaderText of(Reader reader) {
        return new ReaderText(Objects.requireNonNull(reader, "reader"));
    }

    @Override
    protected boolean available(int offset) {
        while (offset >= buffer.length() && !exhausted) {
            fill();
        }
        return offset < buffer.length();
    }

    @Override
    protected Character elementAt(int offset) {
        return buffer.charAt(offset);
    }

    private void fill() {
        var chunk = new char[CHUNK];
        try {
            var count = reader.read(chunk);

            if (count < 0) {
                exhausted = true;
            } else {
                buffer.append(chunk, 0, count);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read text", e);
        }
    }

    @Override
    public String toString() {
        return "ReaderText[" + buffer.length() + " chars decoded" + (exhausted ? ", exhausted]" : "]");
    }
}
