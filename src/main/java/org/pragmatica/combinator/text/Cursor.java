package org.pragmatica.combinator.text;

/**
 * Immutable position in a {@link Text}.
 *
 * <p>Cursors are plain values: reading at the same cursor always yields the same element and the
 * same successor, so an earlier cursor can be reused after a later attempt fails.
 * Cursors are created and advanced by text sources; recognizers only pass them along.
 */
public final class Cursor {

    private static final Cursor START = new Cursor(0);

    private final int offset;

    private Cursor(int offset) {
        this.offset = offset;
    }

    /**
     * Position of the first element of any text.
     */
    public static Cursor start() {
        return START;
    }

    /**
     * Position of the next element.
     */
    public Cursor advance() {
        return new Cursor(offset + 1);
    }

    /**
     * Number of elements before this position.
     */
    public int offset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cursor other && other.offset == offset;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(offset);
    }

    @Override
    public String toString() {
        return "@" + offset;
    }
}
