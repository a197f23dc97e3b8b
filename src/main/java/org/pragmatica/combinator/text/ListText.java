package org.pragmatica.combinator.text;

import java.util.List;

/**
 * In-memory text over arbitrary elements, e.g. tokens produced by a lexer.
 */
public final class ListText<E> extends IndexedText<E> {

    private final List<E> elements;

    private ListText(List<E> elements) {
        this.elements = elements;
    }

    public static <E> ListText<E> of(List<E> elements) {
        return new ListText<>(List.copyOf(elements));
    }

    @SafeVarargs
    public static <E> ListText<E> of(E... elements) {
        return new ListText<>(List.of(elements));
    }

    @Override
    protected boolean available(int offset) {
        return offset < elements.size();
    }

    @Override
    protected E elementAt(int offset) {
        return elements.get(offset);
    }

    @Override
    public String toString() {
        return "ListText[" + elements.size() + " elements]";
    }
}
