package org.pragmatica.combinator.parser;

/**
 * Empty value produced by recognizers that consume nothing meaningful.
 */
public enum Unit {
    UNIT;

    @Override
    public String toString() {
        return "()";
    }
}
