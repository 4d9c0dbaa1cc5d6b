package com.questrail.simmonitor.internal.predicate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Operators accepted in message predicates.
 */
enum Operator
{
    EQUAL("="),
    DIFFERENT("!="),
    LESSER("<"),
    LESSER_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    AND("and"),
    IMPLIES("implies", "iff");

    private final List<String> symbols;

    Operator(String... symbols) {
        this.symbols = List.of(symbols);
    }

    boolean isRelational() {
        return this != AND && this != IMPLIES;
    }

    /**
     * The operator that yields the same result with its operands swapped.
     */
    Operator mirrored() {
        switch (this) {
            case LESSER:
                return GREATER;
            case LESSER_OR_EQUAL:
                return GREATER_OR_EQUAL;
            case GREATER:
                return LESSER;
            case GREATER_OR_EQUAL:
                return LESSER_OR_EQUAL;
            default:
                return this;
        }
    }

    static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbols.contains(symbol))
                .findFirst();
    }

    @Override
    public String toString() {
        return symbols.get(0);
    }
}
