package com.questrail.simmonitor.ast;

import java.util.Objects;

/**
 * Either of two events.
 */
public record EventDisjunctionAst(EventAst first, EventAst second) implements EventAst {

    public EventDisjunctionAst {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }
}
