package org.carball.showplan.parser;

import org.w3c.dom.Element;

/**
 * A statement-shaped element tagged with how it expands into plan statements.
 */
record RawStatement(Kind kind, Element element) {

    enum Kind {
        SIMPLE,
        CONDITIONAL,
        CURSOR
    }

    static RawStatement of(Element element) {
        Kind kind = switch (ShowPlanElements.localName(element)) {
            case "StmtCond" -> Kind.CONDITIONAL;
            case "StmtCursor" -> Kind.CURSOR;
            default -> Kind.SIMPLE;
        };
        return new RawStatement(kind, element);
    }
}
