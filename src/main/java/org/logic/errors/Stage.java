package org.logic.errors;

/**
 * Fase della pipeline che ha prodotto un errore.
 * Ogni {@link LogicException} ne porta una, così il chiamante sa sempre
 * se il problema nasce in lettura, parsing, valutazione, conversione,
 * risoluzione o simulazione.
 */
public enum Stage {
    LEX("lex"),
    PARSE("parse"),
    EVALUATE("evaluate"),
    CONVERT("convert"),
    SOLVE("solve"),
    SIMULATE("simulate");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
