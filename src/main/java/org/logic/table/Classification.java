package org.logic.table;

/**
 * Classificazione semantica di una formula in base alla sua tavola di verità.
 */
public enum Classification {
    /** Vera in ogni riga. */
    TAUTOLOGY,
    /** Falsa in ogni riga. */
    CONTRADICTION,
    /** Almeno una riga vera e almeno una falsa. */
    CONTINGENCY
}
