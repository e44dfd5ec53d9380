package org.logic.errors;

/**
 * Carattere che non corrisponde ad alcuna forma di token.
 * Riporta il carattere incriminato e la sua posizione nel testo sorgente.
 */
public class LexException extends LogicException {

    private static final long serialVersionUID = 1L;

    private final char offendingCharacter;
    private final int offset;

    public LexException(String operation, char offendingCharacter, int offset, String detail) {
        super(Stage.LEX, operation,
                String.format("%s '%c' alla posizione %d", detail, offendingCharacter, offset));
        this.offendingCharacter = offendingCharacter;
        this.offset = offset;
    }

    public char getOffendingCharacter() {
        return offendingCharacter;
    }

    public int getOffset() {
        return offset;
    }
}
