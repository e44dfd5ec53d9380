package org.logic.expression;

import java.util.Objects;

/**
 * Token immutabile prodotto dal lexer.
 *
 * @param type tipo del token
 * @param lexeme testo sorgente esatto del token (vuoto per fine input)
 * @param offset posizione del primo carattere nel sorgente
 */
public record Token(TokenType type, String lexeme, int offset) {

    public Token {
        Objects.requireNonNull(type, "Tipo token non può essere null");
        Objects.requireNonNull(lexeme, "Lessema non può essere null");
        if (offset < 0) {
            throw new IllegalArgumentException("Offset non può essere negativo: " + offset);
        }
    }

    /**
     * Descrizione usata nei messaggi di errore del parser.
     */
    public String describe() {
        return type == TokenType.END_OF_INPUT ? type.getDescription() : "'" + lexeme + "'";
    }
}
