package org.logic.engine;

import org.logic.errors.LogicException;

import java.util.List;

/**
 * Sistema logico registrato nel {@link LogicEngine}.
 */
public interface LogicSystem {

    /** Operatori accettati dal lexer, in tutte le grafie. */
    List<String> SUPPORTED_OPERATORS = List.of(
            "&", "∧", "|", "∨", "^", "⊕", "!", "¬", "->", "→", "<->", "↔",
            "and", "or", "xor", "not", "nand", "nor", "implies", "iff");

    /**
     * Nome con cui il sistema è registrato.
     */
    String getName();

    /**
     * Verifica che il sistema possa elaborare l'espressione.
     *
     * @throws LogicException con la fase che ha rifiutato l'espressione
     */
    void validate(String expression) throws LogicException;

    default List<String> getSupportedOperators() {
        return SUPPORTED_OPERATORS;
    }
}
