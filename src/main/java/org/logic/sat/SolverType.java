package org.logic.sat;

import org.logic.cnf.CNFFormula;

import java.util.Locale;

/**
 * Algoritmi di risoluzione disponibili.
 */
public enum SolverType {

    /** Backtracking cronologico con propagazione unitaria. */
    DPLL,

    /** Apprendimento di clausole dai conflitti con backjumping non cronologico. */
    CDCL;

    /**
     * Crea il solutore per la formula.
     *
     * @param formula formula da risolvere
     * @param maxDecisions budget di decisioni, 0 = illimitato
     * @param restarts restart periodici (solo CDCL)
     * @param subsumption sussunzione delle clausole apprese a ogni restart (solo CDCL)
     */
    public Solver create(CNFFormula formula, long maxDecisions, boolean restarts, boolean subsumption) {
        return switch (this) {
            case DPLL -> new DPLLSolver(formula, maxDecisions);
            case CDCL -> new CDCLSolver(formula, maxDecisions,
                    restarts ? RestartTechnique.DEFAULT_CONFLICT_THRESHOLD : 0, subsumption);
        };
    }

    /**
     * Interpreta il nome del solutore senza distinzione fra maiuscole e minuscole.
     *
     * @throws IllegalArgumentException se il nome non corrisponde ad alcun solutore
     */
    public static SolverType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Solutore sconosciuto: " + name + " (attesi: dpll, cdcl)", e);
        }
    }
}
