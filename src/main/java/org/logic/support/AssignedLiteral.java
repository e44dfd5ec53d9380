package org.logic.support;

import org.logic.cnf.Clause;

import java.util.Objects;

/**
 * LETTERALE ASSEGNATO - Variabile assegnata durante la ricerca con la sua origine
 *
 * Tre origini possibili:
 * • decisione sul primo ramo (valore true, ramo false ancora da esplorare)
 * • decisione sul secondo ramo (il ramo alternativo è l'ultimo rimasto)
 * • implicazione da propagazione unitaria, con la clausola che l'ha forzata
 *
 * Immutabile.
 */
public final class AssignedLiteral {

    //region ATTRIBUTI CORE DELL'ASSEGNAMENTO

    private final String variable;
    private final boolean value;
    private final boolean decision;

    /**
     * Solo per le decisioni: true se questo è già il ramo alternativo.
     */
    private final boolean secondBranch;

    /**
     * Clausola unitaria che ha forzato l'implicazione; null per le decisioni.
     */
    private final Clause ancestorClause;

    //endregion

    //region COSTRUZIONE CON VALIDAZIONE

    private AssignedLiteral(String variable, boolean value, boolean decision, boolean secondBranch,
                            Clause ancestorClause) {
        if (variable == null || variable.isEmpty()) {
            throw new IllegalArgumentException("Variabile dell'assegnamento non può essere vuota");
        }
        if (!decision && ancestorClause == null) {
            throw new IllegalArgumentException("Implicazione di " + variable + " richiede la clausola ancestrale");
        }
        if (decision && ancestorClause != null) {
            throw new IllegalArgumentException("Decisione su " + variable + " non può avere clausola ancestrale");
        }
        this.variable = variable;
        this.value = value;
        this.decision = decision;
        this.secondBranch = secondBranch;
        this.ancestorClause = ancestorClause;
    }

    public static AssignedLiteral decision(String variable, boolean value, boolean secondBranch) {
        return new AssignedLiteral(variable, value, true, secondBranch, null);
    }

    public static AssignedLiteral implication(String variable, boolean value, Clause ancestorClause) {
        return new AssignedLiteral(variable, value, false, false,
                Objects.requireNonNull(ancestorClause, "Clausola ancestrale non può essere null"));
    }

    //endregion

    //region ACCESSO

    public String getVariable() {
        return variable;
    }

    public boolean getValue() {
        return value;
    }

    public boolean isDecision() {
        return decision;
    }

    public boolean isImplication() {
        return !decision;
    }

    public boolean isSecondBranch() {
        return secondBranch;
    }

    public Clause getAncestorClause() {
        return ancestorClause;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AssignedLiteral other)) return false;
        return value == other.value && decision == other.decision && secondBranch == other.secondBranch
                && variable.equals(other.variable) && Objects.equals(ancestorClause, other.ancestorClause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, value, decision, secondBranch, ancestorClause);
    }

    @Override
    public String toString() {
        String origin = decision ? (secondBranch ? "D'" : "D") : "I" + ancestorClause;
        return variable + "=" + value + " [" + origin + "]";
    }
}
