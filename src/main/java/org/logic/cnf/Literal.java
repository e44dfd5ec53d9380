package org.logic.cnf;

/**
 * Variabile o sua negazione.
 *
 * @param variable nome della variabile
 * @param negated true per il letterale negativo
 */
public record Literal(String variable, boolean negated) {

    public Literal {
        if (variable == null || variable.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile del letterale non può essere vuoto");
        }
    }

    public static Literal positive(String variable) {
        return new Literal(variable, false);
    }

    public static Literal negative(String variable) {
        return new Literal(variable, true);
    }

    public Literal negate() {
        return new Literal(variable, !negated);
    }

    /**
     * Vero se il letterale è soddisfatto quando la sua variabile vale {@code value}.
     */
    public boolean isSatisfiedBy(boolean value) {
        return value != negated;
    }

    @Override
    public String toString() {
        return negated ? "¬" + variable : variable;
    }
}
