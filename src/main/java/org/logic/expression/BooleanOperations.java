package org.logic.expression;

/**
 * Funzioni booleane pure su sequenze di lunghezza variabile.
 * Usate dal valutatore per i nodi binari e dalle porte dei circuiti.
 *
 * Sequenze vuote: {@code and} restituisce true, {@code or} e {@code xor} false
 * (elementi neutri delle rispettive operazioni).
 */
public final class BooleanOperations {

    private BooleanOperations() {
    }

    public static boolean and(boolean... inputs) {
        for (boolean input : inputs) {
            if (!input) return false;
        }
        return true;
    }

    public static boolean or(boolean... inputs) {
        for (boolean input : inputs) {
            if (input) return true;
        }
        return false;
    }

    /**
     * Parità: vero se il numero di ingressi veri è dispari.
     */
    public static boolean xor(boolean... inputs) {
        boolean parity = false;
        for (boolean input : inputs) {
            parity ^= input;
        }
        return parity;
    }

    public static boolean not(boolean input) {
        return !input;
    }

    public static boolean nand(boolean... inputs) {
        return !and(inputs);
    }

    public static boolean nor(boolean... inputs) {
        return !or(inputs);
    }

    public static boolean xnor(boolean... inputs) {
        return !xor(inputs);
    }

    public static boolean implies(boolean antecedent, boolean consequent) {
        return !antecedent || consequent;
    }

    public static boolean iff(boolean left, boolean right) {
        return left == right;
    }
}
