package org.logic.table;

/**
 * Funzione booleana su una sequenza ordinata di ingressi,
 * uno per variabile dichiarata.
 */
@FunctionalInterface
public interface BooleanFunction {

    boolean apply(boolean[] inputs);
}
