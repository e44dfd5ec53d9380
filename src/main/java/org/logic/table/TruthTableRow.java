package org.logic.table;

import java.util.List;

/**
 * Riga della tavola di verità: un valore per ogni variabile, nell'ordine
 * di dichiarazione, e il valore della formula.
 */
public record TruthTableRow(List<Boolean> inputs, boolean output) {

    public TruthTableRow {
        inputs = List.copyOf(inputs);
    }

    public boolean input(int index) {
        return inputs.get(index);
    }
}
