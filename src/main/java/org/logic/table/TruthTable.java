package org.logic.table;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TAVOLA DI VERITÀ - Variabili ordinate e righe in ordine binario crescente
 *
 * La prima variabile è il bit più significativo: la riga i assegna alla
 * variabile j il bit {@code (i >> (n - 1 - j)) & 1}. Le righe sono esattamente 2^n.
 */
public final class TruthTable {

    /** Larghezza minima di una colonna nella resa testuale. */
    private static final int MIN_COLUMN_WIDTH = 8;

    private static final String OUTPUT_HEADER = "Output";

    private final List<String> variables;
    private final List<TruthTableRow> rows;

    TruthTable(List<String> variables, List<TruthTableRow> rows) {
        this.variables = List.copyOf(variables);
        this.rows = List.copyOf(rows);
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<Boolean> getOutputs() {
        return rows.stream().map(TruthTableRow::output).toList();
    }

    /**
     * Numero di righe in cui la formula è vera.
     */
    public int countTrue() {
        return (int) rows.stream().filter(TruthTableRow::output).count();
    }

    /**
     * Assegnamento della riga indicata come mappa ordinata variabile → valore.
     */
    public Map<String, Boolean> assignmentAt(int rowIndex) {
        TruthTableRow row = rows.get(rowIndex);
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            assignment.put(variables.get(i), row.input(i));
        }
        return assignment;
    }

    /**
     * Resa a colonne fisse: intestazione con i nomi delle variabili e "Output",
     * separatore, poi una riga per assegnamento con celle T/F.
     */
    @Override
    public String toString() {
        if (rows.isEmpty()) {
            return "Tavola di verità vuota";
        }

        int width = MIN_COLUMN_WIDTH;
        for (String variable : variables) {
            width = Math.max(width, variable.length() + 2);
        }
        String cell = "%-" + width + "s";

        StringBuilder sb = new StringBuilder();
        for (String variable : variables) {
            sb.append(String.format(cell, variable));
        }
        sb.append(OUTPUT_HEADER).append('\n');
        sb.append("-".repeat(variables.size() * width + OUTPUT_HEADER.length())).append('\n');

        for (TruthTableRow row : rows) {
            for (Boolean input : row.inputs()) {
                sb.append(String.format(cell, symbol(input)));
            }
            sb.append(symbol(row.output())).append('\n');
        }
        return sb.toString();
    }

    private static String symbol(boolean value) {
        return value ? "T" : "F";
    }
}
