package org.logic.table;

import org.logic.errors.EvaluationException;
import org.logic.expression.ExpressionEvaluator;
import org.logic.expression.ParsedExpression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * GENERATORE TAVOLE DI VERITÀ
 *
 * Enumera tutti i 2^n assegnamenti sulle variabili dichiarate in ordine binario
 * crescente (prima variabile = bit più significativo) e per ognuno calcola
 * l'uscita di una funzione booleana o di un'espressione analizzata.
 *
 * VINCOLI SULLE VARIABILI:
 * • Lista non null e senza duplicati
 * • Al massimo {@code maxVariables} variabili (la tavola cresce come 2^n)
 */
public class TruthTableGenerator {

    private static final Logger LOGGER = Logger.getLogger(TruthTableGenerator.class.getName());

    public static final int DEFAULT_MAX_VARIABLES = 20;

    /** Limite oltre il quale l'indice di riga non sta in un int. */
    private static final int ABSOLUTE_MAX_VARIABLES = 30;

    private final int maxVariables;

    public TruthTableGenerator() {
        this(DEFAULT_MAX_VARIABLES);
    }

    public TruthTableGenerator(int maxVariables) {
        if (maxVariables < 0 || maxVariables > ABSOLUTE_MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "Numero massimo di variabili deve essere tra 0 e %d, ricevuto: %d",
                    ABSOLUTE_MAX_VARIABLES, maxVariables));
        }
        this.maxVariables = maxVariables;
    }

    //region GENERAZIONE

    /**
     * Tavola di una funzione booleana pura. Le variabili arrivano dal codice
     * chiamante, non da un testo: un elenco non valido è un errore di programmazione.
     *
     * @param variables variabili in ordine di dichiarazione
     * @param function funzione sugli ingressi ordinati
     * @throws IllegalArgumentException se l'elenco ha duplicati, nomi vuoti o troppe variabili
     */
    public TruthTable generate(List<String> variables, BooleanFunction function) {
        Objects.requireNonNull(function, "Funzione non può essere null");
        Objects.requireNonNull(variables, "Lista variabili non può essere null");
        VariableProblem problem = findVariableProblem(variables);
        if (problem != null) {
            throw new IllegalArgumentException(problem.detail());
        }

        int n = variables.size();
        int rowCount = 1 << n;
        List<TruthTableRow> rows = new ArrayList<>(rowCount);

        for (int i = 0; i < rowCount; i++) {
            boolean[] inputs = assignmentBits(i, n);
            boolean output = function.apply(inputs.clone());
            rows.add(new TruthTableRow(box(inputs), output));
        }

        LOGGER.fine(() -> String.format("Tavola generata: %d variabili, %d righe", n, rowCount));
        return new TruthTable(variables, rows);
    }

    /**
     * Tavola di un'espressione. Se l'ordine è null o vuoto si usano le variabili
     * dell'espressione in ordine di comparsa.
     *
     * @throws EvaluationException se l'ordine fornito non copre una variabile dell'espressione,
     *                             contiene duplicati o nomi vuoti, o supera il limite di variabili
     */
    public TruthTable generate(ParsedExpression expression, List<String> variableOrder) throws EvaluationException {
        Objects.requireNonNull(expression, "Espressione non può essere null");
        List<String> variables = variableOrder == null || variableOrder.isEmpty()
                ? expression.getVariables()
                : variableOrder;
        VariableProblem problem = findVariableProblem(variables);
        if (problem != null) {
            throw new EvaluationException("generate", problem.variable(), problem.detail());
        }

        int n = variables.size();
        int rowCount = 1 << n;
        List<TruthTableRow> rows = new ArrayList<>(rowCount);
        Map<String, Boolean> assignment = new HashMap<>();

        for (int i = 0; i < rowCount; i++) {
            boolean[] inputs = assignmentBits(i, n);
            for (int j = 0; j < n; j++) {
                assignment.put(variables.get(j), inputs[j]);
            }
            boolean output = ExpressionEvaluator.evaluate(expression.getRoot(), assignment);
            rows.add(new TruthTableRow(box(inputs), output));
        }

        LOGGER.fine(() -> String.format("Tavola di '%s' generata: %d righe", expression, rowCount));
        return new TruthTable(variables, rows);
    }

    public int getMaxVariables() {
        return maxVariables;
    }

    //endregion

    //region SUPPORTO

    /**
     * Bit della riga {@code row} su {@code n} variabili, il primo è il più significativo.
     */
    static boolean[] assignmentBits(int row, int n) {
        boolean[] bits = new boolean[n];
        for (int j = 0; j < n; j++) {
            bits[j] = ((row >> (n - 1 - j)) & 1) == 1;
        }
        return bits;
    }

    /**
     * Primo difetto dell'elenco di variabili.
     *
     * @param variable variabile coinvolta, null se il difetto riguarda l'elenco intero
     */
    private record VariableProblem(String variable, String detail) {
    }

    /**
     * @return null se l'elenco è utilizzabile per una tavola
     */
    private VariableProblem findVariableProblem(List<String> variables) {
        if (variables.size() > maxVariables) {
            return new VariableProblem(null, String.format(
                    "Troppe variabili per una tavola di verità: %d (massimo %d)", variables.size(), maxVariables));
        }
        Set<String> seen = new HashSet<>();
        for (String variable : variables) {
            if (variable == null || variable.isEmpty()) {
                return new VariableProblem(variable, "Nome variabile non può essere vuoto");
            }
            if (!seen.add(variable)) {
                return new VariableProblem(variable, "Variabile duplicata: " + variable);
            }
        }
        return null;
    }

    private static List<Boolean> box(boolean[] values) {
        List<Boolean> boxed = new ArrayList<>(values.length);
        for (boolean value : values) {
            boxed.add(value);
        }
        return boxed;
    }

    //endregion
}
