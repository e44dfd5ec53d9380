package org.logic.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * FORMULA CNF - Congiunzione ordinata di clausole
 *
 * Oltre alle clausole conserva:
 * • l'ordine di dichiarazione delle variabili, usato dal solutore per scegliere
 *   la prossima variabile da decidere
 * • le variabili sorgente, cioè quelle della formula originale; coincidono con
 *   tutte le variabili tranne quando la codifica introduce variabili ausiliarie
 *
 * La formula vuota è banalmente soddisfacibile (⊤). Immutabile dopo la costruzione.
 */
public final class CNFFormula {

    private static final Logger LOGGER = Logger.getLogger(CNFFormula.class.getName());

    private final List<Clause> clauses;
    private final List<String> variables;
    private final List<String> sourceVariables;

    /**
     * Formula in cui variabili sorgente e dichiarate coincidono.
     */
    public CNFFormula(List<Clause> clauses, List<String> variables) {
        this(clauses, variables, variables);
    }

    /**
     * @param clauses clausole in ordine
     * @param variables tutte le variabili in ordine di dichiarazione; quelle che
     *                  compaiono nelle clausole ma non nella lista vengono accodate
     * @param sourceVariables sottoinsieme corrispondente alla formula originale
     */
    public CNFFormula(List<Clause> clauses, List<String> variables, List<String> sourceVariables) {
        Objects.requireNonNull(clauses, "Clausole non possono essere null");
        Objects.requireNonNull(variables, "Variabili non possono essere null");
        Objects.requireNonNull(sourceVariables, "Variabili sorgente non possono essere null");

        this.clauses = List.copyOf(clauses);

        Set<String> declared = new LinkedHashSet<>(variables);
        for (Clause clause : this.clauses) {
            declared.addAll(clause.getVariables());
        }
        this.variables = List.copyOf(declared);

        if (!declared.containsAll(sourceVariables)) {
            throw new IllegalArgumentException("Variabili sorgente non dichiarate: " + sourceVariables);
        }
        this.sourceVariables = List.copyOf(sourceVariables);

        LOGGER.finest(() -> String.format("CNFFormula costruita: %d clausole, %d variabili",
                this.clauses.size(), this.variables.size()));
    }

    //region ACCESSO

    public List<Clause> getClauses() {
        return clauses;
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<String> getSourceVariables() {
        return sourceVariables;
    }

    public int getClauseCount() {
        return clauses.size();
    }

    public int getVariableCount() {
        return variables.size();
    }

    public int getLiteralCount() {
        return clauses.stream().mapToInt(Clause::size).sum();
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    /**
     * Vero se la formula contiene la clausola vuota ed è quindi insoddisfacibile.
     */
    public boolean hasEmptyClause() {
        return clauses.stream().anyMatch(Clause::isEmpty);
    }

    /**
     * Identificativi numerici progressivi da 1, nell'ordine di dichiarazione
     * (numerazione DIMACS).
     */
    public Map<String, Integer> getVariableMapping() {
        Map<String, Integer> mapping = new LinkedHashMap<>();
        for (String variable : variables) {
            mapping.put(variable, mapping.size() + 1);
        }
        return Collections.unmodifiableMap(mapping);
    }

    /**
     * Nuova formula con le clausole aggiuntive in coda.
     */
    public CNFFormula withClauses(List<Clause> additional) {
        List<Clause> combined = new ArrayList<>(clauses);
        combined.addAll(additional);
        return new CNFFormula(combined, variables, sourceVariables);
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CNFFormula other)) return false;
        return clauses.equals(other.clauses) && variables.equals(other.variables)
                && sourceVariables.equals(other.sourceVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauses, variables, sourceVariables);
    }

    @Override
    public String toString() {
        if (clauses.isEmpty()) {
            return "⊤";
        }
        return clauses.stream().map(Clause::toString).collect(Collectors.joining(" ∧ "));
    }
}
