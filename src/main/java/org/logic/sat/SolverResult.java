package org.logic.sat;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * RISULTATO SAT - Esito immutabile di una risoluzione
 *
 * COMPONENTI:
 * • Esito: SAT o UNSAT
 * • Modello: assegnamento variabile → valore, presente solo per SAT, nell'ordine
 *   di dichiarazione delle variabili
 * • Statistiche della ricerca
 *
 * Costruzione tramite i factory method {@link #satisfiable} e {@link #unsatisfiable}.
 */
public final class SolverResult {

    private final boolean satisfiable;
    private final Map<String, Boolean> assignment;
    private final SolverStatistics statistics;

    private SolverResult(boolean satisfiable, Map<String, Boolean> assignment, SolverStatistics statistics) {
        this.satisfiable = satisfiable;
        this.assignment = assignment;
        this.statistics = statistics != null ? statistics : new SolverStatistics();
    }

    //region FACTORY METHODS

    /**
     * @param assignment modello (non null, può essere vuoto per formule senza variabili)
     */
    public static SolverResult satisfiable(Map<String, Boolean> assignment, SolverStatistics statistics) {
        Objects.requireNonNull(assignment, "Risultato SAT richiede un assegnamento");
        return new SolverResult(true, Collections.unmodifiableMap(new LinkedHashMap<>(assignment)), statistics);
    }

    public static SolverResult unsatisfiable(SolverStatistics statistics) {
        return new SolverResult(false, null, statistics);
    }

    //endregion

    //region ACCESSO

    public boolean isSatisfiable() {
        return satisfiable;
    }

    /**
     * @return modello se la formula è soddisfacibile, altrimenti vuoto
     */
    public Optional<Map<String, Boolean>> getAssignment() {
        return Optional.ofNullable(assignment);
    }

    public SolverStatistics getStatistics() {
        return statistics;
    }

    /**
     * Stesso esito con il modello ristretto alle variabili indicate, nell'ordine dato.
     * Usato per eliminare le variabili ausiliarie di una codifica.
     */
    public SolverResult restrictTo(Collection<String> variables) {
        if (!satisfiable) {
            return this;
        }
        Map<String, Boolean> restricted = new LinkedHashMap<>();
        for (String variable : variables) {
            Boolean value = assignment.get(variable);
            if (value != null) {
                restricted.put(variable, value);
            }
        }
        return satisfiable(restricted, statistics);
    }

    //endregion

    //region RAPPRESENTAZIONE

    public String toCompactString() {
        return satisfiable ? "SAT " + assignment : "UNSAT";
    }

    @Override
    public String toString() {
        if (!satisfiable) {
            return "UNSAT";
        }
        StringBuilder sb = new StringBuilder("SAT\nModello:\n");
        assignment.forEach((variable, value) ->
                sb.append("  ").append(variable).append(" = ").append(value).append('\n'));
        return sb.toString();
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SolverResult other)) return false;
        return satisfiable == other.satisfiable && Objects.equals(assignment, other.assignment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, assignment);
    }
}
