package org.logic.sat;

import org.logic.cnf.CNFFormula;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;
import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.support.AssignedLiteral;
import org.logic.support.DecisionStack;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SOLUTORE DPLL - Ricerca con backtracking cronologico e propagazione unitaria
 *
 * ALGORITMO:
 * 1. Propagazione unitaria al livello 0; un conflitto qui rende la formula UNSAT
 * 2. Se tutte le clausole sono soddisfatte la ricerca termina
 * 3. Decisione: prima variabile non assegnata nell'ordine di dichiarazione, valore true
 * 4. Propagazione: ogni clausola ridotta a un solo letterale non assegnato lo forza
 * 5. Conflitto (clausola con tutti i letterali falsi): si risale fino all'ultima
 *    decisione ancora sul primo ramo e si prova il valore false; se non ne esistono
 *    la formula è UNSAT
 *
 * DETERMINISMO:
 * L'ordine delle variabili e dei valori tentati è fisso, quindi la stessa formula
 * produce sempre lo stesso modello. Le variabili rimaste libere quando ogni clausola
 * è già soddisfatta ricevono true, il valore che la ricerca proverebbe per primo.
 *
 * LIMITI OPZIONALI:
 * • Budget di decisioni ({@code maxDecisions}, 0 = illimitato)
 * • Interruzione del thread, controllata a ogni decisione
 * Entrambi terminano con una {@link SatException}.
 *
 * Ogni istanza risolve una sola formula; {@link #solve()} può essere richiamato e
 * riparte da zero.
 */
public class DPLLSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(DPLLSolver.class.getName());

    /**
     * Stato di una clausola rispetto all'assegnamento parziale corrente.
     */
    private enum ClauseState {
        SATISFIED, FALSIFIED, UNIT, UNRESOLVED
    }

    /** Esito della valutazione di una clausola; {@code unit} è valorizzato solo per UNIT. */
    private record ClauseEvaluation(ClauseState state, Literal unit) {
    }

    //region STATO

    private final CNFFormula formula;
    private final long maxDecisions;

    private Map<String, Boolean> assignment;
    private DecisionStack decisionStack;
    private SolverStatistics statistics;

    //endregion

    public DPLLSolver(CNFFormula formula) {
        this(formula, 0);
    }

    /**
     * @param formula formula da risolvere
     * @param maxDecisions numero massimo di decisioni, 0 per nessun limite
     */
    public DPLLSolver(CNFFormula formula, long maxDecisions) {
        this.formula = Objects.requireNonNull(formula, "Formula non può essere null");
        if (maxDecisions < 0) {
            throw new IllegalArgumentException("Budget di decisioni non può essere negativo: " + maxDecisions);
        }
        this.maxDecisions = maxDecisions;
    }

    @Override
    public String getName() {
        return "DPLL";
    }

    //region RISOLUZIONE

    @Override
    public SolverResult solve() throws SatException {
        initializeSearch();
        LOGGER.fine(() -> String.format("Avvio DPLL: %d clausole, %d variabili",
                formula.getClauseCount(), formula.getVariableCount()));

        if (formula.hasEmptyClause()) {
            LOGGER.fine("Clausola vuota presente: formula insoddisfacibile");
            return finish(SolverResult.unsatisfiable(statistics));
        }

        if (executeUnitPropagation() != null) {
            statistics.incrementConflicts();
            LOGGER.fine("Conflitto al livello 0: formula insoddisfacibile");
            return finish(SolverResult.unsatisfiable(statistics));
        }

        while (!allClausesSatisfied()) {
            checkLimits();

            String variable = pickBranchingVariable();
            if (variable == null) {
                // Con tutte le variabili assegnate e nessun conflitto ogni clausola è soddisfatta
                throw new IllegalStateException("Nessuna variabile libera ma clausole non soddisfatte");
            }
            decide(variable, true, false);

            while (executeUnitPropagation() != null) {
                statistics.incrementConflicts();
                if (!backtrack()) {
                    LOGGER.fine("Spazio di ricerca esaurito: formula insoddisfacibile");
                    return finish(SolverResult.unsatisfiable(statistics));
                }
            }
        }

        return finish(SolverResult.satisfiable(buildModel(), statistics));
    }

    private void initializeSearch() {
        this.assignment = new HashMap<>();
        this.decisionStack = new DecisionStack();
        this.statistics = new SolverStatistics();
    }

    private SolverResult finish(SolverResult result) {
        statistics.stopTimer();
        LOGGER.fine(() -> String.format("DPLL terminato: %s (%s)",
                result.isSatisfiable() ? "SAT" : "UNSAT", statistics));
        return result;
    }

    private void checkLimits() throws SatException {
        if (Thread.currentThread().isInterrupted()) {
            throw new SatException(Stage.SOLVE, "solve", "ricerca interrotta");
        }
        if (maxDecisions > 0 && statistics.getDecisions() >= maxDecisions) {
            throw new SatException(Stage.SOLVE, "solve",
                    "budget di " + maxDecisions + " decisioni esaurito");
        }
    }

    //endregion

    //region DECISIONI E BACKTRACKING

    private String pickBranchingVariable() {
        for (String variable : formula.getVariables()) {
            if (!assignment.containsKey(variable)) {
                return variable;
            }
        }
        return null;
    }

    private void decide(String variable, boolean value, boolean secondBranch) {
        statistics.incrementDecisions();
        decisionStack.addDecision(variable, value, secondBranch);
        assignment.put(variable, value);
    }

    /**
     * Rimuove i livelli le cui decisioni hanno già esplorato entrambi i rami, poi
     * inverte l'ultima decisione rimasta sul primo ramo.
     *
     * @return false se non resta alcun ramo da esplorare
     */
    private boolean backtrack() {
        while (decisionStack.getLevel() > 0) {
            AssignedLiteral decision = decisionStack.getTopDecision();
            unassign(decisionStack.deleteLevel());

            if (!decision.isSecondBranch()) {
                statistics.incrementBacktracks();
                decide(decision.getVariable(), !decision.getValue(), true);
                return true;
            }
        }
        return false;
    }

    private void unassign(List<AssignedLiteral> removed) {
        for (AssignedLiteral literal : removed) {
            assignment.remove(literal.getVariable());
        }
    }

    //endregion

    //region PROPAGAZIONE UNITARIA

    /**
     * Ripete la scansione delle clausole finché nessuna forza più letterali.
     *
     * @return clausola in conflitto, null se la propagazione termina senza conflitti
     */
    private Clause executeUnitPropagation() {
        boolean propagated;
        do {
            propagated = false;
            for (Clause clause : formula.getClauses()) {
                ClauseEvaluation evaluation = evaluateClauseState(clause);
                switch (evaluation.state()) {
                    case FALSIFIED -> {
                        LOGGER.finest(() -> "Conflitto su " + clause);
                        return clause;
                    }
                    case UNIT -> {
                        propagateUnitClause(clause, evaluation.unit());
                        propagated = true;
                    }
                    default -> {
                        // SATISFIED o UNRESOLVED: nulla da fare
                    }
                }
            }
        } while (propagated);
        return null;
    }

    private void propagateUnitClause(Clause clause, Literal unit) {
        boolean value = !unit.negated();
        assignment.put(unit.variable(), value);
        decisionStack.addImpliedLiteral(unit.variable(), value, clause);
        statistics.incrementPropagations();
    }

    private ClauseEvaluation evaluateClauseState(Clause clause) {
        Literal unassigned = null;
        int unassignedCount = 0;

        for (Literal literal : clause.getLiterals()) {
            Boolean value = assignment.get(literal.variable());
            if (value == null) {
                unassigned = literal;
                unassignedCount++;
            } else if (literal.isSatisfiedBy(value)) {
                return new ClauseEvaluation(ClauseState.SATISFIED, null);
            }
        }

        return switch (unassignedCount) {
            case 0 -> new ClauseEvaluation(ClauseState.FALSIFIED, null);
            case 1 -> new ClauseEvaluation(ClauseState.UNIT, unassigned);
            default -> new ClauseEvaluation(ClauseState.UNRESOLVED, null);
        };
    }

    private boolean allClausesSatisfied() {
        for (Clause clause : formula.getClauses()) {
            if (evaluateClauseState(clause).state() != ClauseState.SATISFIED) {
                return false;
            }
        }
        return true;
    }

    //endregion

    /**
     * Modello completo nell'ordine di dichiarazione; le variabili libere valgono true.
     */
    private Map<String, Boolean> buildModel() {
        Map<String, Boolean> model = new LinkedHashMap<>();
        for (String variable : formula.getVariables()) {
            model.put(variable, assignment.getOrDefault(variable, Boolean.TRUE));
        }
        return model;
    }
}
