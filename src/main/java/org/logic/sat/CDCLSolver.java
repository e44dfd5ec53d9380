package org.logic.sat;

import org.logic.cnf.CNFFormula;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;
import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.support.AssignedLiteral;
import org.logic.support.DecisionStack;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SOLUTORE CDCL - Conflict-Driven Clause Learning
 *
 * ALGORITMO:
 * 1. Propagazione unitaria sulle clausole originali e apprese
 * 2. Conflitto al livello 0: la formula è UNSAT
 * 3. Conflitto a un livello d > 0: analisi per risoluzione all'indietro lungo il trail
 *    del livello d fino al primo Unique Implication Point (1-UIP). La clausola appresa
 *    contiene la negazione dell'UIP e i letterali falsi dei livelli inferiori; i
 *    letterali del livello 0 vengono scartati perché falsi in ogni ramo
 * 4. Backjump al livello più alto fra i letterali appresi diversi dall'UIP (0 se la
 *    clausola è unitaria), dove la clausola appresa diventa unitaria e forza l'UIP
 * 5. Decisione: variabile libera con il contatore VSIDS più alto (occorrenze nelle
 *    clausole apprese), a parità la prima nell'ordine di dichiarazione; valore true
 *
 * OTTIMIZZAZIONI OPZIONALI:
 * • Restart ogni {@code restartThreshold} conflitti con ritorno al livello 0
 * • Sussunzione delle clausole apprese a ogni restart
 *
 * LIMITI:
 * Stesso budget di decisioni e controllo dell'interruzione di {@link DPLLSolver}.
 *
 * Le variabili rimaste libere quando ogni clausola è soddisfatta ricevono true.
 */
public class CDCLSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(CDCLSolver.class.getName());

    private enum ClauseState {
        SATISFIED, FALSIFIED, UNIT, UNRESOLVED
    }

    private record ClauseEvaluation(ClauseState state, Literal unit) {
    }

    /**
     * Risultato dell'analisi di un conflitto.
     *
     * @param learnedClause clausola appresa, con il letterale dell'UIP in prima posizione
     * @param assertedLiteral letterale forzato dopo il backjump
     * @param backjumpLevel livello a cui tornare
     */
    private record ConflictAnalysis(Clause learnedClause, Literal assertedLiteral, int backjumpLevel) {
    }

    //region CONFIGURAZIONE

    private final CNFFormula formula;
    private final long maxDecisions;
    private final int restartThreshold;
    private final boolean subsumptionEnabled;

    //endregion

    //region STATO DELLA RICERCA

    private Map<String, AssignedLiteral> assignedValues;
    private Map<String, Integer> assignmentLevels;
    private Map<String, Integer> vsidsCounter;
    private List<Clause> learnedClauses;
    private DecisionStack decisionStack;
    private RestartTechnique restartTechnique;
    private SubsumptionPrinciple subsumptionPrinciple;
    private SolverStatistics statistics;

    //endregion

    public CDCLSolver(CNFFormula formula) {
        this(formula, 0, 0, false);
    }

    /**
     * @param formula formula da risolvere
     * @param maxDecisions numero massimo di decisioni, 0 per nessun limite
     * @param restartThreshold conflitti fra due restart, 0 per disattivare i restart
     * @param subsumptionEnabled sussunzione delle clausole apprese a ogni restart
     */
    public CDCLSolver(CNFFormula formula, long maxDecisions, int restartThreshold, boolean subsumptionEnabled) {
        this.formula = Objects.requireNonNull(formula, "Formula non può essere null");
        if (maxDecisions < 0) {
            throw new IllegalArgumentException("Budget di decisioni non può essere negativo: " + maxDecisions);
        }
        if (restartThreshold < 0) {
            throw new IllegalArgumentException("Soglia di restart non può essere negativa: " + restartThreshold);
        }
        this.maxDecisions = maxDecisions;
        this.restartThreshold = restartThreshold;
        this.subsumptionEnabled = subsumptionEnabled;
    }

    @Override
    public String getName() {
        return "CDCL";
    }

    //region RISOLUZIONE

    @Override
    public SolverResult solve() throws SatException {
        initializeSearch();
        LOGGER.fine(() -> String.format("Avvio CDCL: %d clausole, %d variabili, restart=%s, sussunzione=%s",
                formula.getClauseCount(), formula.getVariableCount(),
                restartTechnique != null, subsumptionEnabled));

        if (formula.hasEmptyClause()) {
            LOGGER.fine("Clausola vuota presente: formula insoddisfacibile");
            return finish(SolverResult.unsatisfiable(statistics));
        }

        while (true) {
            Clause conflict = executeUnitPropagation();

            if (conflict != null) {
                statistics.incrementConflicts();
                if (decisionStack.getLevel() == 0) {
                    LOGGER.fine("Conflitto al livello 0: formula insoddisfacibile");
                    return finish(SolverResult.unsatisfiable(statistics));
                }

                ConflictAnalysis analysis = analyzeConflict(conflict);
                learnClause(analysis.learnedClause());

                if (restartTechnique != null && restartTechnique.registerConflictAndCheckRestart()) {
                    executeRestart();
                } else {
                    backjump(analysis);
                }
                continue;
            }

            if (allClausesSatisfied()) {
                return finish(SolverResult.satisfiable(buildModel(), statistics));
            }

            checkLimits();
            String variable = pickBranchingVariable();
            if (variable == null) {
                throw new IllegalStateException("Nessuna variabile libera ma clausole non soddisfatte");
            }
            decide(variable);
        }
    }

    private void initializeSearch() {
        this.assignedValues = new HashMap<>();
        this.assignmentLevels = new HashMap<>();
        this.vsidsCounter = new HashMap<>();
        this.learnedClauses = new ArrayList<>();
        this.decisionStack = new DecisionStack();
        this.restartTechnique = restartThreshold > 0 ? new RestartTechnique(restartThreshold) : null;
        this.subsumptionPrinciple = new SubsumptionPrinciple();
        this.statistics = new SolverStatistics();
    }

    private SolverResult finish(SolverResult result) {
        statistics.stopTimer();
        LOGGER.fine(() -> String.format("CDCL terminato: %s (%s)",
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

    //region ANALISI DEI CONFLITTI

    /**
     * Risolve la clausola in conflitto con le clausole ancestrali dei letterali del
     * livello corrente, dal più recente, finché ne resta uno solo: il primo UIP.
     */
    private ConflictAnalysis analyzeConflict(Clause conflict) {
        int conflictLevel = decisionStack.getLevel();
        List<AssignedLiteral> trail = decisionStack.getAssignmentsAtLevel(conflictLevel);

        Set<String> seen = new HashSet<>();
        List<Literal> lowerLevelLiterals = new ArrayList<>();
        int pendingAtConflictLevel = 0;
        int trailIndex = trail.size() - 1;
        Clause reason = conflict;
        AssignedLiteral pivot;

        while (true) {
            for (Literal literal : reason.getLiterals()) {
                String variable = literal.variable();
                int level = assignmentLevels.get(variable);
                if (level == 0 || !seen.add(variable)) {
                    continue;
                }
                if (level == conflictLevel) {
                    pendingAtConflictLevel++;
                } else {
                    lowerLevelLiterals.add(literal);
                }
            }

            while (!seen.contains(trail.get(trailIndex).getVariable())) {
                trailIndex--;
            }
            pivot = trail.get(trailIndex--);
            pendingAtConflictLevel--;

            if (pendingAtConflictLevel == 0) {
                break;
            }
            reason = pivot.getAncestorClause();
        }

        // Il letterale dell'UIP è falso nell'assegnamento corrente, come tutti gli altri
        Literal asserted = new Literal(pivot.getVariable(), pivot.getValue());
        List<Literal> learned = new ArrayList<>();
        learned.add(asserted);
        learned.addAll(lowerLevelLiterals);

        int backjumpLevel = 0;
        for (Literal literal : lowerLevelLiterals) {
            backjumpLevel = Math.max(backjumpLevel, assignmentLevels.get(literal.variable()));
        }

        ConflictAnalysis analysis = new ConflictAnalysis(Clause.of(learned), asserted, backjumpLevel);
        LOGGER.finest(() -> String.format("Conflitto su %s al livello %d: appresa %s, backjump a %d",
                conflict, conflictLevel, analysis.learnedClause(), analysis.backjumpLevel()));
        return analysis;
    }

    private void learnClause(Clause clause) {
        learnedClauses.add(clause);
        statistics.incrementLearnedClauses();
        for (Literal literal : clause.getLiterals()) {
            vsidsCounter.merge(literal.variable(), 1, Integer::sum);
        }
    }

    //endregion

    //region BACKJUMP E RESTART

    /**
     * Torna al livello calcolato dall'analisi e vi forza il letterale dell'UIP,
     * giustificato dalla clausola appresa.
     */
    private void backjump(ConflictAnalysis analysis) {
        backtrackTo(analysis.backjumpLevel());
        statistics.incrementBacktracks();

        Literal asserted = analysis.assertedLiteral();
        assign(asserted.variable(), !asserted.negated(), analysis.learnedClause());
        statistics.incrementPropagations();
    }

    /**
     * Abbandona tutte le decisioni; le clausole apprese restano. La clausola appena
     * appresa viene ripresa dalla propagazione al livello 0.
     */
    private void executeRestart() {
        backtrackTo(0);
        restartTechnique.restartExecuted();
        statistics.incrementRestarts();

        if (subsumptionEnabled) {
            int before = learnedClauses.size();
            learnedClauses = subsumptionPrinciple.applySubsumption(learnedClauses);
            statistics.addSubsumedClauses(before - learnedClauses.size());
        }

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Restart #%d: %d clausole apprese conservate",
                    restartTechnique.getTotalRestarts(), learnedClauses.size()));
        }
    }

    private void backtrackTo(int level) {
        while (decisionStack.getLevel() > level) {
            for (AssignedLiteral literal : decisionStack.deleteLevel()) {
                assignedValues.remove(literal.getVariable());
                assignmentLevels.remove(literal.getVariable());
            }
        }
    }

    //endregion

    //region DECISIONI

    private String pickBranchingVariable() {
        String best = null;
        int bestScore = -1;
        for (String variable : formula.getVariables()) {
            if (assignedValues.containsKey(variable)) {
                continue;
            }
            int score = vsidsCounter.getOrDefault(variable, 0);
            if (score > bestScore) {
                best = variable;
                bestScore = score;
            }
        }
        return best;
    }

    private void decide(String variable) {
        statistics.incrementDecisions();
        decisionStack.addDecision(variable, true, false);
        AssignedLiteral decision = decisionStack.getTopDecision();
        assignedValues.put(variable, decision);
        assignmentLevels.put(variable, decisionStack.getLevel());
    }

    private void assign(String variable, boolean value, Clause reason) {
        decisionStack.addImpliedLiteral(variable, value, reason);
        List<AssignedLiteral> level = decisionStack.getAssignmentsAtLevel(decisionStack.getLevel());
        assignedValues.put(variable, level.get(level.size() - 1));
        assignmentLevels.put(variable, decisionStack.getLevel());
    }

    //endregion

    //region PROPAGAZIONE UNITARIA

    /**
     * @return clausola in conflitto, null se la propagazione termina senza conflitti
     */
    private Clause executeUnitPropagation() {
        boolean propagated;
        do {
            propagated = false;
            for (List<Clause> clauses : List.of(formula.getClauses(), learnedClauses)) {
                for (Clause clause : clauses) {
                    ClauseEvaluation evaluation = evaluateClauseState(clause);
                    if (evaluation.state() == ClauseState.FALSIFIED) {
                        return clause;
                    }
                    if (evaluation.state() == ClauseState.UNIT) {
                        Literal unit = evaluation.unit();
                        assign(unit.variable(), !unit.negated(), clause);
                        statistics.incrementPropagations();
                        propagated = true;
                    }
                }
            }
        } while (propagated);
        return null;
    }

    private ClauseEvaluation evaluateClauseState(Clause clause) {
        Literal unassigned = null;
        int unassignedCount = 0;

        for (Literal literal : clause.getLiterals()) {
            AssignedLiteral assigned = assignedValues.get(literal.variable());
            if (assigned == null) {
                unassigned = literal;
                unassignedCount++;
            } else if (literal.isSatisfiedBy(assigned.getValue())) {
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
            AssignedLiteral assigned = assignedValues.get(variable);
            model.put(variable, assigned == null || assigned.getValue());
        }
        return model;
    }

    /**
     * Clausole apprese nell'ultima ricerca, dopo l'eventuale sussunzione.
     */
    public List<Clause> getLearnedClauses() {
        return learnedClauses == null ? List.of() : List.copyOf(learnedClauses);
    }
}
