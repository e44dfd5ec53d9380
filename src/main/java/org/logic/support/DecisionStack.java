package org.logic.support;

import org.logic.cnf.Clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DECISION STACK - Livelli di decisione per il backtracking cronologico
 *
 * ORGANIZZAZIONE:
 * • Livello 0: implicazioni delle clausole unitarie iniziali, sempre presente
 * • Livello i (i > 0): decisione in prima posizione seguita dalle implicazioni
 *   che ne derivano, in ordine cronologico
 *
 * Il livello 0 non viene mai rimosso.
 */
public class DecisionStack {

    private static final Logger LOGGER = Logger.getLogger(DecisionStack.class.getName());

    private final Stack<List<AssignedLiteral>> levelStack;

    public DecisionStack() {
        this.levelStack = new Stack<>();
        this.levelStack.push(new ArrayList<>());
    }

    //region AGGIUNTA

    /**
     * Apre un nuovo livello con la decisione come primo assegnamento.
     */
    public void addDecision(String variable, boolean value, boolean secondBranch) {
        List<AssignedLiteral> level = new ArrayList<>();
        level.add(AssignedLiteral.decision(variable, value, secondBranch));
        levelStack.push(level);

        LOGGER.finest(() -> String.format("Decisione %s=%s (ramo %s), livello=%d",
                variable, value, secondBranch ? "alternativo" : "primo", getLevel()));
    }

    /**
     * Aggiunge un'implicazione al livello corrente.
     */
    public void addImpliedLiteral(String variable, boolean value, Clause ancestorClause) {
        levelStack.peek().add(AssignedLiteral.implication(variable, value, ancestorClause));

        LOGGER.finest(() -> String.format("Implicazione %s=%s da %s, livello=%d",
                variable, value, ancestorClause, getLevel()));
    }

    //endregion

    //region RIMOZIONE

    /**
     * Rimuove il livello più alto.
     *
     * @return assegnamenti rimossi, lista vuota se è rimasto solo il livello 0
     */
    public List<AssignedLiteral> deleteLevel() {
        if (levelStack.size() <= 1) {
            return Collections.emptyList();
        }
        List<AssignedLiteral> removed = levelStack.pop();

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(String.format("Livello %d rimosso: %s", levelStack.size(), removed));
        }
        return removed;
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * Decisione che ha aperto il livello più alto, null al livello 0.
     */
    public AssignedLiteral getTopDecision() {
        if (levelStack.size() <= 1) {
            return null;
        }
        return levelStack.peek().get(0);
    }

    /**
     * @return livello corrente, 0 se non ci sono decisioni aperte
     */
    public int getLevel() {
        return levelStack.size() - 1;
    }

    public List<AssignedLiteral> getAssignmentsAtLevel(int levelIndex) {
        if (levelIndex < 0 || levelIndex >= levelStack.size()) {
            throw new IndexOutOfBoundsException(
                    String.format("Livello %d fuori intervallo [0, %d)", levelIndex, levelStack.size()));
        }
        return Collections.unmodifiableList(levelStack.get(levelIndex));
    }

    public int getTotalAssignments() {
        return levelStack.stream().mapToInt(List::size).sum();
    }

    //endregion

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("DecisionStack{");
        for (int level = 0; level < levelStack.size(); level++) {
            if (level > 0) sb.append(", ");
            sb.append(level).append(": ").append(levelStack.get(level));
        }
        return sb.append('}').toString();
    }
}
