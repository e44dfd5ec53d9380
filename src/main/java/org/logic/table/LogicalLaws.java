package org.logic.table;

import org.logic.expression.BooleanOperations;

import java.util.List;
import java.util.Objects;

/**
 * Proprietà semantiche derivate dalla tavola di verità:
 * tautologia, contraddizione, contingenza, equivalenza.
 */
public class LogicalLaws {

    private final TruthTableGenerator generator;

    public LogicalLaws(TruthTableGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "Generatore non può essere null");
    }

    public boolean isTautology(List<String> variables, BooleanFunction function) {
        return classify(generator.generate(variables, function)) == Classification.TAUTOLOGY;
    }

    public boolean isContradiction(List<String> variables, BooleanFunction function) {
        return classify(generator.generate(variables, function)) == Classification.CONTRADICTION;
    }

    public boolean isContingency(List<String> variables, BooleanFunction function) {
        return classify(generator.generate(variables, function)) == Classification.CONTINGENCY;
    }

    /**
     * Vero se le due funzioni coincidono su ogni assegnamento delle variabili.
     */
    public boolean areEquivalent(List<String> variables, BooleanFunction first, BooleanFunction second) {
        return isTautology(variables, inputs -> first.apply(inputs) == second.apply(inputs));
    }

    /**
     * La classificazione si ferma alla prima riga che smentisce sia la tautologia
     * sia la contraddizione.
     */
    public static Classification classify(TruthTable table) {
        boolean seenTrue = false;
        boolean seenFalse = false;
        for (TruthTableRow row : table.getRows()) {
            if (row.output()) {
                seenTrue = true;
            } else {
                seenFalse = true;
            }
            if (seenTrue && seenFalse) {
                return Classification.CONTINGENCY;
            }
        }
        return seenFalse ? Classification.CONTRADICTION : Classification.TAUTOLOGY;
    }

    //region LEGGI CLASSICHE

    /**
     * ¬(A ∧ B) ≡ ¬A ∨ ¬B e ¬(A ∨ B) ≡ ¬A ∧ ¬B.
     */
    public boolean verifyDeMorgan() {
        List<String> variables = List.of("A", "B");
        return areEquivalent(variables,
                in -> BooleanOperations.nand(in[0], in[1]),
                in -> BooleanOperations.or(!in[0], !in[1]))
                && areEquivalent(variables,
                in -> BooleanOperations.nor(in[0], in[1]),
                in -> BooleanOperations.and(!in[0], !in[1]));
    }

    /**
     * A ∧ (B ∨ C) ≡ (A ∧ B) ∨ (A ∧ C) e A ∨ (B ∧ C) ≡ (A ∨ B) ∧ (A ∨ C).
     */
    public boolean verifyDistributive() {
        List<String> variables = List.of("A", "B", "C");
        return areEquivalent(variables,
                in -> in[0] && (in[1] || in[2]),
                in -> (in[0] && in[1]) || (in[0] && in[2]))
                && areEquivalent(variables,
                in -> in[0] || (in[1] && in[2]),
                in -> (in[0] || in[1]) && (in[0] || in[2]));
    }

    //endregion
}
