package org.logic.cnf;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Valutazione diretta di una CNF e enumerazione degli assegnamenti, per i test.
 */
final class CnfAssertions {

    private CnfAssertions() {
    }

    static boolean satisfies(CNFFormula formula, Map<String, Boolean> assignment) {
        for (Clause clause : formula.getClauses()) {
            boolean satisfied = false;
            for (Literal literal : clause.getLiterals()) {
                Boolean value = assignment.get(literal.variable());
                if (value != null && literal.isSatisfiedBy(value)) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    static Map<String, Boolean> assignment(List<String> variables, int row) {
        Map<String, Boolean> assignment = new HashMap<>();
        for (int j = 0; j < variables.size(); j++) {
            assignment.put(variables.get(j), ((row >> j) & 1) == 1);
        }
        return assignment;
    }
}
