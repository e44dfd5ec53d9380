package org.logic.expression;

import org.logic.errors.EvaluationException;

import java.util.Map;
import java.util.Objects;

/**
 * Valutazione strutturale di un AST rispetto a un assegnamento.
 * Entrambi gli operandi dei nodi binari vengono sempre valutati, dal basso verso
 * l'alto con {@link FormulaNode#fold}: la profondità dell'albero non è limitata.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    /**
     * @param node radice del sottoalbero da valutare
     * @param assignment valori delle variabili
     * @return valore di verità del sottoalbero
     * @throws EvaluationException se una variabile non compare nell'assegnamento
     */
    public static boolean evaluate(FormulaNode node, Map<String, Boolean> assignment) throws EvaluationException {
        Objects.requireNonNull(node, "Nodo non può essere null");
        Objects.requireNonNull(assignment, "Assegnamento non può essere null");

        return node.<Boolean, EvaluationException>fold((current, left, right) -> switch (current.getType()) {
            case VARIABLE -> {
                Boolean value = assignment.get(current.getName());
                if (value == null) {
                    throw new EvaluationException("evaluate", current.getName());
                }
                yield value;
            }
            case CONSTANT -> current.getValue();
            case NOT -> BooleanOperations.not(left);
            default -> applyBinary(current.getType(), left, right);
        });
    }

    private static boolean applyBinary(FormulaNode.Type type, boolean left, boolean right) {
        return switch (type) {
            case AND -> BooleanOperations.and(left, right);
            case OR -> BooleanOperations.or(left, right);
            case XOR -> BooleanOperations.xor(left, right);
            case IMPLIES -> BooleanOperations.implies(left, right);
            case IFF -> BooleanOperations.iff(left, right);
            default -> throw new IllegalStateException("Tipo non binario: " + type);
        };
    }
}
