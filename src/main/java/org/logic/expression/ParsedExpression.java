package org.logic.expression;

import org.logic.errors.EvaluationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Risultato del parsing: radice dell'AST, variabili libere in ordine di prima
 * comparsa e testo sorgente. Immutabile.
 */
public final class ParsedExpression {

    private final String source;
    private final FormulaNode root;
    private final List<String> variables;

    public ParsedExpression(String source, FormulaNode root, List<String> variables) {
        this.source = Objects.requireNonNull(source, "Sorgente non può essere null");
        this.root = Objects.requireNonNull(root, "Radice non può essere null");
        this.variables = List.copyOf(variables);
    }

    public String getSource() {
        return source;
    }

    public FormulaNode getRoot() {
        return root;
    }

    /**
     * @return variabili libere nell'ordine in cui compaiono nel testo
     */
    public List<String> getVariables() {
        return variables;
    }

    public boolean evaluate(Map<String, Boolean> assignment) throws EvaluationException {
        return ExpressionEvaluator.evaluate(root, assignment);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
