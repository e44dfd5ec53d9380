package org.logic.engine;

import org.logic.errors.EvaluationException;
import org.logic.errors.LexException;
import org.logic.errors.ParseException;
import org.logic.expression.ExpressionParser;
import org.logic.expression.ParsedExpression;
import org.logic.table.BooleanFunction;
import org.logic.table.Classification;
import org.logic.table.LogicalLaws;
import org.logic.table.TruthTable;
import org.logic.table.TruthTableGenerator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * SISTEMA CLASSICO - Valutazione, tavole di verità e proprietà semantiche
 *
 * Punto di accesso alle operazioni sul testo delle formule:
 * • valutazione rispetto a un assegnamento
 * • validazione (solo parsing)
 * • tavola di verità da funzione o da espressione
 * • tautologia, contraddizione, contingenza, equivalenza
 *
 * Non ha stato mutabile: le chiamate concorrenti sono sicure.
 */
public class ClassicalSystem implements LogicSystem {

    private static final Logger LOGGER = Logger.getLogger(ClassicalSystem.class.getName());

    public static final String NAME = "classical";

    private final ExpressionParser parser;
    private final TruthTableGenerator generator;
    private final LogicalLaws laws;

    public ClassicalSystem(EngineConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configurazione non può essere null");
        this.parser = new ExpressionParser(configuration.maxNestingDepth());
        this.generator = new TruthTableGenerator(configuration.maxTableVariables());
        this.laws = new LogicalLaws(generator);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void validate(String expression) throws LexException, ParseException {
        validateExpression(expression);
    }

    //region ESPRESSIONI

    public ParsedExpression parse(String expression) throws LexException, ParseException {
        return parser.parse(expression);
    }

    /**
     * Analizza e valuta l'espressione.
     *
     * @throws EvaluationException se una variabile dell'espressione manca nell'assegnamento
     */
    public boolean evaluateExpression(String expression, Map<String, Boolean> assignment)
            throws LexException, ParseException, EvaluationException {
        ParsedExpression parsed = parser.parse(expression);
        boolean result = parsed.evaluate(assignment);
        LOGGER.fine(() -> String.format("'%s' con %s = %s", expression, assignment, result));
        return result;
    }

    public void validateExpression(String expression) throws LexException, ParseException {
        parser.validate(expression);
    }

    //endregion

    //region TAVOLE DI VERITÀ

    /**
     * @throws IllegalArgumentException se l'elenco di variabili non è valido: errore di programmazione
     */
    public TruthTable generateTruthTable(List<String> variables, BooleanFunction function) {
        return generator.generate(variables, function);
    }

    /**
     * @param variableOrder ordine delle colonne; null o vuoto per l'ordine di comparsa
     */
    public TruthTable generateTruthTableFromExpression(String expression, List<String> variableOrder)
            throws LexException, ParseException, EvaluationException {
        return generator.generate(parser.parse(expression), variableOrder);
    }

    //endregion

    //region PROPRIETÀ SEMANTICHE

    public Classification classify(List<String> variables, String expression)
            throws LexException, ParseException, EvaluationException {
        return LogicalLaws.classify(generateTruthTableFromExpression(expression, variables));
    }

    public boolean isTautology(List<String> variables, String expression)
            throws LexException, ParseException, EvaluationException {
        return classify(variables, expression) == Classification.TAUTOLOGY;
    }

    public boolean isContradiction(List<String> variables, String expression)
            throws LexException, ParseException, EvaluationException {
        return classify(variables, expression) == Classification.CONTRADICTION;
    }

    public boolean isContingency(List<String> variables, String expression)
            throws LexException, ParseException, EvaluationException {
        return classify(variables, expression) == Classification.CONTINGENCY;
    }

    /**
     * Vero se le due espressioni hanno lo stesso valore per ogni assegnamento
     * dell'unione delle loro variabili.
     */
    public boolean areEquivalent(String first, String second)
            throws LexException, ParseException, EvaluationException {
        ParsedExpression left = parser.parse(first);
        ParsedExpression right = parser.parse(second);

        Set<String> union = new LinkedHashSet<>(left.getVariables());
        union.addAll(right.getVariables());
        List<String> variables = new ArrayList<>(union);

        TruthTable leftTable = generator.generate(left, variables);
        TruthTable rightTable = generator.generate(right, variables);
        return leftTable.getOutputs().equals(rightTable.getOutputs());
    }

    public LogicalLaws getLaws() {
        return laws;
    }

    //endregion
}
