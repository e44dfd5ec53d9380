package org.logic.engine;

import org.logic.cnf.CNFConverter;
import org.logic.cnf.CNFFormula;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;
import org.logic.cnf.TseitinConverter;
import org.logic.errors.EvaluationException;
import org.logic.errors.LexException;
import org.logic.errors.LogicException;
import org.logic.errors.ParseException;
import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.expression.ExpressionParser;
import org.logic.expression.ParsedExpression;
import org.logic.sat.Solver;
import org.logic.sat.SolverResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SISTEMA SAT - Conversione in CNF e ricerca di un modello
 *
 * PIPELINE:
 * 1. Parsing del testo
 * 2. Conversione CNF secondo la strategia configurata
 * 3. Ricerca con il solutore configurato (DPLL o CDCL, con restart e sussunzione
 *    opzionali) e il budget di decisioni configurato
 * 4. Con la codifica di Tseitin il modello viene ristretto alle variabili sorgente
 *
 * Ogni chiamata è indipendente: nessuno stato viene conservato tra una risoluzione
 * e la successiva.
 */
public class SatSystem implements LogicSystem {

    private static final Logger LOGGER = Logger.getLogger(SatSystem.class.getName());

    public static final String NAME = "sat";

    private final EngineConfiguration configuration;
    private final ExpressionParser parser;
    private final CNFConverter distributiveConverter;
    private final TseitinConverter tseitinConverter;

    public SatSystem(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configurazione non può essere null");
        this.parser = new ExpressionParser(configuration.maxNestingDepth());
        this.distributiveConverter = new CNFConverter(configuration.maxClauses());
        this.tseitinConverter = new TseitinConverter();
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * L'espressione è valida se può essere convertita in CNF.
     */
    @Override
    public void validate(String expression) throws LogicException {
        convertToCnf(expression);
    }

    //region CONVERSIONE

    public CNFFormula convertToCnf(String expression) throws LexException, ParseException, SatException {
        return convertToCnf(parser.parse(expression));
    }

    public CNFFormula convertToCnf(ParsedExpression expression) throws SatException {
        return switch (configuration.cnfStrategy()) {
            case DISTRIBUTIVE -> distributiveConverter.convert(expression);
            case TSEITIN -> tseitinConverter.convert(expression);
        };
    }

    //endregion

    //region RISOLUZIONE

    /**
     * Risolve una formula già in CNF. Il modello comprende tutte le variabili dichiarate.
     */
    public SolverResult solve(CNFFormula formula) throws SatException {
        Solver solver = configuration.solverType().create(formula, configuration.maxDecisions(),
                configuration.restarts(), configuration.subsumption());
        LOGGER.fine(() -> String.format("Risoluzione con %s: %d clausole", solver.getName(), formula.getClauseCount()));
        return solver.solve();
    }

    /**
     * Converte e risolve; il modello è ristretto alle variabili dell'espressione.
     */
    public SolverResult solveExpression(String expression) throws LexException, ParseException, SatException {
        CNFFormula formula = convertToCnf(expression);
        SolverResult result = solve(formula).restrictTo(formula.getSourceVariables());
        LOGGER.fine(() -> String.format("'%s': %s", expression, result.toCompactString()));
        return result;
    }

    /**
     * Soddisfacibilità dell'espressione con alcune variabili fissate.
     * Ogni vincolo diventa una clausola unitaria.
     *
     * @param constraints valori imposti, anche per variabili assenti dall'espressione
     * @throws SatException se un vincolo non ha nome o valore
     */
    public SolverResult isSatisfiable(String expression, Map<String, Boolean> constraints)
            throws LexException, ParseException, SatException {
        Objects.requireNonNull(constraints, "Vincoli non possono essere null");
        CNFFormula formula = convertToCnf(expression);

        List<Clause> units = new ArrayList<>();
        for (Map.Entry<String, Boolean> constraint : constraints.entrySet()) {
            if (constraint.getKey() == null || constraint.getKey().isEmpty()) {
                throw new SatException(Stage.SOLVE, "isSatisfiable", "vincolo senza nome di variabile");
            }
            if (constraint.getValue() == null) {
                throw new SatException(Stage.SOLVE, "isSatisfiable",
                        "vincolo senza valore per la variabile " + constraint.getKey());
            }
            units.add(Clause.of(new Literal(constraint.getKey(), !constraint.getValue())));
        }

        List<String> visible = new ArrayList<>(formula.getSourceVariables());
        for (String variable : constraints.keySet()) {
            if (!visible.contains(variable)) {
                visible.add(variable);
            }
        }
        return solve(formula.withClauses(units)).restrictTo(visible);
    }

    /**
     * Verifica che l'assegnamento soddisfi l'espressione originale.
     *
     * @throws EvaluationException se l'assegnamento non copre tutte le variabili
     */
    public boolean verifySolution(String expression, Map<String, Boolean> assignment)
            throws LexException, ParseException, EvaluationException {
        return parser.parse(expression).evaluate(assignment);
    }

    public EngineConfiguration getConfiguration() {
        return configuration;
    }

    //endregion
}
