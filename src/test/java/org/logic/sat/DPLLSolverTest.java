package org.logic.sat;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.cnf.CNFConverter;
import org.logic.cnf.CNFFormula;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;
import org.logic.errors.LogicException;
import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.expression.ExpressionParser;
import org.logic.expression.ParsedExpression;

public class DPLLSolverTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final CNFConverter converter = new CNFConverter();

    private SolverResult solve(String text) throws LogicException {
        return new DPLLSolver(converter.convert(parser.parse(text))).solve();
    }

    /**
     * Principio della piccionaia: {@code pigeons} piccioni in {@code holes} buche,
     * insoddisfacibile quando i piccioni sono più delle buche.
     */
    private static CNFFormula pigeonhole(int pigeons, int holes) {
        List<Clause> clauses = new ArrayList<>();
        for (int i = 1; i <= pigeons; i++) {
            List<Literal> somewhere = new ArrayList<>();
            for (int j = 1; j <= holes; j++) {
                somewhere.add(Literal.positive("p" + i + "_" + j));
            }
            clauses.add(Clause.of(somewhere));
        }
        for (int j = 1; j <= holes; j++) {
            for (int i = 1; i <= pigeons; i++) {
                for (int k = i + 1; k <= pigeons; k++) {
                    clauses.add(Clause.of(Literal.negative("p" + i + "_" + j), Literal.negative("p" + k + "_" + j)));
                }
            }
        }
        return new CNFFormula(clauses, ImmutableList.of());
    }

    private static boolean satisfies(CNFFormula formula, Map<String, Boolean> model) {
        for (Clause clause : formula.getClauses()) {
            if (clause.getLiterals().stream().noneMatch(l -> l.isSatisfiedBy(model.get(l.variable())))) {
                return false;
            }
        }
        return true;
    }

    @Test
    public void testContradictionIsUnsatisfiable() throws LogicException {
        SolverResult result = solve("A & !A");
        assertThat(result.isSatisfiable(), is(false));
        assertThat(result.getAssignment().isPresent(), is(false));
        assertThat(result.toCompactString(), is("UNSAT"));
    }

    @Test
    public void testDisjunctionIsSatisfiable() throws LogicException {
        SolverResult result = solve("A | B");
        assertThat(result.isSatisfiable(), is(true));

        Map<String, Boolean> model = result.getAssignment().get();
        assertThat(model.get("A") || model.get("B"), is(true));
        // Prima variabile decisa a true, la seconda resta libera e viene completata a true
        assertThat(model, is(ImmutableMap.of("A", true, "B", true)));
    }

    @Test
    public void testUnitPropagationWithoutDecisions() throws LogicException {
        SolverResult result = solve("!A & (A | B)");
        assertThat(result.getAssignment().get(), is(ImmutableMap.of("A", false, "B", true)));
        assertThat(result.getStatistics().getDecisions(), is(0L));
        assertThat(result.getStatistics().getPropagations(), is(2L));
    }

    @Test
    public void testConflictFlipsDecision() throws LogicException {
        CNFFormula formula = converter.convert(parser.parse("(!A | !B) & (!A | B)"));
        SolverResult result = new DPLLSolver(formula).solve();

        assertThat(result.getAssignment().get(), is(ImmutableMap.of("A", false, "B", true)));
        assertThat(result.getStatistics().getConflicts(), is(1L));
        assertThat(result.getStatistics().getBacktracks(), is(1L));
    }

    @Test
    public void testAllCombinationsExcludedIsUnsatisfiable() throws LogicException {
        SolverResult result = solve("(A | B) & (!A | B) & (A | !B) & (!A | !B)");
        assertThat(result.isSatisfiable(), is(false));
        assertThat(result.getStatistics().getConflicts(), greaterThan(0L));
    }

    @Test
    public void testPigeonhole() throws SatException {
        assertThat(new DPLLSolver(pigeonhole(4, 3)).solve().isSatisfiable(), is(false));

        CNFFormula fitting = pigeonhole(3, 3);
        SolverResult result = new DPLLSolver(fitting).solve();
        assertThat(result.isSatisfiable(), is(true));
        assertThat(satisfies(fitting, result.getAssignment().get()), is(true));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "A",
            "!A",
            "(A -> B) & (B -> C) & A",
            "(A ^ B) & (B ^ C) & (A | C)",
            "(A <-> !B) & (B <-> C) & !(A & C)",
            "(A | B | C) & (!A | !B) & (!B | !C) & (!A | !C)"})
    public void testModelsSatisfyFormulaAndExpression(String text) throws LogicException {
        ParsedExpression expression = parser.parse(text);
        CNFFormula formula = converter.convert(expression);
        SolverResult result = new DPLLSolver(formula).solve();

        assertThat(result.isSatisfiable(), is(true));
        Map<String, Boolean> model = result.getAssignment().get();
        assertThat(model.keySet().containsAll(formula.getVariables()), is(true));
        assertThat(satisfies(formula, model), is(true));
        assertThat(expression.evaluate(model), is(true));
    }

    @Test
    public void testDeterministic() throws LogicException {
        CNFFormula formula = converter.convert(parser.parse("(A | B | C) & (!A | !B) & (!C | A)"));
        SolverResult first = new DPLLSolver(formula).solve();
        SolverResult second = new DPLLSolver(formula).solve();
        assertThat(first, is(second));

        DPLLSolver solver = new DPLLSolver(formula);
        assertThat(solver.solve(), is(solver.solve()));
    }

    @Test
    public void testTrivialFormulas() throws SatException {
        SolverResult empty = new DPLLSolver(new CNFFormula(ImmutableList.of(), ImmutableList.of())).solve();
        assertThat(empty.isSatisfiable(), is(true));
        assertThat(empty.getAssignment().get().isEmpty(), is(true));

        CNFFormula withEmptyClause = new CNFFormula(
                ImmutableList.of(Clause.of(Literal.positive("A")), Clause.of(ImmutableList.of())),
                ImmutableList.of("A"));
        assertThat(new DPLLSolver(withEmptyClause).solve().isSatisfiable(), is(false));

        SolverResult unconstrained = new DPLLSolver(
                new CNFFormula(ImmutableList.of(), ImmutableList.of("A", "B"))).solve();
        assertThat(unconstrained.getAssignment().get(), is(ImmutableMap.of("A", true, "B", true)));
    }

    @Test
    public void testDecisionBudget() {
        SatException e = assertThrows(SatException.class, () -> new DPLLSolver(pigeonhole(4, 3), 1).solve());
        assertThat(e.getStage(), is(Stage.SOLVE));
        assertThat(e.getDetail(), containsString("budget"));
        assertThrows(IllegalArgumentException.class, () -> new DPLLSolver(pigeonhole(2, 1), -1));
    }

    @Test
    public void testInterruption() {
        Thread.currentThread().interrupt();
        try {
            SatException e = assertThrows(SatException.class, () -> new DPLLSolver(pigeonhole(3, 2)).solve());
            assertThat(e.getDetail(), containsString("interrotta"));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testStatisticsTimerStopped() throws LogicException {
        SolverResult result = solve("A & B");
        assertThat(result.getStatistics().isTimerStopped(), is(true));
    }
}
