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
import java.util.Random;
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

public class CDCLSolverTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final CNFConverter converter = new CNFConverter();

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

    /**
     * 3-SAT casuale con seme fisso.
     */
    private static CNFFormula random3Sat(long seed, int variables, int clauseCount) {
        Random random = new Random(seed);
        List<Clause> clauses = new ArrayList<>();
        for (int c = 0; c < clauseCount; c++) {
            List<Literal> literals = new ArrayList<>();
            for (int l = 0; l < 3; l++) {
                literals.add(new Literal("x" + random.nextInt(variables), random.nextBoolean()));
            }
            clauses.add(Clause.of(literals));
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

    private static List<Solver> allSolvers(CNFFormula formula) {
        return ImmutableList.of(
                new CDCLSolver(formula),
                new CDCLSolver(formula, 0, RestartTechnique.DEFAULT_CONFLICT_THRESHOLD, false),
                new CDCLSolver(formula, 0, 1, true),
                new CDCLSolver(formula, 0, RestartTechnique.DEFAULT_CONFLICT_THRESHOLD, true));
    }

    @Test
    public void testPigeonholeAgreesWithDpll() throws SatException {
        CNFFormula crowded = pigeonhole(4, 3);
        assertThat(new DPLLSolver(crowded).solve().isSatisfiable(), is(false));
        for (Solver solver : allSolvers(crowded)) {
            SolverResult result = solver.solve();
            assertThat(result.isSatisfiable(), is(false));
            assertThat(result.getStatistics().getLearnedClauses(), greaterThan(0L));
        }

        CNFFormula fitting = pigeonhole(3, 3);
        assertThat(new DPLLSolver(fitting).solve().isSatisfiable(), is(true));
        for (Solver solver : allSolvers(fitting)) {
            SolverResult result = solver.solve();
            assertThat(result.isSatisfiable(), is(true));
            assertThat(satisfies(fitting, result.getAssignment().get()), is(true));
        }
    }

    @Test
    public void testLargerPigeonholeWithRestarts() throws SatException {
        SolverResult result = new CDCLSolver(pigeonhole(5, 4), 0, 5, true).solve();
        assertThat(result.isSatisfiable(), is(false));
        assertThat(result.getStatistics().getRestarts(), greaterThan(0L));
    }

    @Test
    public void testRandomFormulasAgreeWithDpll() throws SatException {
        for (long seed = 1; seed <= 40; seed++) {
            // Rapporto clausole/variabili vicino alla soglia: metà circa SAT, metà UNSAT
            CNFFormula formula = random3Sat(seed, 8, 36);
            boolean expected = new DPLLSolver(formula).solve().isSatisfiable();
            for (Solver solver : allSolvers(formula)) {
                SolverResult result = solver.solve();
                assertThat(solver.getName() + " seme " + seed, result.isSatisfiable(), is(expected));
                if (expected) {
                    assertThat(satisfies(formula, result.getAssignment().get()), is(true));
                }
            }
        }
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
        SolverResult result = new CDCLSolver(formula).solve();

        assertThat(result.isSatisfiable(), is(true));
        Map<String, Boolean> model = result.getAssignment().get();
        assertThat(model.keySet().containsAll(formula.getVariables()), is(true));
        assertThat(expression.evaluate(model), is(true));
    }

    @Test
    public void testConflictProducesLearnedClause() throws SatException {
        // A=true porta a un conflitto: la clausola appresa forza !A al livello 0
        CNFFormula formula = new CNFFormula(ImmutableList.of(
                Clause.of(Literal.negative("A"), Literal.positive("B")),
                Clause.of(Literal.negative("A"), Literal.positive("C")),
                Clause.of(Literal.negative("B"), Literal.negative("C")),
                Clause.of(Literal.positive("A"), Literal.positive("D"))),
                ImmutableList.of("A", "B", "C", "D"));
        CDCLSolver solver = new CDCLSolver(formula);
        SolverResult result = solver.solve();

        assertThat(result.isSatisfiable(), is(true));
        assertThat(result.getAssignment().get().get("A"), is(false));
        assertThat(result.getAssignment().get().get("D"), is(true));
        assertThat(result.getStatistics().getConflicts(), is(1L));
        assertThat(solver.getLearnedClauses(), is(ImmutableList.of(Clause.of(Literal.negative("A")))));
    }

    @Test
    public void testUnitPropagationWithoutDecisions() throws LogicException {
        SolverResult result = new CDCLSolver(converter.convert(parser.parse("!A & (A | B)"))).solve();
        assertThat(result.getAssignment().get(), is(ImmutableMap.of("A", false, "B", true)));
        assertThat(result.getStatistics().getDecisions(), is(0L));
    }

    @Test
    public void testTrivialFormulas() throws SatException {
        SolverResult empty = new CDCLSolver(new CNFFormula(ImmutableList.of(), ImmutableList.of())).solve();
        assertThat(empty.isSatisfiable(), is(true));
        assertThat(empty.getAssignment().get().isEmpty(), is(true));

        CNFFormula withEmptyClause = new CNFFormula(
                ImmutableList.of(Clause.of(Literal.positive("A")), Clause.of(ImmutableList.of())),
                ImmutableList.of("A"));
        assertThat(new CDCLSolver(withEmptyClause).solve().isSatisfiable(), is(false));

        SolverResult unconstrained = new CDCLSolver(
                new CNFFormula(ImmutableList.of(), ImmutableList.of("A", "B"))).solve();
        assertThat(unconstrained.getAssignment().get(), is(ImmutableMap.of("A", true, "B", true)));
    }

    @Test
    public void testDeterministic() throws SatException {
        CNFFormula formula = random3Sat(7, 8, 30);
        CDCLSolver solver = new CDCLSolver(formula, 0, 3, true);
        assertThat(solver.solve(), is(solver.solve()));
        assertThat(new CDCLSolver(formula).solve(), is(new CDCLSolver(formula).solve()));
    }

    @Test
    public void testDecisionBudget() {
        SatException e = assertThrows(SatException.class, () -> new CDCLSolver(pigeonhole(4, 3), 1, 0, false).solve());
        assertThat(e.getStage(), is(Stage.SOLVE));
        assertThat(e.getDetail(), containsString("budget"));

        assertThrows(IllegalArgumentException.class, () -> new CDCLSolver(pigeonhole(2, 1), -1, 0, false));
        assertThrows(IllegalArgumentException.class, () -> new CDCLSolver(pigeonhole(2, 1), 0, -1, false));
    }

    @Test
    public void testInterruption() {
        Thread.currentThread().interrupt();
        try {
            SatException e = assertThrows(SatException.class, () -> new CDCLSolver(pigeonhole(3, 2)).solve());
            assertThat(e.getDetail(), containsString("interrotta"));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    public void testSolverTypeCreatesConfiguredSolver() {
        Solver cdcl = SolverType.CDCL.create(pigeonhole(2, 2), 0, true, true);
        assertThat(cdcl.getName(), is("CDCL"));
        assertThat(SolverType.DPLL.create(pigeonhole(2, 2), 0, false, false).getName(), is("DPLL"));
        assertThat(SolverType.fromName("cdcl"), is(SolverType.CDCL));
        assertThrows(IllegalArgumentException.class, () -> SolverType.fromName("walksat"));
    }
}
