package org.logic.engine;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.logic.cnf.CNFFormula;
import org.logic.errors.EvaluationException;
import org.logic.errors.LogicException;
import org.logic.errors.SatException;
import org.logic.errors.Stage;
import org.logic.sat.SolverResult;
import org.logic.sat.SolverType;

public class SatSystemTest {

    private static SatSystem system(CnfStrategy strategy) {
        return new SatSystem(EngineConfiguration.defaults().withCnfStrategy(strategy));
    }

    @ParameterizedTest
    @EnumSource(CnfStrategy.class)
    public void testBasicSatisfiability(CnfStrategy strategy) throws LogicException {
        SatSystem sat = system(strategy);
        assertThat(sat.solveExpression("A & !A").isSatisfiable(), is(false));

        SolverResult result = sat.solveExpression("A | B");
        assertThat(result.isSatisfiable(), is(true));
        Map<String, Boolean> model = result.getAssignment().get();
        assertThat(model.get("A") || model.get("B"), is(true));
    }

    @ParameterizedTest
    @EnumSource(CnfStrategy.class)
    public void testModelIsRestrictedToExpressionVariables(CnfStrategy strategy) throws LogicException {
        SolverResult result = system(strategy).solveExpression("(A <-> B) & (B ^ C)");
        Map<String, Boolean> model = result.getAssignment().get();

        assertThat(model.keySet(), contains("A", "B", "C"));
        assertThat(system(strategy).verifySolution("(A <-> B) & (B ^ C)", model), is(true));
    }

    @Test
    public void testTseitinKeepsAuxiliaryVariablesInCnf() throws LogicException {
        CNFFormula formula = system(CnfStrategy.TSEITIN).convertToCnf("(A & B) | C");
        assertThat(formula.getSourceVariables(), contains("A", "B", "C"));
        assertThat(formula.getVariableCount() > 3, is(true));

        CNFFormula distributive = system(CnfStrategy.DISTRIBUTIVE).convertToCnf("(A & B) | C");
        assertThat(distributive.getVariableCount(), is(3));
    }

    @Test
    public void testConstraints() throws LogicException {
        SatSystem sat = system(CnfStrategy.DISTRIBUTIVE);

        SolverResult constrained = sat.isSatisfiable("A | B", ImmutableMap.of("A", false));
        assertThat(constrained.getAssignment().get(), is(ImmutableMap.of("A", false, "B", true)));

        assertThat(sat.isSatisfiable("A", ImmutableMap.of("A", false)).isSatisfiable(), is(false));

        SolverResult extra = sat.isSatisfiable("A", ImmutableMap.of("Z", false));
        assertThat(extra.getAssignment().get(), is(ImmutableMap.of("A", true, "Z", false)));
    }

    @Test
    public void testMalformedConstraintsAreSolveErrors() {
        SatSystem sat = system(CnfStrategy.DISTRIBUTIVE);
        Map<String, Boolean> missingValue = new HashMap<>();
        missingValue.put("A", null);
        SatException noValue = assertThrows(SatException.class, () -> sat.isSatisfiable("A | B", missingValue));
        assertThat(noValue.getStage(), is(Stage.SOLVE));
        assertThat(noValue.getMessage(), containsString("A"));

        Map<String, Boolean> missingName = new HashMap<>();
        missingName.put(null, true);
        assertThrows(SatException.class, () -> sat.isSatisfiable("A | B", missingName));
        assertThrows(SatException.class, () -> sat.isSatisfiable("A | B", ImmutableMap.of("", true)));
    }

    @ParameterizedTest
    @EnumSource(CnfStrategy.class)
    public void testCdclConfiguration(CnfStrategy strategy) throws LogicException {
        SatSystem cdcl = new SatSystem(EngineConfiguration.defaults()
                .withCnfStrategy(strategy)
                .withSolverType(SolverType.CDCL)
                .withRestarts(true)
                .withSubsumption(true));

        SolverResult sat = cdcl.solveExpression("(A | B) & (!A | C) & (!C | !B)");
        assertThat(sat.isSatisfiable(), is(true));
        assertThat(cdcl.verifySolution("(A | B) & (!A | C) & (!C | !B)", sat.getAssignment().get()), is(true));

        assertThat(cdcl.solveExpression("(A <-> B) & (B <-> !A)").isSatisfiable(), is(false));
        assertThat(cdcl.isSatisfiable("A -> B", ImmutableMap.of("A", true, "B", false)).isSatisfiable(), is(false));
    }

    @Test
    public void testVerifySolution() throws LogicException {
        SatSystem sat = system(CnfStrategy.DISTRIBUTIVE);
        assertThat(sat.verifySolution("A -> B", ImmutableMap.of("A", true, "B", false)), is(false));
        assertThat(sat.verifySolution("A -> B", ImmutableMap.of("A", false, "B", false)), is(true));
        assertThrows(EvaluationException.class, () -> sat.verifySolution("A -> B", ImmutableMap.of("A", true)));
    }

    @Test
    public void testDecisionBudgetFromConfiguration() {
        SatSystem bounded = new SatSystem(EngineConfiguration.defaults().withMaxDecisions(1));
        // Servono due decisioni indipendenti: la seconda supera il budget
        SatException e = assertThrows(SatException.class, () -> bounded.solveExpression("(A | B) & (C | D)"));
        assertThat(e.getStage(), is(Stage.SOLVE));
        assertThat(bounded.getConfiguration().maxDecisions(), is(1L));
    }

    @Test
    public void testClauseLimitFromConfiguration() throws LogicException {
        SatSystem bounded = new SatSystem(EngineConfiguration.defaults().withMaxClauses(4));
        SatException e = assertThrows(SatException.class,
                () -> bounded.convertToCnf("(A & B) | (C & D) | (E & F)"));
        assertThat(e.getStage(), is(Stage.CONVERT));

        // La codifica di Tseitin non distribuisce e non ha limite di clausole
        SatSystem tseitin = new SatSystem(EngineConfiguration.defaults()
                .withMaxClauses(4).withCnfStrategy(CnfStrategy.TSEITIN));
        tseitin.validate("(A & B) | (C & D) | (E & F)");
        assertThat(tseitin.convertToCnf("(A & B) | (C & D) | (E & F)").getSourceVariables().size(), is(6));
    }
}
