package org.logic.cnf;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.errors.LogicException;
import org.logic.expression.ExpressionParser;
import org.logic.expression.ParsedExpression;
import org.logic.sat.DPLLSolver;
import org.logic.sat.SolverResult;

public class TseitinConverterTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final TseitinConverter tseitin = new TseitinConverter();
    private final CNFConverter distributive = new CNFConverter();

    @Test
    public void testLongChainEncodesOneAuxiliaryPerOperator() throws LogicException {
        StringBuilder chain = new StringBuilder("x0");
        for (int i = 1; i < 10_000; i++) {
            chain.append(i % 2 == 0 ? " | x" : " & x").append(i);
        }
        CNFFormula formula = tseitin.convert(parser.parse(chain.toString()));

        assertThat(formula.getSourceVariables().size(), is(10_000));
        assertThat(formula.getVariableCount(), is(10_000 + 9_999));
    }

    @Test
    public void testAuxiliaryVariablesFollowSourceVariables() throws LogicException {
        CNFFormula formula = tseitin.convert(parser.parse("A & B | C"));

        assertThat(formula.getSourceVariables(), contains("A", "B", "C"));
        assertThat(formula.getVariables(), contains("A", "B", "C", "$t1", "$t2"));
        for (String variable : formula.getVariables().subList(3, 5)) {
            assertThat(variable, startsWith(TseitinConverter.AUXILIARY_PREFIX));
        }
    }

    @Test
    public void testSharedSubformulaIsEncodedOnce() throws LogicException {
        CNFFormula formula = tseitin.convert(parser.parse("(A & B) | (A & B)"));
        assertThat(formula.getVariables(), contains("A", "B", "$t1", "$t2"));
    }

    @Test
    public void testLiteralsNeedNoAuxiliaryVariables() throws LogicException {
        assertThat(tseitin.convert(parser.parse("A")).toString(), is("(A)"));
        assertThat(tseitin.convert(parser.parse("!A")).toString(), is("(¬A)"));
    }

    @Test
    public void testConstantsAreFolded() throws LogicException {
        assertThat(tseitin.convert(parser.parse("A | true")).isEmpty(), is(true));
        assertThat(tseitin.convert(parser.parse("A & false")).hasEmptyClause(), is(true));
        assertThat(tseitin.convert(parser.parse("A & true")).toString(), is("(A)"));
        assertThat(tseitin.convert(parser.parse("true -> A")).toString(), is("(A)"));
        assertThat(tseitin.convert(parser.parse("A -> false")).toString(), is("(¬A)"));
        assertThat(tseitin.convert(parser.parse("A ^ true")).toString(), is("(¬A)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "A & !A",
            "A | B",
            "(A -> B) & (B -> C) & A & !C",
            "A ^ B ^ C",
            "(A <-> B) & (A ^ B)",
            "!(A & B) <-> (!A | !B)",
            "(A nor B) | (C nand A)"})
    public void testEquisatisfiableWithDistributiveConversion(String text) throws LogicException {
        ParsedExpression expression = parser.parse(text);
        SolverResult viaTseitin = new DPLLSolver(tseitin.convert(expression)).solve();
        SolverResult viaDistribution = new DPLLSolver(distributive.convert(expression)).solve();

        assertThat(viaTseitin.isSatisfiable(), is(viaDistribution.isSatisfiable()));
        if (viaTseitin.isSatisfiable()) {
            Map<String, Boolean> projected = viaTseitin.restrictTo(expression.getVariables()).getAssignment().get();
            assertThat(new ArrayList<>(projected.keySet()), is(expression.getVariables()));
            assertThat(expression.evaluate(projected), is(true));
        }
    }

    @Test
    public void testEveryOriginalModelExtendsToEncoding() throws LogicException {
        ParsedExpression expression = parser.parse("(A | B) & !(A & B)");
        CNFFormula formula = tseitin.convert(expression);
        List<String> variables = expression.getVariables();

        for (int row = 0; row < 1 << variables.size(); row++) {
            Map<String, Boolean> assignment = CnfAssertions.assignment(variables, row);
            List<Clause> units = new ArrayList<>();
            assignment.forEach((variable, value) -> units.add(Clause.of(new Literal(variable, !value))));

            boolean extendable = new DPLLSolver(formula.withClauses(units)).solve().isSatisfiable();
            assertThat(extendable, is(expression.evaluate(assignment)));
        }
    }
}
