package org.logic.expression;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.logic.expression.FormulaNode.and;
import static org.logic.expression.FormulaNode.constant;
import static org.logic.expression.FormulaNode.iff;
import static org.logic.expression.FormulaNode.implies;
import static org.logic.expression.FormulaNode.not;
import static org.logic.expression.FormulaNode.or;
import static org.logic.expression.FormulaNode.variable;
import static org.logic.expression.FormulaNode.xor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.errors.LexException;
import org.logic.errors.LogicException;
import org.logic.errors.ParseException;
import org.logic.errors.Stage;

public class ExpressionParserTest {

    private static final FormulaNode A = variable("A");
    private static final FormulaNode B = variable("B");
    private static final FormulaNode C = variable("C");

    private final ExpressionParser parser = new ExpressionParser();

    private FormulaNode root(String text) throws LogicException {
        return parser.parse(text).getRoot();
    }

    @Test
    public void testAndBindsTighterThanOr() throws LogicException {
        ParsedExpression expression = parser.parse("A | B & C");
        assertThat(expression.getRoot(), is(or(A, and(B, C))));
        assertThat(expression.evaluate(ImmutableMap.of("A", false, "B", true, "C", false)), is(false));
    }

    @Test
    public void testXorSitsBetweenAndAndOr() throws LogicException {
        assertThat(root("A | B ^ C"), is(or(A, xor(B, C))));
        assertThat(root("A ^ B & C"), is(xor(A, and(B, C))));
    }

    @Test
    public void testImplicationAndEquivalenceAreLowest() throws LogicException {
        assertThat(root("A | B -> C"), is(implies(or(A, B), C)));
        assertThat(root("A -> B <-> C"), is(iff(implies(A, B), C)));
    }

    @Test
    public void testBinaryOperatorsAreLeftAssociative() throws LogicException {
        assertThat(root("A -> B -> C"), is(implies(implies(A, B), C)));
        assertThat(root("A & B & C"), is(and(and(A, B), C)));
        assertThat(root("A <-> B <-> C"), is(iff(iff(A, B), C)));
    }

    @Test
    public void testNegationBindsTightest() throws LogicException {
        assertThat(root("!A & B"), is(and(not(A), B)));
        assertThat(root("!!A"), is(not(not(A))));
        assertThat(root("!(A & B)"), is(not(and(A, B))));
    }

    @Test
    public void testParenthesesOverridePrecedence() throws LogicException {
        assertThat(root("(A | B) & C"), is(and(or(A, B), C)));
    }

    @Test
    public void testNandAndNorAreDesugared() throws LogicException {
        assertThat(root("A nand B"), is(not(and(A, B))));
        assertThat(root("A nor B"), is(not(or(A, B))));
        assertThat(root("A nand B & C"), is(and(not(and(A, B)), C)));
    }

    @Test
    public void testConstants() throws LogicException {
        assertThat(root("true & F"), is(and(constant(true), constant(false))));
        assertThat(root("1 | 0"), is(or(constant(true), constant(false))));
    }

    @Test
    public void testVariablesInOrderOfFirstAppearance() throws LogicException {
        ParsedExpression expression = parser.parse("C & A | C & B");
        assertThat(expression.getVariables(), is(ImmutableList.of("C", "A", "B")));
        assertThat(parser.parse("true").getVariables().isEmpty(), is(true));
    }

    @Test
    public void testUnicodeAndAsciiFormsParseToSameTree() throws LogicException {
        assertThat(root("¬A ∧ B → C ↔ A ⊕ B"), is(root("!A & B -> C <-> A ^ B")));
        assertThat(root("not A and B implies C iff A xor B"), is(root("!A & B -> C <-> A ^ B")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"A &", "(A & B", "A # B", "", "   ", ")", "A)", "A B", "& A", "A & & B", "()", "!"})
    public void testMalformedInputIsRejected(String text) {
        LogicException e = assertThrows(LogicException.class, () -> parser.parse(text));
        assertThat(e.getStage() == Stage.LEX || e.getStage() == Stage.PARSE, is(true));
    }

    @Test
    public void testEmptyInput() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(""));
        assertThat(e.getFound(), is("input vuoto"));
        assertThat(e.getOffset(), is(0));
    }

    @Test
    public void testMissingOperandReportsEndOfInput() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("A &"));
        assertThat(e.getExpected(), is("operando"));
        assertThat(e.getOffset(), is(3));
    }

    @Test
    public void testUnclosedParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("(A & B"));
        assertThat(e.getExpected(), containsString("')'"));
        assertThat(e.getOffset(), is(6));
    }

    @Test
    public void testUnmatchedClosingParenthesis() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parse("A & B)"));
        assertThat(e.getExpected(), containsString("senza apertura"));
        assertThat(e.getOffset(), is(5));
    }

    @Test
    public void testLexicalErrorsPropagate() {
        LogicException e = assertThrows(LogicException.class, () -> parser.parse("A # B"));
        assertThat(e, instanceOf(LexException.class));
    }

    @Test
    public void testDeepNestingWithinDefaultLimit() throws LogicException {
        String parenthesized = "(".repeat(300) + "A" + ")".repeat(300);
        assertThat(root(parenthesized), is(A));

        FormulaNode negated = root("!".repeat(500) + "A");
        assertThat(negated.getHeight(), is(501));
        assertThat(ExpressionEvaluator.evaluate(negated, ImmutableMap.of("A", true)), is(true));
    }

    @Test
    public void testNestingLimit() throws LogicException {
        int limit = ExpressionParser.DEFAULT_MAX_NESTING_DEPTH;
        String tooDeep = "(".repeat(limit + 1) + "A" + ")".repeat(limit + 1);
        ParseException e = assertThrows(ParseException.class, () -> parser.parse(tooDeep));
        assertThat(e.getExpected(), containsString("annidamento"));
        assertThat(e.getOffset(), is(limit));

        ExpressionParser bounded = new ExpressionParser(10);
        assertThat(bounded.parse("(".repeat(10) + "A" + ")".repeat(10)).getRoot(), is(A));
        assertThrows(ParseException.class, () -> bounded.parse("!".repeat(11) + "A"));
        assertThrows(ParseException.class, () -> bounded.parse("!(".repeat(6) + "A" + ")".repeat(6)));
    }

    @Test
    public void testSiblingGroupsDoNotAccumulateDepth() throws LogicException {
        ExpressionParser bounded = new ExpressionParser(3);
        StringBuilder text = new StringBuilder("!(A)");
        for (int i = 0; i < 50; i++) {
            text.append(" & !(!x").append(i).append(')');
        }
        assertThat(bounded.parse(text.toString()).getVariables().size(), is(51));
    }

    @Test
    public void testLongFlatChainParsesAndEvaluates() throws LogicException {
        int operands = 10_000;
        StringBuilder text = new StringBuilder("x0");
        for (int i = 1; i < operands; i++) {
            text.append(" | x").append(i);
        }
        ParsedExpression expression = parser.parse(text.toString());
        assertThat(expression.getVariables().size(), is(operands));
        assertThat(expression.getRoot().getHeight(), is(operands));

        Map<String, Boolean> assignment = new HashMap<>();
        for (int i = 0; i < operands; i++) {
            assignment.put("x" + i, false);
        }
        assertThat(expression.evaluate(assignment), is(false));
        assignment.put("x" + (operands - 1), true);
        assertThat(expression.evaluate(assignment), is(true));
        assertThat(expression.toString().length() > operands, is(true));
    }

    @Test
    public void testInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ExpressionParser(0));
    }

    @Test
    public void testToStringIsFullyParenthesized() throws LogicException {
        assertThat(parser.parse("A | !B & true").toString(), is("(A ∨ (¬B ∧ ⊤))"));
    }
}
