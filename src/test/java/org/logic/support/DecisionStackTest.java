package org.logic.support;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;

public class DecisionStackTest {

    private static final Clause UNIT_B = Clause.of(Literal.negative("A"), Literal.positive("B"));

    @Test
    public void testLevelsFollowDecisions() {
        DecisionStack stack = new DecisionStack();
        assertThat(stack.getLevel(), is(0));
        assertThat(stack.getTopDecision(), is(nullValue()));

        stack.addDecision("A", true, false);
        stack.addImpliedLiteral("B", true, UNIT_B);
        assertThat(stack.getLevel(), is(1));
        assertThat(stack.getTotalAssignments(), is(2));
        assertThat(stack.getTopDecision().getVariable(), is("A"));
        assertThat(stack.getAssignmentsAtLevel(1).get(1).getAncestorClause(), is(UNIT_B));

        List<AssignedLiteral> removed = stack.deleteLevel();
        assertThat(removed.size(), is(2));
        assertThat(stack.getLevel(), is(0));
        assertThat(stack.getTotalAssignments(), is(0));
    }

    @Test
    public void testLevelZeroIsNeverRemoved() {
        DecisionStack stack = new DecisionStack();
        stack.addImpliedLiteral("B", false, UNIT_B);

        assertThat(stack.deleteLevel(), is(empty()));
        assertThat(stack.getTotalAssignments(), is(1));
        assertThat(stack.getAssignmentsAtLevel(0).get(0).isImplication(), is(true));
    }

    @Test
    public void testLevelIndexOutOfRange() {
        DecisionStack stack = new DecisionStack();
        assertThrows(IndexOutOfBoundsException.class, () -> stack.getAssignmentsAtLevel(1));
        assertThrows(IndexOutOfBoundsException.class, () -> stack.getAssignmentsAtLevel(-1));
    }

    @Test
    public void testAssignedLiteralKinds() {
        AssignedLiteral decision = AssignedLiteral.decision("A", false, true);
        assertThat(decision.isDecision(), is(true));
        assertThat(decision.isSecondBranch(), is(true));
        assertThat(decision.getAncestorClause(), is(nullValue()));

        AssignedLiteral implication = AssignedLiteral.implication("B", true, UNIT_B);
        assertThat(implication.isImplication(), is(true));
        assertThat(implication.isSecondBranch(), is(false));

        assertThrows(NullPointerException.class, () -> AssignedLiteral.implication("B", true, null));
        assertThrows(IllegalArgumentException.class, () -> AssignedLiteral.decision("", true, false));
    }
}
