package org.logic.sat;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.logic.cnf.Clause;
import org.logic.cnf.Literal;

public class SubsumptionPrincipleTest {

    private static final Literal P = Literal.positive("P");
    private static final Literal Q = Literal.positive("Q");
    private static final Literal R = Literal.positive("R");
    private static final Literal A = Literal.positive("A");
    private static final Literal B = Literal.positive("B");

    @Test
    public void testRedundantClausesRemoved() {
        // (P) ∧ (¬R ∨ ¬Q) ∧ (P ∨ Q ∨ ¬R) ∧ (A ∨ ¬R ∨ B ∨ ¬Q) ∧ (R ∨ ¬Q)
        Clause unit = Clause.of(P);
        Clause binary = Clause.of(R.negate(), Q.negate());
        Clause mixed = Clause.of(R, Q.negate());
        List<Clause> clauses = ImmutableList.of(
                unit,
                binary,
                Clause.of(P, Q, R.negate()),
                Clause.of(A, R.negate(), B, Q.negate()),
                mixed);

        SubsumptionPrinciple subsumption = new SubsumptionPrinciple();
        List<Clause> result = subsumption.applySubsumption(clauses);

        assertThat(result, contains(unit, binary, mixed));
        assertThat(subsumption.getEliminatedClausesCount(), is(2));
    }

    @Test
    public void testOriginalOrderKeptAndDuplicatesCollapsed() {
        Clause wide = Clause.of(A, B);
        Clause narrow = Clause.of(Q);
        List<Clause> result = new SubsumptionPrinciple()
                .applySubsumption(ImmutableList.of(wide, narrow, Clause.of(B, A), Clause.of(Q)));

        assertThat(result, contains(wide, narrow));
    }

    @Test
    public void testSubsumes() {
        assertThat(SubsumptionPrinciple.subsumes(Clause.of(P), Clause.of(P, Q)), is(true));
        assertThat(SubsumptionPrinciple.subsumes(Clause.of(P, Q), Clause.of(P)), is(false));
        assertThat(SubsumptionPrinciple.subsumes(Clause.of(P.negate()), Clause.of(P, Q)), is(false));
        assertThat(SubsumptionPrinciple.subsumes(Clause.of(ImmutableList.of()), Clause.of(P)), is(true));
    }

    @Test
    public void testCountAccumulatesAcrossCalls() {
        SubsumptionPrinciple subsumption = new SubsumptionPrinciple();
        subsumption.applySubsumption(ImmutableList.of(Clause.of(P), Clause.of(P, Q)));
        subsumption.applySubsumption(ImmutableList.of(Clause.of(Q), Clause.of(Q, R)));
        assertThat(subsumption.getEliminatedClausesCount(), is(2));
    }
}
