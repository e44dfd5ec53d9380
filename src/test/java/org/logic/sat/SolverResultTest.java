package org.logic.sat;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class SolverResultTest {

    @Test
    public void testRestrictToKeepsRequestedOrder() {
        Map<String, Boolean> model = new LinkedHashMap<>();
        model.put("A", true);
        model.put("$t1", false);
        model.put("B", false);
        SolverResult result = SolverResult.satisfiable(model, new SolverStatistics());

        SolverResult restricted = result.restrictTo(ImmutableList.of("B", "A"));
        assertThat(restricted.getAssignment().get(), is(ImmutableMap.of("B", false, "A", true)));
        assertThat(restricted.getAssignment().get().keySet().iterator().next(), is("B"));
    }

    @Test
    public void testUnsatisfiableIgnoresRestriction() {
        SolverResult result = SolverResult.unsatisfiable(new SolverStatistics());
        assertThat(result.restrictTo(ImmutableList.of("A")).isSatisfiable(), is(false));
    }

    @Test
    public void testRendering() {
        Map<String, Boolean> model = new LinkedHashMap<>();
        model.put("A", true);
        model.put("B", false);
        SolverResult result = SolverResult.satisfiable(model, new SolverStatistics());

        assertThat(result.toString(), is("SAT\nModello:\n  A = true\n  B = false\n"));
        assertThat(SolverResult.unsatisfiable(new SolverStatistics()).toString(), is("UNSAT"));
    }

    @Test
    public void testStatisticsCounters() {
        SolverStatistics statistics = new SolverStatistics();
        statistics.incrementDecisions();
        statistics.incrementDecisions();
        statistics.incrementConflicts();
        assertThat(statistics.getDecisions(), is(2L));
        assertThat(statistics.getConflicts(), is(1L));
        assertThat(statistics.isTimerStopped(), is(false));

        statistics.stopTimer();
        assertThat(statistics.isTimerStopped(), is(true));
    }
}
