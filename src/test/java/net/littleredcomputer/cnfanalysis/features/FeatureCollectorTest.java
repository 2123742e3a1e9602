package net.littleredcomputer.cnfanalysis.features;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsFormatException;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsReader;
import net.littleredcomputer.cnfanalysis.dimacs.FormulaException;
import net.littleredcomputer.cnfanalysis.ipasir.IpasirSolver;
import net.littleredcomputer.cnfanalysis.ipasir.SolverStateException;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class FeatureCollectorTest {

    private static FeatureReport analyze(Reader r, boolean validateHeader) {
        FeatureCollector c = new FeatureCollector(MetricCatalog.standard(), validateHeader);
        try {
            DimacsReader.strict(r).feed(c);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        assertThat(c.solve(), is(IpasirSolver.UNSAT));
        c.release();
        return c.report();
    }

    private static FeatureReport analyze(String cnf) {
        return analyze(new StringReader(cnf), true);
    }

    private static FeatureReport analyzeUnchecked(String cnf) {
        return analyze(new StringReader(cnf), false);
    }

    private FeatureReport resource(String name) {
        return analyze(new InputStreamReader(getClass().getClassLoader().getResourceAsStream(name),
                StandardCharsets.US_ASCII), true);
    }

    @Test
    public void singleClause() {
        FeatureReport r = analyze("p cnf 3 1\n1 2 3 0\n");
        assertThat(r.longMetric("clauses_count"), is(1L));
        assertThat(r.longMetric("literals_count"), is(3L));
        assertThat(r.longMetric("variables_unique_count"), is(3L));
        assertThat(r.doubleMetric("literals_positive_ratio"), is(1.0));
        assertThat(r.longMetric("literals_unit_unique_count"), is(0L));
        assertThat(r.doubleMetric("clauses_length_mean"), is(3.0));
        assertThat(r.doubleMetric("clauses_length_sd"), is(0.0));
        assertThat(r.booleanMetric("true_trivial"), is(true));
        assertThat(r.booleanMetric("false_trivial"), is(false));
        assertThat(r.booleanMetric("clauses_length_uniform"), is(true));
        assertThat(r.longMetric("connected_variable_components_count"), is(1L));
        assertThat(r.longMetric("connected_literal_components_count"), is(4L));
        assertThat(r.doubleMetric("variables_recurrence_percent"), is(1.0));
        assertThat(r.doubleMetric("variables_frequency_entropy"), closeTo(0.0, 1e-12));
        assertThat(r.longMetric("literals_existential_count"), is(3L));
        assertThat(r.longMetric("literals_existential_positive_count"), is(3L));
        assertThat(r.metrics(), not(hasKey("literals_existential_negative_count")));
        assertThat(r.metrics(), not(hasKey("xor2_count")));
        assertThat(r.metrics(), not(hasKey("tautological_literals")));
    }

    @Test
    public void contradictoryUnits() {
        FeatureReport r = analyze("p cnf 1 2\n1 0\n-1 0\n");
        assertThat(r.longMetric("literals_unit_unique_count"), is(2L));
        assertThat(r.longMetric("literals_unit_unique_positive_count"), is(1L));
        assertThat(r.longMetric("literals_unit_unique_negative_count"), is(1L));
        assertThat(r.longMetric("literals_unit_unique_contradictory_variable"), is(1L));
        assertThat(r.longMetric("clauses_unit_positive_count"), is(1L));
        assertThat(r.longMetric("clauses_unit_negative_count"), is(1L));
        assertThat(r.longMetric("literals_existential_count"), is(0L));
    }

    @Test
    public void repeatedUnitsCountOnce() {
        FeatureReport r = analyze("p cnf 2 3\n1 0\n1 0\n2 -1 0\n");
        assertThat(r.longMetric("literals_unit_unique_count"), is(1L));
        assertThat(r.longMetric("literals_unit_unique_positive_count"), is(1L));
        assertThat(r.longMetric("clauses_unit_positive_count"), is(2L));
        assertThat(r.metrics(), not(hasKey("literals_unit_unique_negative_count")));
        assertThat(r.metrics(), not(hasKey("literals_unit_unique_contradictory_variable")));
    }

    @Test
    public void tautologicalClause() {
        FeatureReport r = analyze("p cnf 1 1\n1 -1 0\n");
        assertThat(r.longMetric("tautological_literals"), is(1L));
        assertThat(r.longMetric("tautological_clauses"), is(1L));
    }

    @Test
    public void partlyTautologicalClauses() {
        FeatureReport full = analyze("p cnf 2 1\n-2 1 2 -1 0\n");
        assertThat(full.longMetric("tautological_literals"), is(2L));
        assertThat(full.longMetric("tautological_clauses"), is(1L));
        FeatureReport part = analyze("p cnf 2 1\n1 -1 2 0\n");
        assertThat(part.longMetric("tautological_literals"), is(1L));
        assertThat(part.metrics(), not(hasKey("tautological_clauses")));
    }

    @Test(expected = DimacsFormatException.class)
    public void prematureTerminator() {
        analyze("p cnf 1 2\n0 1 0\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void emptyClauseThroughTheSolverInterface() {
        FeatureCollector c = new FeatureCollector(MetricCatalog.standard(), true);
        c.headerLine(1, 1);
        c.add(0);
    }

    @Test
    public void missingClause() {
        try {
            analyze("p cnf 3 2\n1 2 3 0\n");
            fail("expected a header mismatch");
        } catch (HeaderMismatchException e) {
            assertThat(e.declaredClauses(), is(2));
            assertThat(e.computedClauses(), is(1));
            assertThat(e.declaredVariables(), is(3));
            assertThat(e.computedVariables(), is(3));
            assertThat(e.getMessage(), is("Claimed number of clauses is 2, but is actually 1"));
        }
    }

    @Test
    public void unusedVariable() {
        try {
            analyze("p cnf 4 1\n1 2 3 0\n");
            fail("expected a header mismatch");
        } catch (HeaderMismatchException e) {
            assertThat(e.getMessage(), containsString("variables is 4, but is actually 3"));
        }
        FeatureReport r = analyzeUnchecked("p cnf 4 1\n1 2 3 0\n");
        assertThat(r.longMetric("nbvars"), is(4L));
        assertThat(r.longMetric("variables_unique_count"), is(3L));
    }

    @Test(expected = LiteralBoundException.class)
    public void literalOutOfBounds() {
        analyze("p cnf 2 1\n1 3 0\n");
    }

    @Test
    public void literalOutOfBoundsWithoutValidation() {
        FeatureReport r = analyzeUnchecked("p cnf 2 1\n1 -3 0\n");
        assertThat(r.longMetric("variables_largest"), is(3L));
        assertThat(r.longMetric("variables_lowest"), is(1L));
        assertThat(r.longMetric("variables_unique_count"), is(2L));
        // Variable 2 is declared but unused, so it forms a component of its own.
        assertThat(r.longMetric("connected_variable_components_count"), is(2L));
    }

    @Test
    public void smallestIntIsOutOfBounds() {
        FeatureCollector unit = new FeatureCollector(MetricCatalog.standard(), true);
        unit.headerLine(1, 1);
        try {
            unit.add(Integer.MIN_VALUE);
            fail("expected a bound violation");
        } catch (LiteralBoundException e) {
            assertThat(e.literal(), is(Integer.MIN_VALUE));
            assertThat(e.nbvars(), is(1));
        }
        FeatureCollector longer = new FeatureCollector(MetricCatalog.standard(), true);
        longer.headerLine(1, 1);
        longer.add(1);
        try {
            longer.add(Integer.MIN_VALUE);
            fail("expected a bound violation");
        } catch (LiteralBoundException e) {
            assertThat(e.literal(), is(Integer.MIN_VALUE));
        }
    }

    @Test
    public void smallestIntRejectedWithoutValidation() {
        FeatureCollector c = new FeatureCollector(MetricCatalog.standard(), false);
        c.headerLine(1, 1);
        c.add(1);
        try {
            c.add(Integer.MIN_VALUE);
            fail("expected a formula error");
        } catch (FormulaException e) {
            assertThat(e, not(instanceOf(LiteralBoundException.class)));
        }
    }

    @Test(expected = DimacsFormatException.class)
    public void headerWithoutClauses() {
        analyze("p cnf 0 0\n");
    }

    @Test
    public void duplicatesIgnoreLiteralOrder() {
        FeatureReport r = analyze("p cnf 3 3\n1 -2 3 0\n3 1 -2 0\n-2 3 1 0\n");
        assertThat(r.longMetric("clauses_count"), is(3L));
        assertThat(r.longMetric("clauses_unique_count"), is(1L));
        assertThat(r.longMetric("clauses_length_count"), is(1L));
        assertThat(r.longMetric("literals_count"), is(3L));
        assertThat(r.longMetric("variables_recurrence_sum"), is(9L));
        assertThat(r.doubleMetric("variables_recurrence_mean"), is(3.0));
        assertThat(r.doubleMetric("variables_recurrence_percent"), is(1.0));
    }

    @Test
    public void polarity() {
        FeatureReport r = analyze("p cnf 3 3\n1 2 0\n-1 3 0\n-2 -3 -1 0\n");
        assertThat(r.doubleMetric("literals_positive_ratio"), closeTo(3.0 / 7.0, 1e-12));
        assertThat(r.doubleMetric("literals_positive_in_clauses_ratio_mean"), closeTo(0.5, 1e-12));
        assertThat(r.doubleMetric("literals_positive_in_clauses_ratio_entropy"), closeTo(0.5, 1e-12));
        assertThat(r.longMetric("literals_positive_in_clauses_sum"), is(3L));
        assertThat(r.longMetric("literals_positive_in_clauses_largest"), is(2L));
        assertThat(r.longMetric("literals_positive_in_clauses_smallest"), is(0L));
        assertThat(r.longMetric("clauses_definite_count"), is(1L));
        assertThat(r.longMetric("clauses_goal_count"), is(1L));
        assertThat(r.longMetric("clauses_two_literals_count"), is(2L));
        assertThat(r.booleanMetric("true_trivial"), is(false));
        assertThat(r.booleanMetric("false_trivial"), is(false));
        assertThat(r.booleanMetric("clauses_length_uniform"), is(false));
        assertThat(r.doubleMetric("clauses_length_mean"), closeTo(7.0 / 3.0, 1e-12));
        assertThat(r.doubleMetric("clauses_length_sd"), closeTo(Math.sqrt(1.0 / 3.0), 1e-12));
        assertThat(r.longMetric("clauses_length_smallest"), is(2L));
        assertThat(r.longMetric("clauses_length_largest"), is(3L));
        assertThat(r.longMetric("literals_existential_count"), is(0L));
        assertThat(r.longMetric("literals_occurrence_one_count"), is(5L));
        assertThat(r.longMetric("literals_unique_count"), is(6L));
    }

    @Test
    public void existentialLiteralsBySign() {
        FeatureReport r = analyze("p cnf 3 2\n1 -2 0\n1 3 0\n");
        assertThat(r.longMetric("literals_existential_count"), is(3L));
        assertThat(r.longMetric("literals_existential_positive_count"), is(2L));
        assertThat(r.longMetric("literals_existential_negative_count"), is(1L));
    }

    @Test
    public void components() {
        FeatureReport r = analyze("p cnf 4 3\n1 2 0\n2 3 0\n4 0\n");
        assertThat(r.longMetric("connected_variable_components_count"), is(2L));
        assertThat(r.longMetric("connected_literal_components_count"), is(6L));
    }

    @Test
    public void disjointUnitsAreSeparateComponents() {
        FeatureReport r = analyze("p cnf 3 3\n1 0\n-2 0\n3 0\n");
        assertThat(r.longMetric("connected_variable_components_count"), is(3L));
        assertThat(r.longMetric("connected_literal_components_count"), is(6L));
    }

    @Test
    public void xorPairs() {
        FeatureReport r = resource("xor.cnf");
        assertThat(r.longMetric("xor2_count"), is(2L));
        assertThat(r.longMetric("clauses_count"), is(5L));
        assertThat(r.longMetric("clauses_unique_count"), is(4L));
        assertThat(r.longMetric("clauses_two_literals_count"), is(5L));
    }

    @Test
    public void xorPairsInEitherOrder() {
        assertThat(analyze("p cnf 2 2\n-2 -1 0\n1 2 0\n").longMetric("xor2_count"), is(1L));
        assertThat(analyze("p cnf 2 2\n1 -2 0\n2 -1 0\n").longMetric("xor2_count"), is(1L));
        assertThat(analyze("p cnf 2 2\n1 2 0\n2 1 0\n").metrics(), not(hasKey("xor2_count")));
    }

    @Test
    public void frequencyEntropyOmittedWhenUndefined() {
        FeatureReport r = analyze("p cnf 1 1\n1 1 1 0\n");
        assertThat(r.metrics(), not(hasKey("variables_frequency_entropy")));
        assertThat(r.longMetric("variables_recurrence_largest"), is(3L));
    }

    @Test
    public void simpleFixture() {
        FeatureReport r = resource("simple.cnf");
        assertThat(r.longMetric("nbvars"), is(3L));
        assertThat(r.longMetric("nbclauses"), is(2L));
        assertThat(r.longMetric("literals_count"), is(5L));
        assertThat(r.doubleMetric("clauses_length_mean"), is(2.5));
        assertThat(r.doubleMetric("clauses_length_sd"), is(0.5));
        assertThat(r.longMetric("connected_variable_components_count"), is(1L));
    }

    @Test
    public void everyStandardMetricIsCatalogued() {
        MetricCatalog catalog = MetricCatalog.standard();
        FeatureReport r = analyze("p cnf 3 2\n1 -2 0\n2 3 -1 0\n");
        for (String name : r.metrics().keySet()) {
            assertThat(name, catalog.contains(name), is(true));
        }
        for (MetricCatalog.Definition d : catalog.definitions()) {
            if (d.always()) assertThat(r.metrics(), hasKey(d.name()));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void catalogLimitsMetrics() {
        MetricCatalog tiny = MetricCatalog.builder()
                .section("Header")
                .add("nbvars", MetricType.INTEGER, "variables")
                .build();
        FeatureCollector c = new FeatureCollector(tiny, true);
        c.headerLine(1, 1);
        c.add(1);
        c.add(0);
        c.release();
    }

    @Test
    public void metadataIsCarried() {
        FeatureCollector c = new FeatureCollector(MetricCatalog.standard(), true,
                ImmutableMap.of("@filename", "x.cnf"));
        c.headerLine(1, 1);
        c.add(-1);
        c.add(0);
        c.release();
        assertThat(c.report().metadata(), hasEntry("@filename", (Object) "x.cnf"));
    }

    @Test(expected = SolverStateException.class)
    public void noReportBeforeRelease() {
        FeatureCollector c = new FeatureCollector(MetricCatalog.standard(), true);
        c.headerLine(1, 1);
        c.add(1);
        c.add(0);
        c.report();
    }

    @Test
    public void signature() {
        assertThat(new FeatureCollector(MetricCatalog.standard(), true).signature(), is("IPASIR analyzer 2.0.0"));
    }
}
