package net.littleredcomputer.cnfanalysis.features;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.math.Stats;
import com.google.common.math.StatsAccumulator;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.set.hash.TIntHashSet;
import gnu.trove.set.hash.TLongHashSet;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsFormatException;
import net.littleredcomputer.cnfanalysis.dimacs.FormulaException;
import net.littleredcomputer.cnfanalysis.ipasir.ClauseReadingSolver;
import net.littleredcomputer.cnfanalysis.ipasir.SolverState;
import net.littleredcomputer.cnfanalysis.ipasir.SolverStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Computes the features of a formula in one pass over its clauses. Feed it through the
 * IPASIR calls ({@link #headerLine}, {@link #add}); {@link #release} finalizes the statistics,
 * after which {@link #report} returns them.
 *
 * <p>Distribution statistics (clause lengths, positive literals per clause) cover distinct
 * clauses; structural counters (units, tautologies, XOR pairs, clause kinds) and variable
 * recurrence count every clause read.
 */
public class FeatureCollector extends ClauseReadingSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    // Largest variable for which 2v+1 literal nodes still fit in an array.
    private static final int MAX_VARIABLE = (Integer.MAX_VALUE - 2) / 2;

    private final MetricCatalog catalog;
    private final boolean validateHeader;
    private final ImmutableMap<String, String> metadata;

    private int nbvars;
    private int nbclauses;
    private boolean headerKnown = false;

    private final Set<TIntArrayList> clauses = new HashSet<>();
    private int clausesRead = 0;
    private int duplicates = 0;
    private final TIntIntHashMap literalOccurrences = new TIntIntHashMap();
    private UnionFind literalComponents;
    private UnionFind variableComponents;

    private final StatsAccumulator clauseLengths = new StatsAccumulator();
    private final StatsAccumulator positiveInClause = new StatsAccumulator();
    private final StatsAccumulator positiveRatio = new StatsAccumulator();
    private double positiveRatioEntropy = 0.0;

    private int positiveUnitClauses = 0;
    private int negativeUnitClauses = 0;
    private int twoLiteralClauses = 0;
    private int definiteClauses = 0;
    private int goalClauses = 0;
    private int tautologicalLiterals = 0;
    private int tautologicalClauses = 0;
    private boolean trueTrivial = true;
    private boolean falseTrivial = true;
    private int referenceLength = -1;
    private boolean uniformLength = true;
    private final TIntHashSet unitLiterals = new TIntHashSet();
    private int contradictoryVariable = 0;
    private final TLongHashSet xor2 = new TLongHashSet();
    private int xor2Count = 0;

    private FeatureReport report;

    /**
     * @param catalog        metrics this collector may emit
     * @param validateHeader when true, literals must lie within the declared variable range and
     *                       the final counts must agree with the header
     * @param metadata       report metadata; keys carry the {@link FeatureReport#META_PREFIX}
     */
    public FeatureCollector(MetricCatalog catalog, boolean validateHeader, Map<String, String> metadata) {
        super("features");
        this.catalog = catalog;
        this.validateHeader = validateHeader;
        this.metadata = ImmutableMap.copyOf(metadata);
    }

    public FeatureCollector(MetricCatalog catalog, boolean validateHeader) {
        this(catalog, validateHeader, ImmutableMap.of());
    }

    @Override
    public String signature() {
        return "IPASIR analyzer 2.0.0";
    }

    @Override
    protected void header(int nbvars, int nbclauses) {
        if (nbclauses < 1) throw new DimacsFormatException("DIMACS header must declare at least one clause");
        if (nbvars < 0 || nbvars > MAX_VARIABLE) throw new DimacsFormatException("Unsupported number of variables: " + nbvars);
        this.nbvars = nbvars;
        this.nbclauses = nbclauses;
        headerKnown = true;
        literalComponents = new UnionFind(2 * nbvars + 1);
        variableComponents = new UnionFind(nbvars + 1);
    }

    @Override
    protected void literal(int lit) {
        if (!headerKnown) throw new SolverStateException("literal before header");
        if (lit == Integer.MIN_VALUE) {
            // Has no variable: its absolute value does not fit in an int.
            if (validateHeader) throw new LiteralBoundException(lit, nbvars);
            throw new FormulaException("Literal " + lit + " is too large to be indexed");
        }
        final int v = Literals.thevar(lit);
        if (validateHeader && v > nbvars) throw new LiteralBoundException(lit, nbvars);
        if (v > MAX_VARIABLE) throw new FormulaException("Literal " + lit + " is too large to be indexed");
        if (v >= variableComponents.size()) {
            // Only reachable with header validation off: make room for the undeclared variable.
            variableComponents.grow(v + 1);
            literalComponents.grow(2 * v + 1);
        }
        literalOccurrences.adjustOrPutValue(lit, 1, 1);
    }

    @Override
    protected void endClause(int[] literals) {
        final int[] c = Literals.canonical(literals);
        final int n = c.length;
        ++clausesRead;

        final boolean fresh = clauses.add(new TIntArrayList(c));
        if (!fresh) {
            ++duplicates;
            log.warn("Clause duplicate: %s", new TIntArrayList(c));
        }

        for (int i = 1; i < n; ++i) {
            literalComponents.union(Literals.node(c[0]), Literals.node(c[i]));
            variableComponents.union(Literals.thevar(c[0]), Literals.thevar(c[i]));
        }

        int taut = 0;
        for (int i = 0; i + 1 < n; ++i) {
            if (c[i] == -c[i + 1]) ++taut;
        }
        tautologicalLiterals += taut;
        if (2 * taut == n) ++tautologicalClauses;

        int pos = 0;
        for (int l : c) if (l > 0) ++pos;
        if (pos == n) falseTrivial = false;
        if (pos == 0) {
            trueTrivial = false;
            ++goalClauses;
        }
        if (pos == 1) ++definiteClauses;

        if (n == 1) {
            if (c[0] > 0) ++positiveUnitClauses;
            else ++negativeUnitClauses;
        } else if (n == 2) {
            ++twoLiteralClauses;
            final int a = Math.min(c[0], c[1]);
            final int b = Math.max(c[0], c[1]);
            if (xor2.remove(Literals.pair(a, b))) ++xor2Count;
            else xor2.add(Literals.pair(-b, -a));
        }

        if (referenceLength < 0) referenceLength = n;
        else if (referenceLength != n) uniformLength = false;

        if (fresh) {
            clauseLengths.add(n);
            positiveInClause.add(pos);
            final double ratio = (double) pos / n;
            positiveRatio.add(ratio);
            positiveRatioEntropy += Distribution.entropyTerm(ratio);
            if (n == 1) {
                unitLiterals.add(c[0]);
                if (contradictoryVariable == 0 && unitLiterals.contains(-c[0])) contradictoryVariable = Literals.thevar(c[0]);
            }
        }
    }

    @Override
    protected void finish() {
        if (!headerKnown) throw new SolverStateException("released before a header was read");
        final int variableCount = variableCount();
        if (validateHeader && (variableCount != nbvars || clausesRead != nbclauses)) {
            throw new HeaderMismatchException(nbvars, nbclauses, variableCount, clausesRead);
        }
        if (clausesRead == 0) throw new DimacsFormatException("Formula contains no clauses");
        report = FeatureReport.of(metadata, computeMetrics());
        log.info("%s: %d clauses (%d distinct), %d variables, analyzed in %s",
                metadata.getOrDefault(FeatureReport.metaKey("filename"), "<stdin>"),
                clausesRead, clauses.size(), variableCount, stopwatch());
    }

    private int variableCount() {
        TIntHashSet variables = new TIntHashSet();
        literalOccurrences.forEachKey(l -> {
            variables.add(Literals.thevar(l));
            return true;
        });
        return variables.size();
    }

    /**
     * @return the report computed by {@link #release}
     * @throws SolverStateException if the collector has not been released yet
     */
    public FeatureReport report() {
        if (state() != SolverState.RELEASED || report == null) throw new SolverStateException("no report before release()");
        return report;
    }

    private Map<String, Object> computeMetrics() {
        Metrics m = new Metrics();
        m.put("nbvars", nbvars);
        m.put("nbclauses", nbclauses);

        m.put("clauses_count", clausesRead);
        m.put("clauses_unique_count", clauses.size());
        final Stats lengths = clauseLengths.snapshot();
        m.putDistribution("clauses_length", lengths);
        m.put("clauses_length_uniform", uniformLength);
        m.put("clauses_unit_positive_count", positiveUnitClauses);
        m.put("clauses_unit_negative_count", negativeUnitClauses);
        m.put("clauses_two_literals_count", twoLiteralClauses);
        m.put("clauses_definite_count", definiteClauses);
        m.put("clauses_goal_count", goalClauses);
        if (xor2Count > 0) m.put("xor2_count", xor2Count);
        if (tautologicalLiterals > 0) m.put("tautological_literals", tautologicalLiterals);
        if (tautologicalClauses > 0) m.put("tautological_clauses", tautologicalClauses);

        final Stats positives = positiveInClause.snapshot();
        m.put("literals_count", (long) lengths.sum());
        m.put("literals_unique_count", literalOccurrences.size());
        m.putDistribution("literals_positive_in_clauses", positives);
        m.put("literals_positive_ratio", positives.sum() / lengths.sum());
        m.put("literals_positive_in_clauses_ratio_mean", positiveRatio.mean());
        m.put("literals_positive_in_clauses_ratio_entropy", positiveRatioEntropy);
        putLiteralOccurrences(m);
        putUnitLiterals(m);

        putVariables(m);

        m.put("connected_literal_components_count", literalComponents.count() - 1);
        m.put("connected_variable_components_count", variableComponents.count() - 1);
        m.put("true_trivial", trueTrivial);
        m.put("false_trivial", falseTrivial);
        return m.build();
    }

    private void putLiteralOccurrences(Metrics m) {
        int once = 0, existentialPositive = 0, existentialNegative = 0;
        for (int l : literalOccurrences.keys()) {
            if (literalOccurrences.get(l) == 1) ++once;
            if (!literalOccurrences.containsKey(-l)) {
                if (l > 0) ++existentialPositive;
                else ++existentialNegative;
            }
        }
        m.put("literals_occurrence_one_count", once);
        m.put("literals_existential_count", existentialPositive + existentialNegative);
        if (existentialPositive > 0) m.put("literals_existential_positive_count", existentialPositive);
        if (existentialNegative > 0) m.put("literals_existential_negative_count", existentialNegative);
    }

    private void putUnitLiterals(Metrics m) {
        int positive = 0, negative = 0;
        for (int l : unitLiterals.toArray()) {
            if (l > 0) ++positive;
            else ++negative;
        }
        m.put("literals_unit_unique_count", unitLiterals.size());
        if (positive > 0) m.put("literals_unit_unique_positive_count", positive);
        if (negative > 0) m.put("literals_unit_unique_negative_count", negative);
        if (contradictoryVariable > 0) m.put("literals_unit_unique_contradictory_variable", contradictoryVariable);
    }

    private void putVariables(Metrics m) {
        TIntIntHashMap recurrence = new TIntIntHashMap();
        literalOccurrences.forEachEntry((l, count) -> {
            recurrence.adjustOrPutValue(Literals.thevar(l), count, count);
            return true;
        });
        int largest = 0, lowest = Integer.MAX_VALUE;
        StatsAccumulator rec = new StatsAccumulator();
        double entropy = 0.0;
        boolean frequenciesValid = true;
        for (int v : recurrence.keys()) {
            largest = Math.max(largest, v);
            lowest = Math.min(lowest, v);
            final int count = recurrence.get(v);
            rec.add(count);
            final double frequency = (double) count / clausesRead;
            if (frequency > 1.0) frequenciesValid = false;
            entropy += Distribution.entropyTerm(frequency);
        }
        final Stats recurrenceStats = rec.snapshot();
        m.put("variables_unique_count", recurrence.size());
        m.put("variables_largest", largest);
        m.put("variables_lowest", lowest);
        m.putDistribution("variables_recurrence", recurrenceStats);
        m.put("variables_recurrence_percent", recurrenceStats.mean() / clausesRead);
        if (frequenciesValid) m.put("variables_frequency_entropy", entropy);
    }

    private final class Metrics {
        private final ImmutableSortedMap.Builder<String, Object> b = ImmutableSortedMap.naturalOrder();

        void put(String name, Object value) {
            if (!catalog.contains(name)) throw new IllegalStateException("metric missing from catalog: " + name);
            b.put(name, value);
        }

        void putDistribution(String prefix, Stats s) {
            put(prefix + "_mean", s.mean());
            put(prefix + "_sd", Distribution.standardDeviation(s));
            put(prefix + "_sum", (long) s.sum());
            put(prefix + "_count", s.count());
            put(prefix + "_smallest", (long) s.min());
            put(prefix + "_largest", (long) s.max());
        }

        Map<String, Object> build() { return b.build(); }
    }
}
