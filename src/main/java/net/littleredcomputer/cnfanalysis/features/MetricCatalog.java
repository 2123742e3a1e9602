package net.littleredcomputer.cnfanalysis.features;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Optional;

/**
 * The metrics a report may contain, with their value types and documentation. The collector
 * refuses to emit a metric missing from its catalog, and readers use the catalog to type
 * values recovered from text. Instances are immutable and may be shared freely.
 */
public final class MetricCatalog {

    public static final class Definition {
        private final String name;
        private final String section;
        private final MetricType type;
        private final boolean always;
        private final String description;

        Definition(String name, String section, MetricType type, boolean always, String description) {
            this.name = name;
            this.section = section;
            this.type = type;
            this.always = always;
            this.description = description;
        }

        public String name() { return name; }
        public String section() { return section; }
        public MetricType type() { return type; }
        /** False for metrics that are only written when they apply (e.g. are non-zero). */
        public boolean always() { return always; }
        public String description() { return description; }
    }

    private static final String META_DOCUMENTATION =
            "time\n  UTC timestamp of the analysis, ISO 8601 combined date and time\n"
            + "filename\n  base name (or full path, if so configured) of the file analyzed; absent for stdin\n"
            + "md5sum, sha1sum\n  digests of the file analyzed (only when digests were requested)\n";

    private final ImmutableMap<String, Definition> definitions;

    private MetricCatalog(ImmutableMap<String, Definition> definitions) {
        this.definitions = definitions;
    }

    public static Builder builder() { return new Builder(); }

    public boolean contains(String name) { return definitions.containsKey(name); }

    public Optional<Definition> definition(String name) { return Optional.ofNullable(definitions.get(name)); }

    @Nullable
    public MetricType type(String name) {
        Definition d = definitions.get(name);
        return d == null ? null : d.type();
    }

    public Collection<Definition> definitions() { return definitions.values(); }

    /**
     * @return human readable documentation of the metadata attributes and every metric, by section
     */
    public String documentation() {
        StringBuilder sb = new StringBuilder();
        sb.append("Undocumented values might be lost in future releases.\n\n");
        appendHeading(sb, "Meta attributes");
        sb.append(META_DOCUMENTATION);
        String section = null;
        for (Definition d : definitions.values()) {
            if (!d.section().equals(section)) {
                section = d.section();
                sb.append('\n');
                appendHeading(sb, section);
            }
            sb.append(d.name()).append('\n').append("  ").append(d.description());
            if (!d.always()) sb.append(" (only written when it applies)");
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendHeading(StringBuilder sb, String heading) {
        sb.append(heading).append('\n');
        for (int i = 0; i < heading.length(); ++i) sb.append('=');
        sb.append('\n');
    }

    public static final class Builder {
        private final ImmutableMap.Builder<String, Definition> b = ImmutableMap.builder();
        private String section = "General";

        public Builder section(String section) {
            this.section = section;
            return this;
        }

        public Builder add(String name, MetricType type, String description) {
            b.put(name, new Definition(name, section, type, true, description));
            return this;
        }

        public Builder addOptional(String name, MetricType type, String description) {
            b.put(name, new Definition(name, section, type, false, description));
            return this;
        }

        /**
         * Adds the family prefix_{mean,sd,sum,count,smallest,largest} describing a list of integers.
         */
        public Builder addDistribution(String prefix, String what) {
            add(prefix + "_mean", MetricType.REAL, "Mean of " + what);
            add(prefix + "_sd", MetricType.REAL, "Standard deviation of " + what);
            add(prefix + "_sum", MetricType.INTEGER, "Sum of " + what);
            add(prefix + "_count", MetricType.INTEGER, "Number of values in " + what);
            add(prefix + "_smallest", MetricType.INTEGER, "Smallest of " + what);
            add(prefix + "_largest", MetricType.INTEGER, "Largest of " + what);
            return this;
        }

        public MetricCatalog build() { return new MetricCatalog(b.build()); }
    }

    private static final MetricCatalog STANDARD = builder()
            .section("Header")
            .add("nbvars", MetricType.INTEGER, "Number of variables claimed by the DIMACS header")
            .add("nbclauses", MetricType.INTEGER, "Number of clauses claimed by the DIMACS header")
            .section("Clauses")
            .add("clauses_count", MetricType.INTEGER, "Number of clauses in the file, duplicates included")
            .add("clauses_unique_count", MetricType.INTEGER,
                    "Number of distinct clauses. Differs from clauses_count only if duplicates exist")
            .addDistribution("clauses_length", "the lengths of distinct clauses")
            .add("clauses_length_uniform", MetricType.BOOLEAN, "true if all clauses have the same length")
            .add("clauses_unit_positive_count", MetricType.INTEGER, "Clauses consisting of one positive literal")
            .add("clauses_unit_negative_count", MetricType.INTEGER, "Clauses consisting of one negative literal")
            .add("clauses_two_literals_count", MetricType.INTEGER, "Clauses with exactly two literals")
            .add("clauses_definite_count", MetricType.INTEGER, "Clauses with exactly one positive literal")
            .add("clauses_goal_count", MetricType.INTEGER, "Clauses without any positive literal")
            .addOptional("xor2_count", MetricType.INTEGER,
                    "Number of times clauses {a,b} and {-a,-b} both occur")
            .addOptional("tautological_literals", MetricType.INTEGER,
                    "Number of times a variable occurs with both signs next to each other in a clause")
            .addOptional("tautological_clauses", MetricType.INTEGER,
                    "Clauses made up entirely of complementary literal pairs")
            .section("Literals")
            .add("literals_count", MetricType.INTEGER, "Total number of literals in distinct clauses")
            .add("literals_unique_count", MetricType.INTEGER, "Number of literals that occur at least once")
            .add("literals_occurrence_one_count", MetricType.INTEGER, "Number of literals that occur exactly once")
            .add("literals_existential_count", MetricType.INTEGER, "Variables that occur with one sign only")
            .addOptional("literals_existential_positive_count", MetricType.INTEGER,
                    "Variables that occur with positive sign only")
            .addOptional("literals_existential_negative_count", MetricType.INTEGER,
                    "Variables that occur with negative sign only")
            .addDistribution("literals_positive_in_clauses", "the number of positive literals per distinct clause")
            .add("literals_positive_ratio", MetricType.REAL, "Probability that a random literal is positive")
            .add("literals_positive_in_clauses_ratio_mean", MetricType.REAL,
                    "Mean of the per-clause ratio of positive literals")
            .add("literals_positive_in_clauses_ratio_entropy", MetricType.REAL,
                    "Entropy of the per-clause ratio of positive literals")
            .add("literals_unit_unique_count", MetricType.INTEGER, "Number of distinct unit clauses")
            .addOptional("literals_unit_unique_positive_count", MetricType.INTEGER,
                    "Number of distinct unit clauses with a positive literal")
            .addOptional("literals_unit_unique_negative_count", MetricType.INTEGER,
                    "Number of distinct unit clauses with a negative literal")
            .addOptional("literals_unit_unique_contradictory_variable", MetricType.INTEGER,
                    "A variable v for which both unit clauses v and -v occur")
            .section("Variables")
            .add("variables_unique_count", MetricType.INTEGER, "Number of variables that occur")
            .add("variables_largest", MetricType.INTEGER, "Numerically largest variable")
            .add("variables_lowest", MetricType.INTEGER, "Numerically smallest variable")
            .addDistribution("variables_recurrence", "the number of occurrences of each variable")
            .add("variables_recurrence_percent", MetricType.REAL,
                    "Mean occurrences of a variable divided by the number of clauses")
            .addOptional("variables_frequency_entropy", MetricType.REAL,
                    "Entropy of variable occurrences relative to the number of clauses"
                            + " (omitted if some variable occurs more often than there are clauses)")
            .section("Structure")
            .add("connected_literal_components_count", MetricType.INTEGER,
                    "Connected components of the graph joining literals that share a clause")
            .add("connected_variable_components_count", MetricType.INTEGER,
                    "Connected components of the graph joining variables that share a clause")
            .add("true_trivial", MetricType.BOOLEAN, "Every clause contains a positive literal")
            .add("false_trivial", MetricType.BOOLEAN, "Every clause contains a negative literal")
            .build();

    /**
     * @return the catalog of every metric {@link FeatureCollector} computes
     */
    public static MetricCatalog standard() { return STANDARD; }
}
