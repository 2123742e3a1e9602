package net.littleredcomputer.cnfanalysis;

import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsReader;
import net.littleredcomputer.cnfanalysis.features.FeatureCollector;
import net.littleredcomputer.cnfanalysis.features.FeatureReport;
import net.littleredcomputer.cnfanalysis.features.MetricCatalog;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Analyses one DIMACS file: parses it, feeds the clauses to a {@link FeatureCollector} and
 * returns the finished report with its metadata attached.
 */
public class CnfAnalysis {
    private final MetricCatalog catalog;
    private boolean validateHeader = true;
    private DimacsReader.Mode mode = DimacsReader.Mode.STRICT;
    private boolean fullPath = false;
    private boolean computeDigests = false;
    private Charset charset = StandardCharsets.UTF_8;
    private Clock clock = Clock.systemUTC();
    private Duration logInterval = Duration.ofMillis(1000);

    public CnfAnalysis(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public CnfAnalysis() {
        this(MetricCatalog.standard());
    }

    /** When false, header counts and literal bounds are not checked. */
    public CnfAnalysis setValidateHeader(boolean validateHeader) {
        this.validateHeader = validateHeader;
        return this;
    }

    public CnfAnalysis setMultiline(boolean multiline) {
        this.mode = multiline ? DimacsReader.Mode.MULTILINE : DimacsReader.Mode.STRICT;
        return this;
    }

    /** Record the source as given instead of its base name. */
    public CnfAnalysis setFullPath(boolean fullPath) {
        this.fullPath = fullPath;
        return this;
    }

    public CnfAnalysis setComputeDigests(boolean computeDigests) {
        this.computeDigests = computeDigests;
        return this;
    }

    /** Encoding of files passed to {@link #analyze(Path)}; malformed input is replaced, not rejected. */
    public CnfAnalysis setCharset(Charset charset) {
        this.charset = charset;
        return this;
    }

    public CnfAnalysis setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public CnfAnalysis setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    @CheckReturnValue
    public FeatureReport analyze(Path source) throws IOException {
        try (Reader r = new BufferedReader(new InputStreamReader(Files.newInputStream(source), charset))) {
            return analyze(r, source);
        }
    }

    @CheckReturnValue
    public FeatureReport analyze(Reader r) throws IOException {
        return analyze(r, null);
    }

    /**
     * @param source the file r reads, if any; it names the report and is hashed when digests are requested
     */
    @CheckReturnValue
    public FeatureReport analyze(Reader r, @Nullable Path source) throws IOException {
        FeatureCollector collector = new FeatureCollector(catalog, validateHeader, metadata(source));
        collector.setLogInterval(logInterval);
        new DimacsReader(r, mode).feed(collector);
        collector.solve();
        collector.release();
        return collector.report();
    }

    ImmutableMap<String, String> metadata(@Nullable Path source) throws IOException {
        ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
        b.put(FeatureReport.metaKey("time"), clock.instant().toString());
        if (source != null) {
            Path name = fullPath ? source : source.getFileName();
            b.put(FeatureReport.metaKey("filename"), name.toString());
            if (computeDigests && Files.isRegularFile(source)) {
                SourceDigests.of(source).forEach((k, v) -> b.put(FeatureReport.metaKey(k), v));
            }
        }
        return b.build();
    }
}
