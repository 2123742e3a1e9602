package net.littleredcomputer.cnfanalysis.report;

import net.littleredcomputer.cnfanalysis.features.FeatureReport;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Streams reports to an output. Each {@link #write} emits one entry immediately, so any number
 * of entries may follow each other; {@link #finish} closes the top level container.
 * {@link #close} finishes the document if that has not happened yet, so a writer used in a
 * try-with-resources block always leaves a well-formed document behind. The underlying stream
 * is flushed but never closed.
 */
public interface ReportWriter extends Closeable {

    /**
     * @param metadata keys carry the {@link FeatureReport#META_PREFIX}, which is not written
     * @param metrics  metric names and values
     */
    void write(Map<String, ?> metadata, Map<String, ?> metrics) throws IOException;

    default void write(FeatureReport report) throws IOException {
        write(report.metadata(), report.metrics());
    }

    void finish() throws IOException;
}
