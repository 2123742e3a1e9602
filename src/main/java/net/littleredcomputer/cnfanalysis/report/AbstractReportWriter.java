package net.littleredcomputer.cnfanalysis.report;

import net.littleredcomputer.cnfanalysis.features.FeatureReport;

import java.io.IOException;
import java.util.Map;

/**
 * Tracks whether the document has been opened and closed, and checks entries before a
 * backend sees them.
 */
abstract class AbstractReportWriter implements ReportWriter {
    private boolean started = false;
    private boolean finished = false;

    @Override
    public final void write(Map<String, ?> metadata, Map<String, ?> metrics) throws IOException {
        if (finished) throw new IllegalStateException("write() after finish()");
        metadata.forEach((k, v) -> {
            if (!FeatureReport.isMetaKey(k)) throw new IllegalArgumentException("metadata key lacks prefix: " + k);
            checkValue(k, v);
        });
        metrics.forEach((k, v) -> {
            if (FeatureReport.isMetaKey(k)) throw new IllegalArgumentException("metric key carries metadata prefix: " + k);
            checkValue(k, v);
        });
        if (!started) {
            started = true;
            startDocument();
        }
        writeEntry(metadata, metrics);
    }

    @Override
    public final void finish() throws IOException {
        if (finished) return;
        if (!started) {
            started = true;
            startDocument();
        }
        finished = true;
        endDocument();
    }

    @Override
    public void close() throws IOException {
        finish();
    }

    private static void checkValue(String key, Object v) {
        if (v == null) throw new IllegalArgumentException("null value for " + key);
        if (v instanceof Double && !Double.isFinite((Double) v) || v instanceof Float && !Float.isFinite((Float) v)) {
            throw new IllegalArgumentException("non-finite value for " + key);
        }
        if (!(v instanceof Number || v instanceof Boolean || v instanceof String)) {
            throw new IllegalArgumentException("unsupported value type " + v.getClass().getName() + " for " + key);
        }
    }

    /** Text form shared by every backend: numbers and booleans as {@link String#valueOf} renders them. */
    static String text(Object v) {
        return String.valueOf(v);
    }

    abstract void startDocument() throws IOException;

    abstract void writeEntry(Map<String, ?> metadata, Map<String, ?> metrics) throws IOException;

    abstract void endDocument() throws IOException;
}
