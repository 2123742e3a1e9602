package net.littleredcomputer.cnfanalysis.report;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonStreamContext;
import net.littleredcomputer.cnfanalysis.features.FeatureReport;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Writes reports as JSON:
 * <pre>
 * {"metrics": [{"time": "...", "filename": "...", "metric": {"clauses_count": 42, ...}}, ...]}
 * </pre>
 */
public class JsonReportWriter extends AbstractReportWriter {
    static final String ROOT = "metrics";
    static final String METRIC = "metric";

    private final JsonGenerator json;

    public JsonReportWriter(OutputStream out) throws IOException {
        json = new JsonFactory()
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .createGenerator(out, JsonEncoding.UTF8)
                .useDefaultPrettyPrinter();
    }

    @Override
    void startDocument() throws IOException {
        json.writeStartObject();
        json.writeArrayFieldStart(ROOT);
    }

    @Override
    void writeEntry(Map<String, ?> metadata, Map<String, ?> metrics) throws IOException {
        json.writeStartObject();
        for (Map.Entry<String, ?> e : metadata.entrySet()) {
            json.writeFieldName(FeatureReport.attribute(e.getKey()));
            writeValue(e.getValue());
        }
        json.writeObjectFieldStart(METRIC);
        for (Map.Entry<String, ?> e : metrics.entrySet()) {
            json.writeFieldName(e.getKey());
            writeValue(e.getValue());
        }
        json.writeEndObject();
        json.writeEndObject();
        json.flush();
    }

    private void writeValue(Object v) throws IOException {
        if (v instanceof Boolean) json.writeBoolean((Boolean) v);
        else if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            json.writeNumber(((Number) v).longValue());
        } else if (v instanceof Double || v instanceof Float) json.writeNumber(((Number) v).doubleValue());
        else if (v instanceof BigInteger) json.writeNumber((BigInteger) v);
        else if (v instanceof BigDecimal) json.writeNumber((BigDecimal) v);
        else if (v instanceof Number) json.writeNumber(text(v));
        else json.writeString(text(v));
    }

    @Override
    void endDocument() throws IOException {
        // Unwind whatever a failed entry left open; the outermost two levels are the root array and object.
        JsonStreamContext ctx = json.getOutputContext();
        while (!ctx.inRoot()) {
            if (ctx.inArray()) json.writeEndArray();
            else json.writeEndObject();
            ctx = json.getOutputContext();
        }
        json.writeRaw('\n');
        json.close();
    }
}
