package net.littleredcomputer.cnfanalysis.report;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.littleredcomputer.cnfanalysis.features.FeatureReport;
import net.littleredcomputer.cnfanalysis.features.MetricCatalog;
import net.littleredcomputer.cnfanalysis.features.MetricType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Reads stats files written by {@link XmlReportWriter} or {@link JsonReportWriter} back into
 * {@link FeatureReport}s, one entry at a time. Metadata attributes regain their
 * {@link FeatureReport#META_PREFIX}. XML carries every value as text; those are typed by the
 * catalog, or by their shape when the catalog does not know the metric.
 */
public class ReportReader {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Pattern integerRe = Pattern.compile("-?[0-9]+");
    // Element names of the older "features" layout, still accepted.
    private static final String LEGACY_ROOT = "features";
    private static final String LEGACY_METRIC = "featuring";

    private final MetricCatalog catalog;
    private final ObjectMapper mapper = new ObjectMapper();

    public ReportReader(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public List<FeatureReport> readAll(Path p) throws IOException {
        ReportFormat format = ReportFormat.detect(p);
        try (InputStream in = Files.newInputStream(p)) {
            return readAll(in, format);
        }
    }

    public List<FeatureReport> readAll(InputStream in, ReportFormat format) throws IOException {
        List<FeatureReport> reports = new ArrayList<>();
        read(in, format, reports::add);
        return reports;
    }

    public void read(InputStream in, ReportFormat format, Consumer<FeatureReport> sink) throws IOException {
        switch (format) {
            case XML: readXml(in, sink); break;
            case JSON: readJson(in, sink); break;
            default: throw new IllegalArgumentException("unknown format " + format);
        }
    }

    private void readXml(InputStream in, Consumer<FeatureReport> sink) throws IOException {
        XMLInputFactory factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        try {
            XMLStreamReader xml = factory.createXMLStreamReader(in);
            Map<String, Object> meta = null;
            Map<String, Object> metrics = null;
            boolean rootSeen = false;
            while (xml.hasNext()) {
                int event = xml.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    String name = xml.getLocalName();
                    if (!rootSeen) {
                        if (!name.equals(XmlReportWriter.ROOT) && !name.equals(LEGACY_ROOT)) {
                            throw new IOException("Invalid stats file XML structure: unexpected root element " + name);
                        }
                        rootSeen = true;
                    } else if (name.equals(XmlReportWriter.FILE)) {
                        meta = new LinkedHashMap<>();
                        metrics = new LinkedHashMap<>();
                        for (int i = 0; i < xml.getAttributeCount(); ++i) {
                            meta.put(FeatureReport.metaKey(xml.getAttributeLocalName(i)), xml.getAttributeValue(i));
                        }
                    } else if (name.equals(XmlReportWriter.METRIC) || name.equals(LEGACY_METRIC)) {
                        if (metrics == null) throw new IOException("Invalid stats file XML structure: metric outside file");
                        for (int i = 0; i < xml.getAttributeCount(); ++i) {
                            String key = xml.getAttributeLocalName(i);
                            metrics.put(key, typed(key, xml.getAttributeValue(i)));
                        }
                    }
                } else if (event == XMLStreamConstants.END_ELEMENT && xml.getLocalName().equals(XmlReportWriter.FILE)) {
                    sink.accept(FeatureReport.of(meta, metrics));
                    meta = null;
                    metrics = null;
                }
            }
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Invalid stats file XML structure", e);
        }
    }

    private void readJson(InputStream in, Consumer<FeatureReport> sink) throws IOException {
        try (JsonParser p = mapper.getFactory().createParser(in)) {
            if (p.nextToken() != JsonToken.START_OBJECT) throw new IOException("stats file must hold a JSON object");
            while (p.nextToken() == JsonToken.FIELD_NAME) {
                String field = p.getCurrentName();
                JsonToken t = p.nextToken();
                if (!field.equals(JsonReportWriter.ROOT)) {
                    p.skipChildren();
                    continue;
                }
                if (t != JsonToken.START_ARRAY) throw new IOException("\"metrics\" must be an array");
                while (p.nextToken() == JsonToken.START_OBJECT) {
                    JsonNode entry = mapper.readTree(p);
                    sink.accept(entry(entry));
                }
            }
        }
    }

    private FeatureReport entry(JsonNode entry) throws IOException {
        Map<String, Object> meta = new LinkedHashMap<>();
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = entry.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> f = it.next();
            if (f.getKey().equals(JsonReportWriter.METRIC)) {
                if (!f.getValue().isObject()) throw new IOException("\"metric\" must be an object");
                for (Iterator<Map.Entry<String, JsonNode>> m = f.getValue().fields(); m.hasNext(); ) {
                    Map.Entry<String, JsonNode> metric = m.next();
                    metrics.put(metric.getKey(), value(metric.getKey(), metric.getValue()));
                }
            } else {
                JsonNode v = f.getValue();
                meta.put(FeatureReport.metaKey(f.getKey()), v.isTextual() ? v.textValue() : v.toString());
            }
        }
        return FeatureReport.of(meta, metrics);
    }

    private Object value(String key, JsonNode v) throws IOException {
        if (v.isBoolean()) return v.booleanValue();
        if (v.isIntegralNumber()) return v.longValue();
        if (v.isNumber()) return v.doubleValue();
        if (v.isTextual()) return typed(key, v.textValue());
        throw new IOException("unsupported value for metric " + key + ": " + v);
    }

    Object typed(String key, String text) {
        MetricType type = catalog.type(key);
        if (type != null) {
            try {
                return type.parse(text);
            } catch (IllegalArgumentException e) {
                log.warn("metric %s: %s is not of type %s", key, text, type);
                return text;
            }
        }
        log.debug("metric %s is not in the catalog", key);
        String t = text.trim();
        if (t.equals("true") || t.equals("false")) return Boolean.valueOf(t);
        if (integerRe.matcher(t).matches()) {
            try {
                return Long.parseLong(t);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        try {
            return Double.parseDouble(t);
        } catch (NumberFormatException e) {
            return text;
        }
    }
}
