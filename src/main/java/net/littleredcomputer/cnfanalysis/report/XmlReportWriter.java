package net.littleredcomputer.cnfanalysis.report;

import net.littleredcomputer.cnfanalysis.features.FeatureReport;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Writes reports as XML:
 * <pre>
 * &lt;metrics&gt;
 *   &lt;file time="..." filename="..."&gt;
 *     &lt;metric clauses_count="42"/&gt;
 *     ...
 *   &lt;/file&gt;
 * &lt;/metrics&gt;
 * </pre>
 */
public class XmlReportWriter extends AbstractReportWriter {
    static final String ROOT = "metrics";
    static final String FILE = "file";
    static final String METRIC = "metric";

    private final OutputStream out;
    private final XMLStreamWriter xml;

    public XmlReportWriter(OutputStream out) throws IOException {
        this.out = out;
        try {
            xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
        } catch (XMLStreamException e) {
            throw new IOException("cannot create XML writer", e);
        }
    }

    @Override
    void startDocument() throws IOException {
        try {
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            xml.writeCharacters("\n");
            xml.writeStartElement(ROOT);
        } catch (XMLStreamException e) {
            throw new IOException(e);
        }
    }

    @Override
    void writeEntry(Map<String, ?> metadata, Map<String, ?> metrics) throws IOException {
        try {
            xml.writeCharacters("\n  ");
            xml.writeStartElement(FILE);
            for (Map.Entry<String, ?> e : metadata.entrySet()) {
                xml.writeAttribute(FeatureReport.attribute(e.getKey()), text(e.getValue()));
            }
            for (Map.Entry<String, ?> e : metrics.entrySet()) {
                xml.writeCharacters("\n    ");
                xml.writeEmptyElement(METRIC);
                xml.writeAttribute(e.getKey(), text(e.getValue()));
            }
            xml.writeCharacters("\n  ");
            xml.writeEndElement();
            xml.flush();
        } catch (XMLStreamException e) {
            throw new IOException(e);
        }
    }

    @Override
    void endDocument() throws IOException {
        try {
            xml.writeCharacters("\n");
            // Closes whatever elements a failed entry may have left open, then the root.
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException(e);
        }
        out.write('\n');
        out.flush();
    }
}
