package net.littleredcomputer.cnfanalysis.report;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum ReportFormat {
    XML("xml") {
        @Override
        public ReportWriter newWriter(OutputStream out) throws IOException {
            return new XmlReportWriter(out);
        }
    },
    JSON("json") {
        @Override
        public ReportWriter newWriter(OutputStream out) throws IOException {
            return new JsonReportWriter(out);
        }
    };

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() { return extension; }

    public abstract ReportWriter newWriter(OutputStream out) throws IOException;

    public static Optional<ReportFormat> byName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "xml": return Optional.of(XML);
            case "json": return Optional.of(JSON);
            default: return Optional.empty();
        }
    }

    /**
     * Determine the format of an existing stats file, by its name if that is conclusive,
     * otherwise by its first non-blank character.
     * @throws IOException if the file is empty
     */
    public static ReportFormat detect(Path p) throws IOException {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xml")) return XML;
        if (name.endsWith(".json")) return JSON;
        try (InputStream in = Files.newInputStream(p)) {
            int c;
            do {
                c = in.read();
            } while (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == 0xEF || c == 0xBB || c == 0xBF);
            if (c < 0) throw new IOException("Cannot read features from empty file " + p);
            return c == '<' ? XML : JSON;
        }
    }
}
