package net.littleredcomputer.cnfanalysis;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.cnfanalysis.dimacs.FormulaException;
import net.littleredcomputer.cnfanalysis.features.FeatureReport;
import net.littleredcomputer.cnfanalysis.features.MetricCatalog;
import net.littleredcomputer.cnfanalysis.report.ReportFormat;
import net.littleredcomputer.cnfanalysis.report.ReportWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final String CNF_EXTENSION = ".cnf";

    private static Options options() {
        return new Options()
                .addOption("format", true, "output format: xml or json (default json)")
                .addOption("ignoreheader", false, "do not check the DIMACS header against the clauses")
                .addOption("multiline", false, "clauses may span lines and share them")
                .addOption("stdout", false, "write the report to standard output instead of a stats file")
                .addOption("fullpath", false, "record the file name as given rather than its base name")
                .addOption("hashes", false, "record md5 and sha1 digests of the input file")
                .addOption("description", false, "describe the computed metrics and exit")
                .addOption("encoding", true, "character encoding of the input (default utf-8)")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static ReportFormat format(CommandLine cmd) {
        String f = cmd.getOptionValue("format", "json");
        return ReportFormat.byName(f).orElseGet(() -> {
            log.warn("Unknown format %s, using json", f);
            return ReportFormat.JSON;
        });
    }

    private static Charset charset(CommandLine cmd) throws ParseException {
        String name = cmd.getOptionValue("encoding", "utf-8");
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ParseException("Unknown encoding: " + name);
        }
    }

    private static Duration logInterval(CommandLine cmd) throws ParseException {
        String interval = cmd.getOptionValue("loginterval", "PT1S");
        try {
            return Duration.parse(interval);
        } catch (DateTimeParseException e) {
            throw new ParseException("Invalid -loginterval " + interval + ", expected ISO-8601 like PT0.5S");
        }
    }

    private static CnfAnalysis analysis(CommandLine cmd, Charset charset) throws ParseException {
        return new CnfAnalysis(MetricCatalog.standard())
                .setValidateHeader(!cmd.hasOption("ignoreheader"))
                .setMultiline(cmd.hasOption("multiline"))
                .setFullPath(cmd.hasOption("fullpath"))
                .setComputeDigests(cmd.hasOption("hashes"))
                .setCharset(charset)
                .setLogInterval(logInterval(cmd));
    }

    /** foo.cnf becomes foo.stats.json; any other name just gets .stats.json appended. */
    static Path statsFile(Path source, ReportFormat format) {
        String name = source.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(CNF_EXTENSION)) {
            name = name.substring(0, name.length() - CNF_EXTENSION.length());
        }
        return source.resolveSibling(name + ".stats." + format.extension());
    }

    /**
     * @return the process exit status
     */
    static int run(String[] args, InputStream stdin, PrintStream stdout) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (cmd.hasOption("description")) {
            stdout.print(MetricCatalog.standard().documentation());
            stdout.flush();
            return 0;
        }
        List<String> files = cmd.getArgList();
        if (files.size() > 1) throw new ParseException("Expected a single DIMACS file, got " + files.size());
        ReportFormat format = format(cmd);
        Charset charset = charset(cmd);
        CnfAnalysis analysis = analysis(cmd, charset);
        Stopwatch sw = Stopwatch.createStarted();
        if (files.isEmpty() || files.get(0).equals("-")) {
            log.info("Reading DIMACS from standard input");
            FeatureReport report = analysis.analyze(new BufferedReader(new InputStreamReader(stdin, charset)));
            try (ReportWriter w = format.newWriter(stdout)) {
                w.write(report);
            }
        } else if (cmd.hasOption("stdout")) {
            Path source = Paths.get(files.get(0));
            FeatureReport report = analysis.analyze(source);
            try (ReportWriter w = format.newWriter(stdout)) {
                w.write(report);
            }
        } else {
            Path source = Paths.get(files.get(0));
            Path target = statsFile(source, format);
            try (OutputStream out = Files.newOutputStream(target);
                 ReportWriter w = format.newWriter(out)) {
                w.write(analysis.analyze(source));
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(target);
                throw e;
            }
            log.info("Wrote %s", target);
        }
        log.info("Done in %s", sw.stop());
        return 0;
    }

    public static void main(String[] args) throws IOException {
        int status;
        try {
            status = run(args, System.in, System.out);
        } catch (ParseException e) {
            log.error("%s", e.getMessage());
            new HelpFormatter().printHelp("cnf-analysis [options] <file|->", options());
            status = 2;
        } catch (FormulaException e) {
            log.error("Invalid formula: %s", e.getMessage());
            status = 1;
        }
        System.exit(status);
    }
}
