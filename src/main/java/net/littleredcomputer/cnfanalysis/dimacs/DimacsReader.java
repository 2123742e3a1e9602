package net.littleredcomputer.cnfanalysis.dimacs;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads DIMACS CNF text lazily, one line at a time, as the flat integer sequence
 * <pre>nbvars, nbclauses, l, l, ..., 0, l, ..., 0, ...</pre>
 * The final element is always a clause terminator. Syntax errors are reported as
 * {@link DimacsFormatException}s carrying the offending line number.
 */
public class DimacsReader implements PrimitiveIterator.OfInt {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern integerRe = Pattern.compile("-?[0-9]+");
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    public enum Mode {
        /** One clause per line, each line terminated by 0. */
        STRICT,
        /** Clauses may span lines; '%' starts a comment and a lone '%' ends the input. */
        MULTILINE,
    }

    private final BufferedReader reader;
    private final Mode mode;
    private final TIntArrayList buffer = new TIntArrayList();
    private int cursor = 0;
    private int lineNumber = 0;
    private boolean headerSeen = false;
    private int pending = 0;  // literals of the open clause (multiline mode)
    private boolean exhausted = false;

    public DimacsReader(Reader r, Mode mode) {
        this.reader = r instanceof BufferedReader ? (BufferedReader) r : new BufferedReader(r);
        this.mode = mode;
    }

    public static DimacsReader strict(Reader r) { return new DimacsReader(r, Mode.STRICT); }

    public static DimacsReader multiline(Reader r) { return new DimacsReader(r, Mode.MULTILINE); }

    public static DimacsReader of(String s, Mode mode) { return new DimacsReader(new StringReader(s), mode); }

    public int lineNumber() { return lineNumber; }

    /**
     * Hand the whole stream to sink: the two header values to {@link DimacsSink#headerLine},
     * everything after that to {@link DimacsSink#add}.
     */
    public void feed(DimacsSink sink) throws IOException {
        try {
            final int nbvars = nextInt();
            final int nbclauses = nextInt();
            sink.headerLine(nbvars, nbclauses);
            while (hasNext()) sink.add(nextInt());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public boolean hasNext() {
        fill();
        return cursor < buffer.size();
    }

    @Override
    public int nextInt() {
        if (!hasNext()) throw new NoSuchElementException();
        return buffer.get(cursor++);
    }

    private void fill() {
        while (cursor >= buffer.size() && !exhausted) {
            buffer.resetQuick();
            cursor = 0;
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (line == null) {
                exhausted = true;
                atEnd();
            } else {
                ++lineNumber;
                if (mode == Mode.STRICT) strictLine(line);
                else multilineLine(line);
            }
        }
    }

    private void atEnd() {
        if (!headerSeen) throw new DimacsFormatException("Not a DIMACS file: no header found");
        if (pending > 0) {
            // The last clause may omit its terminator.
            buffer.add(0);
            pending = 0;
        }
    }

    private void header(int nbvars, int nbclauses) {
        log.debug("header: %d variables, %d clauses", nbvars, nbclauses);
        headerSeen = true;
        buffer.add(nbvars);
        buffer.add(nbclauses);
    }

    private int parseCount(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new DimacsFormatException("Header value out of range: " + s, lineNumber);
        }
    }

    private int parseLiteral(String s) {
        if (!integerRe.matcher(s).matches()) throw new DimacsFormatException("Not an integer: " + s, lineNumber);
        int l;
        try {
            l = Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new DimacsFormatException("Literal out of range: " + s, lineNumber);
        }
        if (l == Integer.MIN_VALUE) throw new DimacsFormatException("Literal out of range: " + s, lineNumber);
        return l;
    }

    private void strictLine(String line) {
        String s = line.trim();
        if (s.isEmpty() || s.charAt(0) == 'c') return;
        if (s.charAt(0) == 'p') {
            if (headerSeen) throw new DimacsFormatException("Unexpected DIMACS header", lineNumber);
            Matcher m = pLineRe.matcher(s);
            if (!m.matches()) throw new DimacsFormatException("Invalid header line", lineNumber);
            header(parseCount(m.group(1)), parseCount(m.group(2)));
            return;
        }
        if (!headerSeen) throw new DimacsFormatException("Expected header, unexpected clause", lineNumber);
        List<String> tokens = splitter.splitToList(s);
        final int n = tokens.size();
        if (n < 2 || !tokens.get(n - 1).equals("0")) {
            throw new DimacsFormatException("Clause line must hold literals terminated by 0", lineNumber);
        }
        for (int i = 0; i < n - 1; ++i) {
            int l = parseLiteral(tokens.get(i));
            if (l == 0) throw new DimacsFormatException("Literal must not be 0", lineNumber);
            buffer.add(l);
        }
        buffer.add(0);
    }

    private void multilineLine(String line) {
        String s = line.trim();
        if (s.isEmpty() || s.charAt(0) == 'c') return;
        if (s.charAt(0) == '%') {
            // Some generators (SATLIB among them) close the file with a lone '%'.
            if (s.equals("%")) {
                exhausted = true;
                atEnd();
            }
            return;
        }
        List<String> parts = splitter.splitToList(s);
        if (!headerSeen) {
            if (!parts.get(0).equalsIgnoreCase("p")) throw new DimacsFormatException("Invalid DIMACS header", lineNumber);
            if (parts.size() < 2 || !parts.get(1).equalsIgnoreCase("cnf")) {
                throw new DimacsFormatException("DIMACS header must name format cnf", lineNumber);
            }
            if (parts.size() != 4) throw new DimacsFormatException("DIMACS header must have 4 fields", lineNumber);
            if (!integerRe.matcher(parts.get(2)).matches() || !integerRe.matcher(parts.get(3)).matches()
                    || parts.get(2).startsWith("-") || parts.get(3).startsWith("-")) {
                throw new DimacsFormatException("Invalid header line", lineNumber);
            }
            header(parseCount(parts.get(2)), parseCount(parts.get(3)));
            return;
        }
        if (parts.get(0).equalsIgnoreCase("p")) throw new DimacsFormatException("Unexpected DIMACS header", lineNumber);
        for (String part : parts) {
            int l = parseLiteral(part);
            if (l == 0) {
                if (pending == 0) throw new DimacsFormatException("Empty clause", lineNumber);
                pending = 0;
            } else {
                ++pending;
            }
            buffer.add(l);
        }
    }
}
