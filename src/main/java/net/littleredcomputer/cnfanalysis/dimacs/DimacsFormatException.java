package net.littleredcomputer.cnfanalysis.dimacs;

import java.util.OptionalInt;

public class DimacsFormatException extends FormulaException {
    private final int lineNumber;  // 1-based; 0 when unknown

    public DimacsFormatException(String message) {
        this(message, 0);
    }

    public DimacsFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? message + " at line " + lineNumber : message);
        this.lineNumber = lineNumber;
    }

    public OptionalInt lineNumber() {
        return lineNumber > 0 ? OptionalInt.of(lineNumber) : OptionalInt.empty();
    }
}
