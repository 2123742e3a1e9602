package net.littleredcomputer.cnfanalysis.dimacs;

/**
 * Base class of the errors raised when a formula's content is unacceptable: bad syntax,
 * a header that disagrees with the clauses, or literals outside the declared range.
 * Processing of the offending file cannot continue after one of these.
 */
public class FormulaException extends IllegalArgumentException {
    public FormulaException(String message) {
        super(message);
    }
}
