package net.littleredcomputer.cnfanalysis.features;

import net.littleredcomputer.cnfanalysis.dimacs.FormulaException;

import java.util.ArrayList;
import java.util.List;

/**
 * The counts claimed by the DIMACS p line disagree with what the formula actually contains.
 */
public class HeaderMismatchException extends FormulaException {
    private final int declaredVariables;
    private final int declaredClauses;
    private final int computedVariables;
    private final int computedClauses;

    public HeaderMismatchException(int declaredVariables, int declaredClauses, int computedVariables, int computedClauses) {
        super(message(declaredVariables, declaredClauses, computedVariables, computedClauses));
        this.declaredVariables = declaredVariables;
        this.declaredClauses = declaredClauses;
        this.computedVariables = computedVariables;
        this.computedClauses = computedClauses;
    }

    private static String message(int dv, int dc, int cv, int cc) {
        List<String> problems = new ArrayList<>(2);
        if (dv != cv) problems.add(String.format("Claimed number of variables is %d, but is actually %d", dv, cv));
        if (dc != cc) problems.add(String.format("Claimed number of clauses is %d, but is actually %d", dc, cc));
        return String.join("; ", problems);
    }

    public int declaredVariables() { return declaredVariables; }
    public int declaredClauses() { return declaredClauses; }
    public int computedVariables() { return computedVariables; }
    public int computedClauses() { return computedClauses; }
}
