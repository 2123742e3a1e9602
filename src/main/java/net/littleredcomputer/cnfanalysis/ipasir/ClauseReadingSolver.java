package net.littleredcomputer.cnfanalysis.ipasir;

import gnu.trove.list.array.TIntArrayList;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsFormatException;
import net.littleredcomputer.cnfanalysis.dimacs.DimacsSink;

/**
 * An IPASIR solver that only reads its formula. Literals handed to {@link #add} are gathered
 * into clauses and announced to subclasses through the hooks {@link #header}, {@link #startClause},
 * {@link #literal}, {@link #endClause} and {@link #finish}. No search is ever performed:
 * {@link #solve} answers {@link #UNSAT} as a matter of protocol, not as a verdict on the formula.
 */
public abstract class ClauseReadingSolver extends AbstractIpasirSolver implements DimacsSink {
    private final TIntArrayList clause = new TIntArrayList();
    private boolean activeClause = false;
    private boolean headerSeen = false;
    private boolean anyLiteral = false;
    private boolean finishing = false;

    protected ClauseReadingSolver(String name) {
        super(name);
    }

    @Override
    public void headerLine(int nbvars, int nbclauses) {
        if (state() == SolverState.RELEASED) throw new SolverStateException("header after release");
        if (headerSeen) throw new SolverStateException("header announced twice");
        if (anyLiteral) throw new SolverStateException("header announced after clause data");
        headerSeen = true;
        header(nbvars, nbclauses);
    }

    @Override
    public void add(int litOrZero) {
        super.add(litOrZero);
        if (!headerSeen) throw new SolverStateException("clause data before header");
        if (litOrZero == 0) {
            if (!activeClause) throw new DimacsFormatException("Empty clause");
            int[] literals = clause.toArray();
            clause.resetQuick();
            activeClause = false;
            endClause(literals);
        } else {
            if (!activeClause) {
                activeClause = true;
                startClause();
            }
            anyLiteral = true;
            literal(litOrZero);
            clause.add(litOrZero);
        }
    }

    @Override
    public void assume(int lit) {
        require(SolverState.Operation.ASSUME);
        throw new UnsupportedOperationException("Assumptions are not supported");
    }

    @Override
    public int solve() {
        if (activeClause) throw new SolverStateException("solve() called inside an unterminated clause");
        return super.solve();
    }

    @Override
    protected int search() {
        return UNSAT;
    }

    @Override
    public void release() {
        if (activeClause) throw new SolverStateException("release() called inside an unterminated clause");
        require(SolverState.Operation.RELEASE);
        if (finishing) throw new SolverStateException("release() called again after a failed finish");
        finishing = true;
        finish();
        super.release();
    }

    boolean clauseOpen() { return activeClause; }

    /** Called once with the values of the DIMACS p line, before any clause. */
    protected void header(int nbvars, int nbclauses) {}

    /** Called on the first literal of each clause, before {@link #literal} sees it. */
    protected void startClause() {}

    protected void literal(int lit) {}

    /**
     * Called when a clause is terminated by 0.
     * @param literals the clause's literals in input order; the array belongs to the callee
     */
    protected void endClause(int[] literals) {}

    /** Called exactly once by {@link #release}, after the last clause. */
    protected void finish() {}
}
