package net.littleredcomputer.cnfanalysis.ipasir;

import java.util.function.Predicate;

/**
 * The incremental solver interface (IPASIR 1.1). Literals are non-zero DIMACS integers;
 * a zero passed to {@link #add} terminates the clause being built.
 */
public interface IpasirSolver {
    int UNKNOWN = 0;
    int SAT = 10;
    int UNSAT = 20;

    String signature();

    /**
     * Add a literal to the clause under construction, or close that clause with 0.
     */
    void add(int litOrZero);

    /**
     * Add an assumption for the next call to {@link #solve}.
     */
    void assume(int lit);

    /**
     * @return {@link #SAT}, {@link #UNSAT} or {@link #UNKNOWN} if the search was interrupted
     */
    int solve();

    /**
     * Truth value of lit in the satisfying assignment: lit if true, -lit if false, 0 if
     * irrelevant. Only legal directly after {@link #solve} returned {@link #SAT}.
     */
    int val(int lit);

    /**
     * Whether the assumption lit took part in refuting the formula. Only legal directly
     * after {@link #solve} returned {@link #UNSAT}.
     */
    boolean failed(int lit);

    /**
     * Install a callback polled during search; a true result asks the solver to stop.
     */
    <T> void setTerminate(T state, Predicate<? super T> terminate);

    /**
     * Release all resources. The solver cannot be used after this call.
     */
    void release();
}
