package net.littleredcomputer.cnfanalysis.ipasir;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the IPASIR protocol, each with the set of operations it permits.
 */
public enum SolverState {
    INPUT(EnumSet.of(Operation.ADD, Operation.ASSUME, Operation.SOLVE, Operation.RELEASE, Operation.SET_TERMINATE)),
    SAT(EnumSet.of(Operation.ADD, Operation.ASSUME, Operation.SOLVE, Operation.RELEASE, Operation.SET_TERMINATE,
            Operation.VAL)),
    UNSAT(EnumSet.of(Operation.ADD, Operation.ASSUME, Operation.SOLVE, Operation.RELEASE, Operation.SET_TERMINATE,
            Operation.FAILED)),
    RELEASED(EnumSet.noneOf(Operation.class));

    public enum Operation {
        ADD,
        ASSUME,
        SOLVE,
        VAL,
        FAILED,
        SET_TERMINATE,
        RELEASE,
    }

    private final Set<Operation> permitted;

    SolverState(EnumSet<Operation> permitted) {
        this.permitted = permitted;
    }

    public boolean permits(Operation op) {
        return permitted.contains(op);
    }

    static SolverState afterSolve(int result) {
        switch (result) {
            case IpasirSolver.SAT: return SAT;
            case IpasirSolver.UNSAT: return UNSAT;
            case IpasirSolver.UNKNOWN: return INPUT;
            default: throw new IllegalArgumentException("unknown solve result: " + result);
        }
    }
}
