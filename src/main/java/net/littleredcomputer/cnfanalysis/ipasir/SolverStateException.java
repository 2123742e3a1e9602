package net.littleredcomputer.cnfanalysis.ipasir;

/**
 * An operation was invoked in a state of the solver protocol that does not permit it.
 * This is an integration error of the caller, never a property of the input data.
 */
public class SolverStateException extends IllegalStateException {
    public SolverStateException(String message) {
        super(message);
    }
}
