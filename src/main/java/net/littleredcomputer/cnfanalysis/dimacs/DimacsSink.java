package net.littleredcomputer.cnfanalysis.dimacs;

/**
 * Receiver of a parsed DIMACS stream: the header once, then literals and clause-terminating zeros.
 */
public interface DimacsSink {
    void headerLine(int nbvars, int nbclauses);

    void add(int litOrZero);
}
