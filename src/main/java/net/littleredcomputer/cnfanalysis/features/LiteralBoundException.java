package net.littleredcomputer.cnfanalysis.features;

import net.littleredcomputer.cnfanalysis.dimacs.FormulaException;

public class LiteralBoundException extends FormulaException {
    private final int literal;
    private final int nbvars;

    public LiteralBoundException(int literal, int nbvars) {
        super(String.format("Literal %d not in [-%d, %d] derived from nbvars", literal, nbvars, nbvars));
        this.literal = literal;
        this.nbvars = nbvars;
    }

    public int literal() { return literal; }

    public int nbvars() { return nbvars; }
}
