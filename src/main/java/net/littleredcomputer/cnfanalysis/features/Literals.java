package net.littleredcomputer.cnfanalysis.features;

import java.util.Arrays;

/**
 * Conversions between DIMACS literals and the small integer ids used to index arrays.
 */
final class Literals {
    private Literals() {}

    /**
     * The [2v|2v+1] encoding: 2v for the literal v and 2v+1 for its negation.
     * Sorting encoded literals orders them by variable, and the positive literal of
     * a variable before the negative one.
     */
    static int encode(int literal) {
        return literal > 0 ? 2 * literal : -2 * literal + 1;
    }

    static int decode(int encoded) {
        int sign = ((encoded & 1) == 0) ? 1 : -1;
        return sign * (encoded >> 1);
    }

    static int thevar(int literal) { return Math.abs(literal); }

    /**
     * Node id of a signed literal in a partition of 2n+1 nodes: 2v for v, 2v-1 for -v.
     * Node 0 is never used.
     */
    static int node(int literal) {
        return literal > 0 ? 2 * literal : -2 * literal - 1;
    }

    /**
     * @return a new array holding the clause's literals in canonical order. Repeated literals are kept.
     */
    static int[] canonical(int[] clause) {
        int[] c = new int[clause.length];
        for (int i = 0; i < c.length; ++i) c[i] = encode(clause[i]);
        Arrays.sort(c);
        for (int i = 0; i < c.length; ++i) c[i] = decode(c[i]);
        return c;
    }

    /** Packs an ordered pair of literals into one long. */
    static long pair(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }
}
