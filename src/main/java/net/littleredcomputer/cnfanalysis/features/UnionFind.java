package net.littleredcomputer.cnfanalysis.features;

import java.util.Arrays;

/**
 * Weighted quick-union with path halving over the ids [0, size). Every id starts out
 * as its own component.
 */
class UnionFind {
    private int[] parent;
    private int[] size;
    private int count;

    UnionFind(int n) {
        if (n < 0) throw new IllegalArgumentException("negative size");
        parent = new int[n];
        size = new int[n];
        for (int i = 0; i < n; ++i) {
            parent[i] = i;
            size[i] = 1;
        }
        count = n;
    }

    int size() { return parent.length; }

    /** Number of components, including those of ids never passed to {@link #union}. */
    int count() { return count; }

    int find(int p) {
        while (p != parent[p]) {
            parent[p] = parent[parent[p]];
            p = parent[p];
        }
        return p;
    }

    boolean connected(int p, int q) {
        return find(p) == find(q);
    }

    void union(int p, int q) {
        int i = find(p);
        int j = find(q);
        if (i == j) return;
        if (size[i] < size[j]) {
            parent[i] = j;
            size[j] += size[i];
        } else {
            parent[j] = i;
            size[i] += size[j];
        }
        --count;
    }

    /**
     * Extend the id range to [0, n), adding the new ids as singleton components.
     */
    void grow(int n) {
        final int old = parent.length;
        if (n <= old) return;
        parent = Arrays.copyOf(parent, n);
        size = Arrays.copyOf(size, n);
        for (int i = old; i < n; ++i) {
            parent[i] = i;
            size[i] = 1;
        }
        count += n - old;
    }
}
