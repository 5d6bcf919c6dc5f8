package dominance;

import flowgraph.Node;

/**
 * Lengauer-Tarjan with the balanced forest ("sophisticated" variant). LINK keeps
 * subtree sizes so that compressed paths stay short, giving O(m α(m, n)).
 */
class BalancedLengauerTarjan<N extends Node> extends LengauerTarjan<N> {

    private int[] size;
    private int[] child;

    @Override
    void initForest(int n) {
        size = new int[n];
        child = new int[n];
        for (int i = 0; i < n; i++) {
            size[i] = 1;
            child[i] = NONE;
        }
    }

    @Override
    int eval(int v) {
        if (ancestor[v] == NONE) {
            return label[v];
        }
        compress(v);
        int a = ancestor[v];
        return semi[label[a]] >= semi[label[v]] ? label[v] : label[a];
    }

    @Override
    void link(int v, int w) {
        int s = w;
        while (semi[label[w]] < labelSemi(child[s])) {
            int c = child[s];
            if (size[s] + sizeOf(child[c]) >= 2 * size[c]) {
                ancestor[c] = s;
                child[s] = child[c];
            } else {
                size[c] = size[s];
                ancestor[s] = c;
                s = c;
            }
        }
        label[s] = label[w];
        size[v] += size[w];
        if (size[v] < 2 * size[w]) {
            int t = s;
            s = child[v];
            child[v] = t;
        }
        while (s != NONE) {
            ancestor[s] = v;
            s = child[s];
        }
    }

    // The missing child behaves as a sentinel with semi -1 and size 0.
    private int labelSemi(int v) {
        return v == NONE ? -1 : semi[label[v]];
    }

    private int sizeOf(int v) {
        return v == NONE ? 0 : size[v];
    }
}
