package dominance;

import flowgraph.Node;

/**
 * Lengauer-Tarjan with the simple forest: LINK never rebalances, so the whole
 * computation is O(m log n).
 */
class SimpleLengauerTarjan<N extends Node> extends LengauerTarjan<N> {

    @Override
    int eval(int v) {
        if (ancestor[v] == NONE) {
            return v;
        }
        compress(v);
        return label[v];
    }

    @Override
    void link(int v, int w) {
        ancestor[w] = v;
    }
}
