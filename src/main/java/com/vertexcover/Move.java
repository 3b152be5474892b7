package com.vertexcover;

/** One swap: remove {@code out} from the cover, add {@code in}. */
public final class Move<V> {
    private final V out;
    private final V in;
    private final int outIndex;
    private final int inIndex;

    Move(V out, int outIndex, V in, int inIndex) {
        this.out = out;
        this.outIndex = outIndex;
        this.in = in;
        this.inIndex = inIndex;
    }

    static <V> Move<V> of(Graph<V> g, int outIndex, int inIndex) {
        return new Move<>(g.vertexAt(outIndex), outIndex, g.vertexAt(inIndex), inIndex);
    }

    public V out() { return out; }
    public V in() { return in; }
    int outIndex() { return outIndex; }
    int inIndex() { return inIndex; }

    @Override
    public String toString() {
        return "-" + out + " +" + in;
    }
}
