package ir;

/**
 * Directed control-flow edge between two blocks of the same graph
 */
public final class Edge {

    private final BasicBlock source;
    private final BasicBlock target;
    private final EdgeKind kind;

    public Edge(BasicBlock source, BasicBlock target, EdgeKind kind) {
        assert source != null && target != null && kind != null;
        this.source = source;
        this.target = target;
        this.kind = kind;
    }

    public BasicBlock getSource() {
        return source;
    }

    public BasicBlock getTarget() {
        return target;
    }

    public EdgeKind getKind() {
        return kind;
    }

    @Override
    public int hashCode() {
        return (31 * source.hashCode() + target.hashCode()) * 31 + kind.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Edge)) {
            return false;
        }
        Edge other = (Edge) obj;
        return source == other.source && target == other.target && kind == other.kind;
    }

    @Override
    public String toString() {
        return source + " -" + kind + "-> " + target;
    }
}
