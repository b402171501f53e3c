package ncats.kbgraph;

import java.util.Objects;

/**
 * Directed relationship between two identifiers; for is-a edges the
 * source is the more specific concept and the target its ancestor.
 */
public class Edge {
    final String source;
    final String target;

    public Edge (String source, String target) {
        if (source == null || target == null)
            throw new IllegalArgumentException
                ("Edge endpoints must not be null: "+source+" -> "+target);
        this.source = source;
        this.target = target;
    }

    public String getSource () { return source; }
    public String getTarget () { return target; }

    @Override
    public int hashCode () { return Objects.hash(source, target); }
    @Override
    public boolean equals (Object obj) {
        if (obj instanceof Edge) {
            Edge e = (Edge)obj;
            return source.equals(e.source) && target.equals(e.target);
        }
        return false;
    }

    @Override
    public String toString () { return "("+source+", "+target+")"; }
}
