package ncats.kbgraph.graph;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structural statistics of one node: (out-degree, in-degree, descendants).
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"outDegree", "inDegree", "descendants"})
public class NodeInfo {
    final int outDegree;
    final int inDegree;
    final int descendants;

    public NodeInfo (int outDegree, int inDegree, int descendants) {
        this.outDegree = outDegree;
        this.inDegree = inDegree;
        this.descendants = descendants;
    }

    public int getOutDegree () { return outDegree; }
    public int getInDegree () { return inDegree; }
    public int getDescendants () { return descendants; }

    @Override
    public int hashCode () {
        return 31*(31*outDegree + inDegree) + descendants;
    }

    @Override
    public boolean equals (Object obj) {
        if (obj instanceof NodeInfo) {
            NodeInfo ni = (NodeInfo)obj;
            return outDegree == ni.outDegree && inDegree == ni.inDegree
                && descendants == ni.descendants;
        }
        return false;
    }

    @Override
    public String toString () {
        return "("+outDegree+", "+inDegree+", "+descendants+")";
    }
}
