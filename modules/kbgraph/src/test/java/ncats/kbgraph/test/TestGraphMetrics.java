package ncats.kbgraph.test;

import java.util.*;

import ncats.kbgraph.Edge;
import ncats.kbgraph.graph.*;

import org.junit.Test;
import static org.junit.Assert.*;

public class TestGraphMetrics {

    static DirectedGraph graph (String... pairs) {
        DirectedGraph g = new DirectedGraph ();
        for (int i = 0; i < pairs.length; i += 2)
            g.addEdge(pairs[i], pairs[i+1]);
        return g;
    }

    @Test
    public void testLeaf () {
        DirectedGraph g = graph ("A", "B");
        Map<String, NodeInfo> info = new GraphMetrics (g).calc();
        assertEquals (new NodeInfo (0, 1, 0), info.get("B"));
        assertEquals (new NodeInfo (1, 0, 1), info.get("A"));
    }

    @Test
    public void testSelfLoop () {
        DirectedGraph g = graph ("A", "A");
        NodeInfo ni = new GraphMetrics (g).calc("A");
        assertEquals (1, ni.getOutDegree());
        assertEquals (1, ni.getInDegree());
        assertEquals (1, ni.getDescendants());
    }

    @Test
    public void testCycle () {
        DirectedGraph g = new DirectedGraph
            (Arrays.asList(new Edge ("A", "B"), new Edge ("B", "C"),
                           new Edge ("C", "B")));
        Map<String, NodeInfo> info = new GraphMetrics (g).calc();
        assertEquals (2, info.get("A").getDescendants());
        assertTrue (info.get("B").getDescendants() >= 1);
        assertEquals (new HashSet<>(Arrays.asList("B", "C")),
                      g.descendants("B"));
        assertEquals (Arrays.asList("A", "B", "C"),
                      new ArrayList<>(info.keySet()));
    }

    @Test
    public void testParallelEdgesCollapse () {
        DirectedGraph g = new DirectedGraph
            (Arrays.asList(new Edge ("A", "B"), new Edge ("A", "B")));
        assertEquals (1, g.getEdgeCount());
        assertEquals (1, g.outDegree("A"));
        assertEquals (1, g.inDegree("B"));
    }

    @Test
    public void testDiamond () {
        DirectedGraph g = graph ("D", "B", "D", "C", "B", "A", "C", "A");
        assertEquals (3, g.descendants("D").size());
        assertEquals (new NodeInfo (2, 0, 3), new GraphMetrics (g).calc("D"));
        assertNull (new GraphMetrics (g).calc("X"));
    }

    @Test
    public void testParallelMatchesSerial () {
        DirectedGraph g = new DirectedGraph ();
        // a chain with side branches and a back edge
        for (int i = 1; i < 2500; ++i) {
            g.addEdge("N"+i, "N"+(i-1));
            if (i % 7 == 0)
                g.addEdge("S"+i, "N"+i);
        }
        g.addEdge("N0", "N10");

        Map<String, NodeInfo> serial = new GraphMetrics (g, 1).calc();
        Map<String, NodeInfo> parallel = new GraphMetrics (g, 4).calc();
        assertEquals (g.size(), serial.size());
        assertEquals (serial, parallel);
        assertEquals (new ArrayList<>(serial.keySet()),
                      new ArrayList<>(parallel.keySet()));
        assertEquals (11, serial.get("N0").getDescendants());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBogusThreads () {
        new GraphMetrics (new DirectedGraph (), 0);
    }
}
