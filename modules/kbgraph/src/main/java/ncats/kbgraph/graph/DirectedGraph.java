package ncats.kbgraph.graph;

import java.util.*;

import ncats.kbgraph.Edge;

/**
 * Simple directed graph over string identifiers. Parallel edges collapse
 * into one; self-loops are kept. Node and neighbor iteration follow
 * insertion order.
 */
public class DirectedGraph {
    private final Map<String, Set<String>> succ = new LinkedHashMap<>();
    private final Map<String, Set<String>> pred = new LinkedHashMap<>();
    private int edgeCount;

    public DirectedGraph () {
    }

    public DirectedGraph (Collection<Edge> edges) {
        for (Edge e : edges)
            addEdge (e.getSource(), e.getTarget());
    }

    public void addNode (String node) {
        succ.computeIfAbsent(node, k -> new LinkedHashSet<>());
        pred.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    public boolean addEdge (String u, String v) {
        addNode (u);
        addNode (v);
        if (succ.get(u).add(v)) {
            pred.get(v).add(u);
            ++edgeCount;
            return true;
        }
        return false;
    }

    public boolean contains (String node) { return succ.containsKey(node); }
    public Set<String> nodes () {
        return Collections.unmodifiableSet(succ.keySet());
    }
    public int size () { return succ.size(); }
    public int getEdgeCount () { return edgeCount; }

    public Set<String> successors (String node) {
        Set<String> s = succ.get(node);
        return s != null ? Collections.unmodifiableSet(s)
            : Collections.emptySet();
    }

    public int outDegree (String node) {
        Set<String> s = succ.get(node);
        return s != null ? s.size() : 0;
    }

    public int inDegree (String node) {
        Set<String> p = pred.get(node);
        return p != null ? p.size() : 0;
    }

    /**
     * All nodes reachable from {@code node} through one or more outgoing
     * edges. The node itself is only part of the result when it lies on
     * a cycle (or has a self-loop). Breadth-first with a visited set, so
     * cycles terminate.
     */
    public Set<String> descendants (String node) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String s : successors (node)) {
            if (visited.add(s))
                queue.add(s);
        }

        while (!queue.isEmpty()) {
            String n = queue.poll();
            for (String s : succ.get(n)) {
                if (visited.add(s))
                    queue.add(s);
            }
        }
        return visited;
    }
}
