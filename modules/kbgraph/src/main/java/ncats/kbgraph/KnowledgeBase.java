package ncats.kbgraph;

import java.util.*;
import java.util.logging.Logger;

import ncats.kbgraph.graph.DirectedGraph;
import ncats.kbgraph.graph.GraphMetrics;
import ncats.kbgraph.graph.NodeInfo;

/**
 * Canonical model of one knowledge base. All the name, synonym, and
 * hierarchy mappings are owned here and only change through
 * {@link #add(Concept)}, {@link #retract(String)}, {@link #addEdge},
 * {@link #addXref}, and {@link #ensureRoot}. Once {@link #build} has run the
 * instance is frozen; any further mutation throws
 * {@link IllegalStateException}.
 *
 * <p>Name and synonym collisions are not resolved: the concept added last
 * owns the name (or synonym).
 */
public class KnowledgeBase {
    static final Logger logger =
        Logger.getLogger(KnowledgeBase.class.getName());

    final String name;
    final Map<String, String> nameToId = new LinkedHashMap<>();
    final Map<String, String> idToName = new LinkedHashMap<>();
    final Map<String, String> synonymToId = new LinkedHashMap<>();
    final Map<String, String> altIdToId = new LinkedHashMap<>();
    final Map<String, String> childToParent = new LinkedHashMap<>();
    final Map<String, String> xrefToId = new LinkedHashMap<>();
    final List<Edge> edges = new ArrayList<>();

    String root;
    DirectedGraph graph;
    Map<String, List<String>> nodeToNode;
    Map<String, NodeInfo> idToInfo;

    public KnowledgeBase (String name) {
        this.name = name;
    }

    public String getName () { return name; }
    public boolean isBuilt () { return graph != null; }

    void checkMutable () {
        if (isBuilt ())
            throw new IllegalStateException
                ("Knowledge base "+name+" is already built!");
    }

    /**
     * Register a concept along with its synonyms, alternate identifiers,
     * and one is-a edge per direct ancestor.
     */
    public KnowledgeBase add (Concept concept) {
        checkMutable ();
        String id = concept.getId();
        nameToId.put(concept.getName(), id);
        idToName.put(id, concept.getName());
        for (String syn : concept.getSynonyms())
            synonymToId.put(syn, id);
        for (String alt : concept.getAltIds())
            altIdToId.put(alt, id);

        String parent = concept.getParent();
        if (parent != null)
            childToParent.put(id, parent);
        for (String p : concept.getParents())
            edges.add(new Edge (id, p));
        return this;
    }

    /**
     * Remove every trace of a previously accepted concept: its name,
     * synonyms, alternate ids, aliases, single-parent entry, and every edge
     * it is an endpoint of.
     *
     * @return true if the concept was present
     */
    public boolean retract (String id) {
        checkMutable ();
        String cname = idToName.remove(id);
        if (cname == null)
            return false;

        if (id.equals(nameToId.get(cname)))
            nameToId.remove(cname);
        synonymToId.values().removeIf(id::equals);
        altIdToId.values().removeIf(id::equals);
        xrefToId.values().removeIf(id::equals);
        childToParent.remove(id);
        edges.removeIf(e -> e.getSource().equals(id)
                       || e.getTarget().equals(id));
        return true;
    }

    public KnowledgeBase addEdge (String source, String target) {
        return addEdge (new Edge (source, target));
    }

    public KnowledgeBase addEdge (Edge edge) {
        checkMutable ();
        edges.add(edge);
        return this;
    }

    /**
     * Map an identifier of an external vocabulary to a local concept.
     */
    public KnowledgeBase addXref (String xref, String id) {
        checkMutable ();
        xrefToId.put(xref, id);
        return this;
    }

    /**
     * Make sure the knowledge base has a root concept.
     *
     * @param checkName if true, the root is only injected when no concept
     *        already carries the root name
     * @return true if the root concept was injected
     */
    public boolean ensureRoot (String id, String rootName, boolean checkName) {
        checkMutable ();
        if (checkName && nameToId.containsKey(rootName)) {
            root = nameToId.get(rootName);
            return false;
        }
        nameToId.put(rootName, id);
        idToName.put(id, rootName);
        root = id;
        return true;
    }

    /**
     * Derive the directed graph, the undirected adjacency, and the per-node
     * statistics from the current edges, then freeze this instance.
     */
    public KnowledgeBase build () {
        return build (1);
    }

    public KnowledgeBase build (int threads) {
        checkMutable ();
        DirectedGraph g = new DirectedGraph (edges);

        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Edge e : edges) {
            adj.computeIfAbsent(e.getSource(), k -> new ArrayList<>())
                .add(e.getTarget());
            adj.computeIfAbsent(e.getTarget(), k -> new ArrayList<>())
                .add(e.getSource());
        }
        for (Map.Entry<String, List<String>> me : adj.entrySet())
            me.setValue(Collections.unmodifiableList(me.getValue()));

        idToInfo = Collections.unmodifiableMap
            (new GraphMetrics (g, threads).calc());
        nodeToNode = Collections.unmodifiableMap(adj);
        graph = g;

        logger.info("### "+name+": "+idToName.size()+" concepts, "
                    +synonymToId.size()+" synonyms, "+edges.size()+" edges, "
                    +g.size()+" graph nodes");
        return this;
    }

    public String getId (String name) { return nameToId.get(name); }
    public String getName (String id) { return idToName.get(id); }
    public String getParent (String id) { return childToParent.get(id); }
    public boolean contains (String id) { return idToName.containsKey(id); }

    /**
     * Resolve an identifier, alternate identifier, or external alias to the
     * current identifier of the concept; null if unknown.
     */
    public String resolve (String id) {
        if (idToName.containsKey(id))
            return id;
        String r = altIdToId.get(id);
        return r != null ? r : xrefToId.get(id);
    }

    /*
     * the root concept id (if any)
     */
    public String getRoot () { return root; }

    public Map<String, String> getNameToId () {
        return Collections.unmodifiableMap(nameToId);
    }
    public Map<String, String> getIdToName () {
        return Collections.unmodifiableMap(idToName);
    }
    public Map<String, String> getSynonymToId () {
        return Collections.unmodifiableMap(synonymToId);
    }
    public Map<String, String> getAltIdToId () {
        return Collections.unmodifiableMap(altIdToId);
    }
    public Map<String, String> getChildToParent () {
        return Collections.unmodifiableMap(childToParent);
    }
    public Map<String, String> getXrefToId () {
        return Collections.unmodifiableMap(xrefToId);
    }
    public List<Edge> getEdges () {
        return Collections.unmodifiableList(edges);
    }

    public DirectedGraph getGraph () {
        checkBuilt ();
        return graph;
    }
    public Map<String, List<String>> getNodeToNode () {
        checkBuilt ();
        return nodeToNode;
    }
    public Map<String, NodeInfo> getIdToInfo () {
        checkBuilt ();
        return idToInfo;
    }
    public NodeInfo getInfo (String id) {
        return getIdToInfo().get(id);
    }

    void checkBuilt () {
        if (!isBuilt ())
            throw new IllegalStateException
                ("Knowledge base "+name+" is not yet built!");
    }

    @Override
    public String toString () {
        return "KnowledgeBase{name="+name+",concepts="+idToName.size()
            +",edges="+edges.size()+",built="+isBuilt()+"}";
    }
}
