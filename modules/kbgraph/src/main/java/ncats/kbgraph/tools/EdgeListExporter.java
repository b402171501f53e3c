package ncats.kbgraph.tools;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;

import ncats.kbgraph.*;

/**
 * Re-indexes knowledge base identifiers to dense integers and writes the
 * integer edge list consumed by node2vec. The two steps only share the
 * persisted {@code node_id_to_int.json}, so an edge list can be produced
 * against a mapping written by an earlier run.
 */
public class EdgeListExporter {
    static final Logger logger =
        Logger.getLogger(EdgeListExporter.class.getName());

    public static final String INT_TO_NODE_ID = "int_to_node_id.json";
    public static final String NODE_ID_TO_INT = "node_id_to_int.json";
    public static final String EDGELIST_EXT = ".edgelist";

    final File mappingDir;

    /**
     * @param mappingDir parent directory of the per knowledge base mapping
     *        directories
     */
    public EdgeListExporter (File mappingDir) {
        this.mappingDir = mappingDir;
    }

    public File getMappingDir (String kb) { return new File (mappingDir, kb); }

    /**
     * Number the identifiers of {@code nameToId} in iteration order. Each
     * entry consumes one integer, so an identifier owning several names
     * keeps the last number assigned to it in the reverse mapping.
     */
    public static Map<Integer, String> reindex (Map<String, String> nameToId) {
        Map<Integer, String> intToNode = new LinkedHashMap<>();
        int i = 0;
        for (String id : nameToId.values())
            intToNode.put(i++, id);
        return intToNode;
    }

    public static Map<String, Integer> invert (Map<Integer, String> intToNode) {
        Map<String, Integer> nodeToInt = new LinkedHashMap<>();
        for (Map.Entry<Integer, String> me : intToNode.entrySet())
            nodeToInt.put(me.getValue(), me.getKey());
        return nodeToInt;
    }

    /**
     * Write {@code int_to_node_id.json} and {@code node_id_to_int.json}
     * for the knowledge base.
     *
     * @return the identifier to integer mapping just written
     */
    public Map<String, Integer> writeMappings (KnowledgeBase kb)
        throws IOException {
        Map<Integer, String> intToNode = reindex (kb.getNameToId());
        Map<String, Integer> nodeToInt = invert (intToNode);

        File dir = getMappingDir (kb.getName());
        Util.writeJson(new File (dir, INT_TO_NODE_ID), intToNode);
        Util.writeJson(new File (dir, NODE_ID_TO_INT), nodeToInt);
        logger.info("### "+kb.getName()+": "+intToNode.size()
                    +" identifiers re-indexed to "+dir);
        return nodeToInt;
    }

    public Map<String, Integer> readNodeToInt (String kb) throws IOException {
        return Util.readJson(new File (getMappingDir (kb), NODE_ID_TO_INT),
                             new TypeReference<LinkedHashMap<String, Integer>>
                             () {});
    }

    public Map<Integer, String> readIntToNode (String kb) throws IOException {
        return Util.readJson(new File (getMappingDir (kb), INT_TO_NODE_ID),
                             new TypeReference<LinkedHashMap<Integer, String>>
                             () {});
    }

    /**
     * Write one {@code "<int> <int>\n"} line per edge whose endpoints are
     * both mapped; edges with an unmapped endpoint are dropped.
     *
     * @return number of lines written
     */
    public static int writeEdgeList (List<Edge> edges,
                                     Map<String, Integer> nodeToInt,
                                     Writer writer) throws IOException {
        int count = 0, dropped = 0;
        for (Edge e : edges) {
            Integer u = nodeToInt.get(e.getSource());
            Integer v = nodeToInt.get(e.getTarget());
            if (u != null && v != null) {
                writer.write(u+" "+v+"\n");
                ++count;
            }
            else {
                if (logger.isLoggable(Level.FINE))
                    logger.fine("Unresolved edge endpoint; dropping "+e);
                ++dropped;
            }
        }
        writer.flush();

        if (dropped > 0)
            logger.info("### "+dropped+" edge(s) with unmapped endpoints dropped");
        return count;
    }

    public static int writeEdgeList (List<Edge> edges,
                                     Map<String, Integer> nodeToInt,
                                     File file) throws IOException {
        File dir = file.getAbsoluteFile().getParentFile();
        if (dir != null && !dir.exists() && !dir.mkdirs())
            throw new IOException ("Can't create directory "+dir);

        try (Writer writer = new BufferedWriter
             (new OutputStreamWriter (new FileOutputStream (file),
                                      StandardCharsets.UTF_8))) {
            int count = writeEdgeList (edges, nodeToInt, writer);
            logger.info("### "+count+" edges written to "+file);
            return count;
        }
    }
}
