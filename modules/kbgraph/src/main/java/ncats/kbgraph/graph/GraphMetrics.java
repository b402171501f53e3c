package ncats.kbgraph.graph;

import java.util.*;
import java.util.concurrent.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-node degree and descendant counts of a {@link DirectedGraph}.
 *
 * <p>Descendants are computed with one breadth-first traversal per node,
 * i.e., O(V*(V+E)) in the worst case. Each traversal only reads the graph
 * and writes its own slot, so the work is split across a fixed thread
 * pool when more than one thread is requested; the result is identical
 * to the serial computation.
 */
public class GraphMetrics {
    static final Logger logger =
        Logger.getLogger(GraphMetrics.class.getName());

    static final int BATCH_SIZE = 1000;

    final DirectedGraph graph;
    final int threads;

    public GraphMetrics (DirectedGraph graph) {
        this (graph, 1);
    }

    public GraphMetrics (DirectedGraph graph, int threads) {
        if (threads < 1)
            throw new IllegalArgumentException
                ("Bogus number of threads: "+threads);
        this.graph = graph;
        this.threads = threads;
    }

    public NodeInfo calc (String node) {
        if (!graph.contains(node))
            return null;
        return new NodeInfo (graph.outDegree(node), graph.inDegree(node),
                             graph.descendants(node).size());
    }

    /**
     * @return node statistics keyed by node, in graph node order
     */
    public Map<String, NodeInfo> calc () {
        long start = System.currentTimeMillis();
        Map<String, NodeInfo> info = threads > 1 && graph.size() > BATCH_SIZE
            ? calcParallel () : calcSerial ();
        logger.info("### graph metrics for "+info.size()+" nodes calculated in "
                    +String.format("%1$.3fs",
                                   (System.currentTimeMillis()-start)*1e-3));
        return info;
    }

    protected Map<String, NodeInfo> calcSerial () {
        Map<String, NodeInfo> info = new LinkedHashMap<>();
        for (String node : graph.nodes())
            info.put(node, calc (node));
        return info;
    }

    protected Map<String, NodeInfo> calcParallel () {
        List<String> nodes = new ArrayList<>(graph.nodes());
        ExecutorService es = Executors.newFixedThreadPool(threads);
        try {
            List<Future<NodeInfo[]>> batches = new ArrayList<>();
            for (int i = 0; i < nodes.size(); i += BATCH_SIZE) {
                final List<String> batch = nodes.subList
                    (i, Math.min(i+BATCH_SIZE, nodes.size()));
                batches.add(es.submit(() -> {
                            NodeInfo[] slots = new NodeInfo[batch.size()];
                            for (int j = 0; j < slots.length; ++j)
                                slots[j] = calc (batch.get(j));
                            return slots;
                        }));
            }

            Map<String, NodeInfo> info = new LinkedHashMap<>();
            int k = 0;
            for (Future<NodeInfo[]> f : batches) {
                for (NodeInfo ni : f.get())
                    info.put(nodes.get(k++), ni);
            }
            return info;
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException
                ("Graph metrics calculation interrupted", ex);
        }
        catch (ExecutionException ex) {
            logger.log(Level.SEVERE, "Graph metrics calculation failed!",
                       ex.getCause());
            throw new IllegalStateException (ex.getCause());
        }
        finally {
            es.shutdownNow();
        }
    }
}
