package ncats.kbgraph.tools;

import java.io.File;
import java.io.IOException;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

import ncats.kbgraph.*;

/**
 * Prepare the node2vec input for one knowledge base: load it, write the
 * integer id mappings, and write the integer edge list.
 */
public class BuildEdgeList {
    static final Logger logger =
        Logger.getLogger(BuildEdgeList.class.getName());

    static final String[] OPTIONS = {
        "data", "output", "edgelist", "threads", "terms", "edges",
        "metrics", "reindex"
    };

    final Config conf;
    final Map<String, String> options = new HashMap<>();

    public BuildEdgeList () {
        this (ConfigFactory.load());
    }

    public BuildEdgeList (Config conf) {
        this.conf = conf;
    }

    public BuildEdgeList set (String option, String value) {
        if (!Arrays.asList(OPTIONS).contains(option))
            throw new IllegalArgumentException ("Unknown option: "+option);
        options.put(option, value);
        return this;
    }

    Config getConfig () {
        Config c = conf;
        String data = options.get("data");
        if (data != null) {
            c = c.withValue(KnowledgeBaseSource.CONFIG_ROOT+".data",
                            ConfigValueFactory.fromAnyRef(data));
            if (!options.containsKey("output"))
                c = c.withValue(KnowledgeBaseSource.CONFIG_ROOT+".output",
                                ConfigValueFactory.fromAnyRef(data));
        }
        for (String opt : new String[]{"output", "edgelist", "threads"}) {
            if (options.containsKey(opt))
                c = c.withValue(KnowledgeBaseSource.CONFIG_ROOT+"."+opt,
                                ConfigValueFactory.fromAnyRef
                                (options.get(opt)));
        }
        return c;
    }

    /**
     * @return the knowledge base the edge list was built from
     */
    public KnowledgeBase build (String kbName, String format)
        throws IOException {
        Config c = getConfig ();
        Config kbconf = c.getConfig(KnowledgeBaseSource.CONFIG_ROOT);

        KnowledgeBaseSource source =
            KnowledgeBaseSource.getInstance(c, kbName, format);
        if (options.containsKey("terms"))
            source.setTerms(new File (options.get("terms")));
        if (options.containsKey("edges"))
            source.setEdges(new File (options.get("edges")));

        KnowledgeBase kb = KnowledgeBaseFactory.getInstance(source)
            .load(kbconf.getInt("threads"));

        EdgeListExporter exporter =
            new EdgeListExporter (new File (kbconf.getString("output")));
        if (!"false".equalsIgnoreCase(options.get("reindex")))
            exporter.writeMappings(kb);

        // the edge list only depends on the persisted mapping
        Map<String, Integer> nodeToInt = exporter.readNodeToInt(kbName);
        EdgeListExporter.writeEdgeList
            (kb.getEdges(), nodeToInt,
             new File (kbconf.getString("edgelist"),
                       kbName+EdgeListExporter.EDGELIST_EXT));

        if (options.containsKey("metrics")) {
            File metrics = new File (options.get("metrics"));
            Util.writeJson(metrics, kb.getIdToInfo());
            logger.info("### graph metrics written to "+metrics);
        }
        return kb;
    }

    /**
     * @return process exit status: 0 on success, 1 for usage errors, 2 when
     *         the build failed
     */
    public static int run (Config conf, String... argv) {
        if (argv.length < 2) {
            System.err.println("Usage: "+BuildEdgeList.class.getName()
                               +" KB FORMAT [data=DIR] [output=DIR] "
                               +"[edgelist=DIR] [threads=N] [terms=FILE] "
                               +"[edges=FILE] [metrics=FILE] [reindex=false]");
            System.err.println("where FORMAT is one of obo, tsv, csv, txt");
            return 1;
        }

        BuildEdgeList bel = new BuildEdgeList (conf);
        for (int i = 2; i < argv.length; ++i) {
            int pos = argv[i].indexOf('=');
            if (pos <= 0) {
                System.err.println("Bogus option: "+argv[i]);
                return 1;
            }
            try {
                bel.set(argv[i].substring(0, pos), argv[i].substring(pos+1));
            }
            catch (IllegalArgumentException ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }

        try {
            KnowledgeBase kb = bel.build(argv[0], argv[1]);
            logger.info("$$$ "+kb);
            return 0;
        }
        catch (IOException ex) {
            logger.log(Level.SEVERE, "Can't build edge list for "+argv[0]
                       +" ("+argv[1]+"): "+ex.getMessage(), ex);
        }
        catch (RuntimeException ex) {
            logger.log(Level.SEVERE, "Unexpected failure building edge list "
                       +"for "+argv[0]+" ("+argv[1]+")", ex);
        }
        return 2;
    }

    public static void main (String[] argv) throws Exception {
        System.exit(run (ConfigFactory.load(), argv));
    }
}
