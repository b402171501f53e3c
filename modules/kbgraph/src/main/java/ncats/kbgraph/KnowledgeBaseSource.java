package ncats.kbgraph;

import java.io.File;
import java.util.*;
import java.util.logging.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;

/**
 * Declarative description of one knowledge base source: where its data
 * lives and the per-source rules (namespace filter, root concept,
 * bridging edges, alias prefix, ...) the extractors apply. Instances are
 * read from the {@code kbgraph} block of the configuration, e.g.,
 *
 * <pre>
 * kbgraph.ontology.go_bp {
 *   file = "go-basic.obo"
 *   namespace = "biological_process"
 *   root { id = "GO:0008150", name = "biological_process" }
 * }
 * </pre>
 */
public class KnowledgeBaseSource {
    static final Logger logger =
        Logger.getLogger(KnowledgeBaseSource.class.getName());

    public static final String CONFIG_ROOT = "kbgraph";

    final String kb;
    final SourceType type;
    final File dataDir;

    File file;
    File terms;
    File edges;
    String namespace;
    String rootId;
    String rootName;
    boolean rootCheck = true;
    final List<Edge> bridges = new ArrayList<>();
    String xrefPrefix;
    boolean derivedFrom;
    int headerRows;
    String uriFilter;
    String uriPrefix;
    String idPrefix = "";
    String rank;

    public KnowledgeBaseSource (String kb, SourceType type, File dataDir) {
        this.kb = kb;
        this.type = type;
        this.dataDir = dataDir;
    }

    public static KnowledgeBaseSource getInstance (String kb, String format)
        throws UnknownFormatException {
        return getInstance (ConfigFactory.load(), kb, format);
    }

    public static KnowledgeBaseSource getInstance
        (Config conf, String kb, String format) throws UnknownFormatException {
        Config kbconf = conf.getConfig(CONFIG_ROOT);
        SourceType type = SourceType.select(kb, format);
        KnowledgeBaseSource source = new KnowledgeBaseSource
            (kb, type, new File (kbconf.getString("data")));

        String path = type.getConfigKey()+"."+kb;
        if (kbconf.hasPath(path)) {
            source.parseConfig(kbconf.getConfig(path));
        }
        else if (type == SourceType.ONTOLOGY) {
            source.file = source.resolve(kb+".obo");
        }
        else if (type == SourceType.TEXT) {
            source.terms = source.resolve(kb+"/terms.txt");
            source.edges = source.resolve(kb+"/edges.txt");
        }
        else {
            // the tabular layouts are only known for declared sources
            throw new UnknownFormatException (kb, format);
        }
        logger.info("### "+source);
        return source;
    }

    protected void parseConfig (Config conf) {
        if (conf.hasPath("file"))
            file = resolve (conf.getString("file"));
        terms = resolve (conf.hasPath("terms")
                         ? conf.getString("terms") : kb+"/terms.txt");
        edges = resolve (conf.hasPath("edges")
                         ? conf.getString("edges") : kb+"/edges.txt");

        if (conf.hasPath("namespace"))
            namespace = conf.getString("namespace");

        if (conf.hasPath("root")) {
            Config root = conf.getConfig("root");
            rootId = root.getString("id");
            rootName = root.getString("name");
            if (root.hasPath("check"))
                rootCheck = root.getBoolean("check");
        }

        if (conf.hasPath("bridges")) {
            for (ConfigValue cv : conf.getList("bridges")) {
                if (cv.valueType() != ConfigValueType.LIST) {
                    throw new IllegalArgumentException
                        ("Bridge of "+kb+" is not a [child, parent] pair: "
                         +cv.render());
                }
                List<?> pair = (List<?>)cv.unwrapped();
                if (pair.size() != 2) {
                    throw new IllegalArgumentException
                        ("Bridge of "+kb+" is not a [child, parent] pair: "
                         +pair);
                }
                bridges.add(new Edge (pair.get(0).toString(),
                                      pair.get(1).toString()));
            }
        }

        if (conf.hasPath("xref-prefix"))
            xrefPrefix = conf.getString("xref-prefix");
        if (conf.hasPath("derived-from"))
            derivedFrom = conf.getBoolean("derived-from");
        if (conf.hasPath("header-rows"))
            headerRows = conf.getInt("header-rows");
        if (conf.hasPath("uri-filter"))
            uriFilter = conf.getString("uri-filter");
        if (conf.hasPath("uri-prefix"))
            uriPrefix = conf.getString("uri-prefix");
        if (conf.hasPath("id-prefix"))
            idPrefix = conf.getString("id-prefix");
        if (conf.hasPath("rank"))
            rank = conf.getString("rank");
    }

    File resolve (String path) {
        File f = new File (path);
        return f.isAbsolute() ? f : new File (dataDir, path);
    }

    public String getKb () { return kb; }
    public SourceType getType () { return type; }
    public File getDataDir () { return dataDir; }
    public File getFile () { return file; }
    public KnowledgeBaseSource setFile (File file) {
        this.file = file;
        return this;
    }
    public File getTerms () { return terms; }
    public KnowledgeBaseSource setTerms (File terms) {
        this.terms = terms;
        return this;
    }
    public File getEdges () { return edges; }
    public KnowledgeBaseSource setEdges (File edges) {
        this.edges = edges;
        return this;
    }
    public String getNamespace () { return namespace; }
    public boolean hasRoot () { return rootId != null && rootName != null; }
    public String getRootId () { return rootId; }
    public String getRootName () { return rootName; }
    /*
     * only inject the root when its name is absent
     */
    public boolean isRootCheck () { return rootCheck; }
    public List<Edge> getBridges () {
        return Collections.unmodifiableList(bridges);
    }
    public String getXrefPrefix () { return xrefPrefix; }
    public boolean isDerivedFrom () { return derivedFrom; }
    public int getHeaderRows () { return headerRows; }
    public String getUriFilter () { return uriFilter; }
    public String getUriPrefix () { return uriPrefix; }
    public String getIdPrefix () { return idPrefix; }
    public String getRank () { return rank; }

    @Override
    public String toString () {
        return "KnowledgeBaseSource{kb="+kb+",type="+type
            +",file="+(type == SourceType.TEXT ? terms+"|"+edges : file)+"}";
    }
}
