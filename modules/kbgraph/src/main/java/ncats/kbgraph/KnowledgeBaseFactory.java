package ncats.kbgraph;

import java.io.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import ncats.kbgraph.impl.*;

/**
 * Base class of all source extractors. A factory reads the raw file(s) of
 * one {@link KnowledgeBaseSource}, registers concepts and edges into a fresh
 * {@link KnowledgeBase}, anchors the hierarchy at the configured root, and
 * finally builds the graph view.
 */
public abstract class KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(KnowledgeBaseFactory.class.getName());

    protected final KnowledgeBaseSource source;
    protected KnowledgeBase kb;
    protected int skipped;

    protected KnowledgeBaseFactory (KnowledgeBaseSource source) {
        this.source = source;
    }

    public static KnowledgeBaseFactory getInstance (KnowledgeBaseSource source) {
        switch (source.getType()) {
        case ONTOLOGY:
            return new OboKnowledgeBaseFactory (source);
        case CTD:
            return new CTDKnowledgeBaseFactory (source);
        case TAXONOMY:
            return new NCBITaxonKnowledgeBaseFactory (source);
        case GENE:
            return new NCBIGeneKnowledgeBaseFactory (source);
        case TEXT:
            return new TextKnowledgeBaseFactory (source);
        }
        throw new IllegalArgumentException
            ("Unsupported source type: "+source.getType());
    }

    public KnowledgeBaseSource getSource () { return source; }
    public KnowledgeBase getKnowledgeBase () { return kb; }
    /*
     * records skipped by tolerant extractors during the last load (e.g.,
     * ontology stanzas without a name or outside the namespace)
     */
    public int getSkipped () { return skipped; }

    public KnowledgeBase load () throws IOException {
        return load (1);
    }

    /**
     * Ingest the source and return the built knowledge base.
     *
     * @param threads number of workers for the descendant counts
     */
    public KnowledgeBase load (int threads) throws IOException {
        kb = new KnowledgeBase (source.getKb());
        skipped = 0;
        try {
            int count = register ();
            logger.info("$$$ "+count+" concepts registered for "+source
                        +(skipped > 0 ? " ("+skipped+" records skipped)" : ""));
        }
        catch (IOException ex) {
            logger.log(Level.SEVERE, "Can't load "+source, ex);
            throw ex;
        }
        ensureRootConnectivity ();
        return kb.build(threads);
    }

    /**
     * Parse the source file(s) into {@link #kb}.
     *
     * @return number of concepts registered
     */
    protected abstract int register () throws IOException;

    protected void ensureRootConnectivity () {
        if (source.hasRoot()) {
            if (kb.ensureRoot(source.getRootId(), source.getRootName(),
                              source.isRootCheck())) {
                logger.info("### "+source.getKb()+": root concept "
                            +source.getRootId()+" \""+source.getRootName()
                            +"\" injected");
            }
        }

        for (Edge e : source.getBridges())
            kb.addEdge(e);
    }

    protected InputStream openStream (File file) throws IOException {
        return Util.openStream(file);
    }
}
