package ncats.kbgraph.impl;

import java.io.*;
import java.util.logging.Logger;

import ncats.kbgraph.*;

/**
 * Loads NCBI Gene's {@code gene_info} tab-separated registry. Genes have
 * no hierarchy in this file, so only names and synonyms are registered
 * along with a single placeholder edge that keeps the graph non-empty.
 * The placeholder endpoints are not gene identifiers and never survive
 * the integer edge list export.
 */
public class NCBIGeneKnowledgeBaseFactory extends KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(NCBIGeneKnowledgeBaseFactory.class.getName());

    public static final Edge PLACEHOLDER = new Edge ("NCBIGene1", "NCBIGene2");
    static final String NONE = "-";

    /*
     * 0 #tax_id
     * 1 GeneID
     * 2 Symbol
     * 3 LocusTag
     * 4 Synonyms
     * 5 dbXrefs
     * 6 chromosome
     * 7 map_location
     * 8 description
     */
    static final int ID = 1;
    static final int SYMBOL = 2;
    static final int SYNONYMS = 4;
    static final int DESCRIPTION = 8;

    public NCBIGeneKnowledgeBaseFactory (KnowledgeBaseSource source) {
        super (source);
    }

    @Override
    protected int register () throws IOException {
        int count;
        try (InputStream is = openStream (source.getFile())) {
            count = register (is);
        }
        kb.addEdge(PLACEHOLDER);
        return count;
    }

    public int register (InputStream is) throws IOException {
        LineTokenizer tokenizer = new LineTokenizer ('\t');
        tokenizer.setInputStream(is);
        int count = 0;
        try {
            tokenizer.skip(source.getHeaderRows());

            while (tokenizer.hasNext()) {
                String[] toks = tokenizer.next();
                if (LineTokenizer.isBlank(toks))
                    continue;

                int line = tokenizer.getCount();
                if (toks.length <= DESCRIPTION) {
                    throw new MalformedRecordException
                        (source.getFile().getName(), line, "expecting at least "
                         +(DESCRIPTION+1)+" columns but got "+toks.length);
                }
                if (toks[ID] == null || toks[SYMBOL] == null) {
                    throw new MalformedRecordException
                        (source.getFile().getName(), line,
                         "row has no gene id or symbol");
                }

                String id = source.getIdPrefix()+toks[ID];
                Concept concept = new Concept (id, toks[SYMBOL], source.getKb());
                if (toks[DESCRIPTION] != null && !NONE.equals(toks[DESCRIPTION]))
                    concept.addSynonym(toks[DESCRIPTION]);
                for (String syn : Util.split(toks[SYNONYMS], '/')) {
                    if (!NONE.equals(syn))
                        concept.addSynonym(syn);
                }
                kb.add(concept);
                ++count;
            }
        }
        catch (UncheckedIOException ex) {
            // read failure surfaced by the tokenizer's iterator
            throw ex.getCause();
        }
        return count;
    }
}
