package ncats.kbgraph.impl;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

import ncats.kbgraph.*;

/**
 * Loads the tab-separated hierarchy exports of the Comparative
 * Toxicogenomics Database (CTD_diseases.tsv, CTD_chemicals.tsv,
 * CTD_anatomy.tsv, ...). The leading comment block is skipped by row
 * count. Rows must carry all columns up to the synonyms; a short row
 * aborts the load.
 */
public class CTDKnowledgeBaseFactory extends KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(CTDKnowledgeBaseFactory.class.getName());

    /*
     * 0 Name
     * 1 ID
     * 2 AltIDs
     * 3 Definition
     * 4 ParentIDs
     * 5 TreeNumbers
     * 6 ParentTreeNumbers
     * 7 Synonyms
     * 8 SlimMappings
     */
    static final int NAME = 0;
    static final int ID = 1;
    static final int PARENTS = 4;
    static final int SYNONYMS = 7;

    public CTDKnowledgeBaseFactory (KnowledgeBaseSource source) {
        super (source);
    }

    @Override
    protected int register () throws IOException {
        try (InputStream is = openStream (source.getFile())) {
            return register (is);
        }
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
                if (toks.length <= SYNONYMS) {
                    throw new MalformedRecordException
                        (source.getFile().getName(), line, "expecting at least "
                         +(SYNONYMS+1)+" columns but got "+toks.length);
                }
                if (toks[NAME] == null || toks[ID] == null) {
                    throw new MalformedRecordException
                        (source.getFile().getName(), line,
                         "row has no name or identifier");
                }

                Concept concept = new Concept
                    (toks[ID], toks[NAME], source.getKb());
                for (String p : Util.split(toks[PARENTS], '|'))
                    concept.addParent(p);
                for (String syn : Util.split(toks[SYNONYMS], '|'))
                    concept.addSynonym(syn);
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
