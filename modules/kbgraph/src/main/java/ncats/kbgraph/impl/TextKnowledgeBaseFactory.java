package ncats.kbgraph.impl;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import ncats.kbgraph.*;

/**
 * Loads a knowledge base from two plain text files: the terms file has one
 * {@code id<TAB>name[<TAB>synonym;synonym;...]} line per concept and the
 * edges file one {@code child<TAB>parent} line per relation. Blank lines
 * are skipped in both.
 */
public class TextKnowledgeBaseFactory extends KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(TextKnowledgeBaseFactory.class.getName());

    public TextKnowledgeBaseFactory (KnowledgeBaseSource source) {
        super (source);
    }

    @Override
    protected int register () throws IOException {
        // fail early if either file is missing
        try (InputStream terms = openStream (source.getTerms());
             InputStream edges = openStream (source.getEdges())) {
            int count = registerTerms (terms);
            int nedges = registerEdges (edges);
            logger.info("### "+source.getKb()+": "+nedges+" edges read from "
                        +source.getEdges());
            return count;
        }
    }

    public int registerTerms (InputStream is) throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));
        String file = source.getTerms() != null
            ? source.getTerms().getName() : "terms";

        int count = 0, lines = 0;
        for (String line; (line = br.readLine()) != null; ) {
            ++lines;
            if (line.isEmpty())
                continue;

            String[] toks = line.split("\t", -1);
            if (toks.length < 2 || toks[0].isEmpty()) {
                throw new MalformedRecordException
                    (file, lines, "expecting id<TAB>name but got \""
                     +line+"\"");
            }

            Concept concept = new Concept (toks[0], toks[1], source.getKb());
            if (toks.length == 3) {
                for (String syn : toks[2].split(";"))
                    concept.addSynonym(syn);
            }
            kb.add(concept);
            ++count;
        }
        return count;
    }

    public int registerEdges (InputStream is) throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));
        String file = source.getEdges() != null
            ? source.getEdges().getName() : "edges";

        int count = 0, lines = 0;
        for (String line; (line = br.readLine()) != null; ) {
            ++lines;
            if (line.isEmpty())
                continue;

            String[] toks = line.split("\t", -1);
            if (toks.length < 2 || toks[0].isEmpty() || toks[1].isEmpty()) {
                throw new MalformedRecordException
                    (file, lines, "expecting child<TAB>parent but got \""
                     +line+"\"");
            }
            kb.addEdge(toks[0], toks[1]);
            ++count;
        }
        return count;
    }
}
