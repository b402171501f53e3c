package ncats.kbgraph.impl;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import ncats.kbgraph.*;

/**
 * Loads the BioPortal CSV export of the NCBI taxonomy (NCBITAXON.csv).
 * Only classes of the NCBITAXON namespace at the configured rank (species)
 * are kept; identifiers are rewritten from class URIs to local ids, e.g.,
 * {@code http://purl.bioontology.org/ontology/NCBITAXON/9606} becomes
 * {@code NCBITaxon_9606}.
 */
public class NCBITaxonKnowledgeBaseFactory extends KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(NCBITaxonKnowledgeBaseFactory.class.getName());

    /*
     * 0 Class ID
     * 1 Preferred Label
     * 2 Synonyms
     * ...
     * 7 Parents
     * ...
     * 9 RANK
     */
    static final int ID = 0;
    static final int NAME = 1;
    static final int SYNONYMS = 2;
    static final int PARENTS = 7;
    static final int RANK = 9;

    public NCBITaxonKnowledgeBaseFactory (KnowledgeBaseSource source) {
        super (source);
    }

    protected CSVFormat getCSVFormat () {
        return CSVFormat.EXCEL;
    }

    @Override
    protected int register () throws IOException {
        try (InputStream is = openStream (source.getFile())) {
            return register (is);
        }
    }

    public int register (InputStream is) throws IOException {
        Reader reader = new InputStreamReader (is, StandardCharsets.UTF_8);
        int count = 0;
        try (CSVParser parser = new CSVParser (reader, getCSVFormat ())) {
            for (CSVRecord record : parser) {
                if (record.getRecordNumber() <= source.getHeaderRows())
                    continue;

                String uri = record.get(ID);
                if (!uri.contains(source.getUriFilter()))
                    continue;

                int line = (int)record.getRecordNumber();
                if (record.size() <= RANK) {
                    throw new MalformedRecordException
                        (source.getFile().getName(), line, "expecting at least "
                         +(RANK+1)+" columns but got "+record.size());
                }

                if (!source.getRank().equals(record.get(RANK)))
                    continue;

                Concept concept = new Concept
                    (toLocalId (uri, line), record.get(NAME), source.getKb());
                String parent = record.get(PARENTS);
                if (!parent.isEmpty())
                    concept.addParent(toLocalId (parent, line));
                for (String syn : Util.split(record.get(SYNONYMS), '|'))
                    concept.addSynonym(syn);
                kb.add(concept);
                ++count;
            }
        }
        catch (UncheckedIOException ex) {
            throw ex.getCause();
        }
        return count;
    }

    String toLocalId (String uri, int line) throws MalformedRecordException {
        String prefix = source.getUriPrefix();
        int pos = uri.indexOf(prefix);
        if (pos < 0 || pos+prefix.length() == uri.length()) {
            throw new MalformedRecordException
                (source.getFile().getName(), line,
                 "not a "+prefix+" class: "+uri);
        }
        return source.getIdPrefix()+uri.substring(pos+prefix.length());
    }
}
