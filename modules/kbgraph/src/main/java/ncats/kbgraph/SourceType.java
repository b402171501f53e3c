package ncats.kbgraph;

/**
 * The closed set of source layouts a knowledge base can be read from.
 */
public enum SourceType {
    ONTOLOGY ("ontology"), // OBO stanzas
    CTD ("ctd"), // CTD tab-separated hierarchy exports
    TAXONOMY ("taxonomy"), // comma-separated NCBI taxon registry
    GENE ("gene"), // NCBI gene_info
    TEXT ("text"); // terms.txt + edges.txt

    final String configKey;
    SourceType (String configKey) {
        this.configKey = configKey;
    }

    public String getConfigKey () { return configKey; }

    /**
     * Select the source type for a knowledge base and its declared file
     * format tag; the file format takes precedence over the knowledge
     * base name except for the two NCBI registries.
     */
    public static SourceType select (String kb, String format)
        throws UnknownFormatException {
        if ("obo".equalsIgnoreCase(format))
            return ONTOLOGY;
        if ("tsv".equalsIgnoreCase(format) && !"ncbi_gene".equals(kb))
            return CTD;
        if ("ncbi_taxon".equals(kb))
            return TAXONOMY;
        if ("ncbi_gene".equals(kb))
            return GENE;
        if ("txt".equalsIgnoreCase(format))
            return TEXT;
        throw new UnknownFormatException (kb, format);
    }
}
