package ncats.kbgraph;

/**
 * No extractor matches the requested knowledge base and file format.
 */
public class UnknownFormatException extends KnowledgeBaseException {
    private static final long serialVersionUID = 1L;

    final String kb;
    final String format;

    public UnknownFormatException (String kb, String format) {
        super ("No loader available for knowledge base \""+kb
               +"\" in format \""+format+"\"");
        this.kb = kb;
        this.format = format;
    }

    public String getKb () { return kb; }
    public String getFormat () { return format; }
}
