package ncats.kbgraph;

/**
 * A row or stanza is missing a required field or column.
 */
public class MalformedRecordException extends KnowledgeBaseException {
    private static final long serialVersionUID = 1L;

    final String file;
    final int line;

    public MalformedRecordException (String file, int line, String message) {
        super (file+":"+line+": "+message);
        this.file = file;
        this.line = line;
    }

    public String getFile () { return file; }
    /*
     * 1-based line (or record) number within the file
     */
    public int getLine () { return line; }
}
