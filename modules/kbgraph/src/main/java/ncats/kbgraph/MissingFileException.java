package ncats.kbgraph;

import java.io.File;

public class MissingFileException extends KnowledgeBaseException {
    private static final long serialVersionUID = 1L;

    final File file;

    public MissingFileException (File file) {
        super ("Can't find data: \""+file+"\"");
        this.file = file;
    }

    public File getFile () { return file; }
}
