package ncats.kbgraph;

import java.io.IOException;

/**
 * Base class for all failures raised while ingesting a knowledge base.
 */
public class KnowledgeBaseException extends IOException {
    private static final long serialVersionUID = 1L;

    public KnowledgeBaseException (String message) {
        super (message);
    }

    public KnowledgeBaseException (String message, Throwable cause) {
        super (message, cause);
    }
}
