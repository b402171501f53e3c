package ncats.kbgraph;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class Util {
    static final Logger logger = Logger.getLogger(Util.class.getName());

    static final ObjectMapper MAPPER = new ObjectMapper ();

    private Util () {
    }

    public static ObjectMapper getObjectMapper () { return MAPPER; }

    public static void writeJson (File file, Object obj) throws IOException {
        File dir = file.getAbsoluteFile().getParentFile();
        if (dir != null && !dir.exists() && !dir.mkdirs())
            throw new IOException ("Can't create directory "+dir);
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, obj);
    }

    public static <T> T readJson (File file, TypeReference<T> type)
        throws IOException {
        if (!file.exists())
            throw new MissingFileException (file);
        return MAPPER.readValue(file, type);
    }

    /**
     * Open a (possibly gzip'ed) file for reading.
     */
    public static InputStream openStream (File file) throws IOException {
        if (file == null || !file.isFile())
            throw new MissingFileException (file);

        InputStream is = new BufferedInputStream (new FileInputStream (file));
        is.mark(2);
        int b0 = is.read(), b1 = is.read();
        is.reset();
        if (b0 == 0x1f && b1 == 0x8b) {
            try {
                return new GZIPInputStream (is);
            }
            catch (ZipException ex) {
                is.close();
                throw new KnowledgeBaseException
                    ("Corrupted gzip file: "+file, ex);
            }
        }
        return is;
    }

    /**
     * Split on a literal delimiter, dropping empty tokens.
     */
    public static List<String> split (String value, char delim) {
        List<String> tokens = new ArrayList<>();
        if (value == null)
            return tokens;

        int start = 0;
        for (int i = 0; i <= value.length(); ++i) {
            if (i == value.length() || value.charAt(i) == delim) {
                String tok = value.substring(start, i).trim();
                if (!tok.isEmpty())
                    tokens.add(tok);
                start = i+1;
            }
        }
        return tokens;
    }
}
