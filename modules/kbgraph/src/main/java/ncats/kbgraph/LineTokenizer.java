package ncats.kbgraph;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Streaming tokenizer for delimited text; empty fields come back as null.
 */
public class LineTokenizer implements Iterator<String[]> {
    protected char delim;
    protected Reader reader;
    protected char[] buf = new char[1];
    protected String[] tokens;
    protected boolean checkQuote = false;

    protected int count;
    protected StringBuilder currentLine = new StringBuilder ();
    protected StringBuilder nextLine = new StringBuilder ();

    public LineTokenizer () {
        this ('\t');
    }

    public LineTokenizer (char delim) {
        setDelimiter (delim);
    }

    public void setDelimiter (char delim) {
        this.delim = delim;
    }
    public char getDelimiter () { return delim; }
    public void setCheckQuote (boolean checkQuote) {
        this.checkQuote = checkQuote;
    }

    protected String[] nextLine () throws IOException {
        List<String> tokens = new ArrayList<String>();
        int nb;

        boolean quote = false;
        StringBuilder tok = new StringBuilder ();
        nextLine.setLength(0);
        while ((nb = reader.read(buf)) != -1) {
            if (buf[0] == '"' && checkQuote) {
                quote = !quote;
            }
            else if (buf[0] == '\r') {
                continue;
            }
            else if (buf[0] == '\n') {
                if (!quote) {
                    tokens.add(tok.length() > 0? tok.toString() : null);
                    break;
                }
                else
                    tok.append('\n');
            }
            else if (buf[0] != delim || quote) {
                tok.append(buf[0]);
            }
            else {
                tokens.add(tok.length() > 0 ? tok.toString() : null);
                tok.setLength(0);
            }
            nextLine.append(buf[0]);
        }

        if (nb == -1) {
            if (tokens.isEmpty() && nextLine.length() == 0) return null;
            // no terminating newline at the end of the last record
            if (buf[0] != '\n' || tokens.isEmpty()) {
                tokens.add(tok.length() > 0 ? tok.toString() : null);
            }
        }

        return tokens.toArray(new String[0]);
    }

    public void setInputStream (InputStream is) throws IOException {
        setReader (new InputStreamReader (is, StandardCharsets.UTF_8));
    }

    public void setReader (Reader reader) throws IOException {
        this.reader = reader instanceof BufferedReader
            ? reader : new BufferedReader (reader);
        count = 0;
        buf[0] = 0;
        currentLine.setLength(0);
        tokens = nextLine ();
    }

    /**
     * skip the given number of leading lines (e.g., comment header)
     */
    public int skip (int n) {
        int skipped = 0;
        for (; skipped < n && hasNext (); ++skipped)
            next ();
        return skipped;
    }

    /*
     * number of records returned so far
     */
    public int getCount () { return count; }
    /*
     * raw text of the record last returned by next()
     */
    public String getCurrentLine () {
        return currentLine.toString();
    }

    public static boolean isBlank (String[] tokens) {
        for (String t : tokens)
            if (t != null && !t.trim().isEmpty())
                return false;
        return true;
    }

    public boolean hasNext () {
        return tokens != null;
    }

    public String[] next () {
        if (tokens == null)
            throw new NoSuchElementException ("No line available");
        String[] line = tokens;
        currentLine.setLength(0);
        currentLine.append(nextLine);
        ++count;
        try {
            tokens = nextLine ();
        }
        catch (IOException ex) {
            tokens = null;
            throw new UncheckedIOException (ex);
        }
        return line;
    }
}
