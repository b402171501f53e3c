package ncats.kbgraph.test;

import java.io.*;
import java.util.*;

import ncats.kbgraph.LineTokenizer;

import org.junit.Test;
import static org.junit.Assert.*;

public class TestLineTokenizer {

    static LineTokenizer tokenize (String text, char delim) throws IOException {
        LineTokenizer tokenizer = new LineTokenizer (delim);
        tokenizer.setReader(new StringReader (text));
        return tokenizer;
    }

    @Test
    public void testEmptyFields () throws IOException {
        LineTokenizer tokenizer = tokenize ("a\t\tc\t\nd\te\tf\tg\n", '\t');
        String[] toks = tokenizer.next();
        assertArrayEquals (new String[]{"a", null, "c", null}, toks);
        toks = tokenizer.next();
        assertArrayEquals (new String[]{"d", "e", "f", "g"}, toks);
        assertFalse (tokenizer.hasNext());
        assertEquals ("number of records", 2, tokenizer.getCount());
    }

    @Test
    public void testNoTerminatingNewline () throws IOException {
        LineTokenizer tokenizer = tokenize ("x|y\r\nz|w", '|');
        List<String[]> rows = new ArrayList<>();
        while (tokenizer.hasNext())
            rows.add(tokenizer.next());
        assertEquals (2, rows.size());
        assertArrayEquals (new String[]{"x", "y"}, rows.get(0));
        assertArrayEquals (new String[]{"z", "w"}, rows.get(1));
        assertEquals ("z|w", tokenizer.getCurrentLine());
    }

    @Test
    public void testBlankLine () throws IOException {
        LineTokenizer tokenizer = tokenize ("a\tb\n\nc\td\n", '\t');
        assertFalse (LineTokenizer.isBlank(tokenizer.next()));
        assertTrue (LineTokenizer.isBlank(tokenizer.next()));
        assertArrayEquals (new String[]{"c", "d"}, tokenizer.next());
        assertFalse (tokenizer.hasNext());
    }

    @Test
    public void testSkip () throws IOException {
        LineTokenizer tokenizer = tokenize ("# one\n# two\nA\t1\n", '\t');
        assertEquals (2, tokenizer.skip(2));
        assertArrayEquals (new String[]{"A", "1"}, tokenizer.next());
        assertEquals (3, tokenizer.getCount());
        assertEquals (0, tokenizer.skip(5));
    }

    @Test
    public void testQuote () throws IOException {
        LineTokenizer tokenizer = tokenize ("\"a,b\",c\n", ',');
        tokenizer.setCheckQuote(true);
        tokenizer.setReader(new StringReader ("\"a,b\",c\n"));
        assertArrayEquals (new String[]{"a,b", "c"}, tokenizer.next());
    }
}
