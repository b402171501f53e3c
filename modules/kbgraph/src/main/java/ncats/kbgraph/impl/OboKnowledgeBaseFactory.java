package ncats.kbgraph.impl;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Logger;

import ncats.kbgraph.*;

/**
 * Loads OBO 1.2/1.4 ontologies (ChEBI, HPO, MEDIC, GO, DO, Cellosaurus,
 * CL, Uberon, ...). Only {@code [Term]} stanzas are considered; a term
 * must have a name (and, for namespace-filtered sources such as go_bp and
 * go_cc, the configured namespace) to be accepted. Obsolete terms never
 * make it into the knowledge base.
 */
public class OboKnowledgeBaseFactory extends KnowledgeBaseFactory {
    static final Logger logger =
        Logger.getLogger(OboKnowledgeBaseFactory.class.getName());

    static final String TERM = "[Term]";
    static final String DERIVED_FROM = "derived_from";

    /*
     * tag-value pairs of one stanza; multi-valued tags keep file order
     */
    static class Stanza {
        final String type;
        final int line;
        final Map<String, List<String>> tags = new LinkedHashMap<>();

        Stanza (String type, int line) {
            this.type = type;
            this.line = line;
        }

        void add (String tag, String value) {
            tags.computeIfAbsent(tag, k -> new ArrayList<>()).add(value);
        }

        String get (String tag) {
            List<String> values = tags.get(tag);
            return values != null && !values.isEmpty() ? values.get(0) : null;
        }

        List<String> getAll (String tag) {
            List<String> values = tags.get(tag);
            return values != null ? values : Collections.emptyList();
        }

        boolean isTerm () { return TERM.equals(type); }
        boolean isObsolete () {
            return "true".equalsIgnoreCase(get ("is_obsolete"));
        }
    }

    int obsoletes;

    public OboKnowledgeBaseFactory (KnowledgeBaseSource source) {
        super (source);
    }

    @Override
    protected int register () throws IOException {
        obsoletes = 0;
        int count;
        try (InputStream is = openStream (source.getFile())) {
            count = register (is);
        }
        if (obsoletes > 0)
            logger.info("### "+source.getKb()+": "+obsoletes
                        +" obsolete terms retracted");
        return count;
    }

    public int register (InputStream is) throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, StandardCharsets.UTF_8));

        int count = 0, lines = 0;
        Stanza stanza = null;
        for (String line; (line = br.readLine()) != null; ) {
            ++lines;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("!"))
                continue;

            if (line.startsWith("[") && line.endsWith("]")) {
                if (commit (stanza))
                    ++count;
                stanza = new Stanza (line, lines);
            }
            else if (stanza != null) { // header tags are ignored
                int pos = line.indexOf(':');
                if (pos > 0) {
                    String tag = line.substring(0, pos).trim();
                    String value = stripComment (line.substring(pos+1));
                    if (!value.isEmpty())
                        stanza.add(tag, value);
                }
                else {
                    logger.warning(source.getKb()+":"+lines
                                   +": not a tag-value pair: "+line);
                }
            }
        }

        if (commit (stanza))
            ++count;
        return count;
    }

    protected boolean commit (Stanza stanza) {
        if (stanza == null || !stanza.isTerm())
            return false;

        String id = stanza.get("id");
        String name = stanza.get("name");
        if (id == null || name == null) {
            ++skipped;
            return false;
        }

        if (stanza.isObsolete()) {
            // may have been accepted by an earlier stanza of the same id
            kb.retract(id);
            ++obsoletes;
            return false;
        }

        String namespace = source.getNamespace();
        if (namespace != null && !namespace.equals(stanza.get("namespace"))) {
            ++skipped;
            return false;
        }

        Concept concept = new Concept (id, name, source.getKb());
        for (String alt : stanza.getAll("alt_id"))
            concept.addAltId(firstToken (alt));
        for (String parent : stanza.getAll("is_a"))
            concept.addParent(firstToken (parent));
        for (String syn : stanza.getAll("synonym")) {
            String text = quoted (syn);
            if (text != null)
                concept.addSynonym(text);
            else
                logger.warning(source.getKb()+":"+stanza.line+": "+id
                               +" has unquoted synonym: "+syn);
        }
        kb.add(concept);

        if (source.isDerivedFrom()) {
            for (String rel : stanza.getAll("relationship")) {
                String[] toks = rel.split("\\s+");
                if (toks.length > 1 && DERIVED_FROM.equals(toks[0]))
                    kb.addEdge(toks[1], id); // parent line -> derived line
            }
        }

        String prefix = source.getXrefPrefix();
        if (prefix != null) {
            for (String xref : stanza.getAll("xref")) {
                String ref = firstToken (xref);
                if (ref.startsWith(prefix) && ref.length() > prefix.length())
                    kb.addXref(ref.substring(prefix.length()), id);
            }
        }

        return true;
    }

    static String firstToken (String value) {
        int pos = 0;
        while (pos < value.length()
               && !Character.isWhitespace(value.charAt(pos)))
            ++pos;
        return value.substring(0, pos);
    }

    /*
     * text between the first pair of double quotes
     */
    static String quoted (String value) {
        int start = value.indexOf('"');
        if (start < 0)
            return null;
        StringBuilder sb = new StringBuilder ();
        for (int i = start+1; i < value.length(); ++i) {
            char ch = value.charAt(i);
            if (ch == '\\' && i+1 < value.length()) {
                sb.append(value.charAt(++i));
            }
            else if (ch == '"') {
                return sb.toString();
            }
            else {
                sb.append(ch);
            }
        }
        return null;
    }

    /**
     * Remove the trailing {@code ! comment} and {@code {modifier}} of a tag
     * value; quoted text and escaped characters are left alone.
     */
    static String stripComment (String value) {
        boolean quote = false;
        int end = value.length();
        for (int i = 0; i < value.length(); ++i) {
            char ch = value.charAt(i);
            if (ch == '\\') {
                ++i;
            }
            else if (ch == '"') {
                quote = !quote;
            }
            else if (ch == '!' && !quote) {
                end = i;
                break;
            }
        }

        String v = value.substring(0, end).trim();
        if (v.endsWith("}") && !v.endsWith("\\}")) {
            int pos = v.lastIndexOf('{');
            if (pos > 0 && v.charAt(pos-1) != '\\' && !insideQuote (v, pos))
                v = v.substring(0, pos).trim();
        }
        return v;
    }

    static boolean insideQuote (String value, int pos) {
        boolean quote = false;
        for (int i = 0; i < pos; ++i) {
            char ch = value.charAt(i);
            if (ch == '\\')
                ++i;
            else if (ch == '"')
                quote = !quote;
        }
        return quote;
    }
}
