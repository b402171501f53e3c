package ncats.kbgraph;

import java.util.*;

/**
 * A single entry of a knowledge base as it comes out of a source file.
 * Concepts are staged here by the extractors and then committed to a
 * {@link KnowledgeBase}, which owns all the derived mappings.
 */
public class Concept {
    final String id;
    final String name;
    final String source;
    final Set<String> synonyms = new LinkedHashSet<>();
    final Set<String> altIds = new LinkedHashSet<>();
    final List<String> parents = new ArrayList<>();

    public Concept (String id, String name, String source) {
        if (id == null || id.isEmpty())
            throw new IllegalArgumentException ("Concept has no identifier!");
        if (name == null)
            throw new IllegalArgumentException
                ("Concept "+id+" has no name!");
        this.id = id;
        this.name = name;
        this.source = source;
    }

    public String getId () { return id; }
    public String getName () { return name; }
    public String getSource () { return source; }
    public Set<String> getSynonyms () {
        return Collections.unmodifiableSet(synonyms);
    }
    public Set<String> getAltIds () {
        return Collections.unmodifiableSet(altIds);
    }
    /*
     * direct ancestors in source order
     */
    public List<String> getParents () {
        return Collections.unmodifiableList(parents);
    }

    /**
     * The designated single parent; only defined when the concept has
     * exactly one direct ancestor in its source.
     */
    public String getParent () {
        return parents.size() == 1 ? parents.get(0) : null;
    }

    public Concept addSynonym (String synonym) {
        if (synonym != null && !synonym.isEmpty())
            synonyms.add(synonym);
        return this;
    }

    public Concept addAltId (String altId) {
        if (altId != null && !altId.isEmpty())
            altIds.add(altId);
        return this;
    }

    public Concept addParent (String parent) {
        if (parent != null && !parent.isEmpty())
            parents.add(parent);
        return this;
    }

    @Override
    public int hashCode () { return id.hashCode(); }
    @Override
    public boolean equals (Object obj) {
        if (obj instanceof Concept) {
            Concept c = (Concept)obj;
            return id.equals(c.id) && Objects.equals(source, c.source);
        }
        return false;
    }

    @Override
    public String toString () {
        return "Concept{id="+id+",name=\""+name+"\",source="+source
            +",parents="+parents+"}";
    }
}
