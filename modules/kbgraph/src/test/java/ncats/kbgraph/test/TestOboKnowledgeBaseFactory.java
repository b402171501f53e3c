package ncats.kbgraph.test;

import java.io.*;
import java.util.*;

import ncats.kbgraph.*;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class TestOboKnowledgeBaseFactory {
    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder ();

    KnowledgeBase load (String obo) throws IOException {
        File file = TestUtil.write(tmpDir.newFile("test.obo"), obo);
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (TestUtil.createConfig(), "test", "obo");
        return KnowledgeBaseFactory.getInstance(source.setFile(file)).load();
    }

    @Test
    public void testBiologicalProcess () throws IOException {
        KnowledgeBase kb = TestUtil.load("go_bp", "obo");

        assertEquals (new HashSet<>(Arrays.asList
                                    ("GO:0008150", "GO:0000001", "GO:0000003")),
                      kb.getIdToName().keySet());
        assertEquals ("GO:0000001", kb.getId("mitochondrion inheritance"));
        assertEquals ("GO:0000001",
                      kb.getSynonymToId().get("mitochondrial inheritance"));
        assertEquals ("GO:0000003", kb.getSynonymToId()
                      .get("reproductive physiological process"));
        assertEquals ("GO:0000001", kb.getAltIdToId().get("GO:0000002"));

        // root already present under its name
        assertEquals ("GO:0008150", kb.getRoot());
        assertEquals (3, kb.getNameToId().size());

        assertEquals ("GO:0008150", kb.getParent("GO:0000001"));
        assertNull (kb.getParent("GO:0000003"));
        assertNull (kb.getParent("GO:0008150"));

        assertEquals (Arrays.asList
                      (new Edge ("GO:0000001", "GO:0008150"),
                       new Edge ("GO:0000003", "GO:0008150"),
                       new Edge ("GO:0000003", "GO:0000001")),
                      kb.getEdges());
        assertEquals (2, kb.getInfo("GO:0000003").getDescendants());
        assertEquals (2, kb.getInfo("GO:0008150").getInDegree());
    }

    @Test
    public void testCellularComponent () throws IOException {
        KnowledgeBase kb = TestUtil.load("go_cc", "obo");
        assertEquals (new HashSet<>(Arrays.asList("GO:0005575", "GO:0005623")),
                      kb.getIdToName().keySet());
        assertEquals ("GO:0005623", kb.getAltIdToId().get("GO:0005624"));
        assertFalse (kb.getAltIdToId().containsKey("GO:0000002"));
    }

    @Test
    public void testObsoleteNeverAccepted () throws IOException {
        KnowledgeBase kb = TestUtil.load("go_bp", "obo");
        assertNull (kb.getName("GO:0000004"));
        assertNull (kb.getId("obsolete biological process"));
        assertFalse (kb.getAltIdToId().containsKey("GO:0000009"));
        for (String id : kb.getAltIdToId().values())
            assertTrue (id+" is not a concept", kb.contains(id));
    }

    @Test
    public void testObsoleteRetractsEarlierStanza () throws IOException {
        KnowledgeBase kb = load
            ("[Term]\n"
             +"id: X:1\n"
             +"name: root\n"
             +"\n"
             +"[Term]\n"
             +"id: X:2\n"
             +"name: child\n"
             +"synonym: \"kid\" EXACT []\n"
             +"is_a: X:1\n"
             +"\n"
             +"[Term]\n"
             +"id: X:2\n"
             +"name: child\n"
             +"is_obsolete: true\n");
        assertNull (kb.getName("X:2"));
        assertNull (kb.getId("child"));
        assertNull (kb.getSynonymToId().get("kid"));
        assertTrue (kb.getEdges().isEmpty());
        assertEquals ("root", kb.getName("X:1"));
    }

    @Test
    public void testStanzaWithoutNameSkipped () throws IOException {
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (TestUtil.createConfig(), "go_bp", "obo");
        KnowledgeBaseFactory factory = KnowledgeBaseFactory.getInstance(source);
        KnowledgeBase kb = factory.load();
        // GO:0000005 has no name; GO:0005575 and GO:0005623 are not
        // biological_process
        assertEquals (3, factory.getSkipped());
        assertNull (kb.getName("GO:0000005"));
        // typedefs are not concepts
        assertNull (kb.getId("part of"));
    }

    @Test
    public void testNamespaceRejectionsCounted () throws IOException {
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (TestUtil.createConfig(), "go_cc", "obo");
        KnowledgeBaseFactory factory = KnowledgeBaseFactory.getInstance(source);
        factory.load();
        // three biological_process terms plus the nameless GO:0000005;
        // the obsolete GO:0000004 is not counted
        assertEquals (4, factory.getSkipped());
    }

    @Test
    public void testRootInjectionAndAliases () throws IOException {
        KnowledgeBase kb = TestUtil.load("hp", "obo");
        assertEquals ("HP:0000001", kb.getId("All"));
        assertEquals ("HP:0000001", kb.getRoot());
        assertEquals ("HP:0000118", kb.getXrefToId().get("C4021790"));
        assertEquals ("HP:0000707", kb.getXrefToId().get("C4021791"));
        assertEquals (2, kb.getXrefToId().size());
        assertEquals ("HP:0000707", kb.resolve("C4021791"));
        // root is injected as a concept only; no edges are made up
        assertEquals (1, kb.getEdges().size());
    }

    @Test
    public void testBridgingEdges () throws IOException {
        KnowledgeBase kb = TestUtil.load("chebi", "obo");
        assertEquals ("CHEBI:00", kb.getId("root"));
        assertEquals (5, kb.getEdges().size());
        assertTrue (kb.getEdges().contains(new Edge ("CHEBI:24431", "CHEBI:00")));
        assertTrue (kb.getEdges().contains(new Edge ("CHEBI:33232", "CHEBI:00")));
        assertEquals (2, kb.getInfo("CHEBI:23367").getDescendants());
        assertEquals (4, kb.getInfo("CHEBI:00").getInDegree());
    }

    @Test
    public void testDerivedFrom () throws IOException {
        KnowledgeBase kb = TestUtil.load("cellosaurus", "obo");
        assertEquals (Arrays.asList(new Edge ("CVCL_0030", "CVCL_1922")),
                      kb.getEdges());
        assertTrue (kb.getChildToParent().isEmpty());
        assertEquals ("CVCL_1922", kb.getSynonymToId().get("HeLa-S3"));
        assertEquals (1, kb.getInfo("CVCL_0030").getOutDegree());
    }

    @Test
    public void testObsoleteRetractsDerivedFromEdges () throws IOException {
        File file = TestUtil.write
            (tmpDir.newFile("cellosaurus.obo"),
             "[Term]\n"
             +"id: CVCL_1\n"
             +"name: parent line\n"
             +"\n"
             +"[Term]\n"
             +"id: CVCL_2\n"
             +"name: child line\n"
             +"relationship: derived_from CVCL_1 ! parent line\n"
             +"\n"
             +"[Term]\n"
             +"id: CVCL_2\n"
             +"name: child line\n"
             +"is_obsolete: true\n");
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (TestUtil.createConfig(), "cellosaurus", "obo").setFile(file);
        KnowledgeBase kb = KnowledgeBaseFactory.getInstance(source).load();

        assertEquals (Collections.singletonMap("parent line", "CVCL_1"),
                      kb.getNameToId());
        assertTrue ("edges of obsolete CVCL_2 remain",
                    kb.getEdges().isEmpty());
        assertFalse (kb.getGraph().contains("CVCL_2"));
        assertFalse (kb.getNodeToNode().containsKey("CVCL_2"));
        assertNull (kb.getInfo("CVCL_2"));
        assertNull (kb.getInfo("CVCL_1"));
    }

    @Test
    public void testUndeclaredOntology () throws IOException {
        KnowledgeBase kb = load
            ("format-version: 1.2\n"
             +"[Term]\n"
             +"id: Y:1\n"
             +"name: thing ! with comment\n"
             +"[Term]\n"
             +"id: Y:2\n"
             +"name: other\n"
             +"is_a: Y:1 {source=\"x\"} ! thing\n");
        assertEquals ("Y:1", kb.getId("thing"));
        assertEquals ("Y:1", kb.getParent("Y:2"));
        assertNull (kb.getRoot());
    }

    @Test(expected = MissingFileException.class)
    public void testMissingFile () throws IOException {
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (TestUtil.createConfig(), "uberon", "obo");
        KnowledgeBaseFactory.getInstance(source).load();
    }
}
