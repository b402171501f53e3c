package ncats.kbgraph.test;

import java.io.*;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.logging.Logger;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

import ncats.kbgraph.*;

public class TestUtil {
    static final Logger logger = Logger.getLogger(TestUtil.class.getName());

    public static File getDataDir () {
        try {
            return new File (TestUtil.class.getResource("/kbs").toURI());
        }
        catch (URISyntaxException ex) {
            throw new IllegalStateException (ex);
        }
    }

    /*
     * reference configuration pointing at the test fixtures
     */
    public static Config createConfig (File data, File output) {
        return ConfigFactory.load()
            .withValue("kbgraph.data",
                       ConfigValueFactory.fromAnyRef(data.getPath()))
            .withValue("kbgraph.output",
                       ConfigValueFactory.fromAnyRef(output.getPath()));
    }

    public static Config createConfig () {
        return createConfig (getDataDir (), getDataDir ());
    }

    public static KnowledgeBase load (String kb, String format)
        throws IOException {
        KnowledgeBaseSource source = KnowledgeBaseSource.getInstance
            (createConfig (), kb, format);
        return KnowledgeBaseFactory.getInstance(source).load();
    }

    public static File write (File file, String content) throws IOException {
        Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    public static String read (File file) throws IOException {
        return new String (Files.readAllBytes(file.toPath()),
                           StandardCharsets.UTF_8);
    }
}
