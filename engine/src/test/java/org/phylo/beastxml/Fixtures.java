package org.phylo.beastxml;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.BeastXmlReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Documents under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String SKELETON = "skeleton.xml";
    public static final String LOCATION = "location.xml";
    public static final String GLM = "glm.xml";

    private Fixtures() {
    }

    public static BeastDocument load(String name) {
        InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name);
        if (in == null) {
            throw new IllegalArgumentException("No fixture " + name);
        }
        try {
            return BeastXmlReader.parse(name, in);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static BeastDocument skeleton() {
        return load(SKELETON);
    }

    /**
     * Wraps body elements in {@code <beast version="1.10.4">}.
     */
    public static BeastDocument fragment(String name, String body) {
        return BeastXmlReader.parse(name, "<beast version=\"1.10.4\">" + body + "</beast>");
    }
}
