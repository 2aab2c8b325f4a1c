package org.phylo.beastxml.model;

import org.phylo.beastxml.BeastAssemblyException;
import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.BeastXmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Source of template fragments.
 *
 * Templates are looked up in an optional override directory first and then
 * under {@code templates/} on the classpath. Every {@link #load} parses the file
 * again, so callers always get a fragment they are free to modify.
 */
public final class TemplateLibrary {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateLibrary.class);

    public static final String CLASSPATH_ROOT = "templates/";

    private final Path directory;

    private TemplateLibrary(Path directory) {
        this.directory = directory;
    }

    /**
     * Library backed only by the templates bundled with the engine.
     */
    public static TemplateLibrary bundled() {
        return new TemplateLibrary(null);
    }

    /**
     * Library that prefers files under {@code directory} (same relative layout,
     * e.g. {@code models/hky.xml}) and falls back to the bundled templates.
     */
    public static TemplateLibrary overriddenBy(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Template directory does not exist: " + directory);
        }
        return new TemplateLibrary(directory);
    }

    public boolean exists(String relativePath) {
        if (directory != null && Files.isRegularFile(directory.resolve(relativePath))) {
            return true;
        }
        return classLoader().getResource(CLASSPATH_ROOT + relativePath) != null;
    }

    /**
     * @param relativePath Path under the library root, e.g. {@code modifiers/gamma.xml}
     * @throws TemplateNotFoundException if no such template exists
     */
    public BeastDocument load(String relativePath) {
        try {
            if (directory != null) {
                Path file = directory.resolve(relativePath);
                if (Files.isRegularFile(file)) {
                    LOGGER.debug("Loading template {} from {}", relativePath, file);
                    return BeastXmlReader.parse(file);
                }
            }
            InputStream in = classLoader().getResourceAsStream(CLASSPATH_ROOT + relativePath);
            if (in == null) {
                throw new TemplateNotFoundException(relativePath, describe());
            }
            return BeastXmlReader.parse(relativePath, in);
        } catch (IOException e) {
            throw new BeastAssemblyException("Failed to read template " + relativePath, e);
        }
    }

    private String describe() {
        return directory == null ? "classpath:" + CLASSPATH_ROOT
                : directory + " and classpath:" + CLASSPATH_ROOT;
    }

    private static ClassLoader classLoader() {
        return TemplateLibrary.class.getClassLoader();
    }

    @Override
    public String toString() {
        return "TemplateLibrary[" + describe() + "]";
    }
}
