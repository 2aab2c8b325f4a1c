package org.phylo.beastxml.edit;

import org.phylo.beastxml.xml.BeastDocument;
import org.phylo.beastxml.xml.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Chain length, sampling frequency and output file names of the {@code <mcmc>} block.
 */
public final class RunSettingsEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunSettingsEditor.class);

    public static final int DEFAULT_SAMPLES = 10_000;

    private static final String MCMC = "mcmc";
    private static final String OPERATOR_ANALYSIS = "operatorAnalysis";
    private static final String FILE_NAME = "fileName";

    private RunSettingsEditor() {
        // Static utility class
    }

    /**
     * Sets the chain length and makes every {@code <log>} and {@code <logTree>}
     * of the mcmc block sample {@code samples} times.
     */
    public static void setRunLength(BeastDocument document, long runLength, long samples) {
        if (runLength < 1 || samples < 1) {
            throw new IllegalArgumentException("Run length and samples must be positive");
        }
        if (samples > runLength) {
            throw new IllegalArgumentException("Cannot take " + samples + " samples from " + runLength + " steps");
        }
        Element mcmc = mcmc(document);
        mcmc.setAttribute("chainLength", String.valueOf(runLength));
        String every = String.valueOf(runLength / samples);
        for (Element log : logs(mcmc)) {
            log.setAttribute("logEvery", every);
        }
        LOGGER.debug("Chain length {} logging every {}", runLength, every);
    }

    /**
     * Replaces the name of every output file, keeping its extension:
     * {@code run.log} becomes {@code stem.log}.
     */
    public static void setOutputStem(BeastDocument document, String stem) {
        requireName(stem, "stem");
        renameOutputs(document, fileName -> stem + extension(fileName));
    }

    /**
     * Prefixes every output file: {@code run.log} becomes {@code prefix.run.log}.
     */
    public static void setOutputPrefix(BeastDocument document, String prefix) {
        requireName(prefix, "prefix");
        renameOutputs(document, fileName -> prefix + "." + fileName);
    }

    /**
     * Sets an attribute on the element declaring {@code id}.
     *
     * @throws org.phylo.beastxml.ids.UnknownIdentifierException if nothing declares {@code id}
     */
    public static void setAttribute(BeastDocument document, String id, String name, String value) {
        if (Element.ID.equals(name) || Element.IDREF.equals(name)) {
            throw new IllegalArgumentException("Identifiers are changed by renaming, not by setting '" + name + "'");
        }
        document.lookup(id).setAttribute(name, value);
    }

    private static void renameOutputs(BeastDocument document, UnaryOperator<String> rename) {
        Element mcmc = mcmc(document);
        mcmc.findAttribute(OPERATOR_ANALYSIS).ifPresent(f -> mcmc.setAttribute(OPERATOR_ANALYSIS, rename.apply(f)));
        for (Element log : logs(mcmc)) {
            log.findAttribute(FILE_NAME).ifPresent(f -> log.setAttribute(FILE_NAME, rename.apply(f)));
        }
    }

    private static Element mcmc(BeastDocument document) {
        return document.root().first(MCMC)
                .orElseThrow(() -> new EditException("Document '" + document.name() + "' has no <mcmc> block"));
    }

    private static List<Element> logs(Element mcmc) {
        List<Element> logs = new ArrayList<>(mcmc.children("log"));
        logs.addAll(mcmc.children("logTree"));
        return logs;
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot);
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output " + what + " cannot be empty");
        }
    }
}
