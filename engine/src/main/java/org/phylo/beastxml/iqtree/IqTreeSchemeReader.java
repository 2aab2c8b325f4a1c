package org.phylo.beastxml.iqtree;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.phylo.beastxml.model.SubstitutionModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads IQ-TREE {@code *.best_scheme.nex} files using the ANTLR-generated
 * lexer and parser.
 *
 * Only nucleotide models are supported; a model outside the catalogue is
 * reported as a parse error at the line where it is assigned.
 */
public final class IqTreeSchemeReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(IqTreeSchemeReader.class);

    private static final int DEFAULT_STEP = 1;

    private IqTreeSchemeReader() {
        // Static utility class
    }

    public static IqTreeScheme read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws IqTreeParseException on a syntax error, an unknown model, or a
     *                              model assigned to a partition without charset
     */
    public static IqTreeScheme parse(String text) {
        IqTreeSchemeLexer lexer = new IqTreeSchemeLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        IqTreeSchemeParser parser = new IqTreeSchemeParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        return build(parser.scheme());
    }

    private static IqTreeScheme build(IqTreeSchemeParser.SchemeContext scheme) {
        Map<String, List<Integer>> columns = new LinkedHashMap<>();
        Map<String, SubstitutionModelSpec> models = new LinkedHashMap<>();
        Map<String, String> modelNames = new LinkedHashMap<>();

        for (IqTreeSchemeParser.StatementContext statement : scheme.statement()) {
            if (statement.charset() != null) {
                IqTreeSchemeParser.CharsetContext charset = statement.charset();
                String name = name(charset.name());
                if (columns.containsKey(name)) {
                    throw error("Charset '" + name + "' defined twice", charset.getStart(), null);
                }
                List<Integer> indices = new ArrayList<>();
                for (IqTreeSchemeParser.RangeContext range : charset.range()) {
                    addRange(indices, range);
                }
                columns.put(name, indices);
            } else {
                for (IqTreeSchemeParser.AssignmentContext assignment : statement.charpartition().assignment()) {
                    String name = name(assignment.name());
                    String model = assignment.model().modelComponent().stream()
                            .map(component -> component.WORD().getText())
                            .collect(Collectors.joining("+"));
                    if (!columns.containsKey(name)) {
                        throw error("Model assigned to unknown charset '" + name + "'", assignment.getStart(), null);
                    }
                    try {
                        models.put(name, IqTreeModelTranslator.translate(model));
                    } catch (IllegalArgumentException e) {
                        throw error(e.getMessage(), assignment.getStart(), e);
                    }
                    modelNames.put(name, model);
                }
            }
        }

        for (String charset : columns.keySet()) {
            if (!models.containsKey(charset)) {
                LOGGER.warn("Charset '{}' has no model assigned and will be ignored", charset);
            }
        }
        return new IqTreeScheme(models, modelNames, columns);
    }

    private static void addRange(List<Integer> indices, IqTreeSchemeParser.RangeContext range) {
        int from = Integer.parseInt(range.from.getText());
        if (range.to == null) {
            indices.add(from);
            return;
        }
        int to = Integer.parseInt(range.to.getText());
        int step = range.step == null ? DEFAULT_STEP : Integer.parseInt(range.step.getText());
        if (to < from || step < 1) {
            throw error("Invalid range " + range.getText(), range.getStart(), null);
        }
        for (int i = from; i <= to; i += step) {
            indices.add(i);
        }
    }

    private static String name(IqTreeSchemeParser.NameContext context) {
        String text = context.getText();
        if (context.QUOTED() != null) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static IqTreeParseException error(String message, Token token, Throwable cause) {
        return new IqTreeParseException(message, token.getLine(), token.getCharPositionInLine(), cause);
    }

    /**
     * Error listener that converts ANTLR errors to IqTreeParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new IqTreeParseException(msg, line, charPositionInLine);
        }
    }
}
