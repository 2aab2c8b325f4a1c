package org.phylo.beastxml.cli;

import org.phylo.beastxml.model.TemplateLibrary;

import java.nio.file.Path;
import java.util.Map;

/**
 * Picks the template library: the command-line directory first, then the
 * {@code BEASTXML_TEMPLATES} environment variable, then the bundled templates.
 */
final class TemplateSource {

    static final String ENV_VAR = "BEASTXML_TEMPLATES";

    private TemplateSource() {
    }

    static TemplateLibrary resolve(Path flag, Map<String, String> environment) {
        Path directory = flag;
        if (directory == null) {
            String env = environment.get(ENV_VAR);
            if (env != null && !env.isBlank()) {
                directory = Path.of(env);
            }
        }
        if (directory == null) {
            return TemplateLibrary.bundled();
        }
        return TemplateLibrary.overriddenBy(directory);
    }
}
