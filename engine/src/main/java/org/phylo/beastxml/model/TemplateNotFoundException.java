package org.phylo.beastxml.model;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when a template is neither in the configured directory nor on the classpath.
 */
public class TemplateNotFoundException extends BeastAssemblyException {

    private final String template;

    public TemplateNotFoundException(String template, String searched) {
        super("Template '" + template + "' not found (searched " + searched + ")");
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
