package org.phylo.beastxml;

/**
 * Base class for every failure raised while assembling or editing a BEAST document.
 *
 * An assembly run that throws one of these leaves its target document in an
 * undefined state; callers discard it and re-run with corrected inputs.
 */
public class BeastAssemblyException extends RuntimeException {

    public BeastAssemblyException(String message) {
        super(message);
    }

    public BeastAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
