package org.pragmatica.pycst.error;

/**
 * Whitespace bookkeeping went out of sync while building the tree. Indicates a defect in the
 * library, never a problem with the input.
 */
public final class InflationException extends IllegalStateException {
    public InflationException(String message) {
        super(message);
    }
}
