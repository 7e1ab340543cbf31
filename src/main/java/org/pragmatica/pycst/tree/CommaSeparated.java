package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;

import java.util.Optional;

/**
 * An element of a comma separated list that owns the comma following it, if any.
 */
public interface CommaSeparated extends Codegen {
    Optional<Punctuation.Comma> comma();
}
