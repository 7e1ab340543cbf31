package org.pragmatica.pycst.tree;

import org.pragmatica.pycst.codegen.Codegen;

/**
 * Whitespace that may span several lines when it sits inside brackets.
 */
public sealed interface ParenthesizableWhitespace extends Codegen permits SimpleWhitespace, ParenthesizedWhitespace {
    boolean isEmpty();
}
