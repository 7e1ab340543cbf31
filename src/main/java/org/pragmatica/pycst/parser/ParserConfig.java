package org.pragmatica.pycst.parser;

import java.util.Optional;

/**
 * Parser configuration options.
 *
 * @param version          language level accepted by the parser
 * @param encoding         declared source encoding recorded on the module, {@code utf-8} when absent
 * @param defaultNewline   newline used for synthesized lines, detected from the source when absent
 * @param capturePositions whether inflation fills a position table
 */
public record ParserConfig(
    PythonVersion version,
    Optional<String> encoding,
    Optional<String> defaultNewline,
    boolean capturePositions
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        PythonVersion.PERMISSIVE,
        Optional.empty(),
        Optional.empty(),
        false
    );

    public ParserConfig withCapturePositions(boolean capture) {
        return new ParserConfig(version, encoding, defaultNewline, capture);
    }
}
