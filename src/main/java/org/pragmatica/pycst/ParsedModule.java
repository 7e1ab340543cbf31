package org.pragmatica.pycst;

import org.pragmatica.pycst.inflate.PositionTable;
import org.pragmatica.pycst.tree.Module;

import java.util.Optional;

/**
 * Inflated module together with the spans recorded while it was built.
 *
 * @param positions        present when position capture was enabled
 * @param trackedNodeCount number of NodeIds handed out during inflation
 */
public record ParsedModule(Module module, Optional<PositionTable> positions, int trackedNodeCount) {}
