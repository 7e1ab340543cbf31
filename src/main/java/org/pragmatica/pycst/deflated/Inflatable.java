package org.pragmatica.pycst.deflated;

import org.pragmatica.pycst.inflate.InflateCtx;

/**
 * A deflated element that turns into exactly one inflated value.
 */
interface Inflatable<T> {
    T inflate(InflateCtx ctx);
}
