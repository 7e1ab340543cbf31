package org.pragmatica.pycst.tree;

/**
 * What may follow the body of an {@code if}: an {@code elif} or an {@code else}.
 */
public sealed interface OrElse extends Node permits Statement.If, StatementPart.Else {}
