package io.intellixity.optimade.filter.parse;

/** Child of a concrete syntax tree node: either a nested rule or a token. */
public sealed interface CstElement permits CstNode, CstToken {
}
