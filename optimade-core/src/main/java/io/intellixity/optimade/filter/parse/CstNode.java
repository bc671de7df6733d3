package io.intellixity.optimade.filter.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Concrete syntax tree node tagged by grammar rule name.
 * <p>
 * Built from the parser's own tree and detached from it, so it holds no parser state.
 */
public record CstNode(String rule, List<CstElement> children) implements CstElement {
  public CstNode {
    Objects.requireNonNull(rule, "rule");
    children = List.copyOf(Objects.requireNonNull(children, "children"));
  }

  public List<CstNode> nodes() {
    List<CstNode> out = new ArrayList<>();
    for (CstElement c : children) {
      if (c instanceof CstNode n) out.add(n);
    }
    return out;
  }

  public List<CstNode> nodes(String childRule) {
    List<CstNode> out = new ArrayList<>();
    for (CstElement c : children) {
      if (c instanceof CstNode n && n.rule().equals(childRule)) out.add(n);
    }
    return out;
  }

  public Optional<CstNode> node(String childRule) {
    for (CstElement c : children) {
      if (c instanceof CstNode n && n.rule().equals(childRule)) return Optional.of(n);
    }
    return Optional.empty();
  }

  public CstNode requireNode(String childRule) {
    return node(childRule).orElseThrow(() ->
        new IllegalStateException("Rule '" + rule + "' has no '" + childRule + "' child"));
  }

  public List<CstToken> tokens() {
    List<CstToken> out = new ArrayList<>();
    for (CstElement c : children) {
      if (c instanceof CstToken t) out.add(t);
    }
    return out;
  }

  public Optional<CstToken> token(String tokenType) {
    for (CstElement c : children) {
      if (c instanceof CstToken t && t.is(tokenType)) return Optional.of(t);
    }
    return Optional.empty();
  }

  public boolean hasToken(String tokenType) { return token(tokenType).isPresent(); }

  /** Source text of this subtree, tokens separated by single spaces. */
  public String text() {
    StringBuilder sb = new StringBuilder();
    appendText(this, sb);
    return sb.toString();
  }

  private static void appendText(CstNode node, StringBuilder sb) {
    for (CstElement c : node.children) {
      if (c instanceof CstToken t) {
        if (sb.length() > 0) sb.append(' ');
        sb.append(t.text());
      } else {
        appendText((CstNode) c, sb);
      }
    }
  }
}
