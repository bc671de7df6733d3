package io.intellixity.optimade.filter;

public enum StringPredicateKind {
  CONTAINS("CONTAINS"),
  STARTS_WITH("STARTS WITH"),
  ENDS_WITH("ENDS WITH");

  private final String keyword;

  StringPredicateKind(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() { return keyword; }
}
