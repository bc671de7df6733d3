package io.intellixity.optimade.filter;

public enum Quantifier {
  HAS("HAS"),
  HAS_ALL("HAS ALL"),
  HAS_ANY("HAS ANY"),
  HAS_ONLY("HAS ONLY");

  private final String keyword;

  Quantifier(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() { return keyword; }
}
