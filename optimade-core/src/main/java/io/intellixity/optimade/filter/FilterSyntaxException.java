package io.intellixity.optimade.filter;

/**
 * Raised when a filter string does not match the selected grammar.
 * <p>
 * Line is 1-based, column is 0-based (as reported by the lexer); the offending text is the token
 * or character at that position, empty at end of input.
 */
public final class FilterSyntaxException extends RuntimeException {
  private final String filter;
  private final int line;
  private final int column;
  private final String offendingText;

  public FilterSyntaxException(String message, String filter, int line, int column, String offendingText) {
    super(message + " (line " + line + ", column " + column + ")");
    this.filter = filter;
    this.line = line;
    this.column = column;
    this.offendingText = offendingText == null ? "" : offendingText;
  }

  public FilterSyntaxException(String message, String filter, Throwable cause) {
    super(message, cause);
    this.filter = filter;
    this.line = -1;
    this.column = -1;
    this.offendingText = "";
  }

  public String filter() { return filter; }
  public int line() { return line; }
  public int column() { return column; }
  public String offendingText() { return offendingText; }
}
