package io.intellixity.optimade.filter.parse;

import io.intellixity.optimade.filter.UnknownGrammarVersionException;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar revision, written as {@code v<major>.<minor>.<patch>[.<variant>]} (the grammar file naming pattern).
 * <p>
 * Ordered numerically; for equal numbers the default variant (no tag) sorts first.
 */
public record GrammarVersion(int major, int minor, int patch, String variant) implements Comparable<GrammarVersion> {
  private static final Pattern TAG = Pattern.compile("v?(\\d+)\\.(\\d+)\\.(\\d+)(?:\\.([A-Za-z][A-Za-z0-9_-]*))?");

  private static final Comparator<GrammarVersion> ORDER = Comparator
      .comparingInt(GrammarVersion::major)
      .thenComparingInt(GrammarVersion::minor)
      .thenComparingInt(GrammarVersion::patch)
      .thenComparing(GrammarVersion::variant, Comparator.nullsFirst(Comparator.naturalOrder()));

  public GrammarVersion {
    if (major < 0 || minor < 0 || patch < 0) {
      throw new IllegalArgumentException("version numbers must be >= 0");
    }
    variant = (variant == null || variant.isBlank()) ? null : variant;
  }

  public static GrammarVersion of(int major, int minor, int patch) {
    return new GrammarVersion(major, minor, patch, null);
  }

  public static GrammarVersion parse(String tag) {
    Objects.requireNonNull(tag, "tag");
    Matcher m = TAG.matcher(tag.trim());
    if (!m.matches()) {
      throw new UnknownGrammarVersionException("Malformed grammar version '" + tag + "'; expected v<major>.<minor>.<patch>[.<variant>]");
    }
    try {
      return new GrammarVersion(
          Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)), m.group(4));
    } catch (NumberFormatException e) {
      throw new UnknownGrammarVersionException("Malformed grammar version '" + tag + "'", e);
    }
  }

  public boolean isDefaultVariant() { return variant == null; }

  public String tag() {
    String base = "v" + major + "." + minor + "." + patch;
    return variant == null ? base : base + "." + variant;
  }

  @Override
  public int compareTo(GrammarVersion o) { return ORDER.compare(this, o); }

  @Override
  public String toString() { return tag(); }
}
