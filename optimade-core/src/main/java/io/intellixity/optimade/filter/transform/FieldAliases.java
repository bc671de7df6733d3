package io.intellixity.optimade.filter.transform;

import io.intellixity.optimade.filter.FieldPath;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Static field renames for one collection.
 * <p>
 * {@code aliases} maps a public top-level field name to its backend name and is applied to the
 * first segment of a path only, by exact match: {@code formula_prototype} is renamed, while
 * {@code formula_prototypes} is left alone. {@code lengthAliases} maps a public list field to the
 * public field holding its length, which is then aliased like any other field.
 */
public final class FieldAliases {
  private static final FieldAliases NONE = new FieldAliases(Map.of(), Map.of());

  private final Map<String, String> aliases;
  private final Map<String, String> reverse;
  private final Map<String, String> lengthAliases;

  public FieldAliases(Map<String, String> aliases, Map<String, String> lengthAliases) {
    this.aliases = Map.copyOf(Objects.requireNonNull(aliases, "aliases"));
    this.lengthAliases = Map.copyOf(Objects.requireNonNull(lengthAliases, "lengthAliases"));

    Map<String, String> rev = new HashMap<>();
    for (var e : this.aliases.entrySet()) {
      String from = e.getKey();
      String to = e.getValue();
      if (from.isBlank() || from.indexOf('.') >= 0) {
        throw new IllegalArgumentException("Alias source must be a single field name, got '" + from + "'");
      }
      if (to.isBlank() || to.startsWith("$")) {
        throw new IllegalArgumentException("Invalid alias target for '" + from + "': '" + to + "'");
      }
      String prev = rev.put(to, from);
      if (prev != null) {
        throw new IllegalArgumentException("Backend field '" + to + "' aliased twice: " + prev + ", " + from);
      }
    }
    for (var e : this.lengthAliases.entrySet()) {
      if (e.getKey().isBlank() || e.getValue().isBlank()) {
        throw new IllegalArgumentException("Blank length alias: " + e);
      }
    }
    this.reverse = Map.copyOf(rev);
  }

  public static FieldAliases none() { return NONE; }

  public static FieldAliases of(Map<String, String> aliases) {
    return new FieldAliases(aliases, Map.of());
  }

  public Map<String, String> aliases() { return aliases; }
  public Map<String, String> lengthAliases() { return lengthAliases; }

  /** Backend name for a public top-level name; the name itself when not aliased. */
  public String backendName(String publicName) {
    return aliases.getOrDefault(publicName, publicName);
  }

  /** Public name for a backend top-level name; the name itself when not aliased. */
  public String publicName(String backendName) {
    return reverse.getOrDefault(backendName, backendName);
  }

  public FieldPath resolve(FieldPath path) {
    Objects.requireNonNull(path, "path");
    String target = aliases.get(path.first());
    if (target == null) return path;
    if (!path.isNested()) return FieldPath.of(target);
    return FieldPath.of(target + "." + String.join(".", path.segments().subList(1, path.segments().size())));
  }

  /** Public length field for a list field, matched on the full dotted path. */
  public Optional<FieldPath> lengthField(FieldPath listField) {
    String target = lengthAliases.get(listField.dotted());
    return (target == null) ? Optional.empty() : Optional.of(FieldPath.of(target));
  }

  @Override
  public String toString() {
    return "FieldAliases{aliases=" + aliases + ", lengthAliases=" + lengthAliases + "}";
  }
}
