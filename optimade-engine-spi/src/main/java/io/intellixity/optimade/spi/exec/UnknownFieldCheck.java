package io.intellixity.optimade.spi.exec;

import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.entry.FieldStrictness;
import io.intellixity.optimade.filter.FieldPath;
import io.intellixity.optimade.filter.InvalidFilterException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds referenced fields a collection does not know.
 * <p>
 * A field is known when its first segment is in {@link CollectionSettings#knownFields()}. Fields with
 * another provider's {@code _xyz_} prefix are always warnings; other unknown filter fields fail
 * under {@link FieldStrictness#STRICT}.
 */
public final class UnknownFieldCheck {
  private static final Pattern PROVIDER_PREFIX = Pattern.compile("^_([a-z0-9]+)_.*");

  private final CollectionSettings settings;

  public UnknownFieldCheck(CollectionSettings settings) {
    this.settings = settings;
  }

  public Set<String> checkFilterFields(Collection<FieldPath> fields) {
    Set<String> unknown = new LinkedHashSet<>();
    for (FieldPath f : fields) {
      if (isKnown(f.first())) continue;
      if (settings.strictness() == FieldStrictness.STRICT && !isForeignProviderField(f.first())) {
        throw new InvalidFilterException("Unknown field '" + f.dotted() + "' in filter");
      }
      unknown.add(f.dotted());
    }
    return unknown;
  }

  /** Response and sort fields are only ever reported. */
  public Set<String> report(Collection<String> fields) {
    Set<String> unknown = new LinkedHashSet<>();
    for (String f : fields) {
      if (!isKnown(FieldPath.of(f).first())) unknown.add(f);
    }
    return unknown;
  }

  private boolean isKnown(String topLevel) {
    Set<String> known = settings.knownFields();
    return known.isEmpty() || known.contains(topLevel);
  }

  boolean isForeignProviderField(String topLevel) {
    var m = PROVIDER_PREFIX.matcher(topLevel);
    if (!m.matches()) return false;
    return !m.group(1).equals(settings.providerPrefix());
  }
}
