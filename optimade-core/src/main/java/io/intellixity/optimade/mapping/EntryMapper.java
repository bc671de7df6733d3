package io.intellixity.optimade.mapping;

import io.intellixity.optimade.filter.transform.FieldAliases;

import java.util.*;

/**
 * Maps stored documents back to OPTIMADE resources.
 * <p>
 * Backend names are renamed to public names, {@code _id} is dropped, and everything other than
 * {@code id}, {@code type}, {@code relationships} and {@code links} goes under {@code attributes}.
 * When response fields are requested only those attributes are kept; {@code id} and {@code type}
 * are always present.
 */
public final class EntryMapper {
  public static final Set<String> TOP_LEVEL_FIELDS = Set.of("id", "type", "relationships", "links");

  private final String entryType;
  private final FieldAliases aliases;

  public EntryMapper(String entryType, FieldAliases aliases) {
    this.entryType = Objects.requireNonNull(entryType, "entryType");
    this.aliases = (aliases == null) ? FieldAliases.none() : aliases;
  }

  public String entryType() { return entryType; }

  public Map<String, Object> toResource(Map<String, Object> stored, Set<String> responseFields) {
    Objects.requireNonNull(stored, "stored");
    Set<String> wanted = (responseFields == null) ? Set.of() : responseFields;

    Map<String, Object> resource = new LinkedHashMap<>();
    Map<String, Object> attributes = new LinkedHashMap<>();
    Object relationships = null;
    Object links = null;
    Object id = null;
    Object type = null;

    for (var e : stored.entrySet()) {
      String name = aliases.publicName(e.getKey());
      if (name.equals("_id")) continue;
      switch (name) {
        case "id" -> id = e.getValue();
        case "type" -> type = e.getValue();
        case "relationships" -> relationships = e.getValue();
        case "links" -> links = e.getValue();
        default -> {
          if (wanted.isEmpty() || wanted.contains(name)) attributes.put(name, e.getValue());
        }
      }
    }

    if (id == null) {
      throw new IllegalStateException("Stored " + entryType + " entry has no id: " + stored.keySet());
    }
    resource.put("id", String.valueOf(id));
    resource.put("type", (type == null) ? entryType : String.valueOf(type));
    resource.put("attributes", attributes);
    if (relationships != null && (wanted.isEmpty() || wanted.contains("relationships"))) {
      resource.put("relationships", relationships);
    }
    if (links != null) resource.put("links", links);
    return resource;
  }

  public List<Map<String, Object>> toResources(List<Map<String, Object>> stored, Set<String> responseFields) {
    List<Map<String, Object>> out = new ArrayList<>(stored.size());
    for (Map<String, Object> doc : stored) out.add(toResource(doc, responseFields));
    return out;
  }
}
