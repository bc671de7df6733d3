package io.intellixity.optimade.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.*;

/**
 * Results accumulated from the pages of one provider.
 * <p>
 * Owned by the task querying that provider, so it is not synchronized. After the last page,
 * {@code links.next} and {@code meta.more_data_available} reflect that page only.
 */
public final class QueryResults {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final List<JsonNode> data = new ArrayList<>();
  private final List<String> errors = new ArrayList<>();
  private final ObjectNode meta = NODES.objectNode();
  private final ObjectNode links = NODES.objectNode();
  private final List<JsonNode> included = new ArrayList<>();
  private final Set<String> includedIndex = new HashSet<>();
  private int pages;

  public List<JsonNode> data() { return Collections.unmodifiableList(data); }
  public List<String> errors() { return Collections.unmodifiableList(errors); }
  public ObjectNode meta() { return meta; }
  public ObjectNode links() { return links; }
  public List<JsonNode> included() { return Collections.unmodifiableList(included); }
  public int pages() { return pages; }

  public boolean failed() { return !errors.isEmpty(); }

  /** Folds one JSON:API response document into these results. */
  public void update(JsonNode page) {
    Objects.requireNonNull(page, "page");
    pages++;
    JsonNode d = page.path("data");
    if (d.isArray()) {
      d.forEach(data::add);
    } else if (!d.isMissingNode() && !d.isNull()) {
      if (!data.isEmpty()) throw new ProviderQueryException("Single-object data after earlier pages; refusing to overwrite");
      data.add(d);
    }

    for (JsonNode e : page.path("errors")) errors.add(describeError(e));

    mergeReset(links, page.path("links"), "next", "prev");
    mergeReset(meta, page.path("meta"), "query", "more_data_available");

    for (JsonNode inc : page.path("included")) {
      String typedId = inc.path("type").asText() + "/" + inc.path("id").asText();
      if (includedIndex.add(typedId)) included.add(inc);
    }
  }

  public void addError(String error) {
    errors.add(Objects.requireNonNull(error, "error"));
  }

  /** Next page URL from {@code links.next}, given either as a string or as {@code {"href": ...}}. */
  public Optional<String> nextUrl() {
    JsonNode next = links.path("next");
    if (next.isTextual() && !next.asText().isBlank()) return Optional.of(next.asText());
    JsonNode href = next.path("href");
    if (href.isTextual() && !href.asText().isBlank()) return Optional.of(href.asText());
    return Optional.empty();
  }

  /** {@code meta.data_returned} of the latest page, if the provider sent it. */
  public OptionalLong dataReturned() {
    JsonNode n = meta.path("data_returned");
    return n.canConvertToLong() && n.isIntegralNumber() ? OptionalLong.of(n.asLong()) : OptionalLong.empty();
  }

  public ObjectNode toJson(ObjectMapper mapper) {
    ObjectNode out = mapper.createObjectNode();
    ArrayNode dataNode = out.putArray("data");
    data.forEach(dataNode::add);
    ArrayNode errorNode = out.putArray("errors");
    errors.forEach(errorNode::add);
    out.set("links", links.deepCopy());
    ArrayNode includedNode = out.putArray("included");
    included.forEach(includedNode::add);
    out.set("meta", meta.deepCopy());
    return out;
  }

  /** Copies {@code source} fields over {@code target}; {@code reset} keys missing from the source become null. */
  private static void mergeReset(ObjectNode target, JsonNode source, String... reset) {
    for (String k : reset) target.putNull(k);
    if (source.isObject()) {
      source.fields().forEachRemaining(e -> target.set(e.getKey(), e.getValue()));
    }
  }

  static String describeError(JsonNode error) {
    String title = error.path("title").asText("");
    String detail = error.path("detail").asText("");
    if (title.isEmpty() && detail.isEmpty()) return error.toString();
    if (title.isEmpty()) return detail;
    if (detail.isEmpty()) return title;
    return title + ": " + detail;
  }
}
