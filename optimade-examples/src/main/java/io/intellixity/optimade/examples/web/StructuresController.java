package io.intellixity.optimade.examples.web;

import io.intellixity.optimade.entry.EntryCollection;
import io.intellixity.optimade.entry.EntryQuery;
import io.intellixity.optimade.entry.QueryResultPage;
import io.intellixity.optimade.examples.config.OptimadeProperties;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON:API style {@code /v1/structures} endpoints over one {@link EntryCollection}. */
@RestController
@RequestMapping("/v1/structures")
public final class StructuresController {
  private final EntryCollection structures;
  private final String apiVersion;

  public StructuresController(EntryCollection structures, OptimadeProperties props) {
    this.structures = structures;
    this.apiVersion = props.getApiVersion();
  }

  @GetMapping
  public Map<String, Object> list(@RequestParam(name = "filter", required = false) String filter,
                                  @RequestParam(name = "page_limit", required = false) Integer pageLimit,
                                  @RequestParam(name = "page_offset", defaultValue = "0") int pageOffset,
                                  @RequestParam(name = "page_cursor", required = false) String pageCursor,
                                  @RequestParam(name = "sort", required = false) String sort,
                                  @RequestParam(name = "response_fields", required = false) String responseFields) {
    EntryQuery query = EntryQuery.of(filter)
        .withPageLimit(pageLimit)
        .withPageOffset(pageOffset)
        .withCursor(pageCursor)
        .withSort(sort)
        .withResponseFields(responseFields);
    QueryResultPage page = structures.find(query);

    Map<String, Object> links = new LinkedHashMap<>();
    links.put("next", page.moreDataAvailable() ? nextLink(page.nextCursor()) : null);

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", page.entries());
    body.put("meta", meta(page));
    body.put("links", links);
    return body;
  }

  @GetMapping("/{id}")
  public Map<String, Object> get(@PathVariable("id") String id,
                                 @RequestParam(name = "filter", required = false) String filter,
                                 @RequestParam(name = "response_fields", required = false) String responseFields) {
    QueryResultPage page = structures.findEntry(id, EntryQuery.of(filter).withResponseFields(responseFields));
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", page.entries().isEmpty() ? null : page.entries().get(0));
    body.put("meta", meta(page));
    return body;
  }

  private Map<String, Object> meta(QueryResultPage page) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("api_version", apiVersion);
    meta.put("data_returned", page.dataReturned());
    meta.put("more_data_available", page.moreDataAvailable());
    if (!page.unknownFields().isEmpty()) {
      List<Map<String, Object>> warnings = new ArrayList<>();
      for (String f : page.unknownFields()) {
        warnings.add(Map.of("type", "warning", "title", "Unknown field", "detail", "Unknown field '" + f + "' was ignored"));
      }
      meta.put("warnings", warnings);
    }
    return meta;
  }

  private static String nextLink(String cursor) {
    return ServletUriComponentsBuilder.fromCurrentRequest()
        .replaceQueryParam("page_offset")
        .replaceQueryParam("page_cursor", cursor)
        .toUriString();
  }
}
