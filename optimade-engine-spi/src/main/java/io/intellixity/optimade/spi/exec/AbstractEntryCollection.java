package io.intellixity.optimade.spi.exec;

import io.intellixity.optimade.entry.*;
import io.intellixity.optimade.filter.*;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.compile.FilterFields;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import io.intellixity.optimade.mapping.EntryMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Template-method orchestrator for entry queries.
 * <p>
 * Every request runs {@code RECEIVED -> PARSED -> TRANSFORMED -> EXECUTED -> PAGINATED -> RESPONDED}.
 * The page limit is checked while receiving, before the backend is touched. Any failure is wrapped
 * into a {@link QueryPipelineException} naming the step that was being worked on.
 * <p>
 * Subclasses supply a fresh {@link FilterTransformer} per request and the two backend hooks. A null
 * predicate means "match everything".
 *
 * @param <P> backend predicate type
 */
public abstract class AbstractEntryCollection<P> implements EntryCollection {
  private static final Logger log = LoggerFactory.getLogger(AbstractEntryCollection.class);

  public static final String ID_FIELD = "id";

  private final String entryType;
  private final FilterCompiler compiler;
  private final FieldAliases aliases;
  private final CollectionSettings settings;
  private final EntryMapper mapper;
  private final UnknownFieldCheck fieldCheck;

  protected AbstractEntryCollection(String entryType,
                                    FilterCompiler compiler,
                                    FieldAliases aliases,
                                    CollectionSettings settings) {
    this.entryType = Objects.requireNonNull(entryType, "entryType");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.aliases = (aliases == null) ? FieldAliases.none() : aliases;
    this.settings = (settings == null) ? CollectionSettings.defaults() : settings;
    this.mapper = new EntryMapper(entryType, this.aliases);
    this.fieldCheck = new UnknownFieldCheck(this.settings);
  }

  /** New transformer for one request. */
  protected abstract FilterTransformer<P> newTransformer();

  /** Load one page of stored documents; keys are backend names. */
  protected abstract List<Map<String, Object>> executeFind(P predicate, BackendQuery query);

  /** Count all documents matching {@code predicate}, without paging. */
  protected abstract long executeCount(P predicate);

  @Override
  public final String entryType() { return entryType; }
  public final CollectionSettings settings() { return settings; }
  protected final FieldAliases aliases() { return aliases; }
  protected final FilterCompiler compiler() { return compiler; }

  @Override
  public final QueryResultPage find(EntryQuery query) {
    Objects.requireNonNull(query, "query");
    Request r = new Request();
    try {
      r.enter(PipelineStep.RECEIVED, query);
      int limit = resolvePageLimit(query.pageLimit());
      int offset = resolveOffset(query);

      r.enter(PipelineStep.PARSED, query);
      FilterExpression filter = query.hasFilter() ? compiler.compile(query.filter()) : null;
      Set<String> unknown = checkFields(filter, query);

      r.enter(PipelineStep.TRANSFORMED, query);
      P predicate = transform(filter);

      r.enter(PipelineStep.EXECUTED, query);
      BackendQuery bq = new BackendQuery(resolveSort(query.sort()), offset, limit, resolveProjection(query.responseFields()));
      List<Map<String, Object>> docs = executeFind(predicate, bq);
      long total = executeCount(predicate);

      r.enter(PipelineStep.PAGINATED, query);
      int next = offset + docs.size();
      boolean more = next < total;
      String cursor = more ? new PageCursor(next).token() : null;

      r.enter(PipelineStep.RESPONDED, query);
      QueryResultPage page = new QueryResultPage(mapper.toResources(docs, query.responseFields()), total, more, cursor, unknown);
      log.debug("optimade.query_done collection={} returned={} dataReturned={} more={}", entryType, docs.size(), total, more);
      return page;
    } catch (QueryPipelineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw r.fail(e);
    }
  }

  /**
   * Single entry: {@code id = "<id>"} AND the user filter, fetched with limit 2 so a duplicate id
   * is detected instead of hidden.
   */
  @Override
  public final QueryResultPage findEntry(String id, EntryQuery query) {
    Objects.requireNonNull(id, "id");
    EntryQuery q = (query == null) ? EntryQuery.all() : query;
    Request r = new Request();
    try {
      r.enter(PipelineStep.RECEIVED, q);
      if (id.isBlank()) throw new IllegalArgumentException("Entry id must not be blank");

      r.enter(PipelineStep.PARSED, q);
      FilterExpression byId = new Comparison(FieldPath.of(ID_FIELD), ComparisonOperator.EQ, new StringValue(id));
      FilterExpression user = q.hasFilter() ? compiler.compile(q.filter()) : null;
      FilterExpression filter = (user == null) ? byId : new And(byId, user);
      Set<String> unknown = checkFields(user, q);

      r.enter(PipelineStep.TRANSFORMED, q);
      P predicate = transform(filter);

      r.enter(PipelineStep.EXECUTED, q);
      List<Map<String, Object>> docs = executeFind(predicate, new BackendQuery(resolveSort(List.of()), 0, 2, resolveProjection(q.responseFields())));
      if (docs.size() > 1) {
        throw new InvariantViolationException("More than one " + entryType + " entry with id '" + id + "'");
      }
      long total = executeCount(predicate);

      r.enter(PipelineStep.PAGINATED, q);
      boolean more = docs.size() < total;
      if (more) {
        throw new InvariantViolationException("Single " + entryType + " entry '" + id + "' reports more data available (count=" + total + ")");
      }

      r.enter(PipelineStep.RESPONDED, q);
      return new QueryResultPage(mapper.toResources(docs, q.responseFields()), docs.size(), false, null, unknown);
    } catch (QueryPipelineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw r.fail(e);
    }
  }

  @Override
  public final long count(String filter) {
    Request r = new Request();
    EntryQuery q = EntryQuery.of(filter);
    try {
      r.enter(PipelineStep.RECEIVED, q);
      r.enter(PipelineStep.PARSED, q);
      FilterExpression expr = q.hasFilter() ? compiler.compile(filter) : null;
      checkFields(expr, q);
      r.enter(PipelineStep.TRANSFORMED, q);
      P predicate = transform(expr);
      r.enter(PipelineStep.EXECUTED, q);
      return executeCount(predicate);
    } catch (QueryPipelineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw r.fail(e);
    }
  }

  private P transform(FilterExpression filter) {
    return (filter == null) ? null : newTransformer().transform(filter);
  }

  private int resolvePageLimit(Integer requested) {
    if (requested == null) return settings.pageLimit();
    if (requested <= 0) throw new IllegalArgumentException("page_limit must be > 0, got " + requested);
    if (requested > settings.pageLimitMax()) throw new PageLimitExceededException(requested, settings.pageLimitMax());
    return requested;
  }

  private static int resolveOffset(EntryQuery query) {
    if (query.cursor() != null && !query.cursor().isBlank()) return PageCursor.parse(query.cursor()).offset();
    if (query.pageOffset() < 0) throw new IllegalArgumentException("page_offset must be >= 0, got " + query.pageOffset());
    return query.pageOffset();
  }

  private Set<String> checkFields(FilterExpression filter, EntryQuery query) {
    Set<String> unknown = new LinkedHashSet<>(fieldCheck.checkFilterFields(FilterFields.referenced(filter)));
    unknown.addAll(fieldCheck.report(query.responseFields()));
    List<String> sortFields = new ArrayList<>();
    for (SortField s : query.sort()) sortFields.add(s.field());
    unknown.addAll(fieldCheck.report(sortFields));
    if (!unknown.isEmpty()) {
      log.warn("optimade.query collection={} unknownFields={}", entryType, unknown);
    }
    return unknown;
  }

  /** Backend sort with an {@code id} tie-breaker so paging is stable. */
  protected List<SortField> resolveSort(List<SortField> requested) {
    List<SortField> out = new ArrayList<>(requested.size() + 1);
    boolean hasId = false;
    for (SortField s : requested) {
      if (s.field().equals(ID_FIELD)) hasId = true;
      out.add(new SortField(aliases.resolve(FieldPath.of(s.field())).dotted(), s.direction()));
    }
    if (!hasId) out.add(SortField.asc(aliases.backendName(ID_FIELD)));
    return out;
  }

  private Set<String> resolveProjection(Set<String> responseFields) {
    if (responseFields.isEmpty()) return Set.of();
    Set<String> out = new LinkedHashSet<>();
    for (String f : responseFields) out.add(aliases.backendName(f));
    out.add(aliases.backendName(ID_FIELD));
    out.add(aliases.backendName("type"));
    out.add(aliases.backendName("relationships"));
    return out;
  }

  /** Tracks the step a request is working on. */
  private final class Request {
    private PipelineStep step = PipelineStep.RECEIVED;

    void enter(PipelineStep next, EntryQuery query) {
      step = next;
      if (log.isDebugEnabled()) {
        log.debug("optimade.query step={} collection={} filter={}", next, entryType, query.filter());
      }
    }

    QueryPipelineException fail(RuntimeException cause) {
      QueryPipelineException e = new QueryPipelineException(step, cause);
      if (e.status() >= 500 && e.status() != 501) {
        log.error("optimade.query_failed step={} collection={} status={}", step, entryType, e.status(), cause);
      } else {
        log.debug("optimade.query_failed step={} collection={} status={} error={}", step, entryType, e.status(), cause.getMessage());
      }
      return e;
    }
  }
}
