package io.intellixity.optimade.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import io.intellixity.optimade.entry.CollectionSettings;
import io.intellixity.optimade.filter.compile.FilterCompiler;
import io.intellixity.optimade.filter.transform.FieldAliases;
import io.intellixity.optimade.filter.transform.FilterTransformer;
import io.intellixity.optimade.spi.exec.AbstractEntryCollection;
import io.intellixity.optimade.spi.exec.BackendQuery;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/** Entry collection backed by a MongoDB collection, using the official sync driver. */
public final class MongoEntryCollection extends AbstractEntryCollection<Document> {
  private static final Logger log = LoggerFactory.getLogger(MongoEntryCollection.class);

  private final MongoDatabase db;
  private final MongoQueryPlanner planner;
  private final Set<String> relationshipTypes;

  public MongoEntryCollection(String entryType,
                              MongoDatabase db,
                              String collection,
                              FilterCompiler compiler,
                              FieldAliases aliases,
                              CollectionSettings settings,
                              Set<String> relationshipTypes) {
    super(entryType, compiler, aliases, settings);
    this.db = Objects.requireNonNull(db, "db");
    this.planner = new MongoQueryPlanner(collection);
    this.relationshipTypes = Set.copyOf(Objects.requireNonNull(relationshipTypes, "relationshipTypes"));
  }

  public MongoEntryCollection(String entryType, MongoDatabase db, String collection,
                              FilterCompiler compiler, FieldAliases aliases, CollectionSettings settings) {
    this(entryType, db, collection, compiler, aliases, settings, Set.of());
  }

  @Override
  protected FilterTransformer<Document> newTransformer() {
    return new MongoFilterTransformer(aliases(), relationshipTypes);
  }

  @Override
  protected List<Map<String, Object>> executeFind(Document predicate, BackendQuery query) {
    MongoStatement st = planner.planFind(predicate, query);
    if (log.isDebugEnabled()) {
      log.debug("optimade.mongo op=find collection={} filter={} sort={} skip={} limit={}",
          st.collection(), st.filter().toJson(), st.sort().toJson(), st.skip(), st.limit());
    }
    MongoCollection<Document> col = db.getCollection(st.collection());
    FindIterable<Document> find = col.find(st.filter());
    if (st.projection() != null) find = find.projection(st.projection());
    if (!st.sort().isEmpty()) find = find.sort(st.sort());
    find = find.skip(st.skip()).limit(st.limit());

    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : find) out.add(new LinkedHashMap<>(d));
    return out;
  }

  @Override
  protected long executeCount(Document predicate) {
    MongoStatement st = planner.planCount(predicate);
    CountOptions opts = new CountOptions().maxTime(settings().countTimeout().toMillis(), TimeUnit.MILLISECONDS);
    long n = db.getCollection(st.collection()).countDocuments(st.filter(), opts);
    log.debug("optimade.mongo op=count collection={} result={}", st.collection(), n);
    return n;
  }
}
