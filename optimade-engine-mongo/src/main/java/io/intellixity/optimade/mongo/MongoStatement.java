package io.intellixity.optimade.mongo;

import org.bson.Document;

/** Backend-native statement representation for MongoDB. */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    Integer skip,
    Integer limit
) {
  public enum Kind {
    FIND,
    COUNT
  }
}
