package io.intellixity.docket.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoServerException;
import com.mongodb.MongoWriteException;

/** Classifies driver exceptions. */
final class MongoErrors {
  private MongoErrors() {}

  /** Whether the server rejected a write because of a unique index. */
  static boolean isDuplicateKey(RuntimeException e) {
    if (e instanceof MongoWriteException w) {
      return w.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
    }
    if (e instanceof MongoServerException s) {
      return ErrorCategory.fromErrorCode(s.getCode()) == ErrorCategory.DUPLICATE_KEY;
    }
    return false;
  }
}
