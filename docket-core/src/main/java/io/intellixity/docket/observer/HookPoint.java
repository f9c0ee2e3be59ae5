package io.intellixity.docket.observer;

import io.intellixity.docket.document.Document;

/** Points at which repositories dispatch observer callbacks. */
public enum HookPoint {
  BEFORE_VALIDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.beforeValidate(doc); }
  },
  AFTER_VALIDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.afterValidate(doc); }
  },
  BEFORE_INSERT {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.beforeInsert(doc); }
  },
  BEFORE_UPDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.beforeUpdate(doc); }
  },
  BEFORE_INSERT_OR_UPDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.beforeInsertOrUpdate(doc); }
  },
  AFTER_INSERT {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.afterInsert(doc); }
  },
  AFTER_UPDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.afterUpdate(doc); }
  },
  AFTER_INSERT_OR_UPDATE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.afterInsertOrUpdate(doc); }
  },
  BEFORE_REMOVE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.beforeRemove(doc); }
  },
  AFTER_REMOVE {
    @Override <T extends Document> void fire(DocumentObserver<? super T> o, T doc) { o.afterRemove(doc); }
  };

  abstract <T extends Document> void fire(DocumentObserver<? super T> observer, T doc);
}
