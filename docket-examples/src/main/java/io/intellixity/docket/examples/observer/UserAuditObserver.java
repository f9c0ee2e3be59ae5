package io.intellixity.docket.examples.observer;

import io.intellixity.docket.examples.domain.User;
import io.intellixity.docket.observer.DocumentObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/** Stamps audit timestamps on users and logs their lifecycle. */
public final class UserAuditObserver implements DocumentObserver<User> {
  private static final Logger log = LoggerFactory.getLogger(UserAuditObserver.class);

  private final Clock clock;

  public UserAuditObserver(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void beforeInsert(User user) {
    user.set("createdAt", clock.instant());
  }

  @Override
  public void beforeInsertOrUpdate(User user) {
    user.set("updatedAt", clock.instant());
  }

  @Override
  public void afterInsert(User user) {
    log.info("user created id={} email={}", user.id(), user.email());
  }

  @Override
  public void afterRemove(User user) {
    log.info("user removed id={}", user.id());
  }
}
