package io.intellixity.docket.examples.domain;

import io.intellixity.docket.document.Document;
import io.intellixity.docket.document.DocumentCollection;
import io.intellixity.docket.validation.Validatable;
import io.intellixity.docket.validation.expect.ExpectOptions;
import io.intellixity.docket.validation.expect.Expectations;

import java.util.regex.Pattern;

@DocumentCollection("users")
public class User extends Document implements Validatable {
  private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

  public String name() { return getString("name"); }
  public String email() { return getString("email"); }

  @Override
  public void validate(Expectations expect) {
    expect.expectPresent(get("name"), "name", "can't be empty");
    expect.expectPresent(get("email"), "email", "can't be empty");
    expect.expectMatch(get("email"), "email", "is not an email address", ExpectOptions.with(EMAIL).allowNull(true));
    expect.expectLength(get("name"), ExpectOptions.maximum(100).allowNull(true), "name", "is too long");
    expect.expectNumeric(get("age"), "age", "must be a number", ExpectOptions.allowingNull());
  }
}
