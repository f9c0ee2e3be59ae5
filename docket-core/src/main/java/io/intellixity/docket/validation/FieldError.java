package io.intellixity.docket.validation;

import java.util.Objects;

/** One validation failure. {@code field} is null for errors that concern the document as a whole. */
public record FieldError(String field, String message) {
  public FieldError {
    Objects.requireNonNull(message, "message");
  }

  public String fullMessage(String separator) {
    if (field == null || field.isEmpty()) return message;
    return field + separator + message;
  }
}
