package io.intellixity.docket.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "docket.store")
public class StoreProperties {
  private String uri = "mongodb://localhost:27017";
  private String database = "docket";

  /** Collection name to fields that carry a unique index; created at startup. */
  private final Map<String, List<String>> uniqueIndexes = new HashMap<>();

  public String getUri() { return uri; }
  public void setUri(String uri) { this.uri = uri; }
  public String getDatabase() { return database; }
  public void setDatabase(String database) { this.database = database; }
  public Map<String, List<String>> getUniqueIndexes() { return uniqueIndexes; }
}
