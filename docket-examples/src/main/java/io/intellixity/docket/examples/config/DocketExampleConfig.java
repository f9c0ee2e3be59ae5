package io.intellixity.docket.examples.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.docket.examples.domain.User;
import io.intellixity.docket.examples.observer.UserAuditObserver;
import io.intellixity.docket.exec.Repository;
import io.intellixity.docket.json.DocketJacksonModule;
import io.intellixity.docket.mongo.MongoHandle;
import io.intellixity.docket.mongo.MongoRepositories;
import io.intellixity.docket.observer.ObserverRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class DocketExampleConfig {

  @Bean(destroyMethod = "close")
  public MongoClient mongoClient(StoreProperties props) {
    return MongoClients.create(props.getUri());
  }

  @Bean
  public MongoHandle mongoHandle(MongoClient client, StoreProperties props) {
    return new MongoHandle("mongo:" + props.getDatabase(), client, props.getDatabase());
  }

  @Bean
  public ObserverRegistry observerRegistry() {
    // Registered once at startup; repositories created below share it.
    return ObserverRegistry.builder()
        .register(User.class, new UserAuditObserver(Clock.systemUTC()))
        .build();
  }

  @Bean
  public MongoRepositories mongoRepositories(MongoHandle handle, ObserverRegistry observers, StoreProperties props) {
    MongoRepositories repos = new MongoRepositories(handle, observers);
    props.getUniqueIndexes().forEach((collection, fields) -> fields.forEach(f -> repos.ensureUniqueIndex(collection, f)));
    return repos;
  }

  @Bean
  public Repository<User> userRepository(MongoRepositories repos) {
    return repos.create(User.class, User::new);
  }

  @Bean
  public DocketJacksonModule docketJacksonModule() {
    return new DocketJacksonModule();
  }
}
