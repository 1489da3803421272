package io.b2mash.b2b.schemarouter.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the tenant registry table in the shared schema before anything reads it. */
@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway registryFlyway(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      TenancyProperties properties) {
    return registryFlyway(migrationDataSource, properties.publicSchemaName());
  }

  public static Flyway registryFlyway(DataSource dataSource, String sharedSchema) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration/registry")
        .schemas(sharedSchema)
        .baselineOnMigrate(true)
        .load();
  }
}
