package io.b2mash.b2b.schemarouter.config;

import com.zaxxer.hikari.HikariDataSource;
import io.b2mash.b2b.schemarouter.migration.MigrationCategory;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import io.b2mash.b2b.schemarouter.migration.SqlMigrationLoader;
import io.b2mash.b2b.schemarouter.multitenancy.ConnectionSchemaBinder;
import io.b2mash.b2b.schemarouter.multitenancy.TenantFilter;
import io.b2mash.b2b.schemarouter.multitenancy.TenantLoggingFilter;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import io.b2mash.b2b.schemarouter.routing.EntityClassification;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

@Configuration
public class TenancyConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  EntityClassification entityClassification(TenancyProperties properties) {
    return EntityClassification.fromApps(
        properties.entities(), properties.sharedApps(), properties.tenantApps());
  }

  @Bean
  ConnectionSchemaBinder appSchemaBinder(
      @Qualifier("appDataSource") HikariDataSource appDataSource, TenantRegistry registry) {
    return ConnectionSchemaBinder.forTenants(appDataSource, registry);
  }

  @Bean
  ConnectionSchemaBinder migrationSchemaBinder(
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenancyProperties properties) {
    return ConnectionSchemaBinder.forMigrations(
        migrationDataSource, properties.publicSchemaName());
  }

  @Bean
  MigrationGraph sharedMigrationGraph(TenancyProperties properties) {
    return new SqlMigrationLoader()
        .load(MigrationCategory.SHARED, properties.migration().sharedLocation());
  }

  @Bean
  MigrationGraph tenantMigrationGraph(TenancyProperties properties) {
    return new SqlMigrationLoader()
        .load(MigrationCategory.TENANT, properties.migration().tenantLocation());
  }

  @Bean
  FilterRegistrationBean<TenantLoggingFilter> tenantLoggingFilter() {
    var registration = new FilterRegistrationBean<>(new TenantLoggingFilter());
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE);
    return registration;
  }

  @Bean
  FilterRegistrationBean<TenantFilter> tenantFilter(
      TenantRegistry registry, TenancyProperties properties) {
    var registration =
        new FilterRegistrationBean<>(new TenantFilter(registry, properties.tenantHeader()));
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
