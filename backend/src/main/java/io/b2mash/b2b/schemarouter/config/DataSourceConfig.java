package io.b2mash.b2b.schemarouter.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Two pools against the same database: the application pool serves request traffic and is the
 * only one whose connections get tenant schemas bound; the migration pool runs DDL and ledger
 * writes.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationJdbcClient")
  public JdbcClient migrationJdbcClient(
      @Qualifier("migrationDataSource") DataSource migrationDataSource) {
    return JdbcClient.create(migrationDataSource);
  }
}
