package io.b2mash.b2b.schemarouter.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tenancy options bound from {@code tenancy.*}.
 *
 * @param tenantModel entity type backing tenant records; must be classified as shared
 * @param tenantIdentifierField lookup key used by the registry ({@code identifier} or {@code
 *     schema_name})
 * @param publicSchemaName shared schema that holds infrastructure data and the tenant registry
 * @param entities entity catalog, mapping each entity type to its app label
 * @param sharedApps app labels whose entities always live in the shared schema
 * @param tenantApps app labels whose entities live in each tenant's schema
 * @param tenantHeader request header carrying the tenant identifier
 * @param registryCacheTtl how long resolved tenant lookups are cached; also the longest a status
 *     change made on another node goes unseen here. {@code PT0S} disables caching
 * @param migration migration runner options
 */
@ConfigurationProperties(prefix = "tenancy")
public record TenancyProperties(
    @DefaultValue("tenant_record") String tenantModel,
    @DefaultValue("identifier") String tenantIdentifierField,
    @DefaultValue("public") String publicSchemaName,
    @DefaultValue Map<String, String> entities,
    @DefaultValue List<String> sharedApps,
    @DefaultValue List<String> tenantApps,
    @DefaultValue("X-Tenant-ID") String tenantHeader,
    @DefaultValue("PT10S") Duration registryCacheTtl,
    @DefaultValue Migration migration) {

  /**
   * @param bulkWorkers upper bound on schemas migrated in parallel; further capped by the pool size
   * @param runOnStartup apply pending shared and tenant migrations when the application starts
   * @param sharedLocation classpath location of the shared migration graph
   * @param tenantLocation classpath location of the tenant migration graph
   * @param scaffoldDirectory where {@code makemigrations-tenant} writes new migration files
   */
  public record Migration(
      @DefaultValue("4") int bulkWorkers,
      @DefaultValue("true") boolean runOnStartup,
      @DefaultValue("classpath:db/migration/shared") String sharedLocation,
      @DefaultValue("classpath:db/migration/tenant") String tenantLocation,
      @DefaultValue("src/main/resources/db/migration/tenant") Path scaffoldDirectory) {}
}
