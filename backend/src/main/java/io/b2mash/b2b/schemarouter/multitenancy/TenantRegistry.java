package io.b2mash.b2b.schemarouter.multitenancy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.b2b.schemarouter.config.TenancyProperties;
import io.b2mash.b2b.schemarouter.exception.DuplicateTenantException;
import io.b2mash.b2b.schemarouter.exception.InvalidIdentifierException;
import io.b2mash.b2b.schemarouter.exception.InvalidTenantStateException;
import io.b2mash.b2b.schemarouter.exception.TenantNotFoundException;
import io.b2mash.b2b.schemarouter.exception.TenancyConfigurationException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/** Authoritative mapping from tenant identifier to schema name. */
@Service
@DependsOn("registryFlyway")
public class TenantRegistry {

  private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

  public static final String LOOKUP_BY_IDENTIFIER = "identifier";
  public static final String LOOKUP_BY_SCHEMA_NAME = "schema_name";

  private final TenantRecordRepository repository;
  private final String sharedSchema;
  private final boolean lookupBySchemaName;
  private final Clock clock;

  // Holds ACTIVE records only, keyed by lookup key and by schema name respectively.
  private final Cache<String, TenantRecord> lookupCache;
  private final Cache<String, Boolean> activeSchemaCache;

  @Autowired
  public TenantRegistry(
      TenantRecordRepository repository, TenancyProperties properties, Clock clock) {
    this(
        repository,
        properties.publicSchemaName(),
        properties.tenantIdentifierField(),
        properties.registryCacheTtl(),
        clock);
  }

  public TenantRegistry(
      TenantRecordRepository repository,
      String sharedSchema,
      String identifierField,
      Duration cacheTtl,
      Clock clock) {
    this.repository = repository;
    this.sharedSchema = sharedSchema;
    this.lookupBySchemaName = resolveLookupField(identifierField);
    this.clock = clock;
    this.lookupCache = Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(cacheTtl).build();
    this.activeSchemaCache =
        Caffeine.newBuilder().maximumSize(10_000).expireAfterWrite(cacheTtl).build();
  }

  private static boolean resolveLookupField(String identifierField) {
    if (LOOKUP_BY_IDENTIFIER.equals(identifierField)) {
      return false;
    }
    if (LOOKUP_BY_SCHEMA_NAME.equals(identifierField)) {
      return true;
    }
    throw new TenancyConfigurationException(
        "tenancy.tenant-identifier-field must be 'identifier' or 'schema_name', was: "
            + identifierField);
  }

  /** Registers a tenant whose schema name is derived from its identifier. */
  public TenantRecord register(String identifier) {
    return register(identifier, SchemaNames.deriveFrom(identifier));
  }

  public TenantRecord register(String identifier, String schemaName) {
    SchemaNames.requireValidIdentifier(identifier);
    SchemaNames.requireSafe(schemaName);
    if (sharedSchema.equals(schemaName)) {
      throw new InvalidIdentifierException(
          "Schema name '" + schemaName + "' is reserved for shared data");
    }
    if (repository.existsLive(identifier, schemaName)) {
      throw new DuplicateTenantException(identifier, schemaName);
    }
    var record = TenantRecord.provisioning(identifier, schemaName, clock.instant());
    try {
      repository.insert(record);
    } catch (DuplicateKeyException e) {
      // Concurrent registration won the unique constraint after our existence check
      throw new DuplicateTenantException(identifier, schemaName);
    }
    log.info("Registered tenant {} -> schema {}", identifier, schemaName);
    return record;
  }

  /** Resolves the schema of an ACTIVE tenant. */
  public String lookup(String key) {
    TenantRecord cached = lookupCache.getIfPresent(key);
    if (cached != null) {
      return cached.schemaName();
    }
    Optional<TenantRecord> found =
        lookupBySchemaName
            ? repository.findLiveBySchemaName(key)
            : repository.findLiveByIdentifier(key);
    TenantRecord record =
        found.filter(TenantRecord::isActive).orElseThrow(() -> new TenantNotFoundException(key));
    lookupCache.put(key, record);
    return record.schemaName();
  }

  /** The live record in any status. */
  public Optional<TenantRecord> find(String identifier) {
    return repository.findLiveByIdentifier(identifier);
  }

  public TenantRecord require(String identifier) {
    return find(identifier).orElseThrow(() -> new TenantNotFoundException(identifier));
  }

  /** Whether {@code schemaName} belongs to an ACTIVE tenant. The shared schema is not a tenant. */
  public boolean isActiveSchema(String schemaName) {
    if (!SchemaNames.isSafe(schemaName)) {
      return false;
    }
    Boolean cached = activeSchemaCache.getIfPresent(schemaName);
    if (cached != null) {
      return cached;
    }
    boolean active =
        repository.findLiveBySchemaName(schemaName).map(TenantRecord::isActive).orElse(false);
    if (active) {
      activeSchemaCache.put(schemaName, Boolean.TRUE);
    }
    return active;
  }

  /** Whether any live record, in any status, holds {@code schemaName}. */
  public boolean isSchemaInUse(String schemaName) {
    return repository.findLiveBySchemaName(schemaName).isPresent();
  }

  public TenantRecord markActive(String identifier) {
    return transition(identifier, TenantStatus.ACTIVE);
  }

  public TenantRecord markSuspended(String identifier) {
    return transition(identifier, TenantStatus.SUSPENDED);
  }

  public TenantRecord markDropped(String identifier) {
    return transition(identifier, TenantStatus.DROPPED);
  }

  /** Every record ever registered under {@code identifier}, including dropped ones. */
  public List<TenantRecord> history(String identifier) {
    return repository.findHistory(identifier);
  }

  /** Keyset page of ACTIVE records after {@code afterIdentifier} (exclusive, nullable). */
  public List<TenantRecord> activePage(String afterIdentifier, int limit) {
    return repository.findPageByStatus(TenantStatus.ACTIVE, afterIdentifier, limit);
  }

  public String sharedSchema() {
    return sharedSchema;
  }

  private TenantRecord transition(String identifier, TenantStatus target) {
    var current = find(identifier).orElse(null);
    if (current == null) {
      if (!history(identifier).isEmpty()) {
        throw new InvalidTenantStateException(identifier, "tenant is DROPPED; DROPPED is terminal");
      }
      throw new TenantNotFoundException(identifier);
    }
    if (current.status() == target) {
      return current;
    }
    if (!current.status().canTransitionTo(target)) {
      throw new InvalidTenantStateException(
          identifier, "cannot transition from " + current.status() + " to " + target);
    }
    var now = clock.instant();
    if (!repository.updateStatus(identifier, current.status(), target, now)) {
      throw new InvalidTenantStateException(
          identifier, "status changed concurrently while moving to " + target);
    }
    evict(current);
    log.info(
        "Tenant {} (schema {}) {} -> {}",
        identifier,
        current.schemaName(),
        current.status(),
        target);
    return current.withStatus(target, now);
  }

  private void evict(TenantRecord record) {
    lookupCache.invalidate(record.identifier());
    lookupCache.invalidate(record.schemaName());
    activeSchemaCache.invalidate(record.schemaName());
  }
}
