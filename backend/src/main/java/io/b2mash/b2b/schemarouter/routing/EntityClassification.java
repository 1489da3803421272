package io.b2mash.b2b.schemarouter.routing;

import io.b2mash.b2b.schemarouter.exception.TenancyConfigurationException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable entity-type to scope table. Built and validated once at startup, so a conflicting or
 * incomplete configuration stops the application instead of misrouting a query later.
 */
public final class EntityClassification {

  private final Map<String, EntityScope> scopes;

  private EntityClassification(Map<String, EntityScope> scopes) {
    this.scopes = Map.copyOf(scopes);
  }

  /**
   * Checks that every entity type is in exactly one of the two sets and that neither set names an
   * unknown entity type.
   */
  public static EntityClassification validateClassification(
      Collection<String> entityTypes, Collection<String> sharedSet, Collection<String> tenantSet) {
    Set<String> both = new TreeSet<>(sharedSet);
    both.retainAll(tenantSet);
    if (!both.isEmpty()) {
      throw new TenancyConfigurationException(
          "Entity types classified as both shared and tenant: " + both);
    }
    Set<String> neither = new TreeSet<>(entityTypes);
    neither.removeAll(sharedSet);
    neither.removeAll(tenantSet);
    if (!neither.isEmpty()) {
      throw new TenancyConfigurationException(
          "Entity types classified as neither shared nor tenant: " + neither);
    }
    Set<String> unknown = new TreeSet<>(sharedSet);
    unknown.addAll(tenantSet);
    unknown.removeAll(entityTypes);
    if (!unknown.isEmpty()) {
      throw new TenancyConfigurationException("Classified entity types not in catalog: " + unknown);
    }

    Map<String, EntityScope> scopes = new LinkedHashMap<>();
    sharedSet.forEach(type -> scopes.put(type, EntityScope.SHARED));
    tenantSet.forEach(type -> scopes.put(type, EntityScope.TENANT));
    return new EntityClassification(scopes);
  }

  /**
   * Builds the classification from an entity catalog ({@code entity type -> app label}) and the
   * shared and tenant app lists.
   */
  public static EntityClassification fromApps(
      Map<String, String> entityApps, List<String> sharedApps, List<String> tenantApps) {
    Set<String> overlappingApps = new TreeSet<>(sharedApps);
    overlappingApps.retainAll(tenantApps);
    if (!overlappingApps.isEmpty()) {
      throw new TenancyConfigurationException(
          "Apps listed as both shared and tenant: " + overlappingApps);
    }
    Set<String> shared = new TreeSet<>();
    Set<String> tenant = new TreeSet<>();
    entityApps.forEach(
        (entityType, app) -> {
          if (sharedApps.contains(app)) {
            shared.add(entityType);
          }
          if (tenantApps.contains(app)) {
            tenant.add(entityType);
          }
        });
    return validateClassification(entityApps.keySet(), shared, tenant);
  }

  /** Returns the scope, or null for an entity type outside the catalog. */
  EntityScope scopeOf(String entityType) {
    return scopes.get(entityType);
  }

  public Set<String> entityTypes() {
    return scopes.keySet();
  }
}
