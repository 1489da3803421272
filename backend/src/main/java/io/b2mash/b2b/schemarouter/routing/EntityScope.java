package io.b2mash.b2b.schemarouter.routing;

/** Where an entity's rows live. */
public enum EntityScope {
  /** Always the shared schema, whatever tenant is active. */
  SHARED,
  /** The active tenant's schema. */
  TENANT
}
