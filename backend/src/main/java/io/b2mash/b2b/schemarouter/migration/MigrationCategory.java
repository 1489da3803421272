package io.b2mash.b2b.schemarouter.migration;

/** Shared and tenant schemas evolve through separate migration graphs. */
public enum MigrationCategory {
  SHARED,
  TENANT
}
