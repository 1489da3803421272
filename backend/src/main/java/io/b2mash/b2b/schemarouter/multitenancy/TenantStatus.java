package io.b2mash.b2b.schemarouter.multitenancy;

public enum TenantStatus {
  PROVISIONING,
  ACTIVE,
  SUSPENDED,
  DROPPED;

  /** DROPPED is terminal. A tenant only becomes ACTIVE from PROVISIONING or SUSPENDED. */
  public boolean canTransitionTo(TenantStatus target) {
    if (this == DROPPED) {
      return false;
    }
    return switch (target) {
      case PROVISIONING -> false;
      case ACTIVE -> this == PROVISIONING || this == SUSPENDED;
      case SUSPENDED -> this == ACTIVE;
      case DROPPED -> true;
    };
  }
}
