package io.b2mash.b2b.schemarouter.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TenantStatusTest {

  @Test
  void provisioning_canBecomeActiveOrDropped() {
    assertThat(TenantStatus.PROVISIONING.canTransitionTo(TenantStatus.ACTIVE)).isTrue();
    assertThat(TenantStatus.PROVISIONING.canTransitionTo(TenantStatus.DROPPED)).isTrue();
    assertThat(TenantStatus.PROVISIONING.canTransitionTo(TenantStatus.SUSPENDED)).isFalse();
  }

  @Test
  void active_andSuspended_toggle() {
    assertThat(TenantStatus.ACTIVE.canTransitionTo(TenantStatus.SUSPENDED)).isTrue();
    assertThat(TenantStatus.SUSPENDED.canTransitionTo(TenantStatus.ACTIVE)).isTrue();
    assertThat(TenantStatus.SUSPENDED.canTransitionTo(TenantStatus.DROPPED)).isTrue();
  }

  @Test
  void nothingReturnsToProvisioning() {
    for (TenantStatus status : TenantStatus.values()) {
      assertThat(status.canTransitionTo(TenantStatus.PROVISIONING)).isFalse();
    }
  }

  @Test
  void dropped_isTerminal() {
    for (TenantStatus target : TenantStatus.values()) {
      assertThat(TenantStatus.DROPPED.canTransitionTo(target)).isFalse();
    }
  }
}
