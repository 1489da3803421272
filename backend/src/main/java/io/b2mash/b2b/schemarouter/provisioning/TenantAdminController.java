package io.b2mash.b2b.schemarouter.provisioning;

import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import io.b2mash.b2b.schemarouter.migration.MigrationStateTracker;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRecord;
import io.b2mash.b2b.schemarouter.multitenancy.TenantRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/tenants")
public class TenantAdminController {

  private static final Logger log = LoggerFactory.getLogger(TenantAdminController.class);

  private final SchemaLifecycleManager lifecycleManager;
  private final TenantRegistry registry;
  private final MigrationStateTracker tracker;
  private final MigrationGraph tenantGraph;

  public TenantAdminController(
      SchemaLifecycleManager lifecycleManager,
      TenantRegistry registry,
      MigrationStateTracker tracker,
      @Qualifier("tenantMigrationGraph") MigrationGraph tenantGraph) {
    this.lifecycleManager = lifecycleManager;
    this.registry = registry;
    this.tracker = tracker;
    this.tenantGraph = tenantGraph;
  }

  @PostMapping
  public ResponseEntity<TenantResponse> onboard(@Valid @RequestBody OnboardRequest request) {
    log.info("Received onboarding request for tenant {}", request.identifier());
    var record = lifecycleManager.onboard(request.identifier(), request.schemaName());
    return ResponseEntity.created(URI.create("/internal/tenants/" + record.identifier()))
        .body(TenantResponse.from(record));
  }

  @GetMapping
  public List<TenantResponse> listProvisioned() {
    List<TenantResponse> tenants = new ArrayList<>();
    lifecycleManager.listProvisioned().forEach(r -> tenants.add(TenantResponse.from(r)));
    return tenants;
  }

  @GetMapping("/{identifier}")
  public TenantResponse get(@PathVariable String identifier) {
    return TenantResponse.from(registry.require(identifier));
  }

  @PostMapping("/{identifier}/provision")
  public TenantResponse provision(@PathVariable String identifier) {
    return TenantResponse.from(lifecycleManager.provision(identifier));
  }

  @PostMapping("/{identifier}/suspend")
  public TenantResponse suspend(@PathVariable String identifier) {
    return TenantResponse.from(registry.markSuspended(identifier));
  }

  @PostMapping("/{identifier}/activate")
  public TenantResponse activate(@PathVariable String identifier) {
    return TenantResponse.from(registry.markActive(identifier));
  }

  @PostMapping("/{identifier}/decommission")
  public TenantResponse decommission(@PathVariable String identifier) {
    return TenantResponse.from(lifecycleManager.decommission(identifier));
  }

  @DeleteMapping("/{identifier}/schema")
  public ResponseEntity<Void> dropSchema(
      @PathVariable String identifier, @RequestParam("confirm") String confirmation) {
    lifecycleManager.dropSchema(identifier, confirmation);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{identifier}/migrations")
  public MigrationStatusResponse migrations(@PathVariable String identifier) {
    String schema = registry.require(identifier).schemaName();
    return new MigrationStatusResponse(
        schema,
        tracker.appliedMigrations(schema),
        tracker.pendingMigrations(schema, tenantGraph));
  }

  public record OnboardRequest(
      @NotBlank(message = "identifier is required") @Size(max = 255) String identifier,
      @Size(max = 63) String schemaName) {}

  public record TenantResponse(
      String identifier, String schemaName, String status, Instant createdAt, Instant updatedAt) {

    static TenantResponse from(TenantRecord record) {
      return new TenantResponse(
          record.identifier(),
          record.schemaName(),
          record.status().name(),
          record.createdAt(),
          record.updatedAt());
    }
  }

  public record MigrationStatusResponse(
      String schemaName, Set<String> applied, List<String> pending) {}
}
