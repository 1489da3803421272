package io.b2mash.b2b.schemarouter.migration;

import java.util.List;

/**
 * Per-schema outcome of a bulk migration run, in submission order.
 *
 * @param cancelled whether the run was interrupted; schemas not yet started are then SKIPPED
 */
public record BulkMigrationReport(List<SchemaOutcome> outcomes, boolean cancelled) {

  public BulkMigrationReport {
    outcomes = List.copyOf(outcomes);
  }

  public enum Status {
    SUCCEEDED,
    FAILED,
    SKIPPED
  }

  /**
   * @param applied migrations recorded in this run; for FAILED, those committed before the failure
   *     (they stay applied); always empty for SKIPPED
   * @param error failure description, null unless FAILED
   */
  public record SchemaOutcome(
      String schemaName, Status status, List<String> applied, String error) {

    public static SchemaOutcome succeeded(String schemaName, List<String> applied) {
      return new SchemaOutcome(schemaName, Status.SUCCEEDED, List.copyOf(applied), null);
    }

    public static SchemaOutcome failed(String schemaName, String error) {
      return failed(schemaName, List.of(), error);
    }

    public static SchemaOutcome failed(String schemaName, List<String> applied, String error) {
      return new SchemaOutcome(schemaName, Status.FAILED, List.copyOf(applied), error);
    }

    public static SchemaOutcome skipped(String schemaName) {
      return new SchemaOutcome(schemaName, Status.SKIPPED, List.of(), null);
    }
  }

  public boolean hasFailures() {
    return outcomes.stream().anyMatch(o -> o.status() == Status.FAILED);
  }

  public List<SchemaOutcome> withStatus(Status status) {
    return outcomes.stream().filter(o -> o.status() == status).toList();
  }

  public SchemaOutcome outcomeFor(String schemaName) {
    return outcomes.stream()
        .filter(o -> o.schemaName().equals(schemaName))
        .findFirst()
        .orElse(null);
  }

  /** One line per schema, suitable for console output. */
  public String format() {
    var sb = new StringBuilder();
    for (SchemaOutcome outcome : outcomes) {
      sb.append(String.format("%-40s %-9s", outcome.schemaName(), outcome.status()));
      switch (outcome.status()) {
        case SUCCEEDED ->
            sb.append(
                outcome.applied().isEmpty()
                    ? " up to date"
                    : " applied " + String.join(", ", outcome.applied()));
        case FAILED -> {
          if (!outcome.applied().isEmpty()) {
            sb.append(" applied ").append(String.join(", ", outcome.applied())).append(" then");
          }
          sb.append(' ').append(outcome.error());
        }
        case SKIPPED -> sb.append(" not started (run cancelled)");
      }
      sb.append(System.lineSeparator());
    }
    sb.append(
        String.format(
            "%d succeeded, %d failed, %d skipped",
            withStatus(Status.SUCCEEDED).size(),
            withStatus(Status.FAILED).size(),
            withStatus(Status.SKIPPED).size()));
    return sb.toString();
  }
}
