package io.b2mash.b2b.schemarouter.migration;

import java.util.List;
import java.util.Objects;

/**
 * A node of a migration graph.
 *
 * @param id unique within its graph, e.g. {@code 0002_add_projects}
 * @param dependencies ids that must be applied first
 */
public record Migration(String id, List<String> dependencies, MigrationAction action) {

  public Migration {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(action, "action");
    dependencies = List.copyOf(dependencies);
  }

  public static Migration of(String id, MigrationAction action, String... dependencies) {
    return new Migration(id, List.of(dependencies), action);
  }
}
