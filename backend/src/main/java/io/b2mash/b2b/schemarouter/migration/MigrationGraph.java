package io.b2mash.b2b.schemarouter.migration;

import io.b2mash.b2b.schemarouter.exception.MigrationConflictException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Dependency graph of the migrations for one {@link MigrationCategory}. */
public final class MigrationGraph {

  private final MigrationCategory category;
  private final Map<String, Migration> migrations;

  private MigrationGraph(MigrationCategory category, Map<String, Migration> migrations) {
    this.category = category;
    this.migrations = migrations;
  }

  public static MigrationGraph of(MigrationCategory category, Collection<Migration> migrations) {
    Map<String, Migration> byId = new LinkedHashMap<>();
    for (Migration migration : migrations) {
      if (byId.putIfAbsent(migration.id(), migration) != null) {
        throw new MigrationConflictException(
            null, "Duplicate migration id " + migration.id() + " in " + category + " graph");
      }
    }
    return new MigrationGraph(category, byId);
  }

  public MigrationCategory category() {
    return category;
  }

  public Set<String> ids() {
    return new TreeSet<>(migrations.keySet());
  }

  public Migration get(String id) {
    return migrations.get(id);
  }

  public int size() {
    return migrations.size();
  }

  /** Migrations nothing else depends on; new migrations attach below these. */
  public List<String> leaves() {
    Set<String> leaves = new TreeSet<>(migrations.keySet());
    migrations.values().forEach(m -> leaves.removeAll(m.dependencies()));
    return List.copyOf(leaves);
  }

  /**
   * Returns the not-yet-applied migrations in an order that respects every dependency. Ties break
   * on id, so the order is stable between runs.
   *
   * @throws MigrationConflictException if the graph has a cycle, a pending migration depends on an
   *     id that is neither in the graph nor already applied, or the ledger records a migration
   *     whose in-graph dependency is missing
   */
  public List<Migration> plan(String schemaName, Set<String> applied) {
    for (Migration migration : migrations.values()) {
      for (String dependency : migration.dependencies()) {
        boolean known = migrations.containsKey(dependency) || applied.contains(dependency);
        if (!known) {
          throw new MigrationConflictException(
              schemaName,
              "Migration "
                  + migration.id()
                  + " depends on "
                  + dependency
                  + ", which is neither in the "
                  + category
                  + " graph nor applied");
        }
        if (applied.contains(migration.id()) && !applied.contains(dependency)) {
          throw new MigrationConflictException(
              schemaName,
              "Ledger records "
                  + migration.id()
                  + " as applied but its dependency "
                  + dependency
                  + " is missing");
        }
      }
    }

    List<Migration> ordered = topologicalOrder(schemaName);
    List<Migration> pending = new ArrayList<>();
    for (Migration migration : ordered) {
      if (!applied.contains(migration.id())) {
        pending.add(migration);
      }
    }
    return pending;
  }

  private List<Migration> topologicalOrder(String schemaName) {
    Map<String, Integer> inDegree = new HashMap<>();
    Map<String, List<String>> dependents = new HashMap<>();
    for (Migration migration : migrations.values()) {
      inDegree.putIfAbsent(migration.id(), 0);
      for (String dependency : migration.dependencies()) {
        if (migrations.containsKey(dependency)) {
          inDegree.merge(migration.id(), 1, Integer::sum);
          dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(migration.id());
        }
      }
    }

    TreeSet<String> ready = new TreeSet<>();
    inDegree.forEach(
        (id, degree) -> {
          if (degree == 0) {
            ready.add(id);
          }
        });

    List<Migration> ordered = new ArrayList<>(migrations.size());
    while (!ready.isEmpty()) {
      String id = ready.pollFirst();
      ordered.add(migrations.get(id));
      for (String dependent : dependents.getOrDefault(id, List.of())) {
        if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
          ready.add(dependent);
        }
      }
    }

    if (ordered.size() < migrations.size()) {
      Set<String> cyclic = new TreeSet<>(migrations.keySet());
      ordered.forEach(m -> cyclic.remove(m.id()));
      throw new MigrationConflictException(
          schemaName, "Cycle in " + category + " migration graph involving " + cyclic);
    }
    return ordered;
  }
}
