package io.b2mash.b2b.schemarouter.command;

import java.nio.file.Path;

/** Produces a new migration in the tenant namespace, depending on the current graph leaves. */
@FunctionalInterface
public interface MigrationGenerator {

  /**
   * @param label short description folded into the migration id
   * @return the file holding the generated migration
   */
  Path generate(String label);
}
