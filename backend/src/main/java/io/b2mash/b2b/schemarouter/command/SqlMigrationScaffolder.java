package io.b2mash.b2b.schemarouter.command;

import io.b2mash.b2b.schemarouter.config.TenancyProperties;
import io.b2mash.b2b.schemarouter.exception.MigrationConflictException;
import io.b2mash.b2b.schemarouter.migration.MigrationGraph;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Writes an empty, numbered SQL migration into the tenant migration directory. The new file
 * declares the graph's current leaves as its dependencies so it applies after everything known.
 */
@Component
public class SqlMigrationScaffolder implements MigrationGenerator {

  private static final Logger log = LoggerFactory.getLogger(SqlMigrationScaffolder.class);

  private static final Pattern NUMBER_PREFIX = Pattern.compile("^(\\d+)_");
  private static final String DEFAULT_LABEL = "auto";

  private final Path directory;
  private final MigrationGraph graph;

  @Autowired
  public SqlMigrationScaffolder(
      TenancyProperties properties, @Qualifier("tenantMigrationGraph") MigrationGraph graph) {
    this(properties.migration().scaffoldDirectory(), graph);
  }

  public SqlMigrationScaffolder(Path directory, MigrationGraph graph) {
    this.directory = directory;
    this.graph = graph;
  }

  @Override
  public Path generate(String label) {
    String id = String.format("%04d_%s", nextNumber(), normalize(label));
    Path target = directory.resolve(id + ".sql");
    if (Files.exists(target)) {
      throw new MigrationConflictException(null, "Migration file already exists: " + target);
    }
    try {
      Files.createDirectories(directory);
      Files.writeString(target, render(id, graph.leaves()), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not write migration " + target, e);
    }
    log.info("Generated tenant migration {} at {}", id, target);
    return target;
  }

  static String normalize(String label) {
    if (label == null || label.isBlank()) {
      return DEFAULT_LABEL;
    }
    String normalized =
        label.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_|_$", "");
    return normalized.isEmpty() ? DEFAULT_LABEL : normalized;
  }

  private int nextNumber() {
    int highest = 0;
    for (String id : graph.ids()) {
      highest = Math.max(highest, numberOf(id));
    }
    if (Files.isDirectory(directory)) {
      try (Stream<Path> files = Files.list(directory)) {
        for (Path file : files.toList()) {
          highest = Math.max(highest, numberOf(file.getFileName().toString()));
        }
      } catch (IOException e) {
        throw new UncheckedIOException("Could not list " + directory, e);
      }
    }
    return highest + 1;
  }

  private static int numberOf(String name) {
    Matcher matcher = NUMBER_PREFIX.matcher(name);
    return matcher.find() ? Integer.parseInt(matcher.group(1)) : 0;
  }

  private static String render(String id, List<String> dependencies) {
    var sb = new StringBuilder();
    if (!dependencies.isEmpty()) {
      sb.append("-- depends: ").append(String.join(", ", dependencies)).append('\n');
    }
    sb.append("-- ").append(id).append('\n');
    sb.append('\n');
    return sb.toString();
  }
}
