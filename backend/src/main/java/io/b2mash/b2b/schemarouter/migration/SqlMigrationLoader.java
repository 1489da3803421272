package io.b2mash.b2b.schemarouter.migration;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;

/**
 * Builds a {@link MigrationGraph} from {@code *.sql} files under a location.
 *
 * <p>The file name without {@code .sql} is the migration id. Dependencies come from a leading
 * {@code -- depends: a, b} comment; an empty list marks a root. Files without that header depend
 * on the previous file in name order.
 */
public class SqlMigrationLoader {

  private static final Logger log = LoggerFactory.getLogger(SqlMigrationLoader.class);

  private static final Pattern DEPENDS = Pattern.compile("^--\\s*depends:(.*)$");
  private static final Pattern VALID_ID = Pattern.compile("^[A-Za-z0-9_]+$");

  private final ResourcePatternResolver resolver;

  public SqlMigrationLoader() {
    this(new PathMatchingResourcePatternResolver());
  }

  public SqlMigrationLoader(ResourcePatternResolver resolver) {
    this.resolver = resolver;
  }

  public MigrationGraph load(MigrationCategory category, String location) {
    Resource[] resources;
    try {
      resources = resolver.getResources(location + "/*.sql");
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list migrations at " + location, e);
    }
    Arrays.sort(resources, Comparator.comparing(Resource::getFilename));

    List<Migration> migrations = new ArrayList<>(resources.length);
    String previous = null;
    for (Resource resource : resources) {
      String id = idOf(resource);
      List<String> dependencies = readDependencies(resource);
      if (dependencies == null) {
        dependencies = previous != null ? List.of(previous) : List.of();
      }
      migrations.add(new Migration(id, dependencies, scriptAction(resource)));
      previous = id;
    }
    log.info("Loaded {} {} migrations from {}", migrations.size(), category, location);
    return MigrationGraph.of(category, migrations);
  }

  private static String idOf(Resource resource) {
    String filename = resource.getFilename();
    String id = filename.substring(0, filename.length() - ".sql".length());
    if (!VALID_ID.matcher(id).matches()) {
      throw new IllegalArgumentException("Invalid migration file name: " + filename);
    }
    return id;
  }

  /** Returns the declared dependencies, or null when the file declares none. */
  static List<String> readDependencies(Resource resource) {
    try (var reader =
        new BufferedReader(
            new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        if (!trimmed.startsWith("--")) {
          return null;
        }
        Matcher matcher = DEPENDS.matcher(trimmed);
        if (matcher.matches()) {
          return Arrays.stream(matcher.group(1).split(","))
              .map(String::strip)
              .filter(s -> !s.isEmpty())
              .toList();
        }
      }
      return null;
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read migration " + resource.getDescription(), e);
    }
  }

  private static MigrationAction scriptAction(Resource resource) {
    var script = new EncodedResource(resource, StandardCharsets.UTF_8);
    return connection -> ScriptUtils.executeSqlScript(connection, script);
  }
}
