package io.b2mash.b2b.schemarouter.multitenancy;

import io.b2mash.b2b.schemarouter.exception.InvalidIdentifierException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Schema name rules. Schema names end up concatenated into {@code CREATE SCHEMA}, {@code DROP
 * SCHEMA} and schema-qualified statements, so only lowercase alphanumerics and underscore are
 * accepted.
 */
public final class SchemaNames {

  /** PostgreSQL truncates identifiers beyond NAMEDATALEN - 1. */
  public static final int MAX_LENGTH = 63;

  public static final int MAX_IDENTIFIER_LENGTH = 255;

  private static final Pattern SAFE_SCHEMA = Pattern.compile("^[a-z0-9_]{1," + MAX_LENGTH + "}$");
  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-z0-9_]");
  private static final UUID NAMESPACE = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

  private SchemaNames() {}

  public static boolean isSafe(String schemaName) {
    return schemaName != null && SAFE_SCHEMA.matcher(schemaName).matches();
  }

  /** Returns the name unchanged, or throws {@link InvalidIdentifierException}. */
  public static String requireSafe(String schemaName) {
    if (!isSafe(schemaName)) {
      throw new InvalidIdentifierException(
          "Schema name must match [a-z0-9_]{1," + MAX_LENGTH + "}: " + schemaName);
    }
    return schemaName;
  }

  public static String requireValidIdentifier(String identifier) {
    if (identifier == null || identifier.isBlank()) {
      throw new InvalidIdentifierException("Tenant identifier must not be blank");
    }
    if (identifier.length() > MAX_IDENTIFIER_LENGTH) {
      throw new InvalidIdentifierException(
          "Tenant identifier exceeds " + MAX_IDENTIFIER_LENGTH + " characters");
    }
    return identifier;
  }

  /**
   * Derives a schema name from a tenant identifier: lowercased, unsafe characters replaced by
   * underscore, truncated. Identifiers with nothing usable left fall back to a stable hash.
   */
  public static String deriveFrom(String identifier) {
    requireValidIdentifier(identifier);
    String candidate =
        UNSAFE_CHARS.matcher(identifier.strip().toLowerCase(Locale.ROOT)).replaceAll("_");
    if (candidate.length() > MAX_LENGTH) {
      candidate = candidate.substring(0, MAX_LENGTH);
    }
    if (candidate.replace("_", "").isEmpty()) {
      return hashed(identifier);
    }
    return candidate;
  }

  static String hashed(String identifier) {
    byte[] input = (NAMESPACE + identifier).getBytes(StandardCharsets.UTF_8);
    String hex = UUID.nameUUIDFromBytes(input).toString().replace("-", "");
    return "tenant_" + hex.substring(0, 12);
  }

  /** Double-quotes an already validated schema name for use in DDL. */
  public static String quote(String schemaName) {
    return "\"" + requireSafe(schemaName) + "\"";
  }
}
