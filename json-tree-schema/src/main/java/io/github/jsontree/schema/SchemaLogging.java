package io.github.jsontree.schema;

import java.util.logging.Logger;

/// Centralized logger for the schema validator.
/// All classes use this logger via:
///   import static io.github.jsontree.schema.SchemaLogging.LOG;
final class SchemaLogging {
  public static final Logger LOG = Logger.getLogger("io.github.jsontree.schema");
  private SchemaLogging() {}
}
