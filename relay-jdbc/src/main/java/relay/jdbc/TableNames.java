package relay.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Validation for table names that are concatenated into SQL.
 */
public final class TableNames {
  private static final Pattern VALID = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

  /**
   * @throws IllegalArgumentException if {@code tableName} is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!VALID.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  private TableNames() {}
}
