package relay.jdbc.store;

import relay.jdbc.JdbcTemplate;
import relay.spi.ConnectionProvider;
import relay.spi.MembershipChecker;
import relay.spi.RelayStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link MembershipChecker} that reads the {@code conversation_member} table on its own
 * auto-commit connection. Bulk checks use one {@code IN} query.
 */
public final class JdbcMembershipChecker implements MembershipChecker {
  private final ConnectionProvider connectionProvider;

  public JdbcMembershipChecker(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  @Override
  public boolean isMember(String conversationId, String userId) {
    return !membersOf(userId, List.of(conversationId)).isEmpty();
  }

  @Override
  public Set<String> membersOf(String userId, Collection<String> conversationIds) {
    if (conversationIds.isEmpty()) {
      return Collections.emptySet();
    }
    List<Object> params = new ArrayList<>(conversationIds.size() + 1);
    params.add(userId);
    params.addAll(conversationIds);
    String sql = "SELECT conversation_id FROM conversation_member WHERE user_id=? AND conversation_id IN ("
        + String.join(",", Collections.nCopies(conversationIds.size(), "?")) + ")";
    Set<String> found;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      found = new HashSet<>(JdbcTemplate.query(conn, sql, rs -> rs.getString(1), params.toArray()));
    } catch (SQLException e) {
      throw new RelayStoreException("Failed to read conversation membership", e);
    }
    Set<String> ordered = new LinkedHashSet<>();
    for (String id : conversationIds) {
      if (found.contains(id)) {
        ordered.add(id);
      }
    }
    return ordered;
  }
}
