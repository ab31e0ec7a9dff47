package relay.spi;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Answers whether a user may receive a conversation's events.
 *
 * <p>Implementations throw an unchecked exception when the lookup itself fails; callers
 * must not treat that as "not a member".
 */
@FunctionalInterface
public interface MembershipChecker {

  boolean isMember(String conversationId, String userId);

  /**
   * Returns the subset of {@code conversationIds} the user belongs to, in input order.
   * The default implementation calls {@link #isMember} per id.
   */
  default Set<String> membersOf(String userId, Collection<String> conversationIds) {
    Set<String> result = new LinkedHashSet<>();
    for (String conversationId : conversationIds) {
      if (isMember(conversationId, userId)) {
        result.add(conversationId);
      }
    }
    return result;
  }
}
