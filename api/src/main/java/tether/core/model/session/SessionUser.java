package tether.core.model.session;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Snapshot of the authenticated user taken when a session is created.
 *
 * <p>The snapshot is never joined against a live user directory; a role change
 * only reaches existing sessions through an explicit session update.
 *
 * @param uuid        user identifier, used as the user index key
 * @param role        role at session creation
 * @param email       email address (may be null)
 * @param permissions granted permissions, kept sorted
 */
public record SessionUser(String uuid, String role, String email, Set<String> permissions) {

    public SessionUser {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("User uuid cannot be null or blank");
        }
        permissions = permissions == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(permissions));
    }

    public static SessionUser of(String uuid, String role) {
        return new SessionUser(uuid, role, null, Set.of());
    }

    public SessionUser withRole(String newRole) {
        return new SessionUser(uuid, newRole, email, permissions);
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
