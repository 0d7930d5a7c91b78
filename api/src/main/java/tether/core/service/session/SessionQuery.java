package tether.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import tether.core.model.session.AuthProvider;
import tether.core.model.session.SessionPage;
import tether.core.model.session.SessionRecord;
import tether.core.model.session.SessionStatus;

/**
 * Composable query over indexed sessions.
 *
 * <p>Candidates come from the user index when the query names users, from the
 * constrained providers' indexes when it names providers, and from every provider
 * index otherwise. Every condition, provider and user included, is then evaluated
 * against the hydrated record, so stale index entries never leak into results.
 * A condition that throws counts as not matching.
 *
 * <p>Time conditions read the clock when the query runs, not when it is built.
 */
public final class SessionQuery {

    private static final Logger LOG = Logger.getLogger(SessionQuery.class);

    /**
     * Sort direction.
     */
    public enum Direction {
        ASC,
        DESC
    }

    private final SessionIndex index;
    private final Clock clock;

    private Set<AuthProvider> providers;
    private Set<String> users;
    private final List<Condition> conditions = new ArrayList<>();
    private Comparator<SessionRecord> order =
            Comparator.comparing(SessionRecord::createdAt).thenComparing(SessionRecord::id);
    private String orderDescription;
    private Integer limit;
    private int offset;

    SessionQuery(SessionIndex index, Clock clock) {
        this.index = index;
        this.clock = clock;
    }

    public SessionQuery whereProvider(AuthProvider provider) {
        return whereProviderIn(List.of(provider));
    }

    /**
     * Restrict to sessions of any of the given providers. Repeated calls intersect.
     */
    public SessionQuery whereProviderIn(Collection<AuthProvider> allowed) {
        final var set = allowed.isEmpty() ? EnumSet.noneOf(AuthProvider.class) : EnumSet.copyOf(allowed);
        if (providers == null) {
            providers = set;
        } else {
            providers.retainAll(set);
        }
        return this;
    }

    public SessionQuery whereUser(String userUuid) {
        return whereUserIn(List.of(userUuid));
    }

    /**
     * Restrict to sessions of any of the given users. Repeated calls intersect.
     */
    public SessionQuery whereUserIn(Collection<String> userUuids) {
        final var set = new LinkedHashSet<>(userUuids);
        if (users == null) {
            users = set;
        } else {
            users.retainAll(set);
        }
        return this;
    }

    public SessionQuery whereUserRole(String role) {
        return addCondition("user.role = " + role, r -> role.equals(r.user().role()));
    }

    public SessionQuery whereUserHasAnyRole(Collection<String> roles) {
        final var allowed = Set.copyOf(roles);
        return addCondition("user.role IN " + allowed, r -> allowed.contains(r.user().role()));
    }

    /**
     * Sessions whose user holds every one of {@code roles}. A user carries a single role,
     * so only a set naming at most that role matches.
     */
    public SessionQuery whereUserHasAllRoles(Collection<String> roles) {
        final var required = Set.copyOf(roles);
        return addCondition(
                "user.role CONTAINS ALL " + required,
                r -> required.stream().allMatch(role -> role.equals(r.user().role())));
    }

    public SessionQuery whereUserHasPermission(String permission) {
        return addCondition("user.permissions CONTAINS " + permission, r -> r.user().hasPermission(permission));
    }

    public SessionQuery whereUserHasAllPermissions(Collection<String> permissions) {
        final var required = Set.copyOf(permissions);
        return addCondition(
                "user.permissions CONTAINS ALL " + required,
                r -> r.user().permissions().containsAll(required));
    }

    /**
     * Sessions whose last activity is more than {@code idle} ago.
     */
    public SessionQuery whereLastActivityOlderThan(Duration idle) {
        return addCondition(
                "updated_at < now - " + idle.toSeconds() + "s",
                r -> r.updatedAt().isBefore(clock.instant().minus(idle)));
    }

    public SessionQuery whereLastActivityWithin(Duration window) {
        return addCondition(
                "updated_at >= now - " + window.toSeconds() + "s",
                r -> !r.updatedAt().isBefore(clock.instant().minus(window)));
    }

    /**
     * Sessions created in {@code [from, to]}.
     */
    public SessionQuery whereCreatedBetween(Instant from, Instant to) {
        return addCondition(
                "created_at BETWEEN " + from + " AND " + to,
                r -> !r.createdAt().isBefore(from) && !r.createdAt().isAfter(to));
    }

    public SessionQuery whereStatus(SessionStatus status) {
        return addCondition("status = " + status.key(), r -> r.status() == status);
    }

    public SessionQuery whereIpAddress(String ipAddress) {
        return addCondition("ip_address = " + ipAddress, r -> ipAddress.equals(r.ipAddress()));
    }

    /**
     * Match the client address against a glob where {@code *} stands for any run of characters.
     */
    public SessionQuery whereIpAddressLike(String glob) {
        final var pattern = globToPattern(glob);
        return addCondition(
                "ip_address LIKE " + glob,
                r -> r.ipAddress() != null && pattern.matcher(r.ipAddress()).matches());
    }

    /**
     * Case-insensitive substring match on the user agent.
     */
    public SessionQuery whereUserAgentLike(String fragment) {
        final var needle = fragment.toLowerCase(Locale.ROOT);
        return addCondition(
                "user_agent LIKE %" + fragment + "%",
                r -> r.userAgent() != null && r.userAgent().toLowerCase(Locale.ROOT).contains(needle));
    }

    /**
     * Exact match on a record field or attribute, see {@link SessionRecord#fieldValue(String)}.
     */
    public SessionQuery whereField(String field, String value) {
        return addCondition(
                field + " = " + value, r -> r.fieldValue(field).map(value::equals).orElse(false));
    }

    /**
     * Arbitrary condition.
     */
    public SessionQuery where(Predicate<SessionRecord> predicate) {
        return where("custom", predicate);
    }

    public SessionQuery where(String description, Predicate<SessionRecord> predicate) {
        return addCondition(description, predicate);
    }

    /**
     * Group conditions built on a fresh query; the group must match as a whole.
     * Ordering and paging set inside the group are ignored.
     */
    public SessionQuery whereSessions(Consumer<SessionQuery> group) {
        final var nested = new SessionQuery(index, clock);
        group.accept(nested);
        final var clauses = nested.clauses();
        final var description = clauses.isEmpty() ? "(TRUE)" : "(" + String.join(" AND ", clauses) + ")";
        return addCondition(description, nested::matches);
    }

    /**
     * Match when any of the given conditions matches.
     */
    @SafeVarargs
    public final SessionQuery orWhere(String description, Predicate<SessionRecord>... alternatives) {
        final var all = Arrays.asList(alternatives);
        return addCondition("(" + description + ")", r -> all.stream().anyMatch(p -> p.test(r)));
    }

    /**
     * Sort by {@code created_at}, {@code updated_at}, {@code ttl} or any field understood by
     * {@link SessionRecord#fieldValue(String)}.
     */
    public SessionQuery orderBy(String field, Direction direction) {
        Comparator<SessionRecord> comparator =
                switch (field) {
                    case "created_at" -> Comparator.comparing(SessionRecord::createdAt);
                    case "updated_at" -> Comparator.comparing(SessionRecord::updatedAt);
                    case "ttl" -> Comparator.comparingLong(SessionRecord::ttlSeconds);
                    default -> Comparator.comparing(
                            (SessionRecord r) -> r.fieldValue(field).orElse(null),
                            Comparator.nullsLast(Comparator.naturalOrder()));
                };
        if (direction == Direction.DESC) {
            comparator = comparator.reversed();
        }
        this.order = comparator.thenComparing(SessionRecord::id);
        this.orderDescription = field + " " + direction;
        return this;
    }

    public SessionQuery limit(int max) {
        if (max < 0) {
            throw new IllegalArgumentException("Limit must not be negative");
        }
        this.limit = max;
        return this;
    }

    public SessionQuery offset(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        this.offset = skip;
        return this;
    }

    /**
     * Materialize matching sessions, sorted, with offset and limit applied.
     */
    public Uni<List<SessionRecord>> get() {
        return matching().map(this::window);
    }

    /**
     * Number of matching sessions, ignoring offset and limit.
     */
    public Uni<Integer> count() {
        return matching().map(List::size);
    }

    public Uni<Optional<SessionRecord>> first() {
        return get().map(list -> list.stream().findFirst());
    }

    public Uni<Boolean> exists() {
        return matching().map(list -> !list.isEmpty());
    }

    /**
     * One page of results; {@code page} is 1-based and overrides offset and limit.
     */
    public Uni<SessionPage> paginate(int page, int perPage) {
        if (page < 1 || perPage < 1) {
            throw new IllegalArgumentException("Page and page size must be positive");
        }
        return matching().map(all -> {
            final int from = Math.min(all.size(), (page - 1) * perPage);
            final int to = Math.min(all.size(), from + perPage);
            return new SessionPage(all.subList(from, to), page, perPage, all.size());
        });
    }

    /**
     * SQL-like rendering of the query for logs and debugging.
     */
    public String describe() {
        final var clauses = clauses();
        final var sql = new StringBuilder("SELECT * FROM sessions");
        if (!clauses.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", clauses));
        }
        if (orderDescription != null) {
            sql.append(" ORDER BY ").append(orderDescription);
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        if (offset > 0) {
            sql.append(" OFFSET ").append(offset);
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return describe();
    }

    private List<String> clauses() {
        final var clauses = new ArrayList<String>();
        if (providers != null) {
            clauses.add("provider IN " + providers.stream().map(AuthProvider::key).toList());
        }
        if (users != null) {
            clauses.add("user.uuid IN " + users);
        }
        conditions.forEach(c -> clauses.add(c.description()));
        return clauses;
    }

    private Uni<List<SessionRecord>> matching() {
        return candidateIds()
                .onItem()
                .transformToMulti(ids -> Multi.createFrom().iterable(ids))
                .onItem()
                .transformToUniAndConcatenate(index::hydrate)
                .filter(Optional::isPresent)
                .map(Optional::get)
                .filter(this::matches)
                .collect()
                .asList()
                .map(list -> {
                    final var sorted = new ArrayList<>(list);
                    sorted.sort(order);
                    return List.copyOf(sorted);
                });
    }

    private Uni<Set<String>> candidateIds() {
        if (users != null) {
            return index.userSessionIds(users);
        }
        if (providers != null) {
            return index.providerSessionIds(providers);
        }
        return index.providerSessionIds(EnumSet.allOf(AuthProvider.class));
    }

    private boolean matches(SessionRecord record) {
        if (providers != null && !providers.contains(record.provider())) {
            return false;
        }
        if (users != null && !users.contains(record.user().uuid())) {
            return false;
        }
        for (Condition condition : conditions) {
            try {
                if (!condition.predicate().test(record)) {
                    return false;
                }
            } catch (RuntimeException e) {
                LOG.debugf("Condition '%s' failed on session %s: %s", condition.description(), record.id(), e);
                return false;
            }
        }
        return true;
    }

    private List<SessionRecord> window(List<SessionRecord> sorted) {
        final int from = Math.min(offset, sorted.size());
        final int to = limit == null ? sorted.size() : Math.min(sorted.size(), from + limit);
        return sorted.subList(from, to);
    }

    private SessionQuery addCondition(String description, Predicate<SessionRecord> predicate) {
        conditions.add(new Condition(description, predicate));
        return this;
    }

    private static Pattern globToPattern(String glob) {
        final var parts = Arrays.stream(glob.split("\\*", -1)).map(Pattern::quote).toList();
        return Pattern.compile(String.join(".*", parts));
    }

    private record Condition(String description, Predicate<SessionRecord> predicate) {}
}
