package bastion.adapter.out.storage.redis;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.list.ReactiveListCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import bastion.core.model.lockout.AccessLogEntry;
import bastion.spi.AccessLogRepository;

/**
 * Redis implementation of AccessLogRepository.
 *
 * <p>Key format:
 * <ul>
 *   <li>Sequence: {@code bastion:access-log:seq}</li>
 *   <li>Entry: {@code bastion:access-log:entry:{id}} (hash)</li>
 *   <li>Index, newest first: {@code bastion:access-log:index} (list of ids)</li>
 *   <li>Open sessions per pair: {@code bastion:access-log:open:{usernameLength}:{username}:{ip}} (list of ids)</li>
 * </ul>
 */
public class RedisAccessLogRepository implements AccessLogRepository {

    private static final String SEQUENCE_KEY = "bastion:access-log:seq";
    private static final String ENTRY_PREFIX = "bastion:access-log:entry:";
    private static final String INDEX_KEY = "bastion:access-log:index";
    private static final String OPEN_PREFIX = "bastion:access-log:open:";

    private static final String FIELD_ATTEMPT_TIME = "attemptTime";
    private static final String FIELD_USERNAME = "username";
    private static final String FIELD_IP = "ip";
    private static final String FIELD_USER_AGENT = "ua";
    private static final String FIELD_HTTP_ACCEPT = "httpAccept";
    private static final String FIELD_PATH_INFO = "pathInfo";
    private static final String FIELD_TRUSTED = "trusted";
    private static final String FIELD_LOGIN_TIME = "loginTime";
    private static final String FIELD_LOGOUT_TIME = "logoutTime";

    private final ReactiveValueCommands<String, Long> valueCommands;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveListCommands<String, String> listCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAccessLogRepository(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.valueCommands = redisDataSource.value(String.class, Long.class);
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.listCommands = redisDataSource.list(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<AccessLogEntry> append(AccessLogEntry entry) {
        final var operation = valueCommands.incr(SEQUENCE_KEY).flatMap(id -> {
            final var stored = entry.withId(id);
            final var ref = String.valueOf(id);
            var write = hashCommands
                    .hset(ENTRY_PREFIX + id, toFields(stored))
                    .chain(() -> listCommands.lpush(INDEX_KEY, ref));
            if (stored.username() != null && stored.ipAddress() != null) {
                write = write.chain(() -> listCommands.lpush(openKey(stored.username(), stored.ipAddress()), ref));
            }
            return write.replaceWith(stored);
        });
        return timeoutHelper.withTimeout(operation, "append");
    }

    @Override
    public Uni<Optional<AccessLogEntry>> closeLatest(String username, String ipAddress, Instant logoutTime) {
        final var operation = listCommands.lpop(openKey(username, ipAddress)).flatMap(ref -> {
            if (ref == null) {
                return Uni.createFrom().item(Optional.<AccessLogEntry>empty());
            }
            final var entryKey = ENTRY_PREFIX + ref;
            return hashCommands
                    .hset(entryKey, FIELD_LOGOUT_TIME, String.valueOf(logoutTime.toEpochMilli()))
                    .chain(() -> hashCommands.hgetall(entryKey))
                    .map(fields -> Optional.ofNullable(toEntry(Long.parseLong(ref), fields)));
        });
        return timeoutHelper.withTimeout(operation, "closeLatest");
    }

    @Override
    public Multi<AccessLogEntry> streamRecent(int limit) {
        if (limit <= 0) {
            return Multi.createFrom().empty();
        }
        final var operation = listCommands
                .lrange(INDEX_KEY, 0, limit - 1L)
                .onItem()
                .transformToMulti(refs -> Multi.createFrom().iterable(refs))
                .onItem()
                .transformToUniAndConcatenate(ref -> hashCommands
                        .hgetall(ENTRY_PREFIX + ref)
                        .map(fields -> toEntry(Long.parseLong(ref), fields)));
        return timeoutHelper.withTimeout(operation, "streamRecent");
    }

    private static String openKey(String username, String ipAddress) {
        return OPEN_PREFIX + username.length() + ":" + username + ":" + ipAddress;
    }

    private static Map<String, String> toFields(AccessLogEntry entry) {
        final var fields = new HashMap<String, String>();
        putTime(fields, FIELD_ATTEMPT_TIME, entry.attemptTime());
        putIfPresent(fields, FIELD_USERNAME, entry.username());
        putIfPresent(fields, FIELD_IP, entry.ipAddress());
        putIfPresent(fields, FIELD_USER_AGENT, entry.userAgent());
        putIfPresent(fields, FIELD_HTTP_ACCEPT, entry.httpAccept());
        putIfPresent(fields, FIELD_PATH_INFO, entry.pathInfo());
        fields.put(FIELD_TRUSTED, String.valueOf(entry.trusted()));
        putTime(fields, FIELD_LOGIN_TIME, entry.loginTime());
        putTime(fields, FIELD_LOGOUT_TIME, entry.logoutTime());
        return fields;
    }

    private static AccessLogEntry toEntry(long id, Map<String, String> fields) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        return new AccessLogEntry(
                id,
                time(fields.get(FIELD_ATTEMPT_TIME)),
                fields.get(FIELD_USERNAME),
                fields.get(FIELD_IP),
                fields.get(FIELD_USER_AGENT),
                fields.get(FIELD_HTTP_ACCEPT),
                fields.get(FIELD_PATH_INFO),
                Boolean.parseBoolean(fields.get(FIELD_TRUSTED)),
                time(fields.get(FIELD_LOGIN_TIME)),
                time(fields.get(FIELD_LOGOUT_TIME)));
    }

    private static void putIfPresent(Map<String, String> fields, String field, String value) {
        if (value != null) {
            fields.put(field, value);
        }
    }

    private static void putTime(Map<String, String> fields, String field, Instant value) {
        if (value != null) {
            fields.put(field, String.valueOf(value.toEpochMilli()));
        }
    }

    private static Instant time(String value) {
        return value == null ? null : Instant.ofEpochMilli(Long.parseLong(value));
    }
}
