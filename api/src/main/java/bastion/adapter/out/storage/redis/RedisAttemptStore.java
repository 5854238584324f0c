package bastion.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.lockout.AttemptRecord;
import bastion.core.model.lockout.ScopeKey;
import bastion.core.model.lockout.ScopeType;
import bastion.spi.AttemptStore;

/**
 * Redis implementation of AttemptStore.
 *
 * <p>This is the default implementation for production deployments. Each scope is a
 * hash at {@code bastion:attempt:{scopeKey}} with fields scope, username, ip, ua, count,
 * first and last (epoch millis).
 *
 * <p>The increment runs as a Lua script so the stale-restart check and the update are a
 * single atomic step across instances. Keys carry a TTL of the cool-off window plus a
 * margin; the TTL only reclaims memory, expiry itself is decided by the evaluator.
 */
public class RedisAttemptStore implements AttemptStore {

    private static final Logger LOG = Logger.getLogger(RedisAttemptStore.class);

    static final String KEY_PREFIX = "bastion:attempt:";

    private static final Duration TTL_MARGIN = Duration.ofMinutes(1);

    private static final String FIELD_SCOPE = "scope";
    private static final String FIELD_USERNAME = "username";
    private static final String FIELD_IP = "ip";
    private static final String FIELD_USER_AGENT = "ua";
    private static final String FIELD_COUNT = "count";
    private static final String FIELD_FIRST = "first";
    private static final String FIELD_LAST = "last";

    // KEYS[1] record; ARGV: at, cooloffMillis, ttlMillis, scope, username, ip, ua
    private static final String RECORD_FAILURE_SCRIPT = """
            local last = redis.call('HGET', KEYS[1], 'last')
            local at = tonumber(ARGV[1])
            local cooloff = tonumber(ARGV[2])
            local count = 1
            local first = at
            if last and (cooloff == 0 or at - tonumber(last) <= cooloff) then
              count = tonumber(redis.call('HGET', KEYS[1], 'count')) + 1
              first = tonumber(redis.call('HGET', KEYS[1], 'first'))
            end
            redis.call('HSET', KEYS[1], 'scope', ARGV[4], 'username', ARGV[5], 'ip', ARGV[6], 'ua', ARGV[7],
                'count', count, 'first', first, 'last', at)
            if tonumber(ARGV[3]) > 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[3])
            else
              redis.call('PERSIST', KEYS[1])
            end
            return {count, first}
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAttemptStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        LOG.info("Initialized Redis attempt store");
    }

    @Override
    public Uni<Optional<AttemptRecord>> find(String key) {
        return timeoutHelper.withTimeout(
                hashCommands.hgetall(KEY_PREFIX + key).map(fields -> Optional.ofNullable(toRecord(key, fields))),
                "find");
    }

    @Override
    public Uni<AttemptRecord> recordFailure(
            ScopeKey scope, String ipAddress, String userAgent, Instant at, Duration cooloff) {
        final var sourceIp = scope.ipAddress() != null ? scope.ipAddress() : ipAddress;
        final var ttl = cooloff.isZero() ? 0L : cooloff.plus(TTL_MARGIN).toMillis();
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        RECORD_FAILURE_SCRIPT,
                        "1",
                        KEY_PREFIX + scope.value(),
                        String.valueOf(at.toEpochMilli()),
                        String.valueOf(cooloff.toMillis()),
                        String.valueOf(ttl),
                        scope.type().prefix(),
                        nullToEmpty(scope.username()),
                        nullToEmpty(sourceIp),
                        nullToEmpty(userAgent))
                .map(response -> new AttemptRecord(
                        scope.value(),
                        scope.type(),
                        scope.username(),
                        sourceIp,
                        userAgent,
                        response.get(0).toInteger(),
                        Instant.ofEpochMilli(response.get(1).toLong()),
                        at))
                .invoke(record ->
                        LOG.debugf("Recorded failed attempt for %s: count=%d", scope, record.failureCount()));
        return timeoutHelper.withTimeout(operation, "recordFailure");
    }

    @Override
    public Uni<Boolean> clear(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(KEY_PREFIX + key).map(deleted -> deleted > 0), "clear");
    }

    @Override
    public Uni<Integer> clearByIp(String ipAddress) {
        return removeMatching(record -> ipAddress.equals(record.ipAddress()), "clearByIp");
    }

    @Override
    public Uni<Integer> clearByUsername(String username) {
        return removeMatching(record -> username.equals(record.username()), "clearByUsername");
    }

    @Override
    public Uni<Integer> clearAll() {
        return removeMatching(record -> true, "clearAll");
    }

    @Override
    public Multi<AttemptRecord> streamAll() {
        final var args = new KeyScanArgs().match(KEY_PREFIX + "*").count(1000);
        return timeoutHelper.withTimeout(
                keyCommands
                        .scan(args)
                        .toMulti()
                        .onItem()
                        .transformToUniAndConcatenate(this::load)
                        .select()
                        .where(record -> record != null),
                "streamAll");
    }

    private Uni<Integer> removeMatching(Predicate<AttemptRecord> filter, String operationName) {
        return streamAll()
                .select()
                .where(filter)
                .onItem()
                .transformToUniAndConcatenate(record -> clear(record.key()))
                .collect()
                .asList()
                .map(deleted -> (int) deleted.stream().filter(Boolean::booleanValue).count())
                .invoke(count -> LOG.infof("Cleared %d attempt record(s) (%s)", count, operationName));
    }

    private Uni<AttemptRecord> load(String redisKey) {
        final var key = redisKey.substring(KEY_PREFIX.length());
        return hashCommands.hgetall(redisKey).map(fields -> toRecord(key, fields));
    }

    private static AttemptRecord toRecord(String key, Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_COUNT) == null) {
            return null;
        }
        return new AttemptRecord(
                key,
                ScopeType.fromPrefix(fields.get(FIELD_SCOPE)),
                emptyToNull(fields.get(FIELD_USERNAME)),
                emptyToNull(fields.get(FIELD_IP)),
                emptyToNull(fields.get(FIELD_USER_AGENT)),
                Integer.parseInt(fields.get(FIELD_COUNT)),
                Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_FIRST))),
                Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_LAST))));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
