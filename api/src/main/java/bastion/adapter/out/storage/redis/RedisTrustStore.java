package bastion.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.KeyScanArgs;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.lockout.TrustRecord;
import bastion.spi.TrustStore;

/**
 * Redis implementation of TrustStore.
 *
 * <p>Key format: {@code bastion:trust:{usernameLength}:{username}:{ip}}, a hash with
 * username, ip, first, last and count. Trust records never expire.
 */
public class RedisTrustStore implements TrustStore {

    private static final Logger LOG = Logger.getLogger(RedisTrustStore.class);

    private static final String KEY_PREFIX = "bastion:trust:";

    private static final String FIELD_USERNAME = "username";
    private static final String FIELD_IP = "ip";
    private static final String FIELD_FIRST = "first";
    private static final String FIELD_LAST = "last";
    private static final String FIELD_COUNT = "count";

    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisTrustStore(ReactiveRedisDataSource redisDataSource, RedisTimeoutHelper timeoutHelper) {
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<TrustRecord> markTrusted(String username, String ipAddress, Instant at) {
        final var key = key(username, ipAddress);
        final var millis = String.valueOf(at.toEpochMilli());
        final var operation = hashCommands
                .hsetnx(key, FIELD_FIRST, millis)
                .chain(() -> hashCommands.hset(
                        key, Map.of(FIELD_USERNAME, username, FIELD_IP, ipAddress, FIELD_LAST, millis)))
                .chain(() -> hashCommands.hincrby(key, FIELD_COUNT, 1))
                .chain(() -> hashCommands.hgetall(key))
                .map(RedisTrustStore::toRecord)
                .invoke(record -> LOG.debugf(
                        "Marked %s from %s as trusted (%d sessions)", username, ipAddress, record.logoutCount()));
        return timeoutHelper.withTimeout(operation, "markTrusted");
    }

    @Override
    public Uni<Optional<TrustRecord>> find(String username, String ipAddress) {
        return timeoutHelper.withTimeout(
                hashCommands
                        .hgetall(key(username, ipAddress))
                        .map(fields -> Optional.ofNullable(toRecord(fields))),
                "find");
    }

    @Override
    public Uni<Integer> revoke(String username, String ipAddress) {
        final var args = new KeyScanArgs().match(KEY_PREFIX + "*").count(1000);
        final var operation = keyCommands
                .scan(args)
                .toMulti()
                .onItem()
                .transformToUniAndConcatenate(key -> hashCommands.hgetall(key).map(fields -> {
                    final var record = toRecord(fields);
                    if (record == null) {
                        return null;
                    }
                    final var userMatches = username == null || username.equals(record.username());
                    final var ipMatches = ipAddress == null || ipAddress.equals(record.ipAddress());
                    return userMatches && ipMatches ? key : null;
                }))
                .onItem()
                .transformToUniAndConcatenate(key -> keyCommands.del(key))
                .collect()
                .asList()
                .map(deleted -> deleted.stream().mapToInt(Integer::intValue).sum());
        return timeoutHelper.withTimeout(operation, "revoke");
    }

    private static String key(String username, String ipAddress) {
        return KEY_PREFIX + username.length() + ":" + username + ":" + ipAddress;
    }

    private static TrustRecord toRecord(Map<String, String> fields) {
        if (fields == null || fields.isEmpty() || fields.get(FIELD_LAST) == null) {
            return null;
        }
        return new TrustRecord(
                fields.get(FIELD_USERNAME),
                fields.get(FIELD_IP),
                Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_FIRST))),
                Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_LAST))),
                Long.parseLong(fields.getOrDefault(FIELD_COUNT, "1")));
    }
}
