package bastion.core.service.lockout;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.model.lockout.AccessLogEntry;
import bastion.core.model.lockout.AttemptOutcome;
import bastion.core.model.lockout.AttemptRecord;
import bastion.core.model.lockout.LockoutPolicy;
import bastion.core.model.lockout.LoginAttempt;
import bastion.core.model.lockout.ScopeKey;
import bastion.core.model.lockout.ScopeStatus;
import bastion.core.model.lockout.UserLockedOut;
import bastion.core.model.lockout.Verdict;
import bastion.spi.AccessLogRepository;
import bastion.spi.AttemptStore;
import bastion.spi.TrustStore;

/**
 * Entry point of the lockout subsystem.
 *
 * <p>Every login attempt goes through {@link #recordAttempt}:
 * <ol>
 *   <li>compute the scope keys for (username, ip)</li>
 *   <li>if any scope is already locked, return LOCKED without counting anything</li>
 *   <li>on success, clear the computed scopes and append an access log entry</li>
 *   <li>on failure, increment each scope and emit {@link UserLockedOut} for a scope
 *       whose count lands exactly on the limit</li>
 * </ol>
 *
 * <p>Blacklisted IPs are always locked and whitelisted IPs never are; neither is counted.
 *
 * <p>Storage failures on the attempt path are recovered according to the fail-open
 * setting and never propagate to the caller. Administrative operations propagate them.
 */
@ApplicationScoped
public class AttemptRecorder {

    private static final Logger LOG = Logger.getLogger(AttemptRecorder.class);

    private final LockoutPolicy policy;
    private final ScopingPolicy scopingPolicy;
    private final LockoutEvaluator evaluator;
    private final AttemptStore attemptStore;
    private final TrustStore trustStore;
    private final AccessLogRepository accessLog;
    private final LockoutEventDispatcher dispatcher;

    @Inject
    public AttemptRecorder(
            LockoutPolicy policy,
            ScopingPolicy scopingPolicy,
            LockoutEvaluator evaluator,
            AttemptStore attemptStore,
            TrustStore trustStore,
            AccessLogRepository accessLog,
            LockoutEventDispatcher dispatcher) {
        this.policy = policy;
        this.scopingPolicy = scopingPolicy;
        this.evaluator = evaluator;
        this.attemptStore = attemptStore;
        this.trustStore = trustStore;
        this.accessLog = accessLog;
        this.dispatcher = dispatcher;
    }

    /**
     * Record a login attempt and return the gate verdict.
     *
     * @param attempt the attempt
     * @return Uni with the outcome; never fails
     */
    public Uni<AttemptOutcome> recordAttempt(LoginAttempt attempt) {
        return recoverFromStoreFailure(Uni.createFrom().deferred(() -> doRecordAttempt(attempt)), "recordAttempt");
    }

    private Uni<AttemptOutcome> doRecordAttempt(LoginAttempt attempt) {
        if (!policy.enabled()) {
            return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_DISABLED));
        }
        if (policy.isBlacklisted(attempt.ipAddress())) {
            LOG.debugf("Rejecting attempt from blacklisted IP %s", attempt.ipAddress());
            return Uni.createFrom().item(AttemptOutcome.locked(AttemptOutcome.REASON_IP_BLACKLISTED));
        }

        final var keys =
                scopingPolicy.keysFor(attempt.username(), attempt.ipAddress(), attempt.userAgent());

        if (policy.isWhitelisted(attempt.ipAddress())) {
            if (attempt.success()) {
                return recordSuccess(attempt, keys);
            }
            return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_IP_WHITELISTED));
        }

        if (keys.isEmpty()) {
            if (attempt.success()) {
                return recordSuccess(attempt, keys);
            }
            LOG.debugf("No usable scope for attempt (username and IP both blank), allowing");
            return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_NO_SCOPE));
        }

        return evaluate(keys, attempt.timestamp()).flatMap(current -> {
            if (!current.allowed()) {
                LOG.debugf("Attempt for %s blocked by locked scope %s", attempt.username(), current.key());
                return Uni.createFrom().item(current);
            }
            return attempt.success() ? recordSuccess(attempt, keys) : recordFailure(attempt, keys);
        });
    }

    /**
     * Count a failed attempt against every scope of the attempt, without the locked pre-check.
     *
     * <p>Store failures propagate; use {@link #recordAttempt} on the login path.
     *
     * @param attempt the failed attempt
     * @return Uni with the outcome after the increment
     */
    public Uni<AttemptOutcome> recordFailure(LoginAttempt attempt) {
        return recordFailure(
                attempt, scopingPolicy.keysFor(attempt.username(), attempt.ipAddress(), attempt.userAgent()));
    }

    /**
     * Clear the scopes of a successful attempt and append an access log entry, without the
     * locked pre-check.
     *
     * <p>Store failures propagate; use {@link #recordAttempt} on the login path.
     *
     * @param attempt the successful attempt
     * @return Uni with the outcome
     */
    public Uni<AttemptOutcome> recordSuccess(LoginAttempt attempt) {
        return recordSuccess(
                attempt, scopingPolicy.keysFor(attempt.username(), attempt.ipAddress(), attempt.userAgent()));
    }

    /**
     * Evaluate the lockout state of an attempt without recording anything.
     *
     * @param username the username, may be null
     * @param ipAddress the client IP address, may be null
     * @param userAgent the user agent, may be null
     * @param now evaluation time
     * @return Uni with the outcome; never fails
     */
    public Uni<AttemptOutcome> checkLockout(String username, String ipAddress, String userAgent, Instant now) {
        return recoverFromStoreFailure(
                Uni.createFrom().deferred(() -> {
                    if (!policy.enabled()) {
                        return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_DISABLED));
                    }
                    if (policy.isBlacklisted(ipAddress)) {
                        return Uni.createFrom().item(AttemptOutcome.locked(AttemptOutcome.REASON_IP_BLACKLISTED));
                    }
                    if (policy.isWhitelisted(ipAddress)) {
                        return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_IP_WHITELISTED));
                    }
                    final var keys = scopingPolicy.keysFor(username, ipAddress, userAgent);
                    if (keys.isEmpty()) {
                        return Uni.createFrom().item(AttemptOutcome.allow(AttemptOutcome.REASON_NO_SCOPE));
                    }
                    return evaluate(keys, now)
                            .flatMap(outcome -> isTrusted(username, ipAddress).map(outcome::withTrusted));
                }),
                "checkLockout");
    }

    /**
     * Record the end of a session for a (username, ip) pair.
     *
     * <p>Closes the most recent open access log entry and, when one was closed,
     * marks the pair as trusted.
     *
     * @param username the username
     * @param ipAddress the client IP address
     * @param at logout time
     * @return Uni with the closed entry, or empty if there was no open session
     */
    public Uni<Optional<AccessLogEntry>> recordLogout(String username, String ipAddress, Instant at) {
        if (isBlank(username) || isBlank(ipAddress)) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var user = username.trim();
        final var address = ipAddress.trim();
        return accessLog.closeLatest(user, address, at).flatMap(closed -> {
            if (closed.isEmpty()) {
                LOG.debugf("Logout for %s from %s without an open session", user, address);
                return Uni.createFrom().item(closed);
            }
            return trustStore.markTrusted(user, address, at).map(trust -> closed);
        });
    }

    /**
     * Clear attempt records.
     *
     * <ul>
     *   <li>no arguments: every record</li>
     *   <li>ip only: records scoped to that IP, and username scopes last failed from it</li>
     *   <li>username only: records scoped to that username</li>
     *   <li>both: the union of the two</li>
     * </ul>
     *
     * @param ipAddress the IP address, may be null
     * @param username the username, may be null
     * @return Uni with the number of records removed
     */
    public Uni<Integer> reset(String ipAddress, String username) {
        final Uni<Integer> cleared;
        if (isBlank(ipAddress) && isBlank(username)) {
            cleared = attemptStore.clearAll();
        } else {
            final var byIp = isBlank(ipAddress)
                    ? Uni.createFrom().item(0)
                    : attemptStore.clearByIp(ipAddress.trim());
            cleared = byIp.flatMap(ipCount -> isBlank(username)
                    ? Uni.createFrom().item(ipCount)
                    : attemptStore.clearByUsername(username.trim()).map(userCount -> ipCount + userCount));
        }
        return cleared.invoke(count ->
                LOG.infof("Reset %d attempt record(s) for ip=%s, username=%s", count, ipAddress, username));
    }

    public Uni<Integer> revokeTrust(String username, String ipAddress) {
        return trustStore
                .revoke(blankToNull(username), blankToNull(ipAddress))
                .invoke(count -> LOG.infof("Revoked %d trust record(s) for username=%s, ip=%s", count, username, ipAddress));
    }

    /**
     * List every attempt record with its state at {@code now}.
     */
    public Multi<ScopeStatus> listScopes(Instant now) {
        return scopes(record -> true, now);
    }

    public Multi<ScopeStatus> scopesForIp(String ipAddress, Instant now) {
        final var address = ipAddress.trim();
        return scopes(record -> address.equals(record.ipAddress()), now);
    }

    public Multi<ScopeStatus> scopesForUsername(String username, Instant now) {
        final var user = username.trim();
        return scopes(record -> user.equals(record.username()), now);
    }

    public Multi<AccessLogEntry> recentAccessLogs(int limit) {
        return accessLog.streamRecent(limit);
    }

    /**
     * Evaluate a record for administrative display.
     */
    public ScopeStatus describe(AttemptRecord record, Instant now) {
        final var expired = evaluator.isExpired(record, now);
        return new ScopeStatus(
                record,
                evaluator.decide(record, now),
                expired,
                evaluator.remainingAttempts(record, now),
                evaluator.lockedUntil(record).orElse(null));
    }

    private Multi<ScopeStatus> scopes(Predicate<AttemptRecord> filter, Instant now) {
        return attemptStore.streamAll().select().where(filter).map(record -> describe(record, now));
    }

    private Uni<AttemptOutcome> evaluate(List<ScopeKey> keys, Instant now) {
        return Multi.createFrom()
                .iterable(keys)
                .onItem()
                .transformToUniAndConcatenate(key -> attemptStore.find(key.value()))
                .collect()
                .asList()
                .map(records -> {
                    var maxFailures = 0;
                    for (var found : records) {
                        if (found.isEmpty()) {
                            continue;
                        }
                        final var record = found.get();
                        if (evaluator.decide(record, now) == Verdict.LOCKED) {
                            return AttemptOutcome.locked(
                                    record.key(),
                                    record.failureCount(),
                                    evaluator.lockedUntil(record).orElse(null));
                        }
                        maxFailures = Math.max(maxFailures, evaluator.effectiveFailures(record, now));
                    }
                    return AttemptOutcome.allow(
                            maxFailures, Math.max(0, evaluator.failureLimit() - maxFailures), false);
                });
    }

    private Uni<AttemptOutcome> recordSuccess(LoginAttempt attempt, List<ScopeKey> keys) {
        final var username = blankToNull(attempt.username());
        final var ipAddress = blankToNull(attempt.ipAddress());
        final var userAgent = policy.truncateUserAgent(attempt.userAgent());

        return Multi.createFrom()
                .iterable(keys)
                .onItem()
                .transformToUniAndConcatenate(key -> attemptStore.clear(key.value()))
                .collect()
                .asList()
                .flatMap(cleared -> isTrusted(username, ipAddress))
                .flatMap(trusted -> accessLog
                        .append(new AccessLogEntry(
                                0L,
                                attempt.timestamp(),
                                username,
                                ipAddress,
                                userAgent,
                                attempt.httpAccept(),
                                attempt.pathInfo(),
                                trusted,
                                attempt.timestamp(),
                                null))
                        .map(entry -> {
                            LOG.debugf("Login for %s from %s recorded as access log %d", username, ipAddress, entry.id());
                            return AttemptOutcome.allow(0, evaluator.failureLimit(), trusted);
                        }));
    }

    private Uni<AttemptOutcome> recordFailure(LoginAttempt attempt, List<ScopeKey> keys) {
        final var userAgent = policy.truncateUserAgent(attempt.userAgent());
        final var ipAddress = blankToNull(attempt.ipAddress());
        final var now = attempt.timestamp();

        return Multi.createFrom()
                .iterable(keys)
                .onItem()
                .transformToUniAndConcatenate(
                        key -> attemptStore.recordFailure(key, ipAddress, userAgent, now, policy.cooloffTime()))
                .collect()
                .asList()
                .map(records -> {
                    AttemptRecord transitioned = null;
                    AttemptRecord locked = null;
                    var maxFailures = 0;
                    for (var record : records) {
                        if (transitioned == null && record.failureCount() == evaluator.failureLimit()) {
                            transitioned = record;
                        }
                        if (locked == null && evaluator.decide(record, now) == Verdict.LOCKED) {
                            locked = record;
                        }
                        maxFailures = Math.max(maxFailures, record.failureCount());
                    }

                    if (transitioned != null) {
                        LOG.warnf(
                                "Locked out %s from %s: scope %s reached %d failed attempts",
                                attempt.username(),
                                attempt.ipAddress(),
                                transitioned.key(),
                                transitioned.failureCount());
                        dispatcher.dispatch(new UserLockedOut(
                                now,
                                attempt,
                                blankToNull(attempt.username()),
                                blankToNull(attempt.ipAddress()),
                                transitioned.key(),
                                transitioned.failureCount()));
                    }

                    if (locked != null) {
                        return AttemptOutcome.locked(
                                locked.key(), locked.failureCount(), evaluator.lockedUntil(locked).orElse(null));
                    }
                    return AttemptOutcome.allow(
                            maxFailures, Math.max(0, evaluator.failureLimit() - maxFailures), false);
                });
    }

    private Uni<Boolean> isTrusted(String username, String ipAddress) {
        if (isBlank(username) || isBlank(ipAddress)) {
            return Uni.createFrom().item(false);
        }
        return trustStore.find(username.trim(), ipAddress.trim()).map(Optional::isPresent);
    }

    private Uni<AttemptOutcome> recoverFromStoreFailure(Uni<AttemptOutcome> outcome, String operation) {
        return outcome.onFailure().recoverWithItem(error -> {
            if (policy.failOpen()) {
                LOG.warnf("Lockout store failure during %s, failing open: %s", operation, error.getMessage());
                return AttemptOutcome.allow(AttemptOutcome.REASON_STORE_UNAVAILABLE);
            }
            LOG.warnf("Lockout store failure during %s, failing closed: %s", operation, error.getMessage());
            return AttemptOutcome.locked(AttemptOutcome.REASON_STORE_UNAVAILABLE);
        });
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
