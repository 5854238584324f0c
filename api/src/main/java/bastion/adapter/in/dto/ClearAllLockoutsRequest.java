package bastion.adapter.in.dto;

/**
 * Request body for clearing every attempt record.
 *
 * @param force must be true; guards against accidental calls
 * @param reason free-form reason, logged
 */
public record ClearAllLockoutsRequest(boolean force, String reason) {}
