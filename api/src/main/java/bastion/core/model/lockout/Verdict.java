package bastion.core.model.lockout;

/**
 * Gate decision for a login attempt.
 */
public enum Verdict {
    ALLOWED,
    LOCKED;

    public boolean isLocked() {
        return this == LOCKED;
    }
}
