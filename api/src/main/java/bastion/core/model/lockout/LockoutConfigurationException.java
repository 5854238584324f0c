package bastion.core.model.lockout;

/**
 * Thrown when lockout configuration values are invalid.
 *
 * <p>Raised while the {@link LockoutPolicy} is built at startup and never recovered from.
 */
public class LockoutConfigurationException extends RuntimeException {

    public LockoutConfigurationException(String message) {
        super(message);
    }
}
