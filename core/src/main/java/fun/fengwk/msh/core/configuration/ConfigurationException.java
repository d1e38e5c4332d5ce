package fun.fengwk.msh.core.configuration;

/**
 * Raised when configuration values cannot be used, aborting startup.
 *
 * @author fengwk
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public static void check(boolean condition, String message, Object... args) {
        if (!condition) {
            throw new ConfigurationException(String.format(message, args));
        }
    }

}
