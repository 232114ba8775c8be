package rs.lukaj.minihttp.connections;

/**
 * Thrown if configuration parameters are invalid (e.g. a negative timeout, or disabling certificate checks
 * for a plain http request)
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
}
