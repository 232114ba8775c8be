package rs.lukaj.minihttp.connections;

/**
 * Thrown when request is in invalid state (e.g. body set on a GET request). Detected before anything is sent.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
