package likelion._th.safepath.exception;

/**
 * The geometry provider produced no candidate routes. Routes are never
 * synthesised from nothing, so this surfaces to the caller.
 */
public class NoRoutesAvailableException extends RuntimeException {

    public NoRoutesAvailableException(String message) {
        super(message);
    }
}
