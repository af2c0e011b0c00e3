package turnstile.spi;

/**
 * Thrown when the outbound call could not complete: connection failure or timeout.
 *
 * <p>No retry is attempted by the provider.
 */
public class ProviderTransportException extends ProviderException {

    public ProviderTransportException(String providerName, Throwable cause) {
        super(providerName, "%s: failed to execute request: %s".formatted(providerName, describe(cause)), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
