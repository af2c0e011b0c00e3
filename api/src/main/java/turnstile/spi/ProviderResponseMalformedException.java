package turnstile.spi;

/**
 * Thrown when the provider answered but its body could not be parsed.
 */
public class ProviderResponseMalformedException extends ProviderException {

    private final int statusCode;

    public ProviderResponseMalformedException(String providerName, int statusCode, Throwable cause) {
        super(
                providerName,
                "%s: failed to parse response body (status code %d)".formatted(providerName, statusCode),
                cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status observed on the malformed response.
     */
    public int statusCode() {
        return statusCode;
    }
}
