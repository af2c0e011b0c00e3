package turnstile.spi;

/**
 * Base type for failures raised while looking up or calling an external provider.
 *
 * <p>Each subtype maps to a different remedy for the caller: fix configuration,
 * retry later, or report that the provider declined the request.
 */
public abstract class ProviderException extends RuntimeException {

    private final String providerName;

    protected ProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    protected ProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    /**
     * Name of the provider involved, as requested or configured.
     */
    public String providerName() {
        return providerName;
    }
}
