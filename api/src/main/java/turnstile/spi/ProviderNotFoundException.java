package turnstile.spi;

/**
 * Thrown when a provider name is unknown or the provider is not enabled.
 */
public class ProviderNotFoundException extends ProviderException {

    public ProviderNotFoundException(String providerName) {
        super(providerName, "Provider %s could not be found".formatted(providerName));
    }

    public ProviderNotFoundException(String providerName, String message) {
        super(providerName, message);
    }
}
