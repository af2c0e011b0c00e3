package turnstile.spi;

/**
 * Thrown when an enabled provider cannot be constructed from its configuration.
 *
 * <p>Raised during startup so that misconfiguration aborts boot instead of failing
 * the first user request.
 */
public class ProviderMisconfiguredException extends ProviderException {

    public ProviderMisconfiguredException(String providerName, String message) {
        super(providerName, "%s: %s".formatted(providerName, message));
    }
}
