package turnstile.core.model.provider;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported OAuth identity providers for social sign-in.
 */
public enum IdentityProviderType {
    GITHUB("github"),
    BITBUCKET("bitbucket"),
    GITLAB("gitlab"),
    GOOGLE("google");

    private final String providerName;

    IdentityProviderType(String providerName) {
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }

    /**
     * Resolve a provider type by name, case-insensitively.
     *
     * @param name requested provider name
     * @return the type, or empty if the name is not supported
     */
    public static Optional<IdentityProviderType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT);
        for (IdentityProviderType type : values()) {
            if (type.providerName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
