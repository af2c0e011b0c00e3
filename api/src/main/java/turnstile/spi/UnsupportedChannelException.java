package turnstile.spi;

import turnstile.core.model.message.MessageChannel;

/**
 * Thrown before any network call when a provider cannot deliver on the requested channel.
 */
public class UnsupportedChannelException extends ProviderException {

    private final MessageChannel channel;

    public UnsupportedChannelException(String providerName, MessageChannel channel) {
        super(providerName, "%s: channel type \"%s\" is not supported".formatted(providerName, channel.wireName()));
        this.channel = channel;
    }

    public MessageChannel channel() {
        return channel;
    }
}
