package github.sarthakdev143.ad_autopilot.exception;

/**
 * Raised by outbound integrations when a third-party service rejects a call or cannot be reached.
 */
public class ProviderException extends RuntimeException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
