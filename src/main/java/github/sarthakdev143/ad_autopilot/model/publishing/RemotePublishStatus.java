package github.sarthakdev143.ad_autopilot.model.publishing;

/**
 * A platform's own view of a post. {@code status} is free text; the reconciler understands
 * {@code published}, {@code failed}, {@code posting} and {@code scheduled}.
 */
public record RemotePublishStatus(String status, String publicUrl, String error) {

    public static final String PUBLISHED = "published";
    public static final String FAILED = "failed";
    public static final String POSTING = "posting";
    public static final String SCHEDULED = "scheduled";
}
