package github.sarthakdev143.ad_autopilot.model.timing;

public record DurationValidation(boolean valid, double totalSeconds, String message) {

    public static DurationValidation ok(double totalSeconds) {
        return new DurationValidation(true, totalSeconds, null);
    }

    public static DurationValidation rejected(double totalSeconds, String message) {
        return new DurationValidation(false, totalSeconds, message);
    }
}
