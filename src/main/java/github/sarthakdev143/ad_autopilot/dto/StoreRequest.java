package github.sarthakdev143.ad_autopilot.dto;

public record StoreRequest(String name, String logoUrl) {
}
