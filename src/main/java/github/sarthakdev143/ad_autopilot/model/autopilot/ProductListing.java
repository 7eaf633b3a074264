package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.util.List;

public record ProductListing(String externalId, String title, String description, List<String> images, String price) {

    public ProductListing {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId is required.");
        }
        title = title == null ? "" : title.trim();
        description = description == null ? "" : description;
        images = images == null ? List.of() : List.copyOf(images);
    }
}
