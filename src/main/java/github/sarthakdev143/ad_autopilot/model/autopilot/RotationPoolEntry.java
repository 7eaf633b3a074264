package github.sarthakdev143.ad_autopilot.model.autopilot;

import java.time.Instant;
import java.util.List;

public record RotationPoolEntry(
        String id,
        String storeId,
        String externalId,
        String title,
        String description,
        List<String> images,
        String price,
        boolean active,
        int useCount,
        Instant lastUsedAt,
        Instant createdAt) {

    public static final int MIN_IMAGES = 2;

    public RotationPoolEntry {
        images = images == null ? List.of() : List.copyOf(images);
        if (useCount < 0) {
            throw new IllegalArgumentException("useCount must not be negative.");
        }
    }

    public boolean hasEnoughImages() {
        return images.size() >= MIN_IMAGES;
    }

    public boolean hasBeenUsed() {
        return lastUsedAt != null;
    }

    public RotationPoolEntry markUsed(Instant now) {
        return new RotationPoolEntry(id, storeId, externalId, title, description, images, price, active, useCount + 1, now, createdAt);
    }

    public RotationPoolEntry withActive(boolean isActive) {
        return new RotationPoolEntry(id, storeId, externalId, title, description, images, price, isActive, useCount, lastUsedAt, createdAt);
    }

    public RotationPoolEntry withUsageReset() {
        return new RotationPoolEntry(id, storeId, externalId, title, description, images, price, active, 0, null, createdAt);
    }

    /**
     * Copies catalogue fields from the store listing. Rotation state and the active flag are left alone.
     */
    public RotationPoolEntry refreshedFrom(ProductListing listing) {
        return new RotationPoolEntry(
                id,
                storeId,
                externalId,
                listing.title(),
                listing.description(),
                listing.images(),
                listing.price(),
                active,
                useCount,
                lastUsedAt,
                createdAt);
    }
}
