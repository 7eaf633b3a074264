package github.sarthakdev143.ad_autopilot.service.impl;

import github.sarthakdev143.ad_autopilot.model.autopilot.PoolStats;
import github.sarthakdev143.ad_autopilot.model.autopilot.ProductListing;
import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;
import github.sarthakdev143.ad_autopilot.repository.RotationPoolRepository;
import github.sarthakdev143.ad_autopilot.service.ProductRotationService;
import github.sarthakdev143.ad_autopilot.service.ProductSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class DefaultProductRotationService implements ProductRotationService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProductRotationService.class);

    static final Comparator<RotationPoolEntry> ROTATION_ORDER = Comparator
            .comparing(RotationPoolEntry::lastUsedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(RotationPoolEntry::useCount)
            .thenComparing(RotationPoolEntry::createdAt);

    private final RotationPoolRepository poolRepository;
    private final ProductSource productSource;
    private final Clock clock;

    public DefaultProductRotationService(RotationPoolRepository poolRepository, ProductSource productSource, Clock clock) {
        this.poolRepository = poolRepository;
        this.productSource = productSource;
        this.clock = clock;
    }

    @Override
    public Optional<RotationPoolEntry> getNextProduct(String storeId) {
        return poolRepository.findByStoreId(storeId)
                .stream()
                .filter(RotationPoolEntry::active)
                .min(ROTATION_ORDER);
    }

    @Override
    public RotationPoolEntry markProductUsed(String productId) {
        RotationPoolEntry used = requireEntry(productId).markUsed(clock.instant());
        logger.debug("Marked product {} used, useCount={}", productId, used.useCount());
        return poolRepository.save(used);
    }

    @Override
    public PoolStats getPoolStats(String storeId) {
        List<RotationPoolEntry> entries = poolRepository.findByStoreId(storeId);
        if (entries.isEmpty()) {
            return PoolStats.empty();
        }

        List<RotationPoolEntry> active = entries.stream().filter(RotationPoolEntry::active).toList();
        int used = (int) active.stream().filter(RotationPoolEntry::hasBeenUsed).count();
        long totalUseCount = entries.stream().mapToLong(RotationPoolEntry::useCount).sum();
        int minUseCount = active.stream().mapToInt(RotationPoolEntry::useCount).min().orElse(0);
        int maxUseCount = active.stream().mapToInt(RotationPoolEntry::useCount).max().orElse(0);

        return new PoolStats(
                entries.size(), active.size(), used, active.size() - used, totalUseCount, minUseCount, maxUseCount);
    }

    @Override
    public RotationPoolEntry setProductActive(String productId, boolean active) {
        RotationPoolEntry updated = poolRepository.save(requireEntry(productId).withActive(active));
        logger.info("Product {} active={}", productId, active);
        return updated;
    }

    @Override
    public int resetProductUsage(String storeId) {
        List<RotationPoolEntry> entries = poolRepository.findByStoreId(storeId);
        entries.forEach(entry -> poolRepository.save(entry.withUsageReset()));
        logger.info("Reset usage for {} product(s) in store {}", entries.size(), storeId);
        return entries.size();
    }

    @Override
    public int syncProducts(String storeId) {
        List<ProductListing> listings = productSource.listActiveProducts(storeId);
        Map<String, ProductListing> listed = listings.stream()
                .collect(Collectors.toMap(ProductListing::externalId, Function.identity(), (first, ignored) -> first));

        Map<String, RotationPoolEntry> known = new HashMap<>();
        for (RotationPoolEntry entry : poolRepository.findByStoreId(storeId)) {
            known.put(entry.externalId(), entry);
        }

        Instant now = clock.instant();
        int inserted = 0;
        int deactivated = 0;
        for (ProductListing listing : listed.values()) {
            RotationPoolEntry existing = known.get(listing.externalId());
            if (existing == null) {
                poolRepository.save(new RotationPoolEntry(
                        UUID.randomUUID().toString(),
                        storeId,
                        listing.externalId(),
                        listing.title(),
                        listing.description(),
                        listing.images(),
                        listing.price(),
                        true,
                        0,
                        null,
                        now));
                inserted++;
            } else {
                poolRepository.save(existing.refreshedFrom(listing));
            }
        }

        for (RotationPoolEntry entry : known.values()) {
            if (entry.active() && !listed.containsKey(entry.externalId())) {
                poolRepository.save(entry.withActive(false));
                deactivated++;
            }
        }

        logger.info("Synced store {}: listed={} inserted={} deactivated={}", storeId, listed.size(), inserted, deactivated);
        return deactivated;
    }

    private RotationPoolEntry requireEntry(String productId) {
        return poolRepository.findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Product not found in rotation pool: " + productId));
    }
}
