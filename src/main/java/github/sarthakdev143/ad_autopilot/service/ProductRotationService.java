package github.sarthakdev143.ad_autopilot.service;

import github.sarthakdev143.ad_autopilot.model.autopilot.PoolStats;
import github.sarthakdev143.ad_autopilot.model.autopilot.RotationPoolEntry;

import java.util.Optional;

public interface ProductRotationService {

    /**
     * Least recently used active product: never-used first, then fewest uses, then oldest.
     */
    Optional<RotationPoolEntry> getNextProduct(String storeId);

    RotationPoolEntry markProductUsed(String productId);

    PoolStats getPoolStats(String storeId);

    RotationPoolEntry setProductActive(String productId, boolean active);

    int resetProductUsage(String storeId);

    /**
     * Pulls the store's current catalogue into the pool.
     *
     * @return number of entries deactivated because the store no longer lists them
     */
    int syncProducts(String storeId);
}
