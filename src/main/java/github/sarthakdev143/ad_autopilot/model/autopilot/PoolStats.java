package github.sarthakdev143.ad_autopilot.model.autopilot;

public record PoolStats(
        int totalProducts,
        int activeProducts,
        int usedProducts,
        int unusedProducts,
        long totalUseCount,
        int minUseCount,
        int maxUseCount) {

    public static PoolStats empty() {
        return new PoolStats(0, 0, 0, 0, 0, 0, 0);
    }

    public boolean isExhausted() {
        return activeProducts > 0 && unusedProducts == 0;
    }

    /**
     * True right after the use that brought every active product to the same use count.
     */
    public boolean isPassComplete() {
        return isExhausted() && minUseCount > 0 && minUseCount == maxUseCount;
    }
}
