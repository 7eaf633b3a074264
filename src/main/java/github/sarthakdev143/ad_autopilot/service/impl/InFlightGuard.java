package github.sarthakdev143.ad_autopilot.service.impl;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps two overlapping triggers from working on the same entity at the same time.
 */
public class InFlightGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String key) {
        return inFlight.add(key);
    }

    public void release(String key) {
        inFlight.remove(key);
    }
}
