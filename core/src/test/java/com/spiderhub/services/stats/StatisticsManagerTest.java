package com.spiderhub.services.stats;

import com.spiderhub.common.model.OperationType;
import com.spiderhub.services.stats.StatisticsManager.CallStats;
import com.spiderhub.services.stats.StatisticsManager.Outcome;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for per-site call statistics
 */
class StatisticsManagerTest extends TestBase {

    private final StatisticsManager statistics = new StatisticsManager();

    @Test
    void testCountsPerOperation() {
        statistics.record("a", OperationType.HOME, 100, Outcome.SUCCESS, false);
        statistics.record("a", OperationType.HOME, 300, Outcome.FAILURE, false);
        statistics.record("a", OperationType.SEARCH, 5000, Outcome.TIMEOUT, true);

        CallStats home = statistics.get("a", OperationType.HOME);
        assertEquals(2, home.calls());
        assertEquals(1, home.successes());
        assertEquals(1, home.failures());
        assertEquals(200, home.avgDurationMs());
        assertEquals(300, home.maxDurationMs());
        assertEquals(0.5, home.errorRate());

        CallStats site = statistics.getSiteStats("a");
        assertEquals(3, site.calls());
        assertEquals(1, site.timeouts());
        assertEquals(1, site.slowCalls());
        assertEquals(5000, site.maxDurationMs());
        assertEquals(3, statistics.getTotalCalls());
    }

    @Test
    void testUnknownSiteIsEmpty() {
        assertEquals(0, statistics.get("none", OperationType.DETAIL).calls());
        assertEquals(0, statistics.getSiteStats("none").calls());
        assertTrue(statistics.getRecentErrors("none").isEmpty());
    }

    @Test
    void testSitesSortedAndSlowestFirst() {
        statistics.record("zeta", OperationType.HOME, 10, Outcome.SUCCESS, false);
        statistics.record("alpha", OperationType.HOME, 900, Outcome.SUCCESS, false);
        statistics.record("mid", OperationType.HOME, 400, Outcome.SUCCESS, false);

        assertEquals(List.of("alpha", "mid", "zeta"), List.copyOf(statistics.getAllSites().keySet()));

        Map<String, CallStats> slowest = statistics.getSlowestSites(2);
        assertEquals(List.of("alpha", "mid"), List.copyOf(slowest.keySet()));
    }

    @Test
    void testRecentErrorsAreBounded() {
        for (int i = 0; i < 15; i++) statistics.recordError("a", "error " + i);

        List<String> errors = statistics.getRecentErrors("a");

        assertEquals(10, errors.size());
        assertEquals("error 5", errors.get(0));
        assertEquals("error 14", errors.get(9));
    }

    @Test
    void testClear() {
        statistics.record("a", OperationType.HOME, 1, Outcome.SUCCESS, false);
        statistics.recordError("a", "x");

        statistics.clear();

        assertEquals(0, statistics.getTotalCalls());
        assertTrue(statistics.getAllSites().isEmpty());
        assertTrue(statistics.getRecentErrors("a").isEmpty());
    }
}
