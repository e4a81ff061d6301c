package com.spiderhub.core.config;

import com.spiderhub.common.error.ConfigException;
import com.spiderhub.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigValidator
 */
class ConfigValidatorTest extends TestBase {

    private final ConfigValidator validator = new ConfigValidator();

    private static long count(List<ConfigValidator.ValidationError> errors, String severity) {
        return errors.stream().filter(e -> e.severity.equals(severity)).count();
    }

    @Test
    void testDefaultsAreValid() {
        List<ConfigValidator.ValidationError> errors = validator.validate(new EngineConfig());

        assertTrue(errors.isEmpty(), "Defaults should validate cleanly: " + errors);
        assertDoesNotThrow(() -> validator.validateAndReport(new EngineConfig()));
    }

    @Test
    void testErrorsAreCounted() {
        EngineConfig config = new EngineConfig();
        config.defaultTimeoutMs = 0;
        config.perSiteConcurrency = 0;
        config.errorRateThreshold = 1.5;
        config.retryBaseDelayMs = 5000;
        config.retryMaxDelayMs = 100;

        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        assertEquals(4, count(errors, "ERROR"), "Errors: " + errors);
        ConfigException e = assertThrows(ConfigException.class, () -> validator.validateAndReport(config));
        assertTrue(e.getMessage().contains("4 error(s)"));
    }

    @Test
    void testWarningsDoNotFail() {
        EngineConfig config = new EngineConfig();
        config.queryDeadlineMs = 1000;
        config.maxRetries = 8;
        config.quickTimeoutFactor = 2.0;
        config.healthMinSamples = 50;
        config.cacheTtlSeconds.put("search", 0L);

        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        assertEquals(0, count(errors, "ERROR"));
        assertEquals(5, count(errors, "WARNING"), "Warnings: " + errors);
        assertDoesNotThrow(() -> validator.validateAndReport(config));
    }

    @Test
    void testZeroPlayerTtlIsAllowed() {
        EngineConfig config = new EngineConfig();
        config.cacheTtlSeconds.put("player", 0L);

        assertTrue(validator.validate(config).isEmpty());
    }

    @Test
    void testDiskPathRequiredOnlyWhenDiskEnabled() {
        EngineConfig config = new EngineConfig();
        config.diskCachePath = " ";
        assertEquals(1, count(validator.validate(config), "ERROR"));

        config.diskCacheEnabled = false;
        assertTrue(validator.validate(config).isEmpty());
    }

    @Test
    void testDisabledCacheSkipsCacheChecks() {
        EngineConfig config = new EngineConfig();
        config.cacheEnabled = false;
        config.memoryCacheMaxEntries = 0;

        assertTrue(validator.validate(config).isEmpty());
    }
}
