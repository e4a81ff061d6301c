package com.spiderhub.core.config;

import com.spiderhub.common.error.ConfigException;
import com.spiderhub.common.model.OperationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an {@link EngineConfig} before the engine starts.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(EngineConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateTimeouts(config, errors);
        validateRetry(config, errors);
        validateHealth(config, errors);
        validateCache(config, errors);

        return errors;
    }

    private void validateTimeouts(EngineConfig config, List<ValidationError> errors) {
        if (config.defaultTimeoutMs <= 0) {
            errors.add(new ValidationError("defaultTimeoutMs must be positive", "ERROR"));
        }
        if (config.queryDeadlineMs <= 0) {
            errors.add(new ValidationError("queryDeadlineMs must be positive", "ERROR"));
        } else if (config.queryDeadlineMs < config.defaultTimeoutMs) {
            errors.add(new ValidationError(String.format(
                    "queryDeadlineMs (%d) is shorter than defaultTimeoutMs (%d) - slow sites will always be cut off",
                    config.queryDeadlineMs, config.defaultTimeoutMs), "WARNING"));
        }
        if (config.hookTimeoutMs <= 0) {
            errors.add(new ValidationError("hookTimeoutMs must be positive", "ERROR"));
        }
        if (config.perSiteConcurrency < 1) {
            errors.add(new ValidationError("perSiteConcurrency must be at least 1", "ERROR"));
        }
        if (config.quickTimeoutFactor <= 0 || config.quickTimeoutFactor > 1) {
            errors.add(new ValidationError("quickTimeoutFactor should be in (0, 1]", "WARNING"));
        }
        if (config.degradedTimeoutFactor <= 0 || config.degradedTimeoutFactor > 1) {
            errors.add(new ValidationError("degradedTimeoutFactor should be in (0, 1]", "WARNING"));
        }
    }

    private void validateRetry(EngineConfig config, List<ValidationError> errors) {
        if (config.maxRetries < 0) {
            errors.add(new ValidationError("maxRetries must not be negative", "ERROR"));
        } else if (config.maxRetries > 5) {
            errors.add(new ValidationError("maxRetries > 5 multiplies load on failing upstreams", "WARNING"));
        }
        if (config.retryBaseDelayMs < 0 || config.retryMaxDelayMs < config.retryBaseDelayMs) {
            errors.add(new ValidationError("retry delays must satisfy 0 <= retryBaseDelayMs <= retryMaxDelayMs", "ERROR"));
        }
    }

    private void validateHealth(EngineConfig config, List<ValidationError> errors) {
        if (config.errorRateThreshold <= 0 || config.errorRateThreshold >= 1) {
            errors.add(new ValidationError("errorRateThreshold must be between 0 and 1", "ERROR"));
        }
        if (config.healthMinSamples > config.healthWindow) {
            errors.add(new ValidationError("healthMinSamples is larger than healthWindow - sites never degrade", "WARNING"));
        }
    }

    private void validateCache(EngineConfig config, List<ValidationError> errors) {
        if (!config.cacheEnabled) return;
        if (config.memoryCacheMaxEntries <= 0 || config.memoryCacheMaxBytes <= 0) {
            errors.add(new ValidationError("memory cache limits must be positive", "ERROR"));
        }
        if (config.diskCacheEnabled && (config.diskCachePath == null || config.diskCachePath.isBlank())) {
            errors.add(new ValidationError("diskCacheEnabled but diskCachePath is empty", "ERROR"));
        }
        if (config.diskCacheEnabled && config.diskCacheMaxEntries <= 0) {
            errors.add(new ValidationError("diskCacheMaxEntries must be positive", "ERROR"));
        }
        if (config.diskCachePurgeIntervalMs < 0) {
            errors.add(new ValidationError("diskCachePurgeIntervalMs cannot be negative", "ERROR"));
        }
        for (OperationType type : OperationType.values()) {
            if (config.getTtlMs(type) == 0 && type != OperationType.PLAYER) {
                errors.add(new ValidationError("cache TTL for " + type.key() + " is 0 - results will never be cached", "WARNING"));
            }
        }
    }

    /**
     * Validate and report to the log.
     *
     * @throws ConfigException if any ERROR-level problem was found
     */
    public void validateAndReport(EngineConfig config) throws ConfigException {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new ConfigException(
                    String.format("Engine configuration invalid: %d error(s)", errorCount));
        }
    }
}
