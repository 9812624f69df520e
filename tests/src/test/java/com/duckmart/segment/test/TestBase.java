package com.duckmart.segment.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for segmentation tests.
 *
 * <p>Logs test boundaries and offers Given/When/Then step logging.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;
    private long startNanos;

    @BeforeEach
    void logTestStart(TestInfo info) {
        testName = info.getDisplayName();
        startNanos = System.nanoTime();
        logger.debug(">>> {}", testName);
    }

    @AfterEach
    void logTestEnd() {
        logger.debug("<<< {} ({} ms)", testName, (System.nanoTime() - startNanos) / 1_000_000);
    }

    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}
