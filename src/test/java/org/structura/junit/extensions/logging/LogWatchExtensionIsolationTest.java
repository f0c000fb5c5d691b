package org.structura.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.structura.junit.extensions.logging.LogLevel.ERROR;
import static org.structura.junit.extensions.logging.LogLevel.INFO;
import static org.structura.junit.extensions.logging.LogLevel.WARN;

/**
 * Checks that rules and captured events of one test never reach another test of the same class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionIsolationTest {

    private static final Logger LOG = LoggerFactory.getLogger(LogWatchExtensionIsolationTest.class);
    private static final String SELF = "org\\.structura\\.junit\\.extensions\\.logging\\.LogWatchExtensionIsolationTest";

    @Test
    @ExpectLog(level = ERROR, loggerPattern = SELF, messagePattern = "first: expected error")
    void expectedErrorIsConsumed() {
        LOG.info("first: ignored info");
        LOG.error("first: expected error");
    }

    @Test
    @ExpectLog(level = WARN, loggerPattern = SELF, messagePattern = "second: expected warning")
    void previousErrorDoesNotLeak() {
        LOG.warn("second: expected warning");
    }

    @Test
    @AllowLog(level = WARN, loggerPattern = SELF, messagePattern = "third: .*")
    void allowedWarningsNeedNotAppear() {
        LOG.info("third: nothing to see");
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "fourth: repeated", occurrences = 3)
    void occurrencesAreCountedPerTest() {
        LOG.warn("fourth: repeated");
        LOG.warn("fourth: repeated");
        LOG.warn("fourth: repeated");
    }

    @Test
    void infoAndDebugNeverFail() {
        LOG.info("fifth: only info");
        LOG.debug("fifth: debug");
    }

    @Test
    @ExpectLog(level = INFO, loggerPattern = SELF, messagePattern = "sixth: milestone \\d+")
    void infoExpectationsAreCaptured() {
        LOG.info("sixth: milestone {}", 42);
    }

    @Test
    @FailOnLog(disabled = true)
    void disabledWatchToleratesWarnings() {
        LOG.warn("seventh: tolerated");
    }
}
