package org.edgeweave.junit.extensions.logging;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a WARN or ERROR log line a test is expected to produce. Without it, such lines fail
 * the test under {@link LogWatchExtension}. Every declared line must occur at least once.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(ExpectLogs.class)
public @interface ExpectLog {

    LogLevel level();

    /**
     * Regular expression the whole formatted message must match.
     *
     * @return the pattern.
     */
    String messagePattern();
}
