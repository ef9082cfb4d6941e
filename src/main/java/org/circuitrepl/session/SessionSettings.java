package org.circuitrepl.session;

import com.typesafe.config.Config;

import java.time.Duration;

/**
 * Session settings read from the {@code circuitrepl.session} and {@code circuitrepl.completion} blocks.
 */
public record SessionSettings(Duration commandTimeout,
                              Duration sweepInterval,
                              int historySize,
                              SessionMode mode,
                              Duration completionTimeout,
                              boolean hardwareMonitoring) {

    public static SessionSettings fromConfig(final Config root) {
        final Config session = root.getConfig("circuitrepl.session");
        return new SessionSettings(
                session.getDuration("command-timeout"),
                session.getDuration("sweep-interval"),
                session.getInt("history-size"),
                SessionMode.parse(session.getString("mode")),
                root.getDuration("circuitrepl.completion.timeout"),
                root.getBoolean("circuitrepl.worker.hardware-monitoring"));
    }

    public SessionSettings withMode(final SessionMode newMode) {
        return new SessionSettings(commandTimeout, sweepInterval, historySize, newMode, completionTimeout,
                hardwareMonitoring);
    }
}
