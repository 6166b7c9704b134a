package io.toolhub.server.error;

import io.toolhub.core.error.ErrorReport;
import io.toolhub.core.error.ErrorReporter;
import io.toolhub.core.error.ErrorSeverity;
import io.toolhub.server.validation.LogSanitizer;
import org.jboss.logging.Logger;

/// Default {@link ErrorReporter}: writes each report to the log.
///
/// Severity maps to level: LOW to DEBUG, MEDIUM to WARN, HIGH and CRITICAL to ERROR.
/// The cause's stack trace is attached only at ERROR level; otherwise just its message
/// is logged.
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.toolhub.server.error.LoggingErrorReporter`.
/// @implNote Thread-safe. Stateless.
public class LoggingErrorReporter implements ErrorReporter {

    private static final Logger LOG = Logger.getLogger(LoggingErrorReporter.class);

    @Override
    public void report(ErrorReport report) {
        Logger.Level level = levelFor(report.severity());
        if (!LOG.isEnabled(level)) {
            return;
        }
        String server = report.serverId() != null ? report.serverId() : "-";
        String message = LogSanitizer.sanitize(report.message());
        if (level == Logger.Level.ERROR && report.cause() != null) {
            LOG.logv(
                    level,
                    report.cause(),
                    "[{0}/{1}] server={2} recoverable={3}: {4}",
                    report.category(),
                    report.severity(),
                    LogSanitizer.sanitize(server),
                    report.recoverable(),
                    message);
        } else {
            LOG.logv(
                    level,
                    "[{0}/{1}] server={2} recoverable={3}: {4}",
                    report.category(),
                    report.severity(),
                    LogSanitizer.sanitize(server),
                    report.recoverable(),
                    message);
        }
    }

    static Logger.Level levelFor(ErrorSeverity severity) {
        return switch (severity) {
            case LOW -> Logger.Level.DEBUG;
            case MEDIUM -> Logger.Level.WARN;
            case HIGH, CRITICAL -> Logger.Level.ERROR;
        };
    }
}
