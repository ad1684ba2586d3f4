package work.labinv.sp.config;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link LogLevel} to the Logback root logger at runtime.
 */
public final class LoggingSetup {
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingSetup.class);

    private LoggingSetup() {}

    public static void apply(LogLevel level) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.debug("Logback is not the active SLF4J binding; leaving log levels untouched");
            return;
        }
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(level.logbackLevel());
        LOG.debug("Root log level set to {}", level);
    }
}
