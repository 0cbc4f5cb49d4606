package org.yafcp.config;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Installs the console log format used by every component:
 * {@code [HH:mm:ss] [source class and method] [LEVEL] - message}.
 */
public final class LoggingSetup {

    public static final String LOG_FORMAT = "[%1$tT] [%2$s] [%4$s] - %5$s%6$s%n";

    private static volatile boolean installed = false;

    private LoggingSetup() {
    }

    public static synchronized void install(Level level) {
        if (installed) return;
        // SimpleFormatter reads the format once, on first use
        System.setProperty("java.util.logging.SimpleFormatter.format", LOG_FORMAT);
        Logger rootLogger = Logger.getLogger("");
        for (Handler h : rootLogger.getHandlers()) {
            if (h instanceof ConsoleHandler) {
                rootLogger.removeHandler(h);
            }
        }
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        rootLogger.addHandler(handler);
        rootLogger.setLevel(level);
        installed = true;
    }
}
