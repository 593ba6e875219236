package org.prebid.mobileads.log;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.spi.ExtendedLogger;

public class Logger {

    private static final String FQCN = Logger.class.getCanonicalName();

    private final ExtendedLogger delegate;

    Logger(ExtendedLogger delegate) {
        this.delegate = delegate;
    }

    public void warn(Object message) {
        log(Level.WARN, message, null);
    }

    public void warn(Object message, Object... params) {
        log(Level.WARN, message.toString(), params);
    }

    public void info(Object message, Object... params) {
        log(Level.INFO, message.toString(), params);
    }

    public void debug(Object message) {
        log(Level.DEBUG, message, null);
    }

    public void debug(Object message, Object... params) {
        log(Level.DEBUG, message.toString(), params);
    }

    private void log(Level level, Object message, Throwable t) {
        delegate.logIfEnabled(FQCN, level, null, message, t);
    }

    private void log(Level level, String message, Object... params) {
        delegate.logIfEnabled(FQCN, level, null, message, params);
    }
}
