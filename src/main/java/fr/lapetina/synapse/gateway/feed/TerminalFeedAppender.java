package fr.lapetina.synapse.gateway.feed;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.AppenderBase;
import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logback appender copying INFO and above into the terminal feed.
 * Attached programmatically once the feed exists.
 */
public final class TerminalFeedAppender extends AppenderBase<ILoggingEvent> {

    static final String NAME = "TERMINAL_FEED";

    // Guards against a log statement issued while publishing re-entering the appender
    private static final ThreadLocal<Boolean> PUBLISHING = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final TerminalFeed feed;

    public TerminalFeedAppender(TerminalFeed feed) {
        this.feed = feed;
        setName(NAME);
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (!event.getLevel().isGreaterOrEqual(Level.INFO) || PUBLISHING.get()) {
            return;
        }
        PUBLISHING.set(Boolean.TRUE);
        try {
            feed.publish(event.getLoggerName(), toLogLevel(event.getLevel()), render(event));
        } finally {
            PUBLISHING.set(Boolean.FALSE);
        }
    }

    static LogLevel toLogLevel(Level level) {
        if (level.isGreaterOrEqual(Level.ERROR)) {
            return LogLevel.ERROR;
        }
        if (level.isGreaterOrEqual(Level.WARN)) {
            return LogLevel.WARNING;
        }
        if (level.isGreaterOrEqual(Level.INFO)) {
            return LogLevel.INFO;
        }
        return LogLevel.DEBUG;
    }

    private static String render(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable == null) {
            return message;
        }
        return message + " | " + throwable.getClassName() + ": " + throwable.getMessage();
    }

    /**
     * Adds an appender for the feed to the root logger, replacing any previous one.
     *
     * @return the started appender, or null when Logback is not the bound SLF4J backend
     */
    public static TerminalFeedAppender attach(TerminalFeed feed) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            LoggerFactory.getLogger(TerminalFeedAppender.class)
                    .warn("Logback not bound, terminal log capture disabled: factory={}", factory.getClass().getName());
            return null;
        }
        LoggerContext context = (LoggerContext) factory;
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        detach();

        TerminalFeedAppender appender = new TerminalFeedAppender(feed);
        appender.setContext(context);
        appender.start();
        root.addAppender(appender);
        return appender;
    }

    public static void detach() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ch.qos.logback.classic.Logger root = ((LoggerContext) factory).getLogger(Logger.ROOT_LOGGER_NAME);
            root.detachAppender(NAME);
        }
    }
}
