package fr.lapetina.synapse.gateway.feed;

import ch.qos.logback.classic.Level;
import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TerminalFeedAppenderTest {

    private static final String SOURCE = "fr.lapetina.synapse.gateway.feed.AppenderProbe";

    private TerminalFeed feed;

    @BeforeEach
    void setUp() {
        feed = TerminalFeed.builder().instanceId("gw-test").build();
        feed.start();
    }

    @AfterEach
    void tearDown() {
        TerminalFeedAppender.detach();
        feed.close();
    }

    private List<TerminalEvent> captured() {
        return feed.backlog(new FeedQuery(50, LogLevel.DEBUG, Set.of(SOURCE)));
    }

    @Test
    @DisplayName("should copy INFO and above from the root logger into the feed")
    void shouldCaptureLogs() {
        assertThat(TerminalFeedAppender.attach(feed)).isNotNull();
        Logger logger = LoggerFactory.getLogger(SOURCE);

        logger.debug("too quiet");
        logger.info("Backend registered: name={}", "tts");
        logger.warn("Request failed", new IllegalStateException("socket closed"));

        List<TerminalEvent> events = captured();
        assertThat(events).extracting(TerminalEvent::message).containsExactly(
                "Backend registered: name=tts",
                "Request failed | java.lang.IllegalStateException: socket closed");
        assertThat(events).extracting(TerminalEvent::level).containsExactly(LogLevel.INFO, LogLevel.WARNING);
    }

    @Test
    @DisplayName("should stop capturing once detached")
    void shouldDetach() {
        TerminalFeedAppender.attach(feed);
        TerminalFeedAppender.detach();

        LoggerFactory.getLogger(SOURCE).error("not captured");

        assertThat(captured()).isEmpty();
    }

    @Test
    @DisplayName("should map logback levels onto feed levels")
    void shouldMapLevels() {
        assertThat(TerminalFeedAppender.toLogLevel(Level.ERROR)).isEqualTo(LogLevel.ERROR);
        assertThat(TerminalFeedAppender.toLogLevel(Level.WARN)).isEqualTo(LogLevel.WARNING);
        assertThat(TerminalFeedAppender.toLogLevel(Level.INFO)).isEqualTo(LogLevel.INFO);
        assertThat(TerminalFeedAppender.toLogLevel(Level.TRACE)).isEqualTo(LogLevel.DEBUG);
    }
}
