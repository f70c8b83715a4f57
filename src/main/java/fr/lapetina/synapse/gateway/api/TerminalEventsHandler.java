package fr.lapetina.synapse.gateway.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import fr.lapetina.synapse.gateway.domain.model.LogLevel;
import fr.lapetina.synapse.gateway.domain.model.TerminalEvent;
import fr.lapetina.synapse.gateway.feed.FeedQuery;
import fr.lapetina.synapse.gateway.feed.FeedSubscription;
import fr.lapetina.synapse.gateway.feed.TerminalFeed;
import fr.lapetina.synapse.gateway.infrastructure.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-Sent Events view of the terminal feed.
 *
 * GET /events/terminal streams a {@code meta} event, the matching backlog as {@code log}
 * events, then live {@code log} events, with a {@code : keepalive} comment after each idle
 * period. A stream ended by the gateway flushes the lines still queued and closes with a
 * {@code : closed reason=...} comment. Query parameters: {@code sources} (comma separated),
 * {@code level} (minimum level) and {@code backlog} (1 to 500 lines).
 * GET /events/terminal/stats returns the feed counters.
 */
final class TerminalEventsHandler extends GatewayHandler {

    private static final Logger log = LoggerFactory.getLogger(TerminalEventsHandler.class);

    static final String PATH = "/events/terminal";
    static final int MAX_BACKLOG = 500;
    static final int MIN_KEEPALIVE_SECONDS = 5;

    private final TerminalFeed feed;
    private final GatewayConfig.TerminalFeedConfig config;
    private final String busMode;

    TerminalEventsHandler(ObjectMapper objectMapper, TerminalFeed feed,
                          GatewayConfig.TerminalFeedConfig config, String busMode) {
        super(objectMapper);
        this.feed = feed;
        this.config = config;
        this.busMode = busMode;
    }

    @Override
    protected void doHandle(HttpExchange exchange) throws Exception {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        String path = exchange.getRequestURI().getPath();
        if (feed == null || !config.isLive()) {
            HttpExchanges.sendError(exchange, objectMapper, 404, "Terminal feed disabled");
            return;
        }
        if (path.equals(PATH + "/stats")) {
            HttpExchanges.sendJson(exchange, objectMapper, 200, feed.stats());
        } else if (path.equals(PATH) || path.equals(PATH + "/")) {
            stream(exchange);
        } else {
            HttpExchanges.sendError(exchange, objectMapper, 404, "Not Found");
        }
    }

    private void stream(HttpExchange exchange) throws IOException {
        FeedQuery query = parseQuery(HttpExchanges.queryParams(exchange));
        long keepaliveMs = Duration.ofSeconds(Math.max(MIN_KEEPALIVE_SECONDS, config.getKeepaliveSeconds())).toMillis();

        FeedSubscription subscription = feed.subscribe(query);
        try {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache, no-transform");
            exchange.getResponseHeaders().set("X-Accel-Buffering", "no");
            exchange.sendResponseHeaders(200, 0);
            OutputStream out = exchange.getResponseBody();

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("instance", feed.getInstanceId());
            meta.put("mode", config.getMode());
            meta.put("bus_mode", busMode);
            writeEvent(out, "meta", meta);
            for (TerminalEvent event : subscription.getBacklog()) {
                writeEvent(out, "log", event);
            }
            out.flush();

            long lastWrite = System.currentTimeMillis();
            while (!subscription.isClosed()) {
                long idle = System.currentTimeMillis() - lastWrite;
                TerminalEvent event = subscription.poll(Duration.ofMillis(Math.max(1, keepaliveMs - idle)));
                if (event != null) {
                    if (query.matches(event)) {
                        writeEvent(out, "log", event);
                        out.flush();
                        lastWrite = System.currentTimeMillis();
                    }
                } else if (System.currentTimeMillis() - lastWrite >= keepaliveMs) {
                    out.write(": keepalive\n\n".getBytes(StandardCharsets.UTF_8));
                    out.flush();
                    lastWrite = System.currentTimeMillis();
                }
            }
            finish(out, subscription, query);
        } catch (IOException e) {
            log.debug("Terminal stream closed by client: subscriber={}, error={}", subscription.getId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            feed.unsubscribe(subscription);
        }
    }

    /**
     * Writes what the subscription still held when it was closed, then a comment naming
     * the close reason so the reader can tell a detach from a dropped connection.
     */
    void finish(OutputStream out, FeedSubscription subscription, FeedQuery query) throws IOException {
        List<TerminalEvent> remaining = subscription.drain();
        for (TerminalEvent event : remaining) {
            if (query.matches(event)) {
                writeEvent(out, "log", event);
            }
        }
        FeedSubscription.CloseReason reason = subscription.getCloseReason();
        String wireReason = reason != null ? reason.getWireValue() : "closed";
        out.write((": closed reason=" + wireReason + "\n\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
        log.debug("Terminal stream finished: subscriber={}, reason={}, flushed={}",
                subscription.getId(), wireReason, remaining.size());
    }

    FeedQuery parseQuery(Map<String, String> params) {
        LogLevel defaultLevel = LogLevel.parse(config.getDefaultLevel(), LogLevel.INFO);
        LogLevel level = LogLevel.parse(params.get("level"), defaultLevel);
        int backlog = config.getBacklogLines();
        String rawBacklog = params.get("backlog");
        if (rawBacklog != null && !rawBacklog.isBlank()) {
            try {
                backlog = Integer.parseInt(rawBacklog.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring invalid backlog parameter: value={}", rawBacklog);
            }
        }
        backlog = Math.max(1, Math.min(MAX_BACKLOG, backlog));
        return new FeedQuery(backlog, level, FeedQuery.parseSources(params.get("sources")));
    }

    private void writeEvent(OutputStream out, String type, Object data) throws IOException {
        String frame = "event: " + type + "\ndata: " + objectMapper.writeValueAsString(data) + "\n\n";
        out.write(frame.getBytes(StandardCharsets.UTF_8));
    }
}
