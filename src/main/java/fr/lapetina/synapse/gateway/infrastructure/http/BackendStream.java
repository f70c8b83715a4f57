package fr.lapetina.synapse.gateway.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Open upstream response whose body has not been read yet.
 * Closing it releases the upstream connection.
 */
public final class BackendStream implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BackendStream.class);
    private static final int CHUNK_SIZE = 8192;

    private final String backendName;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final InputStream body;

    public BackendStream(String backendName, int statusCode, Map<String, List<String>> headers, InputStream body) {
        this.backendName = backendName;
        this.statusCode = statusCode;
        this.headers = headers != null ? headers : Map.of();
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public String contentType() {
        return header("Content-Type").orElse("application/octet-stream");
    }

    public InputStream body() {
        return body;
    }

    /**
     * Copies the body to the client as chunks arrive, flushing after each one.
     * Stops at the first failed write and lets the exception propagate so the caller
     * can close this stream.
     *
     * @return number of bytes relayed
     */
    public long relayTo(OutputStream out) throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0;
        int read;
        while ((read = body.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            out.flush();
            total += read;
        }
        return total;
    }

    /**
     * Reads the remaining body fully. Used for error statuses, which are not relayed chunk by chunk.
     */
    public byte[] readAll() throws IOException {
        return body.readAllBytes();
    }

    @Override
    public void close() {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Closing upstream stream failed: backend={}, error={}", backendName, e.getMessage());
        }
    }
}
