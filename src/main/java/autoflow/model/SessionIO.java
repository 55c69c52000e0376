package autoflow.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link SessionTimeline} objects in their canonical JSON form.
 * Shares the ObjectMapper configuration of {@link WorkflowIO}.
 */
public class SessionIO {

    private static final Logger log = LoggerFactory.getLogger(SessionIO.class);

    private SessionIO() {}

    /**
     * Reads a session from a JSON file.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static SessionTimeline read(Path path) throws IOException {
        log.debug("Reading session from: {}", path);
        SessionTimeline session = mapper().readValue(Files.readString(path), SessionTimeline.class);
        log.info("Loaded session '{}' with {} events from {}", session.getSessionId(),
                session.getEventCount(), path);
        return session;
    }

    /** Writes a session to a JSON file (pretty-printed). Parent directories are created. */
    public static void write(SessionTimeline session, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        mapper().writeValue(path.toFile(), session);
        log.info("Wrote session '{}' ({} events) to {}", session.getSessionId(),
                session.getEventCount(), path);
    }

    public static String toJson(SessionTimeline session) throws IOException {
        return mapper().writeValueAsString(session);
    }

    public static SessionTimeline fromJson(String json) throws IOException {
        return mapper().readValue(json, SessionTimeline.class);
    }

    private static ObjectMapper mapper() {
        return WorkflowIO.getMapper();
    }
}
