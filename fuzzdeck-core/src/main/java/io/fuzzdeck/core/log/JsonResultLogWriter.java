package io.fuzzdeck.core.log;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fuzzdeck.api.log.ResultLogWriter;
import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.session.SessionToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends result records to a JSON-lines file, one object per line.
 * Payload bytes are written base64-encoded. Write failures are logged, never thrown.
 */
public class JsonResultLogWriter implements ResultLogWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonResultLogWriter.class);

    private final Path logFilePath;
    private final ObjectMapper objectMapper;
    private BufferedWriter streamWriter;

    public JsonResultLogWriter(String logFilePath) {
        this(Path.of(logFilePath));
    }

    public JsonResultLogWriter(Path logFilePath) {
        this.logFilePath = logFilePath;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(SessionToken token, ResultRecord record) {
        try {
            if (streamWriter == null) {
                streamWriter = Files.newBufferedWriter(logFilePath,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                log.info("Logging results to: {}", logFilePath.toAbsolutePath());
            }
            streamWriter.write(objectMapper.writeValueAsString(new LogLine(token.value(), record)));
            streamWriter.newLine();
            streamWriter.flush();
        } catch (IOException e) {
            log.error("Failed to append result {} to {}", record.uuid(), logFilePath, e);
        }
    }

    @Override
    public synchronized void close() {
        if (streamWriter != null) {
            try {
                streamWriter.close();
            } catch (IOException e) {
                log.error("Failed to close result log {}", logFilePath, e);
            }
            streamWriter = null;
        }
    }

    public Path path() {
        return logFilePath;
    }

    record LogLine(String token, ResultRecord result) {}
}
