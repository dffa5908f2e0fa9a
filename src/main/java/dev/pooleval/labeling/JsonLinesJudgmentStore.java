package dev.pooleval.labeling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.RelevanceJudgment;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only JSON Lines journal of judgments.
 *
 * <p>Every {@link #save} appends one line and flushes it, so a process that dies mid-run keeps
 * every judgment that settled before the crash. Opening an existing journal replays it with
 * last-write-wins per key; a torn final line is logged and ignored.
 */
public class JsonLinesJudgmentStore implements JudgmentStore, Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesJudgmentStore.class);

    private final Path journal;
    private final ObjectMapper objectMapper;
    private final ConcurrentSkipListMap<DocumentKey, RelevanceJudgment> judgments =
            new ConcurrentSkipListMap<>();
    private final BufferedWriter writer;

    JsonLinesJudgmentStore(Path journal, ObjectMapper objectMapper) throws IOException {
        this.journal = journal;
        this.objectMapper = objectMapper;
        replay();
        Path parent = journal.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(journal, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        if (endsWithTornLine()) {
            writer.newLine();
            writer.flush();
        }
    }

    private boolean endsWithTornLine() throws IOException {
        if (!Files.exists(journal) || Files.size(journal) == 0) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(journal, StandardOpenOption.READ)) {
            channel.position(channel.size() - 1);
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }

    /**
     * Open (or create) the journal at {@code journal} and load the judgments it already holds.
     *
     * @throws IOException if the journal cannot be read or opened for appending
     */
    public static JsonLinesJudgmentStore open(Path journal) throws IOException {
        ObjectMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        return new JsonLinesJudgmentStore(journal, mapper);
    }

    private void replay() throws IOException {
        if (!Files.exists(journal)) {
            return;
        }
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(journal, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    RelevanceJudgment judgment = objectMapper.readValue(line, RelevanceJudgment.class);
                    judgments.put(judgment.key(), judgment);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    log.warn("Ignoring unreadable journal line {} in {}: {}",
                            lineNumber, journal, e.getMessage());
                }
            }
        }
        log.info("Loaded {} judgments from {}", judgments.size(), journal);
    }

    @Override
    public Optional<RelevanceJudgment> find(DocumentKey key) {
        return Optional.ofNullable(judgments.get(key));
    }

    @Override
    public synchronized void save(RelevanceJudgment judgment) {
        try {
            writer.write(objectMapper.writeValueAsString(judgment));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append judgment to " + journal, e);
        }
        judgments.put(judgment.key(), judgment);
    }

    @Override
    public List<RelevanceJudgment> findAll() {
        return List.copyOf(judgments.values());
    }

    public Path journal() {
        return journal;
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
