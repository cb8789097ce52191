package ai.lineage.corpus;

import ai.lineage.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * Reads a corpus from a JSON file: either an array of task objects or an object with a {@code tasks} array. Records
 * without a {@code taskId}, or whose fields cannot be read, are skipped with a warning.
 */
public final class JsonTaskCorpusLoader implements TaskCorpusLoader {
    private static final Logger logger = LogManager.getLogger(JsonTaskCorpusLoader.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonTaskCorpusLoader(Path file) {
        this(file, Json.MAPPER);
    }

    public JsonTaskCorpusLoader(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    @Blocking
    public TaskCorpus load() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Corpus file not found: " + file);
        }

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed corpus file " + file + ": " + e.getOriginalMessage(), e);
        }

        var tasksNode = root != null && root.isObject() ? root.get("tasks") : root;
        if (tasksNode == null || !tasksNode.isArray()) {
            throw new IOException("Corpus file " + file + " must contain an array of tasks or a 'tasks' array");
        }

        var records = new ArrayList<TaskRecord>();
        int position = 0;
        for (var node : tasksNode) {
            position++;
            var idNode = node.get("taskId");
            if (!node.isObject() || idNode == null || !idNode.isTextual() || idNode.asText().isBlank()) {
                logger.warn("Skipping entry #{} of {}: no taskId", position, file.getFileName());
                continue;
            }
            try {
                records.add(mapper.treeToValue(node, TaskRecord.class));
            } catch (JsonProcessingException e) {
                logger.warn(
                        "Skipping task {} in {}: {}", idNode.asText(), file.getFileName(), e.getOriginalMessage());
            }
        }

        logger.info("Loaded {} task(s) from {}", records.size(), file);
        return TaskCorpus.of(records);
    }

    @Override
    public String describe() {
        return file.toString();
    }
}
