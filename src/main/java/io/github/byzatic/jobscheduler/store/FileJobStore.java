package io.github.byzatic.jobscheduler.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobscheduler.base_exceptions.StoreException;
import io.github.byzatic.jobscheduler.job.Job;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Job set as a pretty-printed JSON array in a single file.
 * A missing file loads as an empty set. Writes go to a sibling temp file that is then moved into place.
 */
@ThreadSafe
public final class FileJobStore implements JobStore {
    private final static Logger logger = LoggerFactory.getLogger(FileJobStore.class);

    private final Path path;
    private final ObjectMapper mapper;

    public FileJobStore(@NotNull Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public @NotNull Path path() {
        return path;
    }

    @Override
    public synchronized @NotNull List<Job> load() throws StoreException {
        if (!Files.exists(path)) {
            logger.debug("No job file at {}, starting with an empty job set", path);
            return List.of();
        }
        try {
            String json = Files.readString(path);
            if (json.isBlank()) return List.of();
            List<Job> jobs = mapper.readValue(json, new TypeReference<List<Job>>() {
            });
            logger.debug("Loaded {} job(s) from {}", jobs.size(), path);
            return jobs;
        } catch (IOException e) {
            throw new StoreException("Can't load jobs from " + path, e);
        }
    }

    @Override
    public synchronized void save(@NotNull List<Job> jobs) throws StoreException {
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs);
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, json + System.lineSeparator());
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.trace("Saved {} job(s) to {}", jobs.size(), path);
        } catch (IOException e) {
            throw new StoreException("Can't save jobs to " + path, e);
        }
    }
}
