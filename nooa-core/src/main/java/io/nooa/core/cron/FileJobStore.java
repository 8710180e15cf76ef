package io.nooa.core.cron;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class FileJobStore implements JobStore {
    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileJobStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized JobRecord create(JobSpec spec) throws IOException {
        Document document = load();
        if (find(document.jobs(), spec.name()).isPresent()) {
            throw new JobConflictException(spec.name());
        }
        JobRecord record = JobRecord.create(UUID.randomUUID().toString(), spec, clock.instant());
        List<JobRecord> jobs = new ArrayList<>(document.jobs());
        jobs.add(record);
        save(new Document(jobs, document.logs()));
        return record;
    }

    @Override
    public synchronized Optional<JobRecord> get(String name) throws IOException {
        return find(load().jobs(), name);
    }

    @Override
    public synchronized List<JobRecord> list() throws IOException {
        List<JobRecord> jobs = new ArrayList<>(load().jobs());
        // Insertion order breaks ties between jobs created within the same instant.
        Collections.reverse(jobs);
        jobs.sort(Comparator.comparing(JobRecord::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return jobs;
    }

    @Override
    public synchronized boolean remove(String name) throws IOException {
        Document document = load();
        Optional<JobRecord> existing = find(document.jobs(), name);
        if (existing.isEmpty()) {
            return false;
        }
        String jobId = existing.get().id();
        List<JobRecord> jobs = new ArrayList<>(document.jobs());
        jobs.removeIf(job -> job.id().equals(jobId));
        List<ExecutionLogEntry> logs = new ArrayList<>(document.logs());
        logs.removeIf(log -> jobId.equals(log.jobId()));
        save(new Document(jobs, logs));
        return true;
    }

    @Override
    public boolean setEnabled(String name, boolean enabled) throws IOException {
        return update(name, JobUpdate.enabled(enabled));
    }

    @Override
    public synchronized boolean update(String name, JobUpdate update) throws IOException {
        Document document = load();
        List<JobRecord> jobs = new ArrayList<>(document.jobs());
        for (int i = 0; i < jobs.size(); i++) {
            JobRecord job = jobs.get(i);
            if (job.name().equals(name)) {
                jobs.set(i, job.merge(update, clock.instant()));
                save(new Document(jobs, document.logs()));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized ExecutionLogEntry appendLog(String jobId, ExecutionLogEntry entry) throws IOException {
        Document document = load();
        JobRecord job = document.jobs().stream()
            .filter(candidate -> candidate.id().equals(jobId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown job id: " + jobId));
        ExecutionLogEntry stored = new ExecutionLogEntry(
            entry.id() == null ? UUID.randomUUID().toString() : entry.id(),
            jobId,
            job.name(),
            entry.status(),
            entry.startedAt(),
            entry.finishedAt(),
            entry.durationMs(),
            entry.output(),
            entry.error(),
            entry.createdAt() == null ? clock.instant() : entry.createdAt()
        );
        List<ExecutionLogEntry> logs = new ArrayList<>(document.logs());
        logs.add(stored);
        save(new Document(document.jobs(), logs));
        return stored;
    }

    @Override
    public synchronized List<ExecutionLogEntry> listLogs(String jobName, int limit, Instant since) throws IOException {
        List<ExecutionLogEntry> matching = new ArrayList<>();
        for (ExecutionLogEntry log : load().logs()) {
            if (jobName.equals(log.jobName())) {
                matching.add(log);
            }
        }
        Collections.reverse(matching);
        return matching.stream()
            .sorted(Comparator.comparing(ExecutionLogEntry::startedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .filter(log -> since == null || (log.startedAt() != null && !log.startedAt().isBefore(since)))
            .limit(Math.max(1, limit))
            .toList();
    }

    private Optional<JobRecord> find(List<JobRecord> jobs, String name) {
        return jobs.stream().filter(job -> job.name().equals(name)).findFirst();
    }

    private Document load() throws IOException {
        if (!Files.exists(path)) {
            return Document.empty();
        }
        String content = Files.readString(path);
        if (content.isBlank()) {
            return Document.empty();
        }
        Document document = mapper.readValue(content, Document.class);
        return new Document(
            document.jobs() == null ? List.of() : document.jobs(),
            document.logs() == null ? List.of() : document.logs()
        );
    }

    private void save(Document document) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(List<JobRecord> jobs, List<ExecutionLogEntry> logs) {

        static Document empty() {
            return new Document(List.of(), List.of());
        }
    }
}
