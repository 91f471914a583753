package io.github.byzatic.sqlprobe.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.base_exceptions.ValidationException;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Job definitions as a JSON array:
 * <pre>{@code
 * [ {"id": "...", "name": "ping", "description": "", "query": "SELECT true", "frequency": 5} ]
 * }</pre>
 * Entries without an id get a fresh one on load, and the file is rewritten right away so the id survives
 * a restart. Entries that fail validation are skipped with a warning.
 */
public final class JsonJobDefinitionRepository implements JobDefinitionRepository {
    private final static Logger logger = LoggerFactory.getLogger(JsonJobDefinitionRepository.class);

    private static final TypeReference<List<JobDocument>> DOCUMENTS = new TypeReference<List<JobDocument>>() {
    };

    private final VfsJsonFile file;

    private JsonJobDefinitionRepository(VfsJsonFile file) {
        this.file = file;
    }

    /**
     * @param uri any Commons VFS URI, e.g. {@code file:///var/lib/probes/jobs.json}
     */
    public static JsonJobDefinitionRepository forUri(@NotNull String uri) throws PersistenceException {
        return new JsonJobDefinitionRepository(VfsJsonFile.resolve(uri));
    }

    public static JsonJobDefinitionRepository forPath(@NotNull Path path) throws PersistenceException {
        return new JsonJobDefinitionRepository(VfsJsonFile.resolve(path));
    }

    @Override
    public List<JobDefinition> load() throws PersistenceException {
        List<JobDocument> documents = file.read(DOCUMENTS).orElse(Collections.emptyList());
        List<JobDefinition> out = new ArrayList<>(documents.size());
        int assigned = 0;
        for (int i = 0; i < documents.size(); i++) {
            JobDocument d = documents.get(i);
            if (d == null) continue;
            try {
                out.add(d.toDefinition());
                if (!d.hasId()) assigned++;
            } catch (ValidationException | IllegalArgumentException e) {
                logger.warn("Skipping job #{} in {}: {}", i, file.uri(), e.getMessage());
            }
        }
        logger.debug("Loaded {} job(s) from {}", out.size(), file.uri());
        if (assigned > 0) {
            logger.info("Assigned ids to {} job(s), rewriting {}", assigned, file.uri());
            save(out);
        }
        return out;
    }

    @Override
    public void save(List<JobDefinition> definitions) throws PersistenceException {
        List<JobDocument> documents = new ArrayList<>(definitions.size());
        for (JobDefinition d : definitions) documents.add(JobDocument.of(d));
        file.write(documents);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class JobDocument {
        public String id;
        public String name;
        public String description;
        public String query;
        public Integer frequency;

        static JobDocument of(JobDefinition d) {
            JobDocument doc = new JobDocument();
            doc.id = d.getId().toString();
            doc.name = d.getName();
            doc.description = d.getDescription();
            doc.query = d.getQuery();
            doc.frequency = d.getFrequencySeconds();
            return doc;
        }

        boolean hasId() {
            return id != null && !id.isEmpty();
        }

        JobDefinition toDefinition() throws ValidationException {
            if (frequency == null) throw new ValidationException("Job '" + name + "' has no frequency");
            return JobDefinition.builder()
                    .id(hasId() ? UUID.fromString(id) : null)
                    .name(name)
                    .description(description)
                    .query(query)
                    .frequencySeconds(frequency)
                    .build();
        }
    }
}
