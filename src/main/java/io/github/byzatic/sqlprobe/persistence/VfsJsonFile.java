package io.github.byzatic.sqlprobe.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;
import org.apache.commons.vfs2.VFS;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A JSON document stored in a single Commons VFS file. Missing file reads as empty.
 */
final class VfsJsonFile {
    private final static Logger logger = LoggerFactory.getLogger(VfsJsonFile.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    static final String TMP_SUFFIX = ".tmp";

    private final FileObject file;

    VfsJsonFile(@NotNull FileObject file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    static VfsJsonFile resolve(@NotNull String uri) throws PersistenceException {
        try {
            return new VfsJsonFile(VFS.getManager().resolveFile(uri));
        } catch (FileSystemException e) {
            throw new PersistenceException("Cannot resolve " + uri, e);
        }
    }

    static VfsJsonFile resolve(@NotNull Path path) throws PersistenceException {
        return resolve(path.toAbsolutePath().toUri().toString());
    }

    String uri() {
        return file.getName().getURI();
    }

    <T> Optional<T> read(TypeReference<T> type) throws PersistenceException {
        try {
            file.refresh();
            if (!file.exists()) {
                logger.debug("{} does not exist yet", uri());
                return Optional.empty();
            }
            try (InputStream in = file.getContent().getInputStream()) {
                return Optional.ofNullable(MAPPER.readValue(in, type));
            }
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Malformed JSON in " + uri() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read " + uri(), e);
        }
    }

    /**
     * Writes the whole document to a sibling temp file first and then moves it over the target,
     * so a failed write leaves the previous content in place.
     */
    void write(Object value) throws PersistenceException {
        FileObject tmp = null;
        try {
            FileObject parent = file.getParent();
            if (parent == null) throw new PersistenceException("No parent folder for " + uri());
            tmp = parent.resolveFile(file.getName().getBaseName() + TMP_SUFFIX);
            try (OutputStream out = tmp.getContent().getOutputStream()) {
                MAPPER.writeValue(out, value);
            }
            tmp.moveTo(file);
        } catch (IOException e) {
            discard(tmp);
            throw new PersistenceException("Cannot write " + uri(), e);
        }
        logger.debug("Saved {}", uri());
    }

    private void discard(FileObject tmp) {
        if (tmp == null) return;
        try {
            tmp.delete();
        } catch (FileSystemException e) {
            logger.warn("Cannot delete temp file {}: {}", tmp.getName().getURI(), e.getMessage());
        }
    }
}
