package io.prism.rag.retrieval.bm25;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.prism.rag.concurrent.DocumentLocks;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Stores one JSON file per document under a base directory.
 *
 * <p>Writes go to a temporary file in the same directory and are then renamed over the target,
 * so readers only ever open a complete file. Writes for the same document are serialized;
 * different documents write in parallel. Loaded indexes are cached against the file's identity,
 * modification time and size, so a file replaced by another process is read again.</p>
 */
@Slf4j
public class FileSystemBm25IndexStore implements Bm25IndexStore {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]{1,128}");
    private static final String SUFFIX = ".bm25.json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final DocumentLocks writeLocks = new DocumentLocks();
    private final Map<String, CachedIndex> cache = new ConcurrentHashMap<>();

    public FileSystemBm25IndexStore(Path baseDir, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create BM25 index directory " + baseDir, e);
        }
    }

    @Override
    public void save(String documentId, Bm25IndexData data) {
        writeLocks.lock(documentId);
        try {
            Path target = pathFor(documentId);
            Path temp = baseDir.resolve(target.getFileName() + ".tmp-" + UUID.randomUUID());
            try {
                Files.write(temp, objectMapper.writeValueAsBytes(data));
                moveIntoPlace(temp, target);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new UncheckedIOException("Failed to save BM25 index for document " + documentId, e);
            }
            cache.remove(documentId);
            log.info("Saved BM25 index for document {} ({} chunks, {} terms)",
                    documentId, data.getChunkCount(), data.getVocabulary().size());
        } finally {
            writeLocks.unlock(documentId);
        }
    }

    @Override
    public Optional<Bm25IndexData> load(String documentId) {
        Path path = pathFor(documentId);
        try {
            FileStamp stamp = FileStamp.of(Files.readAttributes(path, BasicFileAttributes.class));
            CachedIndex cached = cache.get(documentId);
            if (cached != null && cached.stamp().equals(stamp)) {
                return Optional.of(cached.data());
            }
            Bm25IndexData data = objectMapper.readValue(Files.readAllBytes(path), Bm25IndexData.class);
            cache.put(documentId, new CachedIndex(stamp, data));
            return Optional.of(data);
        } catch (NoSuchFileException e) {
            cache.remove(documentId);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load BM25 index for document " + documentId, e);
        }
    }

    @Override
    public boolean delete(String documentId) {
        writeLocks.lock(documentId);
        try {
            cache.remove(documentId);
            boolean deleted = Files.deleteIfExists(pathFor(documentId));
            if (deleted) {
                log.info("Deleted BM25 index for document {}", documentId);
            }
            return deleted;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete BM25 index for document " + documentId, e);
        } finally {
            writeLocks.unlock(documentId);
        }
    }

    @Override
    public boolean exists(String documentId) {
        return Files.exists(pathFor(documentId));
    }

    /**
     * Reads the raw persisted bytes of a document's index, or {@code null} when absent.
     */
    byte[] readRaw(String documentId) {
        try {
            return Files.readAllBytes(pathFor(documentId));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    Path pathFor(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId is required");
        }
        String name = SAFE_NAME.matcher(documentId).matches() ? documentId : sha256(documentId);
        return baseDir.resolve(name + SUFFIX);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported in {}, falling back to replace", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}", path, e);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record FileStamp(Object fileKey, FileTime modified, long size) {

        static FileStamp of(BasicFileAttributes attributes) {
            return new FileStamp(attributes.fileKey(), attributes.lastModifiedTime(), attributes.size());
        }
    }

    private record CachedIndex(FileStamp stamp, Bm25IndexData data) {
    }
}
