package com.flamingo.ai.scriptrag.embedding.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.scriptrag.embedding.codec.BinaryEmbeddingCodec;
import com.flamingo.ai.scriptrag.exception.EmbeddingDecodeException;
import com.flamingo.ai.scriptrag.exception.VectorStorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable blob store writing one file per embedding.
 *
 * <p>Layout: {@code root/{model with '/' replaced by '_'}/{entityType}/{entityId}.{ext}}, with an
 * optional {@code {entityId}.json} metadata sidecar. The store does not index vectors, so {@link
 * #search} is unsupported. Unreadable or corrupted payloads are reported as absent.
 */
@Slf4j
public class FileVectorStore implements VectorStore {

  private static final String METADATA_EXTENSION = "json";
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final Path root;
  private final String extension;
  private final String markerFileName;
  private final BinaryEmbeddingCodec codec;
  private final ObjectMapper objectMapper;

  private volatile boolean rootPrepared;

  public FileVectorStore(
      Path root,
      String extension,
      String markerFileName,
      BinaryEmbeddingCodec codec,
      ObjectMapper objectMapper) {
    this.root = root;
    this.extension = extension;
    this.markerFileName = markerFileName;
    this.codec = codec;
    this.objectMapper = objectMapper;
  }

  public FileVectorStore(Path root, BinaryEmbeddingCodec codec, ObjectMapper objectMapper) {
    this(root, "emb", ".gitattributes", codec, objectMapper);
  }

  /** Path of the embedding file for a key, whether or not it exists. */
  public Path getEmbeddingPath(String entityType, long entityId, String model) {
    return root.resolve(modelDirectoryName(model))
        .resolve(entityType)
        .resolve(entityId + "." + extension);
  }

  @Override
  public void store(
      String entityType,
      long entityId,
      float[] vector,
      String model,
      Map<String, Object> metadata) {
    ensureRootPrepared();
    Path path = getEmbeddingPath(entityType, entityId, model);
    Path metadataPath = sidecarPath(path, entityId);
    try {
      Files.createDirectories(path.getParent());
      writeAtomically(path, codec.encode(vector));
      if (metadata != null && !metadata.isEmpty()) {
        writeAtomically(metadataPath, objectMapper.writeValueAsBytes(metadata));
      } else {
        Files.deleteIfExists(metadataPath);
      }
    } catch (IOException e) {
      throw new VectorStorageException("Failed to store embedding at " + path, e);
    }
    log.debug(
        "Stored embedding: path={}, entityType={}, entityId={}, dimension={}",
        path,
        entityType,
        entityId,
        vector.length);
  }

  @Override
  public Optional<float[]> retrieve(String entityType, long entityId, String model) {
    Path path = getEmbeddingPath(entityType, entityId, model);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(codec.decode(Files.readAllBytes(path)));
    } catch (IOException | EmbeddingDecodeException e) {
      log.warn("Failed to load embedding from {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  /** Reads the metadata sidecar for a key, empty if there is none or it cannot be parsed. */
  public Map<String, Object> readMetadata(String entityType, long entityId, String model) {
    Path path = getEmbeddingPath(entityType, entityId, model);
    Path metadataPath = sidecarPath(path, entityId);
    if (!Files.exists(metadataPath)) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(metadataPath.toFile(), METADATA_TYPE);
    } catch (IOException e) {
      log.warn("Failed to read embedding metadata from {}: {}", metadataPath, e.getMessage());
      return Map.of();
    }
  }

  @Override
  public boolean delete(String entityType, long entityId, String model) {
    if (model != null) {
      return deleteFiles(getEmbeddingPath(entityType, entityId, model), entityId);
    }
    if (!Files.isDirectory(root)) {
      return false;
    }
    boolean deleted = false;
    try (DirectoryStream<Path> modelDirs = Files.newDirectoryStream(root, Files::isDirectory)) {
      for (Path modelDir : modelDirs) {
        Path path = modelDir.resolve(entityType).resolve(entityId + "." + extension);
        deleted |= deleteFiles(path, entityId);
      }
    } catch (IOException e) {
      throw new VectorStorageException("Failed to scan embedding store at " + root, e);
    }
    return deleted;
  }

  /** Ids of every entity of a type stored for a model, in no particular order. */
  public List<Long> listEntityIds(String entityType, String model) {
    Path dir = root.resolve(modelDirectoryName(model)).resolve(entityType);
    List<Long> ids = new ArrayList<>();
    if (!Files.isDirectory(dir)) {
      return ids;
    }
    String suffix = "." + extension;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + suffix)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        String stem = name.substring(0, name.length() - suffix.length());
        try {
          ids.add(Long.parseLong(stem));
        } catch (NumberFormatException e) {
          log.debug("Skipping non-entity file {}", file);
        }
      }
    } catch (IOException e) {
      throw new VectorStorageException("Failed to list embeddings in " + dir, e);
    }
    return ids;
  }

  @Override
  public boolean exists(String entityType, long entityId, String model) {
    return Files.exists(getEmbeddingPath(entityType, entityId, model));
  }

  private boolean deleteFiles(Path path, long entityId) {
    try {
      boolean deleted = Files.deleteIfExists(path);
      Files.deleteIfExists(sidecarPath(path, entityId));
      return deleted;
    } catch (IOException e) {
      throw new VectorStorageException("Failed to delete embedding at " + path, e);
    }
  }

  private Path sidecarPath(Path embeddingPath, long entityId) {
    return embeddingPath.resolveSibling(entityId + "." + METADATA_EXTENSION);
  }

  private void writeAtomically(Path target, byte[] bytes) throws IOException {
    Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
    try {
      Files.write(tmp, bytes);
      Files.move(
          tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /** Creates the root and its tracking marker once; an existing marker is never rewritten. */
  private void ensureRootPrepared() {
    if (rootPrepared) {
      return;
    }
    synchronized (this) {
      if (rootPrepared) {
        return;
      }
      Path marker = root.resolve(markerFileName);
      try {
        Files.createDirectories(root);
        if (!Files.exists(marker)) {
          Files.writeString(
              marker,
              "*." + extension + " filter=lfs diff=lfs merge=lfs -text\n",
              StandardCharsets.UTF_8,
              StandardOpenOption.CREATE_NEW);
          log.info("Created tracking marker {}", marker);
        }
      } catch (FileAlreadyExistsException e) {
        log.debug("Tracking marker {} created concurrently", marker);
      } catch (IOException e) {
        throw new VectorStorageException("Failed to prepare embedding store at " + root, e);
      }
      rootPrepared = true;
    }
  }

  static String modelDirectoryName(String model) {
    return model.replace('/', '_');
  }
}
