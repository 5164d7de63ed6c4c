package com.flamingo.ai.researchcache.store;

import com.flamingo.ai.researchcache.exception.AttachmentMissingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Blob directory of one collection store. Each attachment is one file named after its key plus an
 * extension detected from the filename or content type.
 */
@Slf4j
public class AttachmentFileStore {

  private final Path directory;

  public AttachmentFileStore(Path directory) {
    this.directory = directory;
  }

  public Path directory() {
    return directory;
  }

  public Path pathFor(String attachmentKey, String filename, String contentType) {
    return directory.resolve(attachmentKey + detectExtension(filename, contentType));
  }

  /**
   * Writes the bytes through a temp file so a crash never leaves a truncated blob behind. A blob
   * already at the target is moved aside and kept until the returned replacement is either
   * committed or undone.
   */
  public BlobReplacement replace(
      String attachmentKey, String filename, String contentType, byte[] bytes) {
    Path target = pathFor(attachmentKey, filename, contentType);
    try {
      Files.createDirectories(directory);
      Path temp = Files.createTempFile(directory, attachmentKey, ".part");
      Files.write(temp, bytes);
      Path backup = null;
      if (Files.exists(target)) {
        backup = Files.createTempFile(directory, attachmentKey, ".bak");
        Files.move(target, backup, StandardCopyOption.REPLACE_EXISTING);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      return new BlobReplacement(target, backup);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write attachment " + attachmentKey, e);
    }
  }

  public boolean exists(String localPath) {
    return localPath != null && Files.isRegularFile(Path.of(localPath));
  }

  public byte[] read(String attachmentKey, String localPath) {
    if (!exists(localPath)) {
      throw new AttachmentMissingException(
          attachmentKey, localPath == null ? directory : Path.of(localPath));
    }
    try {
      return Files.readAllBytes(Path.of(localPath));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read attachment " + attachmentKey, e);
    }
  }

  /** Deletes blob files; failures are logged and the remaining files are still attempted. */
  public int deleteAll(Collection<String> localPaths) {
    int deleted = 0;
    for (String localPath : localPaths) {
      if (localPath == null) {
        continue;
      }
      try {
        if (Files.deleteIfExists(Path.of(localPath))) {
          deleted++;
        }
      } catch (IOException e) {
        log.warn("Could not delete attachment blob {}: {}", localPath, e.getMessage());
      }
    }
    return deleted;
  }

  public long totalBytes() {
    if (!Files.isDirectory(directory)) {
      return 0L;
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files.filter(Files::isRegularFile).mapToLong(AttachmentFileStore::sizeOf).sum();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list " + directory, e);
    }
  }

  /**
   * A blob written over whatever was at {@code target}.
   *
   * @param backup the previous blob, or {@code null} when the target did not exist
   */
  public record BlobReplacement(Path target, Path backup) {

    /** Keeps the new blob. */
    void commit() {
      if (backup == null) {
        return;
      }
      try {
        Files.deleteIfExists(backup);
      } catch (IOException e) {
        log.warn("Could not delete replaced blob {}: {}", backup, e.getMessage());
      }
    }

    /** Puts the previous blob back, or removes the new one when there was none. */
    void undo() {
      try {
        if (backup == null) {
          Files.deleteIfExists(target);
        } else {
          Files.move(backup, target, StandardCopyOption.REPLACE_EXISTING);
        }
      } catch (IOException e) {
        log.warn("Could not restore blob {}: {}", target, e.getMessage());
      }
    }
  }

  static String detectExtension(String filename, String contentType) {
    if (filename != null) {
      String name = Path.of(filename).getFileName().toString();
      int dot = name.lastIndexOf('.');
      if (dot > 0 && dot < name.length() - 1) {
        String ext = name.substring(dot).toLowerCase(Locale.ROOT);
        if (ext.matches("\\.[a-z0-9]{1,8}")) {
          return ext;
        }
      }
    }
    String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
    if (type.contains("pdf")) {
      return ".pdf";
    }
    if (type.contains("html")) {
      return ".html";
    }
    if (type.contains("markdown")) {
      return ".md";
    }
    if (type.startsWith("text")) {
      return ".txt";
    }
    return ".bin";
  }

  private static long sizeOf(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
