package com.acme.inventory.store;

import com.acme.inventory.spi.ObjectStore;
import com.acme.inventory.spi.ObjectStoreException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Object store backed by a local directory; keys are relative paths under the root. Conditional
 * create maps onto {@link StandardOpenOption#CREATE_NEW}, which is atomic on local file systems.
 * Compare-and-delete is serialized per instance, so it is atomic only among users of the same
 * instance.
 */
public class FileSystemObjectStore implements ObjectStore {

  private final Path root;

  public FileSystemObjectStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public Optional<byte[]> get(String key) {
    Path path = resolve(key);
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new ObjectStoreException(key, "Cannot read object", e);
    }
  }

  @Override
  public void put(String key, byte[] content, String contentType) {
    Path path = resolve(key);
    try {
      Files.createDirectories(path.getParent());
      Path tmp = Files.createTempFile(path.getParent(), ".put-", ".tmp");
      Files.write(tmp, content);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new ObjectStoreException(key, "Cannot write object", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      throw new ObjectStoreException(key, "Cannot delete object", e);
    }
  }

  @Override
  public boolean supportsConditionalWrite() {
    return true;
  }

  @Override
  public boolean putIfAbsent(String key, byte[] content, String contentType) {
    Path path = resolve(key);
    try {
      Files.createDirectories(path.getParent());
      Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
      return true;
    } catch (FileAlreadyExistsException e) {
      return false;
    } catch (IOException e) {
      throw new ObjectStoreException(key, "Cannot create object", e);
    }
  }

  @Override
  public synchronized boolean deleteIfUnchanged(String key, byte[] expected) {
    Optional<byte[]> current = get(key);
    if (current.isEmpty() || !Arrays.equals(current.get(), expected)) {
      return false;
    }
    delete(key);
    return true;
  }

  private Path resolve(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key cannot be blank");
    }
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new IllegalArgumentException("key escapes the store root: " + key);
    }
    return path;
  }
}
