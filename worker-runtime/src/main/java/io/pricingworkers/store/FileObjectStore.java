package io.pricingworkers.store;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Stores each object as {@code root/bucket/key}. Writes go to a temp file first and are moved into place,
 * so readers never observe a partial object.
 */
public class FileObjectStore implements ObjectStore {
    private final Path root;

    public FileObjectStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root);
    }

    public Path root() { return root; }

    @Override
    public void put(String bucket, String key, byte[] data) throws IOException {
        Path dir = root.resolve(bucket);
        Files.createDirectories(dir);
        Path out = dir.resolve(key);
        Path tmp = Files.createTempFile(dir, "." + key, ".tmp");
        try {
            Files.write(tmp, data, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            try {
                Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public Optional<byte[]> get(String bucket, String key) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(root.resolve(bucket).resolve(key)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean exists(String bucket, String key) {
        return Files.isRegularFile(root.resolve(bucket).resolve(key));
    }

    @Override
    public void delete(String bucket, String key) throws IOException {
        Files.deleteIfExists(root.resolve(bucket).resolve(key));
    }

    @Override
    public List<String> list(String bucket) throws IOException {
        Path dir = root.resolve(bucket);
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) return out;
        try (Stream<Path> s = Files.list(dir)) {
            s.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith("."))
                    .sorted()
                    .forEach(out::add);
        }
        return out;
    }
}
