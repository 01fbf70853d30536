package com.ambient.core.content;

import com.ambient.core.cluster.NotFoundException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File store behind the content service, rooted at one directory per tenant.
 * All paths go through {@link ContentPaths#normalize} before touching the disk.
 */
public class LocalContentStore {

    private final Path baseDir;

    public LocalContentStore(Path baseDir) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public void write(String path, byte[] data) {
        Path target = resolve(path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, data);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write file", e);
        }
    }

    public byte[] read(String path) {
        Path target = resolve(path);
        if (Files.isDirectory(target)) {
            throw new ContentPathException("path is a directory");
        }
        try {
            return Files.readAllBytes(target);
        } catch (NoSuchFileException e) {
            throw new NotFoundException("not found");
        } catch (IOException e) {
            throw new UncheckedIOException("read failed", e);
        }
    }

    public List<ContentEntry> list(String path) {
        String normalized = ContentPaths.normalize(path);
        Path target = resolve(normalized);
        if (!Files.exists(target)) {
            throw new NotFoundException("not found");
        }
        try {
            if (!Files.isDirectory(target)) {
                return List.of(entry(target, normalized));
            }
            List<ContentEntry> entries = new ArrayList<>();
            try (Stream<Path> children = Files.list(target)) {
                for (Path child : children.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                    entries.add(entry(child, normalized + "/" + child.getFileName()));
                }
            }
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("readdir failed", e);
        }
    }

    private Path resolve(String path) {
        String normalized = ContentPaths.normalize(path);
        Path resolved = baseDir.resolve(normalized.substring(1)).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new ContentPathException("invalid path");
        }
        return resolved;
    }

    private static ContentEntry entry(Path file, String contentPath) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return new ContentEntry(
                file.getFileName().toString(),
                contentPath,
                attrs.isDirectory(),
                attrs.isDirectory() ? 0 : attrs.size(),
                attrs.lastModifiedTime().toInstant().truncatedTo(ChronoUnit.SECONDS).toString());
    }
}
