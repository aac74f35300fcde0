package org.dataworks.coalescence.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

/**
 * ObjectStore implementation for local filesystem access.
 * Keys are '/'-separated paths relative to the root directory, listed in lexicographic order as S3 does.
 */
@RequiredArgsConstructor
@Slf4j
public class FileObjectStore implements ObjectStore {

    private final Path rootPath;

    /**
     * Create a FileObjectStore, creating the root directory if needed
     * @param rootPath the root directory path
     * @return the store
     * @throws IOException if the root directory cannot be created
     */
    public static FileObjectStore open(Path rootPath) throws IOException {
        Files.createDirectories(rootPath);
        return new FileObjectStore(rootPath);
    }

    @Override
    public byte[] read(String key) throws IOException {
        Path fullPath = resolve(key);
        log.debug("Reading object from: {}", fullPath);

        if (!Files.isRegularFile(fullPath)) {
            throw new NoSuchFileException(fullPath.toString(), null, "Object does not exist: " + key);
        }
        return Files.readAllBytes(fullPath);
    }

    @Override
    public void writeMerged(String key, List<byte[]> orderedContents) throws IOException {
        Path fullPath = resolve(key);
        Files.createDirectories(fullPath.getParent());

        // Write beside the target and move into place so readers never see a partial object
        Path partial = Files.createTempFile(fullPath.getParent(), ".merge-", ".partial");
        try {
            try (OutputStream output = Files.newOutputStream(partial)) {
                for (byte[] content : orderedContents) {
                    output.write(content);
                }
            }
            Files.move(partial, fullPath, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
        log.debug("Wrote {} parts to {}", orderedContents.size(), fullPath);
    }

    @Override
    public void delete(List<String> keys) throws IOException {
        List<String> failed = new ArrayList<>();
        for (String key : keys) {
            try {
                Files.deleteIfExists(resolve(key));
            } catch (IOException e) {
                log.warn("Failed to delete {}: {}", key, e.getMessage());
                failed.add(key);
            }
        }
        if (!failed.isEmpty()) {
            throw new IOException("Failed to delete " + failed.size() + " objects: " + failed);
        }
    }

    @Override
    public Flux<List<ObjectSummary>> listTranches(String prefix, int pageSize) {
        ObjectLister.checkPageSize(pageSize);
        return Flux.defer(() -> {
            try {
                return Flux.fromIterable(listSummaries(prefix));
            } catch (IOException e) {
                return Flux.error(e);
            }
        }).buffer(pageSize);
    }

    private List<ObjectSummary> listSummaries(String prefix) throws IOException {
        if (!Files.isDirectory(rootPath)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(rootPath)) {
            List<Path> files = paths.filter(Files::isRegularFile)
                .filter(path -> !path.getFileName().toString().endsWith(".partial"))
                .collect(Collectors.toList());
            List<ObjectSummary> summaries = new ArrayList<>();
            for (Path file : files) {
                String key = toKey(file);
                if (key.startsWith(prefix)) {
                    summaries.add(new ObjectSummary(key, Files.size(file)));
                }
            }
            summaries.sort(Comparator.comparing(ObjectSummary::key));
            return summaries;
        }
    }

    private Path resolve(String key) {
        Path fullPath = rootPath.resolve(key).normalize();
        if (!fullPath.startsWith(rootPath.normalize())) {
            throw new IllegalArgumentException("Key escapes the store root: " + key);
        }
        return fullPath;
    }

    private String toKey(Path file) {
        return rootPath.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
