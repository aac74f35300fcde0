package org.dataworks.coalescence.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

import reactor.core.publisher.Flux;

/**
 * An ObjectStore held in memory, for exercising the pipeline without S3 or a filesystem.
 * Thread safe; keys are listed in lexicographic order.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final NavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<>();

    public InMemoryObjectStore put(String key, byte[] content) {
        objects.put(key, content.clone());
        return this;
    }

    public boolean contains(String key) {
        return objects.containsKey(key);
    }

    public List<String> keys() {
        return new ArrayList<>(objects.keySet());
    }

    @Override
    public byte[] read(String key) throws IOException {
        byte[] content = objects.get(key);
        if (content == null) {
            throw new NoSuchFileException(key, null, "Object does not exist");
        }
        return content.clone();
    }

    @Override
    public void writeMerged(String key, List<byte[]> orderedContents) throws IOException {
        ByteArrayOutputStream merged = new ByteArrayOutputStream();
        for (byte[] content : orderedContents) {
            merged.write(content);
        }
        objects.put(key, merged.toByteArray());
    }

    @Override
    public void delete(List<String> keys) {
        keys.forEach(objects::remove);
    }

    @Override
    public Flux<List<ObjectSummary>> listTranches(String prefix, int pageSize) {
        ObjectLister.checkPageSize(pageSize);
        return Flux.defer(() -> Flux.fromIterable(objects.tailMap(prefix, true).entrySet()))
            .takeWhile(entry -> entry.getKey().startsWith(prefix))
            .map(entry -> new ObjectSummary(entry.getKey(), entry.getValue().length))
            .buffer(pageSize);
    }
}
