package org.dataworks.coalescence.pipeline.key;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.dataworks.coalescence.io.ObjectSummary;
import org.dataworks.coalescence.pipeline.ir.ObjectDescriptor;

/**
 * The key structures of the objects being coalesced. Both share the file name shape
 * {@code <topic>_<partition>_<startOffset>-<endOffset>.<extension>} under any number of directories;
 * they differ in extension.
 *
 * <pre>
 *   DATA      corporate_storage/ucfs_audit/2020/11/05/data/businessAudit/data.businessAudit_4_100-200.jsonl.gz
 *   MANIFEST  streaming/main/db.core.contract_10_1000-2000.txt
 * </pre>
 */
public enum KeyLayout {
    DATA("jsonl.gz"),
    MANIFEST("txt");

    private final String extension;
    private final Pattern pattern;

    KeyLayout(String extension) {
        this.extension = extension;
        this.pattern = Pattern.compile("^(?<directory>(?:[^/]+/)*)"
            + "(?<topic>[\\w-]+(?:\\.[\\w-]+)+)"
            + "_(?<partition>\\d+)_(?<start>\\d+)-(?<end>\\d+)"
            + "\\." + Pattern.quote(extension) + "$");
    }

    public static KeyLayout of(boolean manifests) {
        return manifests ? MANIFEST : DATA;
    }

    /**
     * Parse the topic, partition and offsets out of a listed object's key.
     *
     * @param summary the listed object
     * @return the parsed descriptor
     * @throws MalformedKeyException if the key does not have this layout's structure
     */
    public ObjectDescriptor describe(ObjectSummary summary) throws MalformedKeyException {
        Matcher matcher = pattern.matcher(summary.key());
        if (!matcher.matches()) {
            throw new MalformedKeyException(summary.key(), this);
        }
        try {
            return new ObjectDescriptor(
                summary.key(),
                summary.size(),
                matcher.group("topic"),
                Integer.parseInt(matcher.group("partition")),
                Long.parseLong(matcher.group("start")),
                Long.parseLong(matcher.group("end")),
                this);
        } catch (NumberFormatException e) {
            throw new MalformedKeyException(summary.key(), this, e);
        }
    }

    /**
     * The key of the object that the given run of descriptors is merged into: it sits in the directory of the
     * first descriptor and spans the first descriptor's start offset to the last descriptor's end offset.
     */
    public String mergedKey(List<ObjectDescriptor> descriptors) {
        ObjectDescriptor first = descriptors.get(0);
        ObjectDescriptor last = descriptors.get(descriptors.size() - 1);
        return directoryOf(first.key()) + first.topic() + "_" + first.partition()
            + "_" + first.startOffset() + "-" + last.endOffset() + "." + extension;
    }

    private static String directoryOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? "" : key.substring(0, slash + 1);
    }
}
