package org.dataworks.coalescence.pipeline.ir;

import org.dataworks.coalescence.pipeline.key.KeyLayout;

/**
 * A listed object whose key has been parsed: which topic and partition it belongs to, and the offsets it covers.
 */
public record ObjectDescriptor(
    String key,
    long size,
    String topic,
    int partition,
    long startOffset,
    long endOffset,
    KeyLayout layout
) {}
