package org.dataworks.coalescence.io;

/**
 * One entry of an object listing: the key of a stored object and its size in bytes.
 */
public record ObjectSummary(String key, long size) {}
