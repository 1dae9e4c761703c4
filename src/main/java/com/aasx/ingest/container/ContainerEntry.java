package com.aasx.ingest.container;

import java.util.Objects;

/**
 * One classified entry of an open container. Only valid while the owning
 * {@link ContainerReader} is open.
 *
 * @param name the raw entry name, including any directory prefix
 * @param size uncompressed size in bytes, or -1 when the archive does not record it
 * @param kind classification by name pattern
 */
public record ContainerEntry(String name, long size, EntryKind kind) {

    public ContainerEntry {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}
