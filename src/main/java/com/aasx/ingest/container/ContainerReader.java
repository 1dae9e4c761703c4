package com.aasx.ingest.container;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Read-only view over a ZIP container. Entries are enumerated once at open time
 * and classified by name; content is only read on request.
 *
 * <pre>{@code
 * try (ContainerReader reader = ContainerReader.open(path)) {
 *     for (ContainerEntry entry : reader) {
 *         byte[] content = reader.read(entry);
 *     }
 * }
 * }</pre>
 */
public final class ContainerReader implements Iterable<ContainerEntry>, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ContainerReader.class);

    private final Path path;
    private final long sizeBytes;
    private final ZipFile zipFile;
    private final List<ContainerEntry> entries;

    private ContainerReader(Path path, long sizeBytes, ZipFile zipFile, List<ContainerEntry> entries) {
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.zipFile = zipFile;
        this.entries = entries;
    }

    /**
     * Opens a container.
     *
     * @throws ContainerNotFoundException       if the path does not exist
     * @throws InvalidContainerFormatException if the file is not a readable ZIP archive
     */
    public static ContainerReader open(Path path) {
        Objects.requireNonNull(path, "path is required");
        if (!Files.isRegularFile(path)) {
            throw new ContainerNotFoundException(path);
        }

        long size;
        ZipFile zip;
        try {
            size = Files.size(path);
            zip = new ZipFile(path.toFile());
        } catch (ZipException e) {
            throw new InvalidContainerFormatException("Not a ZIP archive: " + path, e);
        } catch (IOException e) {
            throw new InvalidContainerFormatException("Cannot open container: " + path, e);
        }

        List<ContainerEntry> entries = new ArrayList<>();
        try {
            Enumeration<? extends ZipEntry> zipEntries = zip.entries();
            while (zipEntries.hasMoreElements()) {
                ZipEntry zipEntry = zipEntries.nextElement();
                if (zipEntry.isDirectory()) {
                    continue;
                }
                entries.add(new ContainerEntry(zipEntry.getName(), zipEntry.getSize(),
                        EntryClassifier.classify(zipEntry.getName())));
            }
        } catch (RuntimeException e) {
            closeQuietly(zip);
            throw new InvalidContainerFormatException("Corrupt central directory: " + path, e);
        }

        log.debug("container.opened path={} entries={}", path, entries.size());
        return new ContainerReader(path, size, zip, Collections.unmodifiableList(entries));
    }

    public List<ContainerEntry> entries() {
        return entries;
    }

    @Override
    public Iterator<ContainerEntry> iterator() {
        return entries.iterator();
    }

    /**
     * Reads the full content of an entry. Failures are entry-level: the reader stays usable.
     */
    public byte[] read(ContainerEntry entry) throws IOException {
        ZipEntry zipEntry = zipFile.getEntry(entry.name());
        if (zipEntry == null) {
            throw new IOException("Entry not present in container: " + entry.name());
        }
        try (InputStream in = zipFile.getInputStream(zipEntry)) {
            return in.readAllBytes();
        }
    }

    public Path path() {
        return path;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    @Override
    public void close() {
        closeQuietly(zipFile);
    }

    private static void closeQuietly(ZipFile zip) {
        try {
            zip.close();
        } catch (IOException e) {
            log.warn("Error closing container {}", zip.getName(), e);
        }
    }
}
