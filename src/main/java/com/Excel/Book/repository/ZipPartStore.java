package com.Excel.Book.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Part store held in memory, read from and written to a zip stream.
 */
public class ZipPartStore implements PartStore {

    private static final Logger logger = LoggerFactory.getLogger(ZipPartStore.class);

    private final Map<String, byte[]> parts = new LinkedHashMap<>();
    private final ReadWriteLock partsLock = new ReentrantReadWriteLock();

    public ZipPartStore() {
    }

    public ZipPartStore(Map<String, byte[]> initialParts) {
        initialParts.forEach(this::writePart);
    }

    /**
     * Load every entry of a zip stream. Directory entries are skipped.
     */
    public static ZipPartStore read(InputStream in) throws IOException {
        ZipPartStore store = new ZipPartStore();
        try (ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (!entry.isDirectory()) {
                    store.writePart(entry.getName(), zip.readAllBytes());
                }
                zip.closeEntry();
            }
        }
        logger.debug("Read {} parts from zip stream", store.parts.size());
        return store;
    }

    /**
     * Write all parts as a zip archive. The stream is finished but not closed.
     */
    public void writeTo(OutputStream out) throws IOException {
        partsLock.readLock().lock();
        try {
            ZipOutputStream zip = new ZipOutputStream(out);
            for (Map.Entry<String, byte[]> part : parts.entrySet()) {
                zip.putNextEntry(new ZipEntry(part.getKey()));
                zip.write(part.getValue());
                zip.closeEntry();
            }
            zip.finish();
            logger.debug("Wrote {} parts to zip stream", parts.size());
        } finally {
            partsLock.readLock().unlock();
        }
    }

    @Override
    public byte[] readPart(String path) {
        partsLock.readLock().lock();
        try {
            byte[] data = parts.get(normalize(path));
            return data != null ? data.clone() : new byte[0];
        } finally {
            partsLock.readLock().unlock();
        }
    }

    @Override
    public void writePart(String path, byte[] data) {
        if (path == null || normalize(path).isEmpty()) {
            throw new IllegalArgumentException("Part path cannot be null or empty");
        }
        partsLock.writeLock().lock();
        try {
            parts.put(normalize(path), data.clone());
        } finally {
            partsLock.writeLock().unlock();
        }
    }

    @Override
    public boolean hasPart(String path) {
        partsLock.readLock().lock();
        try {
            return parts.containsKey(normalize(path));
        } finally {
            partsLock.readLock().unlock();
        }
    }

    @Override
    public List<String> partNames() {
        partsLock.readLock().lock();
        try {
            return new ArrayList<>(parts.keySet());
        } finally {
            partsLock.readLock().unlock();
        }
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
