package com.Excel.Book.service;

import com.Excel.Book.config.WorkbookStorageProperties;
import com.Excel.Book.exception.WorkbookAlreadyExistsException;
import com.Excel.Book.exception.WorkbookException;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.repository.ZipPartStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Keeps workbook packages as {@code <name>.xlsx} files in the storage directory.
 */
@Service
public class WorkbookStorageService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookStorageService.class);

    private static final String TEMPLATE_ROOT = "templates/";
    private static final List<String> TEMPLATE_PARTS = List.of(
            "[Content_Types].xml",
            "_rels/.rels",
            "docProps/app.xml",
            "docProps/core.xml",
            "xl/workbook.xml",
            "xl/_rels/workbook.xml.rels",
            "xl/worksheets/sheet1.xml",
            "xl/styles.xml");
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");
    private static final String EXTENSION = ".xlsx";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path storageDir;
    private final WorkbookPartService workbookPartService;
    private final RelationshipService relationshipService;
    private final ContentTypesService contentTypesService;

    public WorkbookStorageService(WorkbookStorageProperties properties, WorkbookPartService workbookPartService,
                                  RelationshipService relationshipService, ContentTypesService contentTypesService) {
        this.storageDir = Paths.get(properties.getDir());
        this.workbookPartService = workbookPartService;
        this.relationshipService = relationshipService;
        this.contentTypesService = contentTypesService;
    }

    /**
     * Initialize storage directory on startup
     */
    @PostConstruct
    public void initializeStorageDirectory() {
        try {
            Files.createDirectories(storageDir);
            logger.info("Initialized workbook storage at: {}", storageDir.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to initialize workbook storage directory", e);
            throw new UncheckedIOException("Failed to initialize workbook storage directory", e);
        }
    }

    public boolean exists(String name) {
        return Files.exists(resolve(name));
    }

    /**
     * Create a package with a single empty sheet and store it.
     *
     * @throws WorkbookAlreadyExistsException when a workbook with that name exists
     */
    public SpreadsheetPackage create(String name) {
        if (exists(name)) {
            throw new WorkbookAlreadyExistsException(name);
        }
        SpreadsheetPackage pkg = newPackage();
        save(name, pkg);
        logger.info("Created workbook '{}'", name);
        return pkg;
    }

    /**
     * A package built from the bundled templates, not yet stored anywhere.
     */
    public SpreadsheetPackage newPackage() {
        Map<String, byte[]> parts = new LinkedHashMap<>();
        ClassLoader loader = WorkbookStorageService.class.getClassLoader();
        for (String part : TEMPLATE_PARTS) {
            try (InputStream in = loader.getResourceAsStream(TEMPLATE_ROOT + part)) {
                if (in == null) {
                    throw new WorkbookException("Missing package template: " + part);
                }
                parts.put(part, in.readAllBytes());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read package template " + part, e);
            }
        }
        return new SpreadsheetPackage(new ZipPartStore(parts));
    }

    /**
     * @throws NoSuchElementException when no workbook with that name is stored
     */
    public SpreadsheetPackage open(String name) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            throw new NoSuchElementException("Workbook not found: " + name);
        }
        try (InputStream in = Files.newInputStream(file)) {
            logger.debug("Opening workbook '{}' from {}", name, file);
            return new SpreadsheetPackage(ZipPartStore.read(in));
        } catch (IOException e) {
            logger.error("IO error reading workbook '{}': {}", name, e.getMessage());
            throw new UncheckedIOException("Failed to read workbook " + name, e);
        }
    }

    /**
     * Flush every decoded part and write the package atomically.
     */
    public void save(String name, SpreadsheetPackage pkg) {
        workbookPartService.flush(pkg);
        relationshipService.flush(pkg);
        contentTypesService.flush(pkg);

        if (!(pkg.getParts() instanceof ZipPartStore)) {
            throw new IllegalArgumentException("Only zip-backed packages can be stored");
        }
        ZipPartStore store = (ZipPartStore) pkg.getParts();

        Path file = resolve(name);
        Path tempFile = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        try {
            Files.createDirectories(storageDir);
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                store.writeTo(out);
            }
            Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            logger.info("Saved workbook '{}' to {}", name, file);
        } catch (IOException e) {
            logger.error("IO error saving workbook '{}': {}", name, e.getMessage(), e);
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupException) {
                logger.warn("Failed to clean up temporary workbook file: {}", cleanupException.getMessage());
            }
            throw new UncheckedIOException("Failed to save workbook " + name, e);
        }
    }

    /**
     * Letters, digits, {@code _ . -}, at most 128 characters, not starting
     * with a separator.
     */
    public static boolean isValidName(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }

    private Path resolve(String name) {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Invalid workbook name: " + name);
        }
        return storageDir.resolve(name + EXTENSION);
    }
}
