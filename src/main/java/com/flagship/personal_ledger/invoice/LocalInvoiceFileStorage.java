package com.flagship.personal_ledger.invoice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Stores invoice files under {@code ledger.invoices.storage-root}, one
 * directory per owner.
 */
@Component
@Slf4j
public class LocalInvoiceFileStorage implements InvoiceFileStorage {

    private final Path root;

    public LocalInvoiceFileStorage(@Value("${ledger.invoices.storage-root:./invoices}") String storageRoot) {
        this.root = Path.of(storageRoot).toAbsolutePath().normalize();
    }

    @Override
    public String store(UUID ownerId, String filename, byte[] content) throws IOException {
        Path directory = root.resolve(ownerId.toString());
        Files.createDirectories(directory);
        Path target = directory.resolve(UUID.randomUUID() + "-" + sanitize(filename));
        Files.write(target, content);
        log.debug("Invoice file stored: path={}, bytes={}", target, content.length);
        return root.relativize(target).toString();
    }

    @Override
    public void delete(String storagePath) throws IOException {
        Path target = root.resolve(storagePath).normalize();
        if (!target.startsWith(root)) {
            throw new IOException("Storage path escapes the invoice root: " + storagePath);
        }
        boolean deleted = Files.deleteIfExists(target);
        log.debug("Invoice file delete: path={}, existed={}", target, deleted);
    }

    private static String sanitize(String filename) {
        if (filename == null || filename.isBlank()) {
            return "invoice";
        }
        String name = Path.of(filename).getFileName().toString();
        return name.replaceAll("[^a-zA-Z0-9._-]", "_");
    }
}
