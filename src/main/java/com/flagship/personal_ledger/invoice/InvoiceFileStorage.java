package com.flagship.personal_ledger.invoice;

import java.io.IOException;
import java.util.UUID;

/**
 * Where invoice images live. The ledger only keeps the returned path.
 */
public interface InvoiceFileStorage {

    /**
     * @return storage path to keep on the invoice row
     */
    String store(UUID ownerId, String filename, byte[] content) throws IOException;

    /**
     * Removes a stored file. A missing file is not an error.
     */
    void delete(String storagePath) throws IOException;
}
