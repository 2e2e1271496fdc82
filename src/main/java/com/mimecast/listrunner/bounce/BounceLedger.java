package com.mimecast.listrunner.bounce;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Per list store of bounce records.
 *
 * <p>Updates are atomic per member across threads and processes.
 *
 * @see FileBounceLedger
 */
public interface BounceLedger {

    /**
     * Gets record by member address.
     *
     * @param address Member address.
     * @return Optional of BounceRecord.
     * @throws IOException Unable to read.
     */
    Optional<BounceRecord> get(String address) throws IOException;

    /**
     * Gets all records.
     *
     * @return List of BounceRecord.
     * @throws IOException Unable to read.
     */
    List<BounceRecord> records() throws IOException;

    /**
     * Atomically reads, transforms and stores a record.
     * <p>The mutation receives null when no record exists and returns null to delete the record.
     *
     * @param address  Member address.
     * @param mutation Transformation.
     * @return Stored record or null when deleted.
     * @throws IOException Unable to read or write.
     */
    BounceRecord update(String address, UnaryOperator<BounceRecord> mutation) throws IOException;

    /**
     * Deletes a record.
     *
     * @param address Member address.
     * @return True if a record existed.
     * @throws IOException Unable to delete.
     */
    boolean remove(String address) throws IOException;
}
