package com.mimecast.listrunner.directory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves list names to their policy, roster and bounce ledger.
 *
 * @see com.mimecast.listrunner.directory.files.FilesListDirectory
 */
public interface ListDirectory {

    /**
     * Resolves a list.
     *
     * @param name List name.
     * @return Optional of MailingList, empty if no such list.
     * @throws IOException Unable to read the list definition.
     */
    Optional<MailingList> resolve(String name) throws IOException;

    /**
     * Gets the names of all lists.
     *
     * @return List of names.
     * @throws IOException Unable to enumerate.
     */
    List<String> listNames() throws IOException;
}
