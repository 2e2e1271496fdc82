package com.mimecast.listrunner.entry;

/**
 * No list of the given name exists.
 */
public class UnknownListException extends Exception {

    /**
     * Constructs a new UnknownListException instance.
     *
     * @param listName List name.
     */
    public UnknownListException(String listName) {
        super("No such list: " + listName);
    }
}
