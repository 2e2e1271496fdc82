package com.mimecast.listrunner.directory.files;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.MailingList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilesListDirectoryTest {

    @TempDir
    Path root;

    private FilesListDirectory directory;

    @BeforeEach
    void setUp() throws IOException {
        TestLists.install(root.resolve("lists"));
        directory = new FilesListDirectory(root.resolve("lists"), TestLists.HOSTNAME);
    }

    @Test
    void resolvesList() throws IOException {
        MailingList list = directory.resolve(" Test ").orElseThrow();

        assertEquals("test", list.getName());
        assertEquals("test@lists.example.com", list.getPostingAddress());
        assertEquals("test-bounces@lists.example.com", list.getBouncesAddress());
        assertEquals("test-request@lists.example.com", list.getRequestAddress());
        assertEquals("test-owner@lists.example.com", list.getOwnerAddress());
        assertEquals("Test <test.lists.example.com>", list.getListId());
        assertEquals(List.of("owner@example.com", "moderator@example.com"), list.getModerationRecipients());
        assertEquals(4, list.getRoster().members().size());
    }

    @Test
    void unknownOrInvalidNames() throws IOException {
        assertTrue(directory.resolve("nosuch").isEmpty());
        assertTrue(directory.resolve("../test").isEmpty());
        assertTrue(directory.resolve("").isEmpty());
        assertTrue(directory.resolve(null).isEmpty());
    }

    @Test
    void listNamesNeedPolicy() throws IOException {
        Files.createDirectories(root.resolve("lists").resolve("empty"));
        Files.createDirectories(root.resolve("lists").resolve("another"));
        Files.writeString(root.resolve("lists").resolve("another").resolve(FilesListDirectory.POLICY_FILE), "{}");

        assertEquals(List.of("another", "test"), directory.listNames());
    }

    @Test
    void missingListsDir() throws IOException {
        assertTrue(new FilesListDirectory(root.resolve("none"), TestLists.HOSTNAME).listNames().isEmpty());
    }
}
