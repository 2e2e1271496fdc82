package com.mimecast.listrunner.directory.files;

import com.mimecast.listrunner.TestLists;
import com.mimecast.listrunner.directory.DeliveryStatus;
import com.mimecast.listrunner.directory.Member;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileRosterTest {

    @TempDir
    Path root;

    private FileRoster roster;

    @BeforeEach
    void setUp() throws IOException {
        roster = new FileRoster(TestLists.install(root.resolve("lists")));
    }

    @Test
    void lookupIgnoresCase() throws IOException {
        Member bob = roster.getMember("Bob@Example.COM").orElseThrow();

        assertTrue(bob.isModerated());
        assertTrue(roster.getMember("carol@example.com").orElseThrow().isDigest());
        assertFalse(roster.getMember("dave@example.com").orElseThrow().isEnabled());
        assertFalse(roster.isMember("nobody@example.com"));
    }

    @Test
    void addReplacesExisting() throws IOException {
        // When:
        roster.addMember(new Member("ALICE@example.com").setDigest(true));
        roster.addMember(new Member("erin@example.com"));

        // Then:
        assertEquals(5, roster.members().size());
        assertTrue(roster.getMember("alice@example.com").orElseThrow().isDigest());
        assertEquals(DeliveryStatus.ENABLED, roster.getMember("erin@example.com").orElseThrow().getDeliveryStatus());
    }

    @Test
    void removeAndStatus() throws IOException {
        assertTrue(roster.removeMember("carol@example.com"));
        assertFalse(roster.removeMember("carol@example.com"));

        assertTrue(roster.setDeliveryStatus("dave@example.com", DeliveryStatus.ENABLED));
        assertFalse(roster.setDeliveryStatus("nobody@example.com", DeliveryStatus.BY_USER));

        // Changes are visible to a fresh reader.
        FileRoster reread = new FileRoster(root.resolve("lists").resolve(TestLists.LIST));
        assertEquals(3, reread.members().size());
        assertTrue(reread.getMember("dave@example.com").orElseThrow().isEnabled());
    }

    @Test
    void corruptRosterFails() throws IOException {
        Files.writeString(root.resolve("lists").resolve(TestLists.LIST).resolve(FileRoster.MEMBERS_FILE), "[{");

        assertThrows(IOException.class, () -> roster.members());
    }

    @Test
    void missingRosterIsEmpty() throws IOException {
        assertTrue(new FileRoster(root.resolve("none")).members().isEmpty());
    }
}
