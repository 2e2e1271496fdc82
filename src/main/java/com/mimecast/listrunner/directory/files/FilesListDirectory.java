package com.mimecast.listrunner.directory.files;

import com.mimecast.listrunner.bounce.FileBounceLedger;
import com.mimecast.listrunner.config.list.ListConfig;
import com.mimecast.listrunner.directory.ListDirectory;
import com.mimecast.listrunner.directory.MailingList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * List directory backed by one folder per list.
 *
 * <p>Layout under {@code <listsDir>/<name>/}:
 * <ul>
 *     <li>{@code list.json5} list policy.</li>
 *     <li>{@code members.json} roster.</li>
 *     <li>{@code bounces/} bounce ledger.</li>
 * </ul>
 */
public class FilesListDirectory implements ListDirectory {
    private static final Logger log = LogManager.getLogger(FilesListDirectory.class);

    public static final String POLICY_FILE = "list.json5";
    private static final Pattern VALID_NAME = Pattern.compile("^[a-z0-9][a-z0-9._-]*$");

    private final Path listsDir;
    private final String hostname;

    /**
     * Constructs a new FilesListDirectory instance.
     *
     * @param listsDir Lists root directory.
     * @param hostname Site host name.
     */
    public FilesListDirectory(Path listsDir, String hostname) {
        this.listsDir = listsDir;
        this.hostname = hostname;
    }

    @Override
    public Optional<MailingList> resolve(String name) throws IOException {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (!VALID_NAME.matcher(normalized).matches()) {
            log.debug("Invalid list name: {}", name);
            return Optional.empty();
        }

        Path listDir = listsDir.resolve(normalized);
        Path policyFile = listDir.resolve(POLICY_FILE);
        if (!Files.isRegularFile(policyFile)) {
            return Optional.empty();
        }

        ListConfig policy = new ListConfig(policyFile.toString());
        return Optional.of(new MailingList(normalized, hostname, policy,
                new FileRoster(listDir), new FileBounceLedger(listDir.resolve(FileBounceLedger.DIRECTORY))));
    }

    @Override
    public List<String> listNames() throws IOException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(listsDir)) {
            return names;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(listsDir)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path.resolve(POLICY_FILE))) {
                    names.add(path.getFileName().toString());
                }
            }
        }
        Collections.sort(names);
        return names;
    }
}
