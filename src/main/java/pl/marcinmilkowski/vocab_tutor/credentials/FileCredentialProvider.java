package pl.marcinmilkowski.vocab_tutor.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Properties;

/**
 * Stores the key in a properties file, readable by the owner only where the file system allows it.
 */
public class FileCredentialProvider implements CredentialProvider {

    private static final Logger logger = LoggerFactory.getLogger(FileCredentialProvider.class);

    static final String KEY_PROPERTY = "dictionary_api_key";

    private final Path file;

    public FileCredentialProvider(Path file) {
        this.file = file;
    }

    @Override
    public synchronized Optional<String> get() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            logger.warn("Could not read credential file {}", file, e);
            return Optional.empty();
        }
        String key = props.getProperty(KEY_PROPERTY);
        return key == null || key.isBlank() ? Optional.empty() : Optional.of(key);
    }

    @Override
    public synchronized boolean set(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        Properties props = new Properties();
        props.setProperty(KEY_PROPERTY, key.strip());
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = createOwnerOnlyTempFile(parent);
            try {
                try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                    props.store(writer, "vocab-tutor credentials");
                }
                replaceWith(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
            logger.info("Stored API key in {}", file);
            return true;
        } catch (IOException e) {
            logger.error("Could not write credential file {}", file, e);
            return false;
        }
    }

    @Override
    public synchronized void clear() {
        try {
            if (Files.deleteIfExists(file)) {
                logger.info("Removed API key from {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete credential file " + file, e);
        }
    }

    // the key is never on disk with wider permissions than rw-------
    private static Path createOwnerOnlyTempFile(Path dir) throws IOException {
        if (Files.getFileStore(dir).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return Files.createTempFile(dir, ".credentials", ".tmp",
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------")));
        }
        logger.debug("POSIX permissions not supported in {}", dir);
        return Files.createTempFile(dir, ".credentials", ".tmp");
    }

    private void replaceWith(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
