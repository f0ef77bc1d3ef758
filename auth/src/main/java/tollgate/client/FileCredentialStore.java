package tollgate.client;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

/**
 * Stores the credential bundle as JSON in a single owner-only file.
 *
 * <p>A save writes a temporary file that is created with mode 0600 in the target directory and
 * then renamed over the target, so the token file never exists with broader permissions. The
 * directory is created with, or tightened to, mode 0700.
 */
public class FileCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(FileCredentialStore.class);

    static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");
    static final Set<PosixFilePermission> OWNER_ONLY_DIRECTORY = PosixFilePermissions.fromString("rwx------");

    private final Path file;
    private final ObjectMapper objectMapper;
    private final boolean posix;

    public FileCredentialStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.objectMapper = objectMapper;
        this.posix = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
        if (!posix) {
            LOG.warnv("File system does not support POSIX permissions; {0} relies on the user profile ACLs", file);
        }
    }

    public Path file() {
        return file;
    }

    @Override
    public Optional<CredentialBundle> load() throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        if (posix && !OWNER_ONLY_FILE.containsAll(Files.getPosixFilePermissions(file))) {
            LOG.warnv("Token file {0} is readable by other users; tightening to 0600", file);
            Files.setPosixFilePermissions(file, OWNER_ONLY_FILE);
        }
        return Optional.of(objectMapper.readValue(file.toFile(), CredentialBundle.class));
    }

    @Override
    public void save(CredentialBundle bundle) throws IOException {
        final var directory = file.getParent();
        ensureOwnerOnlyDirectory(directory);

        final var temp = posix
                ? Files.createTempFile(
                        directory, ".tokens-", ".tmp", PosixFilePermissions.asFileAttribute(OWNER_ONLY_FILE))
                : Files.createTempFile(directory, ".tokens-", ".tmp");
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(bundle));
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        LOG.debugv("Saved credentials to {0}", file);
    }

    @Override
    public void delete() throws IOException {
        if (Files.deleteIfExists(file)) {
            LOG.infov("Deleted credentials at {0}", file);
        }
    }

    private void ensureOwnerOnlyDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            if (posix) {
                Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(OWNER_ONLY_DIRECTORY));
            } else {
                Files.createDirectories(directory);
            }
            return;
        }
        if (posix && !OWNER_ONLY_DIRECTORY.containsAll(Files.getPosixFilePermissions(directory))) {
            LOG.warnv("Token directory {0} is accessible by other users; tightening to 0700", directory);
            Files.setPosixFilePermissions(directory, OWNER_ONLY_DIRECTORY);
        }
    }
}
