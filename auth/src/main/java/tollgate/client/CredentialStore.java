package tollgate.client;

import java.io.IOException;
import java.util.Optional;

/**
 * Persistence for a {@link CredentialBundle}.
 */
public interface CredentialStore {

    Optional<CredentialBundle> load() throws IOException;

    /**
     * Replace the stored bundle. The stored copy must be readable by its owner only.
     */
    void save(CredentialBundle bundle) throws IOException;

    void delete() throws IOException;
}
