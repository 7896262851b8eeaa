package pl.marcinmilkowski.vocab_tutor.credentials;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the key for the lifetime of the process only.
 */
public class InMemoryCredentialProvider implements CredentialProvider {

    private final AtomicReference<String> key = new AtomicReference<>();

    @Override
    public Optional<String> get() {
        return Optional.ofNullable(key.get());
    }

    @Override
    public boolean set(String newKey) {
        if (newKey == null || newKey.isBlank()) {
            return false;
        }
        key.set(newKey.strip());
        return true;
    }

    @Override
    public void clear() {
        key.set(null);
    }
}
