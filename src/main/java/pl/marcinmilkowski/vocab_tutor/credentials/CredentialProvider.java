package pl.marcinmilkowski.vocab_tutor.credentials;

import java.util.Optional;

/**
 * Storage for the external dictionary API key.
 */
public interface CredentialProvider {

    Optional<String> get();

    /**
     * Store a key, replacing any existing one.
     *
     * @return false if the key was rejected or could not be stored
     */
    boolean set(String key);

    void clear();
}
