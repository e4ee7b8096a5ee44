package ai.coursedoc.transcoder.config;

import java.util.Optional;

/**
 * Reads transcoder settings from the host's environment variables.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(System.getenv(key));
    }
}
