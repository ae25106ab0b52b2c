package ai.cv.composer.config;

import java.util.Optional;

/**
 * Looks up configuration values by environment variable name.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of the variable, empty when it is unset or blank.
     */
    default Optional<String> nonBlank(String key) {
        return get(key).map(String::strip).filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
