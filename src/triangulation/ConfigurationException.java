package triangulation;

/**
 * Invalid triangulation settings. Fatal: stops the whole pass.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
