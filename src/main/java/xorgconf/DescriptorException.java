package xorgconf;

/**
 * Thrown when a YAML document descriptor cannot be turned into sections.
 */
public class DescriptorException extends IllegalArgumentException {

    public DescriptorException(String message) {
        super(message);
    }

    public DescriptorException(String message, Throwable cause) {
        super(message, cause);
    }
}
