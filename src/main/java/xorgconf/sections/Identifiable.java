package xorgconf.sections;

/**
 * A section other sections can refer to by name.
 */
public interface Identifiable {
    String getIdentifier();
}
