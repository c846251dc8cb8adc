package xorgconf;

import lombok.Getter;
import xorgconf.sections.Identifiable;
import xorgconf.sections.Section;

/**
 * Thrown when a document contains a section that lacks a required field.
 */
@Getter
public class IncompleteSectionException extends IllegalStateException {

    private final transient Section section;

    public IncompleteSectionException(Section section) {
        super(String.format("%s section %s is missing required fields", section.getTag(), describe(section)));
        this.section = section;
    }

    static String describe(Section section) {
        if (section instanceof Identifiable) {
            String identifier = ((Identifiable) section).getIdentifier();
            return identifier == null ? "<no identifier>" : "\"" + identifier + "\"";
        }
        return "<unnamed>";
    }
}
