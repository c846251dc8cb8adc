package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access permissions of the DRI device, e.g. mode {@code 0666}.
 */
@Getter
@Setter
@Accessors(chain = true)
public class DriSection extends Section {

    private String mode;

    public DriSection() {
        super(SectionTag.DRI);
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Mode", mode);
        return entries;
    }
}
