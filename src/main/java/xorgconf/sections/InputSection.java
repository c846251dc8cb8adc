package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common part of the input sections: identifier, driver and the {@link InputProperties}.
 */
@Getter
@Setter
@Accessors(chain = true)
public abstract class InputSection extends Section implements Identifiable {

    private String identifier;
    private String driver;
    private InputProperties properties = new InputProperties();

    InputSection(SectionTag tag, String identifier, String driver) {
        super(tag);
        this.identifier = identifier;
        this.driver = driver;
    }

    public InputSection setProperties(InputProperties properties) {
        this.properties = Validate.notNull(properties, "properties");
        return this;
    }

    @Override
    public boolean isRenderable() {
        return StringUtils.isNotEmpty(identifier);
    }

    @Override
    protected final Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Identifier", identifier);
        entries.put("Driver", driver);
        entries.putAll(extraEntries());
        return entries;
    }

    @Override
    protected Map<String, Object> fieldOptions() {
        return properties.toOptions();
    }

    /**
     * Entries following Identifier and Driver.
     */
    protected abstract Map<String, Object> extraEntries();
}
