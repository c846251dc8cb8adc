package xorgconf.sections;

import java.util.Collections;
import java.util.Map;

/**
 * A single input device, e.g. a keyboard or mouse, usually referenced from a
 * {@link ServerLayoutSection}.
 */
public class InputDeviceSection extends InputSection {

    public InputDeviceSection(String identifier) {
        this(identifier, null);
    }

    public InputDeviceSection(String identifier, String driver) {
        super(SectionTag.INPUT_DEVICE, identifier, driver);
    }

    @Override
    public InputDeviceSection setIdentifier(String identifier) {
        super.setIdentifier(identifier);
        return this;
    }

    @Override
    public InputDeviceSection setDriver(String driver) {
        super.setDriver(driver);
        return this;
    }

    @Override
    public InputDeviceSection setProperties(InputProperties properties) {
        super.setProperties(properties);
        return this;
    }

    @Override
    protected Map<String, Object> extraEntries() {
        return Collections.emptyMap();
    }
}
