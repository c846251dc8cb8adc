package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds a {@link DeviceSection} to a {@link MonitorSection}. Both are referenced by identifier.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ScreenSection extends Section implements Identifiable {

    private String identifier;
    private DeviceSection device;
    private MonitorSection monitor;
    private Integer defaultDepth;
    private Boolean accel;

    public ScreenSection(String identifier) {
        super(SectionTag.SCREEN);
        this.identifier = identifier;
    }

    @Override
    public boolean isRenderable() {
        return StringUtils.isNotEmpty(identifier)
                && device != null && StringUtils.isNotEmpty(device.getIdentifier())
                && monitor != null && StringUtils.isNotEmpty(monitor.getIdentifier());
    }

    @Override
    public List<Section> getReferences() {
        List<Section> references = new ArrayList<>();
        if (device != null) {
            references.add(device);
        }
        if (monitor != null) {
            references.add(monitor);
        }
        return references;
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Identifier", identifier);
        entries.put("Device", device == null ? null : device.getIdentifier());
        entries.put("Monitor", monitor == null ? null : monitor.getIdentifier());
        entries.put("DefaultDepth", defaultDepth);
        return entries;
    }

    @Override
    protected Map<String, Object> fieldOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("Accel", accel);
        return options;
    }
}
