package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A graphics device. There must be at least one, for the video card being used.
 * A device is active when an active {@link ScreenSection} references it.
 */
@Getter
@Setter
@Accessors(chain = true)
public class DeviceSection extends Section implements Identifiable {

    private String identifier;
    private String driver;
    /**
     * Bus location of the card, e.g. {@code PCI:1:0:0}. Mandatory in multi-head setups.
     */
    private String busId;
    /**
     * Head of a multi-head card this section drives, counted from 0.
     */
    private Integer screen;

    public DeviceSection(String identifier) {
        super(SectionTag.DEVICE);
        this.identifier = identifier;
    }

    public DeviceSection(String identifier, String driver) {
        this(identifier);
        this.driver = driver;
    }

    @Override
    public boolean isRenderable() {
        return StringUtils.isNotEmpty(identifier);
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Identifier", identifier);
        entries.put("Driver", driver);
        entries.put("BusID", busId);
        entries.put("Screen", screen);
        return entries;
    }
}
