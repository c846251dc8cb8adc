package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A monitor. The relative placement options (LeftOf, RightOf, Above, Below) take the
 * identifier of another monitor.
 */
@Getter
@Setter
@Accessors(chain = true)
public class MonitorSection extends Section implements Identifiable {

    private String identifier;
    private String modeLine;
    private Boolean primary;
    private String preferredMode;
    private Integer positionX;
    private Integer positionY;
    private String leftOf;
    private String rightOf;
    private String above;
    private String below;
    private Boolean enable;
    private Boolean ignore;
    /**
     * One of {@code normal}, {@code left}, {@code right} or {@code inverted}.
     */
    private String rotate;

    public MonitorSection(String identifier) {
        super(SectionTag.MONITOR);
        this.identifier = identifier;
    }

    @Override
    public boolean isRenderable() {
        return StringUtils.isNotEmpty(identifier);
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Identifier", identifier);
        entries.put("ModeLine", modeLine);
        return entries;
    }

    @Override
    protected Map<String, Object> fieldOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("Primary", primary);
        options.put("PreferredMode", preferredMode);
        options.put("LeftOf", leftOf);
        options.put("RightOf", rightOf);
        options.put("Above", above);
        options.put("Below", below);
        options.put("Enable", enable);
        options.put("Ignore", ignore);
        options.put("Rotate", rotate);
        if (positionX != null && positionY != null) {
            options.put("Position", positionX + " " + positionY);
        }
        return options;
    }
}
