package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ties screens and input devices together into one layout.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ServerLayoutSection extends Section implements Identifiable {

    private String identifier;
    private List<ScreenSection> screens = new ArrayList<>();
    private List<InputDeviceSection> inputDevices = new ArrayList<>();

    public ServerLayoutSection(String identifier) {
        super(SectionTag.SERVER_LAYOUT);
        this.identifier = identifier;
    }

    public ServerLayoutSection addScreen(ScreenSection screen) {
        screens.add(Validate.notNull(screen, "screen"));
        return this;
    }

    public ServerLayoutSection addInputDevice(InputDeviceSection inputDevice) {
        inputDevices.add(Validate.notNull(inputDevice, "input device"));
        return this;
    }

    @Override
    public boolean isRenderable() {
        return StringUtils.isNotEmpty(identifier)
                && screens != null && !screens.isEmpty()
                && allNamed(screens) && (inputDevices == null || allNamed(inputDevices));
    }

    // Every referenced section must be nameable, otherwise its line would silently disappear.
    private static boolean allNamed(List<? extends Identifiable> sections) {
        return sections.stream()
                .allMatch(section -> section != null && StringUtils.isNotEmpty(section.getIdentifier()));
    }

    @Override
    public List<Section> getReferences() {
        List<Section> references = new ArrayList<>();
        if (screens != null) {
            references.addAll(screens);
        }
        if (inputDevices != null) {
            references.addAll(inputDevices);
        }
        references.removeIf(Objects::isNull);
        return references;
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Identifier", identifier);
        entries.put("Screen", identifiersOf(screens));
        entries.put("InputDevice", identifiersOf(inputDevices));
        return entries;
    }

    private static List<String> identifiersOf(List<? extends Identifiable> sections) {
        if (sections == null) {
            return new ArrayList<>();
        }
        return sections.stream()
                .filter(Objects::nonNull)
                .map(Identifiable::getIdentifier)
                .collect(Collectors.toList());
    }
}
