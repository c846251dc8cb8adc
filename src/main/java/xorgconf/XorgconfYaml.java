package xorgconf;

import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import xorgconf.sections.DeviceSection;
import xorgconf.sections.DriSection;
import xorgconf.sections.FilesSection;
import xorgconf.sections.InputClassSection;
import xorgconf.sections.InputDeviceSection;
import xorgconf.sections.InputSection;
import xorgconf.sections.ModuleSection;
import xorgconf.sections.MonitorSection;
import xorgconf.sections.ScreenSection;
import xorgconf.sections.Section;
import xorgconf.sections.SectionTag;
import xorgconf.sections.ServerFlagsSection;
import xorgconf.sections.ServerLayoutSection;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds an {@link Xorgconf} from a YAML descriptor:
 * <pre>
 * sections:
 *   - type: Device
 *     identifier: card0
 *     driver: modesetting
 *   - type: Screen
 *     identifier: screen0
 *     device: card0
 *     monitor: monitor0
 *     options:
 *       AccelMethod: glamor
 * </pre>
 * Fields use the lowerCamel names of the section setters. References name sections declared
 * earlier in the same descriptor; the first section with a matching identifier wins.
 */
@Slf4j
public class XorgconfYaml {

    private static final String SECTIONS = "sections";
    private static final String TYPE = "type";
    private static final String OPTIONS = "options";
    private static final String CUSTOM_LINES = "customLines";

    private final Yaml yaml;

    public XorgconfYaml() {
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    public Xorgconf load(Path path) throws IOException {
        return load(Files.readString(path, StandardCharsets.UTF_8));
    }

    public Xorgconf load(String data) {
        Xorgconf conf = new Xorgconf();
        if (data == null || data.isBlank()) {
            return conf;
        }

        Object root;
        try {
            root = yaml.load(data);
        } catch (YAMLException e) {
            throw new DescriptorException("Malformed descriptor: " + e.getMessage(), e);
        }
        if (root == null) {
            return conf;
        }
        if (!(root instanceof Map)) {
            throw new DescriptorException("Descriptor root must be a mapping");
        }

        Object sections = ((Map<?, ?>) root).get(SECTIONS);
        if (sections == null) {
            return conf;
        }
        if (!(sections instanceof List)) {
            throw new DescriptorException("'" + SECTIONS + "' must be a sequence");
        }

        List<?> items = (List<?>) sections;
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map)) {
                throw new DescriptorException("Section #" + i + " must be a mapping");
            }
            Fields fields = new Fields(i, (Map<?, ?>) items.get(i));
            conf.addSection(toSection(fields, conf));
        }
        log.debug("Loaded {} sections from descriptor", items.size());
        return conf;
    }

    private Section toSection(Fields fields, Xorgconf conf) {
        String type = fields.requiredString(TYPE);
        SectionTag tag;
        try {
            tag = SectionTag.of(type);
        } catch (IllegalArgumentException e) {
            throw fields.error(e.getMessage());
        }

        Section section;
        switch (tag) {
            case DEVICE:
                section = device(fields);
                break;
            case MONITOR:
                section = monitor(fields);
                break;
            case SCREEN:
                section = screen(fields, conf);
                break;
            case SERVER_LAYOUT:
                section = serverLayout(fields, conf);
                break;
            case INPUT_DEVICE:
                section = inputProperties(fields,
                        new InputDeviceSection(fields.string("identifier"), fields.string("driver")));
                break;
            case INPUT_CLASS:
                section = inputClass(fields);
                break;
            case FILES:
                section = new FilesSection()
                        .setFontPaths(fields.strings("fontPaths"))
                        .setModulePath(fields.string("modulePath"))
                        .setXkbDir(fields.string("xkbDir"));
                break;
            case MODULE:
                section = new ModuleSection()
                        .setLoad(fields.strings("load"))
                        .setDisable(fields.strings("disable"));
                break;
            case DRI:
                section = new DriSection().setMode(fields.string("mode"));
                break;
            case SERVER_FLAGS:
                section = serverFlags(fields);
                break;
            default:
                throw fields.error("Unsupported section type " + tag);
        }

        section.setOptions(fields.options(OPTIONS));
        section.setCustomLines(fields.strings(CUSTOM_LINES));
        fields.checkAllConsumed();
        return section;
    }

    private static DeviceSection device(Fields fields) {
        return new DeviceSection(fields.string("identifier"), fields.string("driver"))
                .setBusId(fields.string("busId"))
                .setScreen(fields.integer("screen"));
    }

    private static MonitorSection monitor(Fields fields) {
        return new MonitorSection(fields.string("identifier"))
                .setModeLine(fields.string("modeLine"))
                .setPrimary(fields.bool("primary"))
                .setPreferredMode(fields.string("preferredMode"))
                .setPositionX(fields.integer("positionX"))
                .setPositionY(fields.integer("positionY"))
                .setLeftOf(fields.string("leftOf"))
                .setRightOf(fields.string("rightOf"))
                .setAbove(fields.string("above"))
                .setBelow(fields.string("below"))
                .setEnable(fields.bool("enable"))
                .setIgnore(fields.bool("ignore"))
                .setRotate(fields.string("rotate"));
    }

    private static ScreenSection screen(Fields fields, Xorgconf conf) {
        ScreenSection screen = new ScreenSection(fields.string("identifier"))
                .setDefaultDepth(fields.integer("defaultDepth"))
                .setAccel(fields.bool("accel"));
        String device = fields.string("device");
        if (device != null) {
            screen.setDevice(resolve(fields, conf, SectionTag.DEVICE, device, DeviceSection.class));
        }
        String monitor = fields.string("monitor");
        if (monitor != null) {
            screen.setMonitor(resolve(fields, conf, SectionTag.MONITOR, monitor, MonitorSection.class));
        }
        return screen;
    }

    private static ServerLayoutSection serverLayout(Fields fields, Xorgconf conf) {
        ServerLayoutSection layout = new ServerLayoutSection(fields.string("identifier"));
        for (String screen : fields.strings("screens")) {
            layout.addScreen(resolve(fields, conf, SectionTag.SCREEN, screen, ScreenSection.class));
        }
        for (String inputDevice : fields.strings("inputDevices")) {
            layout.addInputDevice(resolve(fields, conf, SectionTag.INPUT_DEVICE, inputDevice, InputDeviceSection.class));
        }
        return layout;
    }

    private static InputClassSection inputClass(Fields fields) {
        InputClassSection inputClass = new InputClassSection(fields.string("identifier"), fields.string("driver"))
                .setMatchProduct(fields.string("matchProduct"))
                .setMatchVendor(fields.string("matchVendor"))
                .setMatchDevicePath(fields.string("matchDevicePath"))
                .setMatchOs(fields.string("matchOs"))
                .setMatchPnpId(fields.string("matchPnpId"))
                .setMatchUsbId(fields.string("matchUsbId"))
                .setMatchDriver(fields.string("matchDriver"))
                .setMatchTag(fields.string("matchTag"))
                .setMatchLayout(fields.string("matchLayout"))
                .setMatchIsKeyboard(fields.bool("matchIsKeyboard"))
                .setMatchIsPointer(fields.bool("matchIsPointer"))
                .setMatchIsJoystick(fields.bool("matchIsJoystick"))
                .setMatchIsTablet(fields.bool("matchIsTablet"))
                .setMatchIsTouchpad(fields.bool("matchIsTouchpad"))
                .setMatchIsTouchscreen(fields.bool("matchIsTouchscreen"))
                .setIgnore(fields.bool("ignore"));
        return inputProperties(fields, inputClass);
    }

    private static <T extends InputSection> T inputProperties(Fields fields, T section) {
        section.getProperties()
                .setAutoServerLayout(fields.bool("autoServerLayout"))
                .setFloating(fields.bool("floating"))
                .setTransformationMatrix(fields.string("transformationMatrix"))
                .setAccelerationProfile(fields.integer("accelerationProfile"))
                .setConstantDeceleration(fields.decimal("constantDeceleration"))
                .setAdaptiveDeceleration(fields.decimal("adaptiveDeceleration"))
                .setAccelerationScheme(fields.string("accelerationScheme"))
                .setAccelerationNumerator(fields.integer("accelerationNumerator"))
                .setAccelerationDenominator(fields.integer("accelerationDenominator"))
                .setAccelerationThreshold(fields.integer("accelerationThreshold"));
        return section;
    }

    private static ServerFlagsSection serverFlags(Fields fields) {
        return new ServerFlagsSection()
                .setDefaultServerLayout(fields.string("defaultServerLayout"))
                .setNoTrapSignals(fields.bool("noTrapSignals"))
                .setUseSigio(fields.bool("useSigio"))
                .setDontVtSwitch(fields.bool("dontVtSwitch"))
                .setDontZap(fields.bool("dontZap"))
                .setDontZoom(fields.bool("dontZoom"))
                .setDisableVidModeExtension(fields.bool("disableVidModeExtension"))
                .setAllowNonLocalXvidtune(fields.bool("allowNonLocalXvidtune"))
                .setAllowMouseOpenFail(fields.bool("allowMouseOpenFail"))
                .setBlankTime(fields.integer("blankTime"))
                .setStandbyTime(fields.integer("standbyTime"))
                .setSuspendTime(fields.integer("suspendTime"))
                .setOffTime(fields.integer("offTime"))
                .setPixmap(fields.integer("pixmap"))
                .setNoPm(fields.bool("noPm"))
                .setXinerama(fields.bool("xinerama"))
                .setAiglx(fields.bool("aiglx"))
                .setDri2(fields.bool("dri2"))
                .setGlxVisuals(fields.string("glxVisuals"))
                .setUseDefaultFontPath(fields.bool("useDefaultFontPath"))
                .setIgnoreAbi(fields.bool("ignoreAbi"))
                .setAutoAddDevices(fields.bool("autoAddDevices"))
                .setAutoEnableDevices(fields.bool("autoEnableDevices"))
                .setLog(fields.string("log"))
                .setDpms(fields.bool("dpms"));
    }

    private static <T extends Section> T resolve(Fields fields, Xorgconf conf, SectionTag tag,
                                                 String identifier, Class<T> type) {
        return conf.getSection(tag, identifier)
                .map(type::cast)
                .orElseThrow(() -> fields.error(String.format("%s \"%s\" is not declared before this section",
                        tag, identifier)));
    }

    /**
     * Typed access to the keys of one section mapping. Keys that are never read are reported as unknown.
     */
    private static final class Fields {
        private final int index;
        private final Map<?, ?> values;
        private final Set<Object> consumed = new HashSet<>();

        Fields(int index, Map<?, ?> values) {
            this.index = index;
            this.values = values;
        }

        String requiredString(String key) {
            String value = string(key);
            if (value == null) {
                throw error("'" + key + "' is required");
            }
            return value;
        }

        String string(String key) {
            Object value = get(key);
            if (value == null || value instanceof String) {
                return (String) value;
            }
            throw typeError(key, "a string", value);
        }

        Integer integer(String key) {
            Object value = get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Integer) {
                return (Integer) value;
            }
            if (value instanceof Long && (Long) value >= Integer.MIN_VALUE && (Long) value <= Integer.MAX_VALUE) {
                return ((Long) value).intValue();
            }
            throw typeError(key, "an integer", value);
        }

        Double decimal(String key) {
            Object value = get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            throw typeError(key, "a number", value);
        }

        Boolean bool(String key) {
            Object value = get(key);
            if (value == null || value instanceof Boolean) {
                return (Boolean) value;
            }
            throw typeError(key, "a boolean", value);
        }

        List<String> strings(String key) {
            Object value = get(key);
            List<String> result = new ArrayList<>();
            if (value == null) {
                return result;
            }
            if (value instanceof String) {
                result.add((String) value);
                return result;
            }
            if (!(value instanceof List)) {
                throw typeError(key, "a sequence of strings", value);
            }
            for (Object element : (List<?>) value) {
                if (!(element instanceof String)) {
                    throw typeError(key, "a sequence of strings", value);
                }
                result.add((String) element);
            }
            return result;
        }

        // A key without a value declares a valueless option.
        Map<String, Object> options(String key) {
            Object value = get(key);
            Map<String, Object> result = new LinkedHashMap<>();
            if (value == null) {
                return result;
            }
            if (!(value instanceof Map)) {
                throw typeError(key, "a mapping", value);
            }
            for (Map.Entry<?, ?> option : ((Map<?, ?>) value).entrySet()) {
                String name = String.valueOf(option.getKey());
                Object optionValue = option.getValue() == null ? "" : option.getValue();
                if (optionValue instanceof Map || (optionValue instanceof List
                        && ((List<?>) optionValue).stream().anyMatch(e -> e instanceof Map || e instanceof List))) {
                    throw typeError(key + "." + name, "a scalar or sequence", optionValue);
                }
                result.put(name, optionValue);
            }
            return result;
        }

        void checkAllConsumed() {
            for (Object key : values.keySet()) {
                if (!consumed.contains(key)) {
                    throw error("Unknown field '" + key + "'");
                }
            }
        }

        DescriptorException error(String message) {
            return new DescriptorException("Section #" + index + ": " + message);
        }

        private Object get(String key) {
            consumed.add(key);
            return values.get(key);
        }

        private DescriptorException typeError(String key, String expected, Object actual) {
            return error(String.format("'%s' must be %s, got %s", key, expected, actual));
        }
    }
}
