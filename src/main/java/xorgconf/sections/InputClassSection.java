package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies input options to every hotplugged device matching all of the set Match* predicates.
 * String predicates accept {@code |}-separated alternatives.
 */
@Getter
@Setter
@Accessors(chain = true)
public class InputClassSection extends InputSection {

    private String matchProduct;
    private String matchVendor;
    private String matchDevicePath;
    private String matchOs;
    private String matchPnpId;
    private String matchUsbId;
    private String matchDriver;
    private String matchTag;
    private String matchLayout;
    private Boolean matchIsKeyboard;
    private Boolean matchIsPointer;
    private Boolean matchIsJoystick;
    private Boolean matchIsTablet;
    private Boolean matchIsTouchpad;
    private Boolean matchIsTouchscreen;
    /**
     * Makes the server skip matching devices entirely.
     */
    private Boolean ignore;

    public InputClassSection(String identifier) {
        this(identifier, null);
    }

    public InputClassSection(String identifier, String driver) {
        super(SectionTag.INPUT_CLASS, identifier, driver);
    }

    @Override
    public InputClassSection setIdentifier(String identifier) {
        super.setIdentifier(identifier);
        return this;
    }

    @Override
    public InputClassSection setDriver(String driver) {
        super.setDriver(driver);
        return this;
    }

    @Override
    public InputClassSection setProperties(InputProperties properties) {
        super.setProperties(properties);
        return this;
    }

    @Override
    protected Map<String, Object> extraEntries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("MatchProduct", matchProduct);
        entries.put("MatchVendor", matchVendor);
        entries.put("MatchDevicePath", matchDevicePath);
        entries.put("MatchOS", matchOs);
        entries.put("MatchPnPID", matchPnpId);
        entries.put("MatchUSBID", matchUsbId);
        entries.put("MatchDriver", matchDriver);
        entries.put("MatchTag", matchTag);
        entries.put("MatchLayout", matchLayout);
        entries.put("MatchIsKeyboard", matchIsKeyboard);
        entries.put("MatchIsPointer", matchIsPointer);
        entries.put("MatchIsJoystick", matchIsJoystick);
        entries.put("MatchIsTablet", matchIsTablet);
        entries.put("MatchIsTouchpad", matchIsTouchpad);
        entries.put("MatchIsTouchscreen", matchIsTouchscreen);
        return entries;
    }

    @Override
    protected Map<String, Object> fieldOptions() {
        Map<String, Object> options = new LinkedHashMap<>(super.fieldOptions());
        options.put("Ignore", ignore);
        return options;
    }
}
