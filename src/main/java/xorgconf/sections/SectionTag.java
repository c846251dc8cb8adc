package xorgconf.sections;

import lombok.Getter;

/**
 * Section kinds understood by the xorg.conf parser.
 */
@Getter
public enum SectionTag {
    DEVICE("Device"),
    MONITOR("Monitor"),
    SCREEN("Screen"),
    SERVER_LAYOUT("ServerLayout"),
    INPUT_DEVICE("InputDevice"),
    INPUT_CLASS("InputClass"),
    FILES("Files"),
    MODULE("Module"),
    DRI("DRI"),
    SERVER_FLAGS("ServerFlags");

    private final String text;

    SectionTag(String text) {
        this.text = text;
    }

    public static SectionTag of(String text) {
        for (SectionTag tag : values()) {
            if (tag.text.equalsIgnoreCase(text)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("Unknown section type: " + text);
    }

    @Override
    public String toString() {
        return text;
    }
}
