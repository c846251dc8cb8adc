package xorgconf.sections;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One {@code Section "<tag>" ... EndSection} block of an xorg.conf.
 * <p>
 * Every section carries free-form options and custom lines next to the structured entries
 * supplied by the concrete variant. A block is rendered as the opening tag, the entries,
 * the options, the custom lines and the closing tag, in that order.
 */
@Slf4j
public abstract class Section {

    private static final String END_SECTION = "EndSection";

    @Getter
    private final SectionTag tag;
    private final Map<String, Object> options = new LinkedHashMap<>();
    private final List<String> customLines = new ArrayList<>();

    Section(SectionTag tag) {
        this.tag = Validate.notNull(tag, "tag");
    }

    /**
     * Stores an option. A {@code null} value leaves the store untouched, an empty string
     * produces a valueless option.
     */
    public Section addOption(String name, Object value) {
        Validate.notNull(name, "option name");
        if (value != null) {
            options.put(name, value);
        }
        return this;
    }

    public Object getOption(String name) {
        return options.get(name);
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public Section setOptions(Map<String, ?> options) {
        Map<String, Object> replacement = new LinkedHashMap<>();
        if (options != null) {
            for (Map.Entry<String, ?> option : options.entrySet()) {
                Validate.notNull(option.getKey(), "option name");
                if (option.getValue() != null) {
                    replacement.put(option.getKey(), option.getValue());
                }
            }
        }
        this.options.clear();
        this.options.putAll(replacement);
        return this;
    }

    public Section addCustomLine(String customLine) {
        Validate.notNull(customLine, "custom line");
        customLines.add(customLine);
        return this;
    }

    public List<String> getCustomLines() {
        return Collections.unmodifiableList(customLines);
    }

    public Section setCustomLines(List<String> customLines) {
        List<String> replacement = new ArrayList<>();
        if (customLines != null) {
            for (String customLine : customLines) {
                replacement.add(Validate.notNull(customLine, "custom line"));
            }
        }
        this.customLines.clear();
        this.customLines.addAll(replacement);
        return this;
    }

    /**
     * Whether every field the X server requires for this kind of section is set.
     */
    public boolean isRenderable() {
        return true;
    }

    /**
     * Sections this one names in its entries. They are not rendered as part of this block.
     */
    public List<Section> getReferences() {
        return Collections.emptyList();
    }

    /**
     * Renders the block, or returns empty when a required field is missing.
     */
    public Optional<String> render() {
        if (!isRenderable()) {
            log.debug("{} section is missing required fields, not rendering", tag);
            return Optional.empty();
        }

        StringBuilder out = new StringBuilder();
        out.append("Section \"").append(tag.getText()).append('"').append(EntryFormatter.LINE_SEPARATOR);

        for (Map.Entry<String, Object> entry : entries().entrySet()) {
            EntryFormatter.appendEntry(out, entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, Object> option : mergedOptions().entrySet()) {
            EntryFormatter.appendOption(out, option.getKey(), option.getValue());
        }
        for (String customLine : customLines) {
            EntryFormatter.appendLine(out, customLine);
        }

        out.append(END_SECTION).append(EntryFormatter.LINE_SEPARATOR);
        return Optional.of(out.toString());
    }

    /**
     * Structured entries in output order. Unset values are kept in the map and skipped on output.
     */
    protected abstract Map<String, Object> entries();

    /**
     * Typed fields the variant renders as {@code Option} lines, in output order.
     */
    protected Map<String, Object> fieldOptions() {
        return Collections.emptyMap();
    }

    // Field options win over caller options of the same name but keep the caller's position.
    private Map<String, Object> mergedOptions() {
        Map<String, Object> merged = new LinkedHashMap<>(options);
        for (Map.Entry<String, Object> option : fieldOptions().entrySet()) {
            if (option.getValue() != null) {
                merged.put(option.getKey(), option.getValue());
            }
        }
        return merged;
    }
}
