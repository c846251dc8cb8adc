package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server extension modules to load or to keep from being loaded.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ModuleSection extends Section {

    private List<String> load = new ArrayList<>();
    private List<String> disable = new ArrayList<>();

    public ModuleSection() {
        super(SectionTag.MODULE);
    }

    public ModuleSection addLoad(String module) {
        load.add(module);
        return this;
    }

    public ModuleSection addDisable(String module) {
        disable.add(module);
        return this;
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("Load", load);
        entries.put("Disable", disable);
        return entries;
    }
}
