package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File and directory locations used by the server.
 */
@Getter
@Setter
@Accessors(chain = true)
public class FilesSection extends Section {

    /**
     * Font directories, searched in order. Each one becomes its own FontPath line.
     */
    private List<String> fontPaths = new ArrayList<>();
    /**
     * Comma-separated directories searched for loadable modules.
     */
    private String modulePath;
    private String xkbDir;

    public FilesSection() {
        super(SectionTag.FILES);
    }

    public FilesSection addFontPath(String fontPath) {
        fontPaths.add(fontPath);
        return this;
    }

    @Override
    protected Map<String, Object> entries() {
        Map<String, Object> entries = new LinkedHashMap<>();
        entries.put("FontPath", fontPaths);
        entries.put("ModulePath", modulePath);
        entries.put("XkbDir", xkbDir);
        return entries;
    }
}
