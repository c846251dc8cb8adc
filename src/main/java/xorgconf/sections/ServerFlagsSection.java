package xorgconf.sections;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global server options. Everything here is an {@code Option} line.
 * Times are in minutes.
 */
@Getter
@Setter
@Accessors(chain = true)
public class ServerFlagsSection extends Section {

    private String defaultServerLayout;
    private Boolean noTrapSignals;
    private Boolean useSigio;
    private Boolean dontVtSwitch;
    private Boolean dontZap;
    private Boolean dontZoom;
    private Boolean disableVidModeExtension;
    private Boolean allowNonLocalXvidtune;
    private Boolean allowMouseOpenFail;
    private Integer blankTime;
    private Integer standbyTime;
    private Integer suspendTime;
    private Integer offTime;
    /**
     * Pixmap bits per pixel for depth 24, 24 or 32.
     */
    private Integer pixmap;
    private Boolean noPm;
    private Boolean xinerama;
    private Boolean aiglx;
    private Boolean dri2;
    /**
     * One of {@code minimal}, {@code typical} or {@code all}.
     */
    private String glxVisuals;
    private Boolean useDefaultFontPath;
    private Boolean ignoreAbi;
    private Boolean autoAddDevices;
    private Boolean autoEnableDevices;
    private String log;
    private Boolean dpms;

    public ServerFlagsSection() {
        super(SectionTag.SERVER_FLAGS);
    }

    @Override
    protected Map<String, Object> entries() {
        return Collections.emptyMap();
    }

    @Override
    protected Map<String, Object> fieldOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("DefaultServerLayout", defaultServerLayout);
        options.put("NoTrapSignals", noTrapSignals);
        options.put("UseSIGIO", useSigio);
        options.put("DontVTSwitch", dontVtSwitch);
        options.put("DontZap", dontZap);
        options.put("DontZoom", dontZoom);
        options.put("DisableVidModeExtension", disableVidModeExtension);
        options.put("AllowNonLocalXvidtune", allowNonLocalXvidtune);
        options.put("AllowMouseOpenFail", allowMouseOpenFail);
        options.put("BlankTime", blankTime);
        options.put("StandbyTime", standbyTime);
        options.put("SuspendTime", suspendTime);
        options.put("OffTime", offTime);
        options.put("Pixmap", pixmap);
        options.put("NoPM", noPm);
        options.put("Xinerama", xinerama);
        options.put("AIGLX", aiglx);
        options.put("DRI2", dri2);
        options.put("GlxVisuals", glxVisuals);
        options.put("UseDefaultFontPath", useDefaultFontPath);
        options.put("IgnoreABI", ignoreAbi);
        options.put("AutoAddDevices", autoAddDevices);
        options.put("AutoEnableDevices", autoEnableDevices);
        options.put("Log", log);
        options.put("DPMS", dpms);
        return options;
    }
}
