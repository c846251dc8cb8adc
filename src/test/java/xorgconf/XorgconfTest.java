package xorgconf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xorgconf.sections.DeviceSection;
import xorgconf.sections.FilesSection;
import xorgconf.sections.InputClassSection;
import xorgconf.sections.InputDeviceSection;
import xorgconf.sections.ModuleSection;
import xorgconf.sections.MonitorSection;
import xorgconf.sections.ScreenSection;
import xorgconf.sections.Section;
import xorgconf.sections.SectionTag;
import xorgconf.sections.ServerFlagsSection;
import xorgconf.sections.ServerLayoutSection;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XorgconfTest {

    private static final String EXPECTED_1 = "src/test/resources/xorgconf/expected_1.conf";

    private final DeviceSection device = new DeviceSection("device1", "driverA").setScreen(4);
    private final MonitorSection monitor = new MonitorSection("monitor1").setPrimary(true).setEnable(false);
    private final ScreenSection screen = new ScreenSection("screen1").setDevice(device).setMonitor(monitor);

    @Test
    void emptyDocumentRendersNothing() {
        assertTrue(new Xorgconf().render().isEmpty());
    }

    @Test
    void rendersSectionsInRegistrationOrder() {
        var conf = new Xorgconf()
                .addSection(device)
                .addSection(monitor)
                .addSection(screen);

        var actual = conf.render().orElseThrow();

        assertEquals("Section \"Device\"\n" +
                "  Identifier \"device1\"\n" +
                "  Driver \"driverA\"\n" +
                "  Screen \"4\"\n" +
                "EndSection\n" +
                "\n" +
                "Section \"Monitor\"\n" +
                "  Identifier \"monitor1\"\n" +
                "  Option \"Primary\" \"true\"\n" +
                "  Option \"Enable\" \"false\"\n" +
                "EndSection\n" +
                "\n" +
                "Section \"Screen\"\n" +
                "  Identifier \"screen1\"\n" +
                "  Device \"device1\"\n" +
                "  Monitor \"monitor1\"\n" +
                "EndSection\n" +
                "\n", actual);
    }

    @Test
    void rendersFullDocument() throws Exception {
        var conf = fullDocument();

        var expected = Files.readString(Paths.get(EXPECTED_1));
        var actual = conf.render().orElseThrow();
        assertEquals(expected, actual);
        assertEquals(actual, conf.render().orElseThrow());
    }

    @Test
    void everySectionIsClosedOnce() {
        var actual = fullDocument().render().orElseThrow();

        var lines = actual.lines().toArray(String[]::new);
        var opened = 0;
        var closed = 0;
        for (String line : lines) {
            if (line.startsWith("Section \"")) {
                assertEquals(opened, closed);
                opened++;
            } else if (line.equals("EndSection")) {
                closed++;
                assertEquals(opened, closed);
            }
        }
        assertEquals(8, opened);
        assertEquals(8, closed);
    }

    @Test
    void referencedSectionsAreNotRenderedImplicitly() {
        var actual = new Xorgconf().addSection(screen).render().orElseThrow();

        assertFalse(actual.contains("Section \"Device\""));
        assertFalse(actual.contains("Section \"Monitor\""));
        assertTrue(actual.contains("  Device \"device1\"\n"));
    }

    @Test
    void incompleteSectionFailsWholeDocument() {
        var conf = new Xorgconf()
                .addSection(device)
                .addSection(new ScreenSection("screen1").setDevice(device));

        var e = assertThrows(IncompleteSectionException.class, conf::render);
        assertEquals(SectionTag.SCREEN, e.getSection().getTag());
        assertEquals("Screen section \"screen1\" is missing required fields", e.getMessage());
    }

    @Test
    void getSectionsFiltersByTagAndIdentifier() {
        var second = new ScreenSection("screen2").setDevice(device).setMonitor(monitor);
        var module = new ModuleSection().addLoad("glx");
        var conf = new Xorgconf()
                .addSection(screen)
                .addSection(device)
                .addSection(module)
                .addSection(second);

        assertEquals(List.of(screen, second), conf.getSections(SectionTag.SCREEN, null));
        assertEquals(List.of(second), conf.getSections(SectionTag.SCREEN, "screen2"));
        assertEquals(List.of(device), conf.getSections(null, "device1"));
        assertEquals(List.of(screen, device, module, second), conf.getSections(null, null));
        assertTrue(conf.getSections(SectionTag.DEVICE, "screen2").isEmpty());
        assertTrue(conf.getSections(SectionTag.MODULE, "glx").isEmpty());
    }

    @Test
    void getSectionReturnsFirstMatch() {
        var duplicate = new DeviceSection("device1", "driverB");
        var conf = new Xorgconf()
                .addSection(device)
                .addSection(duplicate);

        assertSame(device, conf.getSection(SectionTag.DEVICE, "device1").orElseThrow());
        assertTrue(conf.getSection(SectionTag.MONITOR, null).isEmpty());
    }

    @Test
    void setSectionsReplacesContent() {
        var conf = new Xorgconf().addSection(device);
        conf.setSections(List.of(monitor, screen));

        assertEquals(List.of(monitor, screen), conf.getSections());
    }

    @Test
    void setSectionsAcceptsOwnView() {
        var conf = new Xorgconf()
                .addSection(device)
                .addSection(monitor);

        conf.setSections(conf.getSections());

        assertEquals(List.of(device, monitor), conf.getSections());
    }

    @Test
    void setSectionsWithNullKeepsContent() {
        var conf = new Xorgconf().addSection(device);
        var replacement = new ArrayList<Section>();
        replacement.add(monitor);
        replacement.add(null);

        assertThrows(NullPointerException.class, () -> conf.setSections(replacement));
        assertEquals(List.of(device), conf.getSections());
    }

    @Test
    void writesRenderedDocument(@TempDir Path dir) throws Exception {
        var target = dir.resolve("xorg.conf");
        var conf = fullDocument();

        assertEquals(WriteResult.WRITTEN, conf.write(target));
        assertEquals(Files.readString(Paths.get(EXPECTED_1)), Files.readString(target));
    }

    @Test
    void emptyDocumentIsNotWritten(@TempDir Path dir) throws Exception {
        var target = dir.resolve("xorg.conf");

        assertEquals(WriteResult.NOTHING_TO_WRITE, new Xorgconf().write(target));
        assertFalse(Files.exists(target));
    }

    @Test
    void writeFailureIsPropagated(@TempDir Path dir) {
        var target = dir.resolve("missing").resolve("xorg.conf");
        var conf = new Xorgconf().addSection(device);

        assertThrows(IOException.class, () -> conf.write(target));
    }

    @Test
    void validateReportsIncompleteSectionsAndDanglingReferences() {
        var orphan = new MonitorSection("orphan");
        var broken = new ScreenSection("broken").setDevice(device).setMonitor(orphan);
        var layout = new ServerLayoutSection(null);
        var conf = new Xorgconf()
                .addSection(device)
                .addSection(broken)
                .addSection(layout)
                .addSection(new FilesSection());

        var issues = conf.validate();

        assertEquals(2, issues.size());
        assertEquals(SectionTag.SCREEN, issues.get(0).getTag());
        assertEquals("broken", issues.get(0).getIdentifier());
        assertEquals("references Monitor section \"orphan\" which is not part of the document", issues.get(0).getMessage());
        assertEquals(SectionTag.SERVER_LAYOUT, issues.get(1).getTag());
        assertEquals("missing required fields", issues.get(1).getMessage());
    }

    @Test
    void validDocumentHasNoIssues() {
        assertTrue(fullDocument().validate().isEmpty());
    }

    private Xorgconf fullDocument() {
        var inputDevice1 = new InputDeviceSection("inputDevice1", "driverB");
        inputDevice1.getProperties().setFloating(true);
        var inputDevice2 = new InputDeviceSection("inputDevice2", "driverC");
        inputDevice2.getProperties().setAutoServerLayout(false);
        var inputClass = new InputClassSection("inputClass1").setMatchIsTouchscreen(true);
        inputClass.getProperties().setAdaptiveDeceleration(1.5);
        var layout = new ServerLayoutSection("layout1")
                .addScreen(screen)
                .addInputDevice(inputDevice1)
                .addInputDevice(inputDevice2);
        var flags = new ServerFlagsSection()
                .setDefaultServerLayout("layout1")
                .setDontZap(false)
                .setDontVtSwitch(true)
                .setBlankTime(5);

        return new Xorgconf()
                .addSection(device)
                .addSection(monitor)
                .addSection(screen)
                .addSection(inputDevice1)
                .addSection(inputDevice2)
                .addSection(inputClass)
                .addSection(layout)
                .addSection(flags);
    }
}
