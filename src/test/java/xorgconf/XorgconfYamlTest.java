package xorgconf;

import org.junit.jupiter.api.Test;
import xorgconf.sections.DeviceSection;
import xorgconf.sections.ScreenSection;
import xorgconf.sections.SectionTag;

import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XorgconfYamlTest {

    private static final String INPUT_1 = "src/test/resources/xorgconf/input_1.yaml";
    private static final String INPUT_2 = "src/test/resources/xorgconf/input_2.yaml";
    private static final String EXPECTED_1 = "src/test/resources/xorgconf/expected_1.conf";
    private static final String EXPECTED_2 = "src/test/resources/xorgconf/expected_2.conf";

    private final XorgconfYaml xorgconfYaml = new XorgconfYaml();

    @Test
    void loadsDescriptor() throws Exception {
        var conf = xorgconfYaml.load(Paths.get(INPUT_1));

        var expected = Files.readString(Paths.get(EXPECTED_1));
        assertEquals(expected, conf.render().orElseThrow());
    }

    @Test
    void loadsOptionsCustomLinesAndSequences() throws Exception {
        var conf = xorgconfYaml.load(Files.readString(Paths.get(INPUT_2)));

        var expected = Files.readString(Paths.get(EXPECTED_2));
        assertEquals(expected, conf.render().orElseThrow());
        assertTrue(conf.validate().isEmpty());
    }

    @Test
    void resolvesReferencesToDeclaredSections() {
        var conf = xorgconfYaml.load("sections:\n" +
                "  - type: Device\n" +
                "    identifier: card0\n" +
                "  - type: Monitor\n" +
                "    identifier: monitor0\n" +
                "  - type: Screen\n" +
                "    identifier: screen0\n" +
                "    device: card0\n" +
                "    monitor: monitor0\n");

        var screen = (ScreenSection) conf.getSection(SectionTag.SCREEN, "screen0").orElseThrow();
        assertSame(conf.getSection(SectionTag.DEVICE, "card0").orElseThrow(), screen.getDevice());
        assertEquals("monitor0", screen.getMonitor().getIdentifier());
    }

    @Test
    void blankDescriptorGivesEmptyDocument() {
        assertTrue(xorgconfYaml.load("").getSections().isEmpty());
        assertTrue(xorgconfYaml.load("# nothing here\n").getSections().isEmpty());
        assertTrue(xorgconfYaml.load("sections: []\n").render().isEmpty());
    }

    @Test
    void keepsIncompleteSections() {
        var conf = xorgconfYaml.load("sections:\n" +
                "  - type: device\n" +
                "    driver: vesa\n");

        var device = (DeviceSection) conf.getSections().get(0);
        assertEquals("vesa", device.getDriver());
        assertThrows(IncompleteSectionException.class, conf::render);
    }

    @Test
    void rejectsReferenceToUndeclaredSection() {
        var e = assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n" +
                "  - type: Screen\n" +
                "    identifier: screen0\n" +
                "    device: card0\n"));

        assertEquals("Section #0: Device \"card0\" is not declared before this section", e.getMessage());
    }

    @Test
    void rejectsUnknownType() {
        var e = assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n" +
                "  - type: Keyboard\n"));

        assertEquals("Section #0: Unknown section type: Keyboard", e.getMessage());
    }

    @Test
    void rejectsUnknownField() {
        var e = assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n" +
                "  - type: DRI\n" +
                "  - type: Module\n" +
                "    loads: [glx]\n"));

        assertEquals("Section #1: Unknown field 'loads'", e.getMessage());
    }

    @Test
    void rejectsWronglyTypedValue() {
        var e = assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n" +
                "  - type: ServerFlags\n" +
                "    blankTime: soon\n"));

        assertEquals("Section #0: 'blankTime' must be an integer, got soon", e.getMessage());
    }

    @Test
    void rejectsNestedOptionValue() {
        var e = assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n" +
                "  - type: Device\n" +
                "    identifier: card0\n" +
                "    options:\n" +
                "      AccelMethod:\n" +
                "        a: b\n"));

        assertEquals("Section #0: 'options.AccelMethod' must be a scalar or sequence, got {a=b}", e.getMessage());
    }

    @Test
    void rejectsMalformedRoot() {
        assertThrows(DescriptorException.class, () -> xorgconfYaml.load("- type: DRI\n"));
        assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections: DRI\n"));
        assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections:\n  - DRI\n"));
        assertThrows(DescriptorException.class, () -> xorgconfYaml.load("sections: [\n"));
    }
}
