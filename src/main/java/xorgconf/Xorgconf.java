package xorgconf;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;
import xorgconf.sections.Identifiable;
import xorgconf.sections.Section;
import xorgconf.sections.SectionTag;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An xorg.conf document: sections rendered in the order they were added, separated by a blank line.
 * <p>
 * Sections referenced by other sections (a screen's device, a layout's screens) are written only
 * when they are added to the document themselves.
 */
@Slf4j
public class Xorgconf {

    private static final String SECTION_SEPARATOR = "\n";

    private final List<Section> sections = new ArrayList<>();

    public Xorgconf addSection(Section section) {
        sections.add(Validate.notNull(section, "section"));
        return this;
    }

    public Xorgconf setSections(List<? extends Section> sections) {
        List<Section> replacement = new ArrayList<>();
        if (sections != null) {
            for (Section section : sections) {
                replacement.add(Validate.notNull(section, "section"));
            }
        }
        this.sections.clear();
        this.sections.addAll(replacement);
        return this;
    }

    public List<Section> getSections() {
        return Collections.unmodifiableList(sections);
    }

    /**
     * Sections matching every non-null filter, in document order. An identifier filter never
     * matches sections without an identifier.
     */
    public List<Section> getSections(SectionTag tag, String identifier) {
        return sections.stream()
                .filter(section -> tag == null || section.getTag() == tag)
                .filter(section -> identifier == null || hasIdentifier(section, identifier))
                .collect(Collectors.toList());
    }

    public Optional<Section> getSection(SectionTag tag, String identifier) {
        return getSections(tag, identifier).stream().findFirst();
    }

    /**
     * Renders all sections.
     *
     * @return the document text, or empty when no section was added
     * @throws IncompleteSectionException if a section lacks a required field
     */
    public Optional<String> render() {
        if (sections.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder result = new StringBuilder();
        for (Section section : sections) {
            String block = section.render()
                    .orElseThrow(() -> new IncompleteSectionException(section));
            result.append(block).append(SECTION_SEPARATOR);
        }
        log.debug("Rendered {} sections", sections.size());
        return Optional.of(result.toString());
    }

    /**
     * Renders the document and writes it to {@code path}. An empty document leaves the file alone.
     *
     * @throws IOException if the file cannot be written
     * @throws IncompleteSectionException if a section lacks a required field
     */
    public WriteResult write(Path path) throws IOException {
        Validate.notNull(path, "path");
        Optional<String> rendered = render();
        if (rendered.isEmpty()) {
            log.warn("No sections to write, skipping {}", path);
            return WriteResult.NOTHING_TO_WRITE;
        }
        Files.write(path, rendered.get().getBytes(StandardCharsets.UTF_8));
        log.info("Wrote {} sections to {}", sections.size(), path);
        return WriteResult.WRITTEN;
    }

    public WriteResult write(String filename) throws IOException {
        return write(Paths.get(filename));
    }

    /**
     * Lists incomplete sections and references to sections that were never added to this document.
     */
    public List<ValidationIssue> validate() {
        Set<Section> registered = Collections.newSetFromMap(new IdentityHashMap<>());
        registered.addAll(sections);

        List<ValidationIssue> issues = new ArrayList<>();
        for (Section section : sections) {
            if (!section.isRenderable()) {
                issues.add(issue(section, "missing required fields"));
            }
            for (Section reference : section.getReferences()) {
                if (!registered.contains(reference)) {
                    issues.add(issue(section, String.format("references %s section %s which is not part of the document",
                            reference.getTag(), IncompleteSectionException.describe(reference))));
                }
            }
        }
        issues.forEach(issue -> log.warn("{} {}: {}", issue.getTag(), issue.getIdentifier(), issue.getMessage()));
        return issues;
    }

    private static ValidationIssue issue(Section section, String message) {
        return ValidationIssue.builder()
                .tag(section.getTag())
                .identifier(section instanceof Identifiable ? ((Identifiable) section).getIdentifier() : null)
                .message(message)
                .build();
    }

    private static boolean hasIdentifier(Section section, String identifier) {
        return section instanceof Identifiable
                && Objects.equals(((Identifiable) section).getIdentifier(), identifier);
    }
}
