package xorgconf;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import xorgconf.sections.SectionTag;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class ValidationIssue {
    private SectionTag tag;
    private String identifier;
    private String message;
}
