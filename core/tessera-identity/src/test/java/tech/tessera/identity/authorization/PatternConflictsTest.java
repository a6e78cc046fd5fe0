package tech.tessera.identity.authorization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.tessera.identity.common.errors.ErrorKind;
import tech.tessera.identity.common.errors.FieldError;
import tech.tessera.identity.common.errors.ValidationErrors;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for allow/deny conflict detection.
 */
class PatternConflictsTest {

    private static List<AccessPattern.Rbac> rbac(String... texts) throws MalformedPatternException {
        List<AccessPattern.Rbac> patterns = new ArrayList<>();
        for (String text : texts) {
            patterns.add(AccessPattern.Rbac.parse(text));
        }
        return patterns;
    }

    @Test
    @DisplayName("findConflicts should not report a narrower deny under a wildcard allow")
    void findConflicts_shouldNotReportCarveOut_whenDenyIsNarrower() throws MalformedPatternException {
        List<AccessPattern.Rbac> conflicts = PatternConflicts.findConflicts(
            rbac("blog.posts.*"), rbac("blog.posts.delete"));

        assertThat(conflicts).isEmpty();
    }

    @Test
    @DisplayName("findConflicts should report a pattern present in both sets once")
    void findConflicts_shouldReportSharedPatternOnce() throws MalformedPatternException {
        List<AccessPattern.Rbac> conflicts = PatternConflicts.findConflicts(
            rbac("blog.posts.delete", "*.blog.posts.delete", "users.read.*"),
            rbac("blog.posts.delete"));

        assertThat(conflicts).containsExactly(new AccessPattern.Rbac("*", "blog", "posts", "delete"));
    }

    @Test
    @DisplayName("findConflicts should be symmetric as a set")
    void findConflicts_shouldBeSymmetric() throws MalformedPatternException {
        List<AccessPattern.Rbac> allow = rbac("a.b.c", "x.y.z", "*.users.read.*");
        List<AccessPattern.Rbac> deny = rbac("*.users.read.*", "a.b.c", "q.r.s");

        assertThat(new HashSet<>(PatternConflicts.findConflicts(allow, deny)))
            .isEqualTo(new HashSet<>(PatternConflicts.findConflicts(deny, allow)));
    }

    @Test
    @DisplayName("validate should add a conflicting pattern error per conflict")
    void validate_shouldAddConflictError_whenSetsOverlap() {
        ValidationErrors errors = new ValidationErrors();

        PatternConflicts.validate(List.of("blog.posts.delete"), List.of("blog.posts.delete"),
            AccessPattern.Rbac::parse, errors);

        assertThat(errors.asList()).singleElement().satisfies(error -> {
            assertThat(error.code()).isEqualTo("CONFLICTING_PATTERN");
            assertThat(error.kind()).isEqualTo(ErrorKind.CONFLICTING_PATTERNS);
            assertThat(error.value()).isEqualTo("*.blog.posts.delete");
        });
    }

    @Test
    @DisplayName("validate should report malformed entries with their index")
    void validate_shouldReportMalformedEntries_withIndex() {
        ValidationErrors errors = new ValidationErrors();

        PatternConflicts.validate(List.of("users.read.*", "broken"), List.of("a..b"),
            AccessPattern.Ubac::parse, errors);

        assertThat(errors.asList()).extracting(FieldError::field)
            .containsExactly("permissions[1]", "forbidden[0]");
        assertThat(errors.asList()).extracting(FieldError::code).containsOnly("MALFORMED_PATTERN");
    }

    @Test
    @DisplayName("validate should accept null lists")
    void validate_shouldAcceptNullLists() {
        ValidationErrors errors = new ValidationErrors();

        PatternConflicts.validate(null, null, AccessPattern.Ubac::parse, errors);

        assertThat(errors.isEmpty()).isTrue();
    }
}
