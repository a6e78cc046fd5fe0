package tech.tessera.identity.common.errors;

import java.util.List;
import java.util.Map;

/**
 * Aggregate of every field error found while validating one payload.
 *
 * <p>The kind is the shared kind of all errors when they agree (only uniqueness
 * violations gives ALREADY_EXISTS, only pattern conflicts gives CONFLICTING_PATTERNS),
 * otherwise VALIDATION_FAILED.
 */
public class CumulativeValidationException extends IdentityException {

    private final List<FieldError> errors;

    public CumulativeValidationException(String resource, List<FieldError> errors) {
        this(resource, errors, kindOf(errors));
    }

    private CumulativeValidationException(String resource, List<FieldError> errors, ErrorKind kind) {
        super(kind,
            kind == ErrorKind.VALIDATION_FAILED ? "VALIDATION_FAILED" : kind.name(),
            "Validation failed for " + resource + " with " + errors.size() + " error(s)",
            Map.of("errors", errors.stream().map(FieldError::toMap).toList()));
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> errors() {
        return errors;
    }

    public boolean hasErrorFor(String field) {
        return errors.stream().anyMatch(e -> e.field().equals(field));
    }

    private static ErrorKind kindOf(List<FieldError> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A cumulative validation failure needs at least one error");
        }
        ErrorKind first = errors.get(0).kind();
        boolean homogeneous = errors.stream().allMatch(e -> e.kind() == first);
        return homogeneous ? first : ErrorKind.VALIDATION_FAILED;
    }
}
