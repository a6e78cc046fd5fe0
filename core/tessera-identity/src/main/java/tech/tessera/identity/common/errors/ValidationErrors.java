package tech.tessera.identity.common.errors;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulator shared by the validation steps of one operation.
 * Steps append; nothing is thrown until {@link #throwIfAny(String)}.
 */
public final class ValidationErrors {

    private final List<FieldError> errors = new ArrayList<>();

    public ValidationErrors add(FieldError error) {
        errors.add(error);
        return this;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<FieldError> asList() {
        return List.copyOf(errors);
    }

    public void throwIfAny(String resource) {
        if (!errors.isEmpty()) {
            throw asException(resource);
        }
    }

    public CumulativeValidationException asException(String resource) {
        return new CumulativeValidationException(resource, errors);
    }
}
