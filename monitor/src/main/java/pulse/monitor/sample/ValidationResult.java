package pulse.monitor.sample;

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.collect.ImmutableList;

public class ValidationResult {

    private static final ValidationResult VALID = new ValidationResult(Collections.emptyList());

    private final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = ImmutableList.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(List<String> errors) {
        return errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("valid", isValid());
        tsb.append("errors", errors);
        return tsb.toString();
    }
}
