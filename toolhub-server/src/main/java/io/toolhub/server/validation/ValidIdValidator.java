package io.toolhub.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.regex.Pattern;

/// Checks strings against the identifier pattern of {@link ValidId}.
///
/// @see ValidId
public class ValidIdValidator implements ConstraintValidator<ValidId, String> {

    private static final Pattern ID_PATTERN = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._-]{0,254}");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return isValidId(value);
    }

    /// Checks an identifier outside of Bean Validation.
    ///
    /// @param value the candidate, may be null
    /// @return `true` if the value matches the identifier pattern
    public static boolean isValidId(String value) {
        return value != null && !value.isBlank() && ID_PATTERN.matcher(value).matches();
    }
}
