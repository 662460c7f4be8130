package com.lineguard.pipeline;

import com.lineguard.common.TextNormalizer;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Checks {@link ItemName} against the same normalization catalog matching uses.
 */
public class ItemNameValidator implements ConstraintValidator<ItemName, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || value.isBlank() || !TextNormalizer.normalize(value).isEmpty();
    }
}
