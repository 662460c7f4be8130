package com.lineguard.pipeline;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Item name that still has text once normalized, so "-" or "• " alone is not a name.
 * Null and blank are left to {@code @NotBlank}.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = ItemNameValidator.class)
public @interface ItemName {

    String message() default "must contain more than list markers";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
