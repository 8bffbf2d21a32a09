package io.repokeeper.core.repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import static java.util.Locale.ENGLISH;

public class ModelValidator
{
    public static ModelValidator builder()
    {
        return new ModelValidator();
    }

    private static final Pattern COMPONENT_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.+\\-]*$");
    private static final Pattern DISTRIBUTION_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.+\\-/]*$");

    private final List<ModelValidationException.Failure> failures = new ArrayList<>();

    private ModelValidator()
    { }

    public ModelValidator error(String fieldName, Object object, String errorMessage)
    {
        failures.add(new ModelValidationException.Failure(fieldName, object, errorMessage));
        return this;
    }

    public ModelValidator check(String fieldName, Object object, boolean expression, String errorMessage)
    {
        if (!expression) {
            error(fieldName, object, errorMessage);
        }
        return this;
    }

    public ModelValidator check(String fieldName, Object object, boolean expression, String errorMessageFormat, Object... args)
    {
        if (!expression) {
            error(fieldName, object, String.format(ENGLISH, errorMessageFormat, args));
        }
        return this;
    }

    public ModelValidator checkNotEmpty(String fieldName, String value)
    {
        return check(fieldName, value, !value.isEmpty(), "must not be blank");
    }

    public ModelValidator checkNotEmpty(String fieldName, Collection<?> values)
    {
        return check(fieldName, null, !values.isEmpty(), "must not be empty");
    }

    public ModelValidator checkMaxLength(String fieldName, String value, int max)
    {
        return check(fieldName, value, value.length() <= max, "must not be longer than " + max + " characters");
    }

    public ModelValidator checkUnique(String fieldName, Collection<String> values)
    {
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (!seen.add(value)) {
                error(fieldName, value, "must not be given twice");
            }
        }
        return this;
    }

    public ModelValidator checkComponentName(String fieldName, String value)
    {
        checkNotEmpty(fieldName, value);
        if (!value.isEmpty()) {
            check(fieldName, value, COMPONENT_NAME.matcher(value).matches(),
                    "must consist of letters, digits and _ . + - and start with a letter or digit");
        }
        return checkMaxLength(fieldName, value, 255);
    }

    public ModelValidator checkDistributionName(String fieldName, String value)
    {
        checkNotEmpty(fieldName, value);
        if (!value.isEmpty()) {
            check(fieldName, value, DISTRIBUTION_NAME.matcher(value).matches(),
                    "must consist of letters, digits and _ . + - / and start with a letter or digit");
            check(fieldName, value, !value.contains(".."), "must not contain '..'");
        }
        return checkMaxLength(fieldName, value, 255);
    }

    /**
     * Publish prefix relative to the storage root. "." is the root itself.
     */
    public ModelValidator checkPrefix(String fieldName, String value)
    {
        checkNotEmpty(fieldName, value);
        check(fieldName, value, !value.startsWith("/"), "must be a relative path");
        check(fieldName, value, value.equals(".") || !value.endsWith("/"), "must not end with '/'");
        for (String segment : value.split("/")) {
            if (segment.equals("..")) {
                error(fieldName, value, "must not contain '..' segment");
                break;
            }
        }
        return checkMaxLength(fieldName, value, 255);
    }

    public void validate(String modelType, Object modelObject)
    {
        if (!failures.isEmpty()) {
            throw new ModelValidationException("Validating " + modelType + " failed", modelObject, failures);
        }
    }
}
