package org.opensearch.migrations.artifacts.jcommander;

import java.lang.reflect.Field;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.opensearch.migrations.artifacts.arguments.ArgNameConstants;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.ParametersDelegate;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fills JCommander parameter objects from environment variables.  Each flag name maps to
 * {@code PREFIX + UPPER_SNAKE_CASE + SUFFIX}, so {@code --max-retries} with prefix
 * {@code ARTIFACT_MIGRATION_} reads {@code ARTIFACT_MIGRATION_MAX_RETRIES}.
 *
 * <p>Call this before parsing the command line so that explicit flags overwrite what came from the
 * environment.
 */
@Slf4j
public class EnvVarParameterPuller {

    public static final String DEFAULT_SUFFIX = "";
    private static final Pattern CAMEL_CASE_PATTERN = Pattern.compile("([A-Z])");

    @FunctionalInterface
    public interface EnvVarGetter {
        String getEnv(String name);
    }

    private EnvVarParameterPuller() {
        throw new IllegalStateException("EnvVarParameterPuller utility class should not be instantiated");
    }

    public static <T> T injectFromEnv(T params, String prefix) {
        return injectFromEnv(params, System::getenv, prefix, DEFAULT_SUFFIX);
    }

    public static <T> T injectFromEnv(T params, EnvVarGetter envVarGetter, String prefix) {
        return injectFromEnv(params, envVarGetter, prefix, DEFAULT_SUFFIX);
    }

    /**
     * @throws ParameterException if a variable is set to a value the field's type cannot hold
     */
    public static <T> T injectFromEnv(@NonNull T params, EnvVarGetter envVarGetter, String prefix, String suffix) {
        List<String> addedEnvParams = new ArrayList<>();
        injectFromEnvRecursive(params, envVarGetter, addedEnvParams, prefix, suffix);

        if (!addedEnvParams.isEmpty()) {
            log.atInfo().setMessage("Adding parameters from the following environment variables: {}")
                .addArgument(addedEnvParams).log();
        }
        return params;
    }

    private static void injectFromEnvRecursive(Object params,
                                               EnvVarGetter envVarGetter,
                                               List<String> addedEnvParams,
                                               String prefix,
                                               String suffix)
    {
        Class<?> clazz = params.getClass();
        while (clazz != null && clazz != Object.class) {
            for (Field field : clazz.getDeclaredFields()) {
                try {
                    if (field.isAnnotationPresent(ParametersDelegate.class)) {
                        field.setAccessible(true);
                        var delegatedObject = field.get(params);
                        if (delegatedObject != null) {
                            injectFromEnvRecursive(delegatedObject, envVarGetter, addedEnvParams, prefix, suffix);
                        }
                    } else if (field.isAnnotationPresent(Parameter.class)) {
                        field.setAccessible(true);
                        var nameAndValue = findEnvValue(field.getAnnotation(Parameter.class), envVarGetter,
                            prefix, suffix);
                        if (nameAndValue != null) {
                            setFieldValue(params, field, nameAndValue.getKey(), nameAndValue.getValue());
                            addedEnvParams.add(nameAndValue.getKey());
                        }
                    }
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Could not access parameter field " + field.getName(), e);
                }
            }
            clazz = clazz.getSuperclass();
        }
    }

    private static Map.Entry<String, String> findEnvValue(Parameter annotation,
                                                          EnvVarGetter envVarGetter,
                                                          String prefix,
                                                          String suffix)
    {
        for (String name : annotation.names()) {
            for (var envName : toEnvVarNames(name, prefix, suffix)) {
                var envValue = envVarGetter.getEnv(envName);
                if (envValue != null) {
                    return Map.entry(envName, envValue);
                }
            }
        }
        return null;
    }

    /**
     * Environment variable names for a flag, most specific first.  Credential flags also map to the
     * unprefixed name, which is how container platforms usually inject secrets.
     */
    public static List<String> toEnvVarNames(final String argName, String prefix, String suffix) {
        String normalized = argName
            .replaceAll("^-+", "")
            .replace("-", "_");

        Matcher matcher = CAMEL_CASE_PATTERN.matcher(normalized);
        String envCase = matcher.replaceAll("_$1").toUpperCase(Locale.ROOT);
        return Stream.concat(
            Stream.of(prefix + envCase + suffix),
            (!prefix.isEmpty() || !suffix.isEmpty())
                && ArgNameConstants.POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES.matcher(argName).matches()
                ? Stream.of(envCase)
                : Stream.empty()
        ).collect(Collectors.toList());
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static void setFieldValue(Object params, Field field, String envName, String value)
        throws IllegalAccessException
    {
        Class<?> type = field.getType();
        try {
            if (type == String.class) {
                field.set(params, value);
            } else if (type == int.class || type == Integer.class) {
                field.set(params, Integer.parseInt(value.trim()));
            } else if (type == long.class || type == Long.class) {
                field.set(params, Long.parseLong(value.trim()));
            } else if (type == double.class || type == Double.class) {
                field.set(params, Double.parseDouble(value.trim()));
            } else if (type == boolean.class || type == Boolean.class) {
                field.set(params, Boolean.parseBoolean(value.trim()));
            } else if (type == Path.class) {
                field.set(params, Path.of(value));
            } else if (type.isEnum()) {
                field.set(params, Enum.valueOf((Class<? extends Enum>) type, value.trim().toUpperCase(Locale.ROOT)));
            } else {
                log.atWarn().setMessage("Unsupported field type for environment variable injection: {} (field: {})")
                    .addArgument(type::getName).addArgument(field::getName).log();
            }
        } catch (IllegalArgumentException e) {
            throw new ParameterException("Environment variable " + envName + " has value '" + value
                + "', which is not a valid " + type.getSimpleName(), e);
        }
    }
}
