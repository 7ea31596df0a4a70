package org.opensearch.migrations.artifacts.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Renders command lines for logging with the values of secret flags replaced.  Handles both
 * {@code --flag value} and {@code --flag=value}.
 */
public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static final String CENSORED_VALUE = "******";

    public static List<String> getRedactedArgs(String[] args) {
        return getRedactedArgs(args, ArgNameConstants.CENSORED_ARGS);
    }

    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredArgs) {
        List<String> redactedArgs = new ArrayList<>();
        boolean shouldCensorNext = false;

        for (String arg : args) {
            int equalsAt = arg.indexOf('=');
            if (shouldCensorNext) {
                redactedArgs.add(CENSORED_VALUE);
                shouldCensorNext = false;
            } else if (censoredArgs.contains(arg)) {
                redactedArgs.add(arg);
                shouldCensorNext = true;
            } else if (equalsAt > 0 && censoredArgs.contains(arg.substring(0, equalsAt))) {
                redactedArgs.add(arg.substring(0, equalsAt + 1) + CENSORED_VALUE);
            } else {
                redactedArgs.add(arg);
            }
        }

        return redactedArgs;
    }
}
