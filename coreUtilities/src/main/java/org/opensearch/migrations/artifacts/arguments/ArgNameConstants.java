package org.opensearch.migrations.artifacts.arguments;

import java.util.List;
import java.util.regex.Pattern;

public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    public static final String CHECKPOINT_USER_ARG_KEBAB_CASE = "--checkpoint-jdbc-user";
    public static final String CHECKPOINT_USER_ARG_CAMEL_CASE = "--checkpointJdbcUser";
    public static final String CHECKPOINT_PASSWORD_ARG_KEBAB_CASE = "--checkpoint-jdbc-password";
    public static final String CHECKPOINT_PASSWORD_ARG_CAMEL_CASE = "--checkpointJdbcPassword";

    /** Flags whose values may also come from unprefixed environment variables. */
    public static final Pattern POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES =
        Pattern.compile("--checkpoint(?:-jdbc-|Jdbc)(?:user|User|password|Password)");

    public static final List<String> CENSORED_ARGS =
        List.of(CHECKPOINT_PASSWORD_ARG_KEBAB_CASE, CHECKPOINT_PASSWORD_ARG_CAMEL_CASE);
}
