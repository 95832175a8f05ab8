package org.logicsolver.solver;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import java.util.Locale;

/**
 * Tunable behaviour of the lexer and the parser.
 * <p>
 * Bound from the {@code logic-solver} block of the configuration:
 * <pre>
 * logic-solver {
 *   lexer {
 *     bare-equals = "error"               # or "skip"
 *     multi-character-identifiers = false
 *   }
 *   parser {
 *     lenient-reduction = false
 *   }
 * }
 * </pre>
 *
 * @param bareEquals What the lexer does with a '=' that is not followed by '>'.
 * @param multiCharacterIdentifiers Whether a run of letters forms one variable name.
 * @param lenientReduction Whether a binary operator with a single operand is accepted by the parser.
 */
public record SolverOptions(
        BareEqualsPolicy bareEquals,
        boolean multiCharacterIdentifiers,
        boolean lenientReduction
) {

    /** The configuration path of the solver block. */
    public static final String CONFIG_PATH = "logic-solver";

    /**
     * What the lexer does with a '=' that does not start '=>'.
     */
    public enum BareEqualsPolicy {
        /** Raise a lex error. */
        ERROR,
        /** Skip the character and report a warning. */
        SKIP
    }

    /**
     * Returns the strict defaults: bare '=' is an error, identifiers are single letters
     * and degenerate reductions are parse errors.
     * @return The default options.
     */
    public static SolverOptions defaults() {
        return new SolverOptions(BareEqualsPolicy.ERROR, false, false);
    }

    /**
     * Binds the options from a configuration. Missing keys fall back to {@link #defaults()}.
     * @param config The root configuration.
     * @return The bound options.
     * @throws ConfigException.BadValue if {@code bare-equals} is not a known policy.
     */
    public static SolverOptions fromConfig(Config config) {
        SolverOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config solverConfig = config.getConfig(CONFIG_PATH);

        BareEqualsPolicy bareEquals = defaults.bareEquals();
        if (solverConfig.hasPath("lexer.bare-equals")) {
            String value = solverConfig.getString("lexer.bare-equals");
            try {
                bareEquals = BareEqualsPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(solverConfig.origin(), CONFIG_PATH + ".lexer.bare-equals",
                        "Expected 'error' or 'skip' but got '" + value + "'", e);
            }
        }
        boolean multiCharacterIdentifiers = solverConfig.hasPath("lexer.multi-character-identifiers")
                ? solverConfig.getBoolean("lexer.multi-character-identifiers")
                : defaults.multiCharacterIdentifiers();
        boolean lenientReduction = solverConfig.hasPath("parser.lenient-reduction")
                ? solverConfig.getBoolean("parser.lenient-reduction")
                : defaults.lenientReduction();

        return new SolverOptions(bareEquals, multiCharacterIdentifiers, lenientReduction);
    }
}
