package org.ghgcalc.formula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Rewrites human-typed formula notation into the canonical syntax accepted by
 * {@link FormulaParser}.
 *
 * Supported rewrites:
 * - {@code E = expr} keeps only the text after the first {@code =}
 * - {@code \times}, {@code \cdot} become {@code *}; {@code \div} becomes {@code /}
 * - {@code \frac{A}{B}} becomes {@code (A)/(B)}
 * - {@code \sqrt{A}} becomes {@code sqrt(A)}
 * - {@code name_{i,j}} becomes {@code name_i,j}
 *
 * These are plain text rewrites over single-level braces. Anything that does
 * not match is left as typed and the parser decides whether it is valid.
 */
public final class NotationNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(NotationNormalizer.class);

    private static final Pattern FRAC = Pattern.compile("\\\\frac\\{([^}]+)\\}\\{([^}]+)\\}");
    private static final Pattern SQRT = Pattern.compile("\\\\sqrt\\{([^}]+)\\}");
    private static final Pattern BRACED_SUBSCRIPT =
            Pattern.compile("([\\p{L}_][\\p{L}\\p{N}_]*)_\\{([\\p{L}\\p{N},]+)\\}");

    private NotationNormalizer() {
        // Static utility class
    }

    /**
     * Normalizes formula text. Never throws; {@code null} normalizes to the
     * empty string.
     *
     * @param text formula text as typed, possibly {@code name = expression}
     * @return canonical expression text
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }

        String expression = text.strip();
        int eq = expression.indexOf('=');
        if (eq >= 0) {
            expression = expression.substring(eq + 1).strip();
        }

        // Rewriting a subscript can expose a \frac or \sqrt whose argument held it,
        // so repeat until nothing changes. Every pass only shortens the text.
        String previous;
        String rewritten = expression;
        do {
            previous = rewritten;
            rewritten = rewriteOnce(previous);
        } while (!rewritten.equals(previous));

        if (LOG.isDebugEnabled() && !rewritten.equals(text)) {
            LOG.debug("Normalized formula '{}' -> '{}'", text, rewritten);
        }
        return rewritten;
    }

    private static String rewriteOnce(String text) {
        String result = text
                .replace("\\times", "*")
                .replace("\\cdot", "*")
                .replace("\\div", "/");
        result = FRAC.matcher(result).replaceAll("($1)/($2)");
        result = SQRT.matcher(result).replaceAll("sqrt($1)");
        result = BRACED_SUBSCRIPT.matcher(result).replaceAll("$1_$2");
        return result;
    }
}
