package com.newsdigest.backend.similarity;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.util.DigestUtils;

/**
 * Strips the noise news titles carry so that syndicated copies of one story compare equal.
 */
public final class TextNormalizer {

    private static final List<Pattern> NOISE_PATTERNS = List.of(
            Pattern.compile("\\s*\\|\\s*[^|]*$"),     // " | Source Name" suffix
            Pattern.compile("\\s+-\\s+[^-]*$"),       // " - Source Name" suffix
            Pattern.compile("^\\s*\\w+:\\s*"),        // "City:" prefix
            Pattern.compile("\\s*\\([^)]*\\)\\s*"),   // parenthetical
            Pattern.compile("\\s*\\[[^\\]]*\\]\\s*")  // bracketed
    );
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : NOISE_PATTERNS) {
            String stripped = pattern.matcher(normalized).replaceAll(" ");
            // A pattern that would eat the whole title is noise detection gone wrong
            if (!stripped.isBlank()) {
                normalized = stripped;
            }
        }
        normalized = NON_WORD.matcher(normalized).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Lowercase, strip punctuation and collapse whitespace, without the title-specific noise rules.
     */
    public static String normalizeBody(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Quick exact-duplicate key: normalized title plus source.
     */
    public static String fingerprint(String title, String source) {
        String key = normalize(title) + "|" + (source != null ? source.trim().toLowerCase(Locale.ROOT) : "unknown");
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8));
    }
}
