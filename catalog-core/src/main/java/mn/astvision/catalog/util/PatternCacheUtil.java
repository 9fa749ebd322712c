package mn.astvision.catalog.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * @author zorigtbaatar
 */

public class PatternCacheUtil {
    private static final int MAX_CACHE_SIZE = 500;

    private static final Map<String, Pattern> CACHE = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
            return size() > MAX_CACHE_SIZE;
        }
    });

    private PatternCacheUtil() {
    }

    /**
     * Returns a cached Pattern instance for the given regex and flags.
     *
     * @param regex the regular expression string
     * @param flags pattern compilation flags (e.g., Pattern.CASE_INSENSITIVE)
     * @return compiled Pattern instance (cached)
     * @throws java.util.regex.PatternSyntaxException if the regex is invalid
     */
    public static Pattern get(String regex, int flags) {
        if (regex == null) {
            throw new IllegalArgumentException("Regex must not be null");
        }
        return CACHE.computeIfAbsent(flags + "::" + regex, k -> Pattern.compile(regex, flags));
    }

    public static void clearCache() {
        CACHE.clear();
    }

    public static int cacheSize() {
        return CACHE.size();
    }
}
