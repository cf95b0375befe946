package io.meteredbatch.runlog;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds run ids of the form {@code <batch timestamp>_<index:03d>_<sanitized identity>}.
 */
public final class RunIds {
    private static final Pattern UNSAFE = Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int MAX_IDENTITY_LENGTH = 50;

    private RunIds() {
    }

    public static String of(String batchTimestamp, int index, String identity) {
        return String.format(Locale.ROOT, "%s_%03d_%s", batchTimestamp, index, sanitize(identity));
    }

    static String sanitize(String identity) {
        String s = UNSAFE.matcher(identity).replaceAll("");
        s = SEPARATORS.matcher(s).replaceAll("-");
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') start++;
        while (end > start && s.charAt(end - 1) == '-') end--;
        s = s.substring(start, end);
        if (s.length() > MAX_IDENTITY_LENGTH) s = s.substring(0, MAX_IDENTITY_LENGTH);
        return s.toLowerCase(Locale.ROOT);
    }
}
