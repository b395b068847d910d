package io.simpledb.util;

import org.apache.commons.lang.StringUtils;

public class ExtraStringUtil {
    /**
     * Strips one pair of surrounding quote characters, if {@code s} is quoted by {@code quote} on both ends.
     * A doubled quote inside is unescaped to a single one.
     */
    public static String unquote(String s, char quote) {
        if (s != null && s.length() >= 2 && s.charAt(0) == quote && s.charAt(s.length() - 1) == quote) {
            String q = String.valueOf(quote);
            return StringUtils.replace(s.substring(1, s.length() - 1), q + q, q);
        }
        return s;
    }
}
