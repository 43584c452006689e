package com.starscape.photocatalog.features.device.app;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the escape sequences udev uses in volume label link names.
 */
public final class DeviceLabels {
    
    private static final Pattern HEX_ESCAPE = Pattern.compile("\\\\x([0-9a-fA-F]{2})");
    private static final Pattern OCTAL_ESCAPE = Pattern.compile("\\\\([0-7]{3})");
    
    private DeviceLabels() {
    }
    
    /**
     * Undo URL encoding, then {@code \xNN} hex escapes, then {@code \NNN} octal escapes.
     * "My\x20Photos" becomes "My Photos".
     */
    public static String sanitize(String label) {
        if (label == null) {
            return null;
        }
        String decoded = urlDecode(label);
        decoded = replaceAll(HEX_ESCAPE, decoded, digits -> (char) Integer.parseInt(digits, 16));
        return replaceAll(OCTAL_ESCAPE, decoded, digits -> (char) Integer.parseInt(digits, 8));
    }
    
    private static String urlDecode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        try {
            // '+' is a literal in label names, not an encoded space
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed percent sequence: keep the raw label
            return value;
        }
    }
    
    private static String replaceAll(Pattern pattern, String value, Function<String, Character> decoder) {
        Matcher matcher = pattern.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = String.valueOf(decoder.apply(matcher.group(1)));
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
