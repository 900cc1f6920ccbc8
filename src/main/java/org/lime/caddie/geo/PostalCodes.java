package org.lime.caddie.geo;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PostalCodes {

    private static final Pattern EMBEDDED = Pattern.compile("\\b(\\d{5})(?:-\\d{4})?\\b");
    private static final Pattern WHOLE = Pattern.compile("^\\s*(\\d{5})(?:-\\d{4})?\\s*$");

    private PostalCodes() {
    }

    public static Optional<String> find(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = EMBEDDED.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static boolean containsPostalCode(String text) {
        return find(text).isPresent();
    }

    public static boolean isPostalCode(String text) {
        return text != null && WHOLE.matcher(text).matches();
    }
}
