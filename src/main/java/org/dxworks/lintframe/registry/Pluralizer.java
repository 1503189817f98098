package org.dxworks.lintframe.registry;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * English pluralisation of snake_cased class names, the way framework table names are derived.
 */
public final class Pluralizer {

    private static final Map<String, String> IRREGULAR = Map.ofEntries(
            Map.entry("person", "people"),
            Map.entry("man", "men"),
            Map.entry("woman", "women"),
            Map.entry("child", "children"),
            Map.entry("tooth", "teeth"),
            Map.entry("foot", "feet"),
            Map.entry("mouse", "mice"),
            Map.entry("goose", "geese"),
            Map.entry("ox", "oxen"),
            Map.entry("criterion", "criteria"),
            Map.entry("cactus", "cacti"),
            Map.entry("quiz", "quizzes")
    );

    private static final Set<String> UNCOUNTABLE = Set.of(
            "equipment", "information", "rice", "money", "species", "series", "fish", "sheep",
            "news", "data", "feedback", "metadata", "deer", "moose", "police", "staff", "traffic"
    );

    private static final Set<String> F_TO_VES = Set.of("knife", "wife", "life", "leaf", "half", "wolf", "shelf", "calf", "thief");

    private Pluralizer() {
    }

    /** {@code UserProfile} becomes {@code user_profiles}; {@code Person} becomes {@code people}. */
    public static String tableName(String className) {
        String snake = snakeCase(className);
        int idx = snake.lastIndexOf('_');
        String head = idx >= 0 ? snake.substring(0, idx + 1) : "";
        String last = idx >= 0 ? snake.substring(idx + 1) : snake;
        return head + plural(last);
    }

    public static String snakeCase(String studly) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < studly.length(); i++) {
            char c = studly.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = studly.charAt(i - 1);
                boolean nextLower = i + 1 < studly.length() && Character.isLowerCase(studly.charAt(i + 1));
                if (Character.isLowerCase(prev) || Character.isDigit(prev)
                        || (Character.isUpperCase(prev) && nextLower)) {
                    sb.append('_');
                }
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    public static String plural(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || UNCOUNTABLE.contains(lower)) return lower;
        String irregular = IRREGULAR.get(lower);
        if (irregular != null) return irregular;
        if (lower.endsWith("us")) return lower + "es";
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
                || lower.endsWith("ch") || lower.endsWith("sh")) {
            return lower + "es";
        }
        if (lower.endsWith("y") && lower.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        if (F_TO_VES.contains(lower)) {
            return lower.endsWith("fe")
                    ? lower.substring(0, lower.length() - 2) + "ves"
                    : lower.substring(0, lower.length() - 1) + "ves";
        }
        return lower + "s";
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
