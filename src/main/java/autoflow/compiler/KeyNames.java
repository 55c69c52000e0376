package autoflow.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical key names and combination tokens.
 *
 * <p>Recorders report keys in the spelling of their input library
 * ({@code Key.enter}, {@code Key.ctrl_l}, {@code '\x03'}). Everything downstream
 * works on the canonical form: library prefix removed, lower-cased.
 *
 * <p>Accepted spellings for combination tokens, after canonicalization and
 * removal of surrounding single quotes:
 * <ul>
 *   <li>Ctrl: {@code ctrl}, {@code ctrl_l}, {@code ctrl_r}</li>
 *   <li>Alt: {@code alt}, {@code alt_l}, {@code alt_r}, {@code alt_gr}</li>
 *   <li>Shift: {@code shift}, {@code shift_l}, {@code shift_r}</li>
 *   <li>C: {@code c}, the escaped control character {@code \x03}, the raw U+0003</li>
 *   <li>V: {@code v}, the escaped control character {@code \x16}, the raw U+0016</li>
 * </ul>
 */
public final class KeyNames {

    static final String LIBRARY_PREFIX = "key.";

    private static final Set<String> CTRL  = Set.of("ctrl", "ctrl_l", "ctrl_r");
    private static final Set<String> ALT   = Set.of("alt", "alt_l", "alt_r", "alt_gr");
    private static final Set<String> SHIFT = Set.of("shift", "shift_l", "shift_r");
    private static final Set<String> C     = Set.of("c", "\\x03", "\u0003");
    private static final Set<String> V     = Set.of("v", "\\x16", "\u0016");

    private static final Map<String, String> DISPLAY = Map.ofEntries(
            Map.entry("enter",     "Enter"),
            Map.entry("esc",       "Escape"),
            Map.entry("escape",    "Escape"),
            Map.entry("space",     "Space"),
            Map.entry("tab",       "Tab"),
            Map.entry("backspace", "Backspace"),
            Map.entry("delete",    "Delete"),
            Map.entry("up",        "↑"),
            Map.entry("down",      "↓"),
            Map.entry("left",      "←"),
            Map.entry("right",     "→"));

    private KeyNames() {}

    /**
     * Canonical key name: surrounding whitespace stripped, library prefix
     * removed, lower-cased. Control characters such as U+0003 are kept.
     * {@code "Key.enter"} becomes {@code "enter"}; null becomes the empty string.
     */
    public static String canonical(String raw) {
        if (raw == null) return "";
        String key = raw.strip();
        if (key.toLowerCase(Locale.ROOT).startsWith(LIBRARY_PREFIX)) {
            key = key.substring(LIBRARY_PREFIX.length());
        }
        return key.toLowerCase(Locale.ROOT);
    }

    /** Display name of a canonical key, e.g. {@code enter -> Enter}, {@code f5 -> F5}. */
    public static String display(String canonicalKey) {
        String mapped = DISPLAY.get(canonicalKey);
        if (mapped != null) return mapped;
        if (canonicalKey.isEmpty()) return canonicalKey;
        return Character.toUpperCase(canonicalKey.charAt(0)) + canonicalKey.substring(1);
    }

    /**
     * Normalized token of one raw combination key: {@code Ctrl}, {@code Alt},
     * {@code Shift}, {@code C}, {@code V}, or the upper-cased key otherwise.
     */
    public static String comboToken(String raw) {
        String key = unquote(canonical(raw));
        if (CTRL.contains(key))  return "Ctrl";
        if (ALT.contains(key))   return "Alt";
        if (SHIFT.contains(key)) return "Shift";
        if (C.contains(key))     return "C";
        if (V.contains(key))     return "V";
        return key.toUpperCase(Locale.ROOT);
    }

    public static List<String> comboTokens(List<?> rawKeys) {
        List<String> tokens = new ArrayList<>();
        if (rawKeys == null) return tokens;
        for (Object k : rawKeys) {
            tokens.add(comboToken(String.valueOf(k)));
        }
        return tokens;
    }

    /** Human-readable combination, e.g. {@code Ctrl+Shift+T}. */
    public static String formatCombination(List<?> rawKeys) {
        return String.join("+", comboTokens(rawKeys));
    }

    /** True when the keys spell Ctrl+C in any accepted spelling. */
    public static boolean isCopy(List<?> rawKeys) {
        List<String> tokens = comboTokens(rawKeys);
        return tokens.contains("Ctrl") && tokens.contains("C");
    }

    /** True when the keys spell Ctrl+V in any accepted spelling. */
    public static boolean isPaste(List<?> rawKeys) {
        List<String> tokens = comboTokens(rawKeys);
        return tokens.contains("Ctrl") && tokens.contains("V");
    }

    private static String unquote(String key) {
        if (key.length() >= 2 && key.startsWith("'") && key.endsWith("'")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
