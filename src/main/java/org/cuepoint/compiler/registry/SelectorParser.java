package org.cuepoint.compiler.registry;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts class and ID tokens from a CSS selector and checks its basic syntax.
 * <p>
 * Attribute selectors and quoted strings are skipped; arguments of functional pseudo-classes
 * such as {@code :not(.hidden)} are scanned like the rest of the selector.
 */
public final class SelectorParser {

    private SelectorParser() {
        // Static utility
    }

    /**
     * Parses a selector or selector list.
     *
     * @param selector The selector text, e.g. {@code .button.primary > #footer}.
     * @return The tokens in order of occurrence.
     * @throws InvalidSelectorException if the selector is empty or malformed.
     */
    public static ParsedSelector parse(String selector) throws InvalidSelectorException {
        if (selector == null || selector.isBlank()) {
            throw new InvalidSelectorException("Selector is empty");
        }
        List<String> classes = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        String s = selector.trim();
        int depth = 0;
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '.' || c == '#') {
                int end = readName(s, i + 1);
                if (end == i + 1) {
                    throw new InvalidSelectorException("Expected a name after '" + c + "' at position " + i);
                }
                if (Character.isDigit(s.charAt(i + 1))) {
                    throw new InvalidSelectorException("Name after '" + c + "' cannot start with a digit at position " + i);
                }
                String name = unescape(s.substring(i + 1, end));
                if (c == '.') classes.add(name);
                else ids.add(name);
                i = end;
            } else if (c == '[') {
                i = skipBracket(s, i);
            } else if (c == '"' || c == '\'') {
                i = skipString(s, i);
            } else if (c == '(') {
                depth++;
                i++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new InvalidSelectorException("Unexpected ')' at position " + i);
                }
                i++;
            } else if (c == '\\') {
                i += 2;
            } else if (isNameChar(c) || Character.isWhitespace(c) || ":*>+~,|".indexOf(c) >= 0) {
                i++;
            } else {
                throw new InvalidSelectorException("Unexpected character '" + c + "' at position " + i);
            }
        }
        if (depth != 0) {
            throw new InvalidSelectorException("Unclosed '(' in selector");
        }
        return new ParsedSelector(classes, ids);
    }

    /**
     * @param selector A selector.
     * @return {@code true} if {@link #parse(String)} accepts it.
     */
    public static boolean isValid(String selector) {
        try {
            parse(selector);
            return true;
        } catch (InvalidSelectorException e) {
            return false;
        }
    }

    private static int readName(String s, int from) {
        int i = from;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                i += 2;
            } else if (isNameChar(c)) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c > 0x7F;
    }

    private static String unescape(String name) {
        if (name.indexOf('\\') < 0) return name;
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '\\' && i + 1 < name.length()) {
                sb.append(name.charAt(++i));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static int skipBracket(String s, int open) throws InvalidSelectorException {
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(s, i);
            } else if (c == ']') {
                return i + 1;
            } else {
                i++;
            }
        }
        throw new InvalidSelectorException("Unclosed '[' at position " + open);
    }

    private static int skipString(String s, int open) throws InvalidSelectorException {
        char quote = s.charAt(open);
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        throw new InvalidSelectorException("Unterminated string at position " + open);
    }
}
