package org.cuepoint.compiler.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Collects the class and ID names defined by the rule selectors of a stylesheet.
 * <p>
 * Declaration blocks are skipped, as are at-rules that do not contain style rules
 * ({@code @font-face}, {@code @keyframes}, ...). Grouping at-rules such as {@code @media}
 * are entered and their rules collected.
 */
public final class CssParser {

    private static final Logger LOG = LoggerFactory.getLogger(CssParser.class);

    private static final Set<String> GROUPING_AT_RULES = Set.of("media", "supports", "document", "layer", "container", "scope");

    private CssParser() {
        // Static utility
    }

    /**
     * Parses a stylesheet.
     *
     * @param css The stylesheet text.
     * @return The class and ID names in order of first appearance.
     * @throws CssParseException if braces are unbalanced or a comment or string is not terminated.
     */
    public static CssFileMetadata parse(String css) throws CssParseException {
        String text = stripComments(css);
        Set<String> classes = new LinkedHashSet<>();
        Set<String> ids = new LinkedHashSet<>();
        Deque<Integer> groups = new ArrayDeque<>();
        StringBuilder prelude = new StringBuilder();

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = skipString(text, i);
                prelude.append(text, i, end);
                i = end;
            } else if (c == '{') {
                String p = prelude.toString().trim();
                prelude.setLength(0);
                if (p.startsWith("@") && GROUPING_AT_RULES.contains(atRuleName(p))) {
                    groups.push(i);
                    i++;
                } else {
                    if (!p.startsWith("@")) {
                        collectSelectorTokens(p, classes, ids);
                    }
                    i = skipBlock(text, i);
                }
            } else if (c == '}') {
                if (groups.isEmpty()) {
                    throw new CssParseException("Unexpected '}'", lineOf(text, i));
                }
                groups.pop();
                prelude.setLength(0);
                i++;
            } else if (c == ';') {
                prelude.setLength(0);
                i++;
            } else {
                prelude.append(c);
                i++;
            }
        }
        if (!groups.isEmpty()) {
            throw new CssParseException("Unclosed '{'", lineOf(text, groups.peek()));
        }
        return new CssFileMetadata(classes, ids);
    }

    private static void collectSelectorTokens(String selector, Set<String> classes, Set<String> ids) {
        if (selector.isEmpty()) return;
        try {
            ParsedSelector parsed = SelectorParser.parse(selector);
            classes.addAll(parsed.classes());
            ids.addAll(parsed.ids());
        } catch (InvalidSelectorException e) {
            LOG.debug("Skipping unparsable selector '{}': {}", selector, e.getMessage());
        }
    }

    private static String atRuleName(String prelude) {
        int end = 1;
        while (end < prelude.length() && (Character.isLetterOrDigit(prelude.charAt(end)) || prelude.charAt(end) == '-')) {
            end++;
        }
        return prelude.substring(1, end).toLowerCase(Locale.ROOT);
    }

    private static int skipBlock(String text, int open) throws CssParseException {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                i = skipString(text, i);
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i + 1;
            }
            i++;
        }
        throw new CssParseException("Unclosed '{'", lineOf(text, open));
    }

    private static int skipString(String text, int open) throws CssParseException {
        char quote = text.charAt(open);
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n') {
                break;
            } else {
                i++;
            }
        }
        throw new CssParseException("Unterminated string", lineOf(text, open));
    }

    /**
     * Replaces comments by spaces, keeping line breaks so that line numbers stay correct.
     */
    private static String stripComments(String css) throws CssParseException {
        StringBuilder sb = new StringBuilder(css.length());
        int i = 0;
        while (i < css.length()) {
            if (css.startsWith("/*", i)) {
                int end = css.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new CssParseException("Unterminated comment", lineOf(css, i));
                }
                for (int k = i; k < end + 2; k++) {
                    sb.append(css.charAt(k) == '\n' ? '\n' : ' ');
                }
                i = end + 2;
            } else {
                sb.append(css.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    private static int lineOf(String text, int index) {
        int line = 1;
        for (int k = 0; k < index && k < text.length(); k++) {
            if (text.charAt(k) == '\n') line++;
        }
        return line;
    }
}
