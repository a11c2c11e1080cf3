package com.architecture.memory.codegraph.service.graph.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Text helpers shared by the pattern-based parsers. All offsets refer to the original text:
 * {@link #blankOut} keeps length and line breaks, so line numbers survive stripping.
 */
public final class SourceText {

    public enum Syntax {
        // Kotlin, Dart: // and /* */ comments, "", '' and triple-quoted strings
        C_LIKE,
        // Python: # comments, "", '' and triple-quoted strings
        PYTHON
    }

    private SourceText() {
    }

    /**
     * Replace comment bodies and string literal contents with spaces. String delimiters stay,
     * so a literal still reads as an expression.
     */
    public static String blankOut(String text, Syntax syntax) {
        char[] out = text.toCharArray();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (syntax == Syntax.C_LIKE && c == '/' && i + 1 < length && text.charAt(i + 1) == '/') {
                i = blankUntilLineEnd(text, out, i);
            } else if (syntax == Syntax.C_LIKE && c == '/' && i + 1 < length && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                end = end < 0 ? length : end + 2;
                blank(out, i, end);
                i = end;
            } else if (syntax == Syntax.PYTHON && c == '#') {
                i = blankUntilLineEnd(text, out, i);
            } else if (c == '"' || c == '\'') {
                i = blankString(text, out, i, c);
            } else {
                i++;
            }
        }
        return new String(out);
    }

    private static int blankUntilLineEnd(String text, char[] out, int start) {
        int end = text.indexOf('\n', start);
        end = end < 0 ? text.length() : end;
        blank(out, start, end);
        return end;
    }

    private static int blankString(String text, char[] out, int start, char quote) {
        String triple = String.valueOf(new char[]{quote, quote, quote});
        if (text.startsWith(triple, start)) {
            int end = text.indexOf(triple, start + 3);
            end = end < 0 ? text.length() : end + 3;
            blank(out, start + 3, Math.max(start + 3, end - 3));
            return end;
        }
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote || c == '\n') {
                break;
            }
            i++;
        }
        int end = Math.min(i, text.length());
        blank(out, start + 1, end);
        return Math.min(end + 1, text.length());
    }

    private static void blank(char[] out, int from, int to) {
        for (int i = from; i < to && i < out.length; i++) {
            if (out[i] != '\n') {
                out[i] = ' ';
            }
        }
    }

    /**
     * Offsets at which each line starts. Index 0 is line 1.
     */
    public static int[] lineOffsets(String text) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                offsets.add(i + 1);
            }
        }
        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * 1-based line number of an offset.
     */
    public static int lineAt(int[] lineOffsets, int offset) {
        int index = Arrays.binarySearch(lineOffsets, offset);
        return index >= 0 ? index + 1 : -index - 1;
    }

    public static int lineCount(String text) {
        return lineOffsets(text).length;
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or the last index if unbalanced.
     */
    public static int matchingClose(String text, int openIndex) {
        char open = text.charAt(openIndex);
        char close = open == '(' ? ')' : open == '[' ? ']' : '}';
        int depth = 0;
        for (int i = openIndex; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return text.length() - 1;
    }

    /**
     * Split on commas that are not nested in brackets or generic arguments.
     */
    public static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{' || c == '<') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}' || c == '>') {
                depth = Math.max(0, depth - 1);
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        String last = text.substring(start).trim();
        if (!last.isEmpty()) {
            parts.add(last);
        }
        parts.removeIf(String::isEmpty);
        return parts;
    }

    /**
     * Number of arguments in the call whose '(' is at {@code openIndex}.
     */
    public static int countArguments(String text, int openIndex) {
        int close = matchingClose(text, openIndex);
        if (close <= openIndex) {
            return -1;
        }
        return splitTopLevel(text.substring(openIndex + 1, close)).size();
    }

    /**
     * Strip generic arguments, nullability markers and package qualifiers: "kotlin.collections.List<Foo>?" -> "List".
     */
    public static String simpleTypeName(String type) {
        if (type == null) {
            return null;
        }
        String cleaned = type.trim();
        int generic = cleaned.indexOf('<');
        if (generic >= 0) {
            cleaned = cleaned.substring(0, generic);
        }
        cleaned = cleaned.replace("?", "").replace("[]", "").trim();
        int space = cleaned.indexOf(' ');
        if (space > 0) {
            cleaned = cleaned.substring(0, space);
        }
        int paren = cleaned.indexOf('(');
        if (paren >= 0) {
            cleaned = cleaned.substring(0, paren).trim();
        }
        int dot = cleaned.lastIndexOf('.');
        return dot >= 0 ? cleaned.substring(dot + 1) : cleaned;
    }

    /**
     * Index of the first non-whitespace character at or after {@code from}, or text length.
     */
    public static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
