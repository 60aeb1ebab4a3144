package io.callmap.compdb;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a shell command line into words using POSIX shell quoting rules.
 * Variable expansion and globbing are not performed.
 */
public final class CommandLineSplitter {

    private CommandLineSplitter() {
    }

    /**
     * @throws IllegalArgumentException If a quote is left open or the line ends in a lone backslash
     */
    public static List<String> split(String commandLine) {
        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inWord = false;
        int i = 0;
        int length = commandLine.length();

        while (i < length) {
            char c = commandLine.charAt(i);

            if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(current.toString());
                    current.setLength(0);
                    inWord = false;
                }
                i++;
            } else if (c == '\'') {
                int end = commandLine.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new IllegalArgumentException("No closing single quote in: " + commandLine);
                }
                current.append(commandLine, i + 1, end);
                inWord = true;
                i = end + 1;
            } else if (c == '"') {
                i = readDoubleQuoted(commandLine, i + 1, current);
                inWord = true;
            } else if (c == '\\') {
                if (i + 1 >= length) {
                    throw new IllegalArgumentException("Trailing backslash in: " + commandLine);
                }
                char next = commandLine.charAt(i + 1);
                if (next != '\n') {
                    current.append(next);
                    inWord = true;
                }
                i += 2;
            } else {
                current.append(c);
                inWord = true;
                i++;
            }
        }

        if (inWord) {
            words.add(current.toString());
        }
        return words;
    }

    /**
     * Reads up to the closing double quote, returning the index after it.
     * Inside double quotes a backslash only escapes {@code $ ` " \} and newline.
     */
    private static int readDoubleQuoted(String line, int start, StringBuilder out) {
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\' && i + 1 < line.length()) {
                char next = line.charAt(i + 1);
                if (next == '$' || next == '`' || next == '"' || next == '\\') {
                    out.append(next);
                    i += 2;
                    continue;
                }
                if (next == '\n') {
                    i += 2;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        throw new IllegalArgumentException("No closing double quote in: " + line);
    }
}
