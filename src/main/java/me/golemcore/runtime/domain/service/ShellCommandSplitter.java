package me.golemcore.runtime.domain.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a shell command line into its simple commands at {@code &&},
 * {@code ||}, {@code ;}, {@code |} and newlines, respecting single quotes,
 * double quotes and backslash escapes.
 */
final class ShellCommandSplitter {

    private ShellCommandSplitter() {
    }

    /**
     * @return the trimmed, non-empty parts; empty when the command has unbalanced
     *         quotes or no content
     */
    static Optional<List<String>> split(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        int length = command.length();

        for (int i = 0; i < length; i++) {
            char c = command.charAt(i);
            if (c == '\\' && !inSingle && i + 1 < length) {
                current.append(c).append(command.charAt(++i));
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble && isSeparator(command, i)) {
                flush(parts, current);
                if (i + 1 < length && isDoubleOperator(c, command.charAt(i + 1))) {
                    i++;
                }
                continue;
            }
            current.append(c);
        }
        if (inSingle || inDouble) {
            return Optional.empty();
        }
        flush(parts, current);
        return parts.isEmpty() ? Optional.empty() : Optional.of(parts);
    }

    private static boolean isSeparator(String command, int index) {
        char c = command.charAt(index);
        if (c == ';' || c == '|' || c == '\n') {
            return true;
        }
        return c == '&' && index + 1 < command.length() && command.charAt(index + 1) == '&';
    }

    private static boolean isDoubleOperator(char c, char next) {
        return (c == '&' && next == '&') || (c == '|' && next == '|');
    }

    private static void flush(List<String> parts, StringBuilder current) {
        String part = current.toString().trim();
        if (!part.isEmpty()) {
            parts.add(part);
        }
        current.setLength(0);
    }
}
