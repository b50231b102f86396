package com.tanumd.core.util;

import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normalization of attachment logical paths.
 *
 * <p>A logical path is a relative, forward-slash separated path. Backslashes are treated as
 * separators, empty and {@code .} segments are dropped, and {@code ..} segments or a leading
 * separator are rejected outright rather than resolved.
 *
 * <pre>{@code
 * LogicalPaths.normalize("a/./b");          // "a/b"
 * LogicalPaths.normalize("images\\x.png");  // "images/x.png"
 * LogicalPaths.normalize("images/../x");    // throws AttachmentException
 * }</pre>
 */
public final class LogicalPaths {

    private LogicalPaths() {
        // Utility class
    }

    /**
     * Normalizes a logical path.
     *
     * @param input raw path
     * @return normalized path
     * @throws AttachmentException with {@link Reason#INVALID_PATH} if the path is empty,
     *     absolute, escapes upward or contains control characters
     */
    public static String normalize(String input) {
        if (input == null || input.isEmpty()) {
            throw invalid(input, "logical path must not be empty");
        }

        String unified = input.replace('\\', '/');
        if (unified.startsWith("/")) {
            throw invalid(input, "logical path must not start with '/'");
        }

        List<String> segments = new ArrayList<>();
        for (String segment : unified.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw invalid(input, "logical path must not contain '..'");
            }
            if (segment.chars().anyMatch(Character::isISOControl)) {
                throw invalid(input, "logical path must not contain control characters");
            }
            segments.add(segment);
        }

        if (segments.isEmpty()) {
            throw invalid(input, "logical path resolves to empty");
        }
        if (segments.get(0).length() == 2 && segments.get(0).charAt(1) == ':') {
            throw invalid(input, "logical path must not start with a drive letter");
        }
        return String.join("/", segments);
    }

    /**
     * Normalizes a path, returning empty instead of throwing.
     *
     * @param input raw path
     * @return normalized path, or empty if the input is not a valid logical path
     */
    public static Optional<String> tryNormalize(String input) {
        try {
            return Optional.of(normalize(input));
        } catch (AttachmentException e) {
            return Optional.empty();
        }
    }

    private static AttachmentException invalid(String input, String message) {
        return new AttachmentException(Reason.INVALID_PATH, message + " (`" + input + "`)");
    }
}
