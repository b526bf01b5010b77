package com.identity.resolution.rules;

/**
 * Rejects raw names that cannot be matched at all.
 */
public final class InputValidator {

    /** Maximum accepted raw name length. */
    public static final int MAX_NAME_LENGTH = 1000;

    private InputValidator() {
        // utility class
    }

    /**
     * Validates a raw name and returns its normalized form.
     *
     * @throws InvalidInputException if the name is null, blank, too long, contains
     *                               control characters or has no comparable characters
     */
    public static String requireMatchable(String rawName, NameNormalizer normalizer) {
        if (rawName == null || rawName.isBlank()) {
            throw new InvalidInputException("Raw name must not be null or blank");
        }
        if (rawName.length() > MAX_NAME_LENGTH) {
            throw new InvalidInputException("Raw name exceeds maximum length of " + MAX_NAME_LENGTH
                    + " characters (was " + rawName.length() + ")");
        }
        if (containsControlCharacters(rawName)) {
            throw new InvalidInputException("Raw name must not contain control characters");
        }
        String normalized = normalizer.normalize(rawName);
        if (normalized.isEmpty()) {
            throw new InvalidInputException("Raw name has no letters or digits: '" + rawName + "'");
        }
        return normalized;
    }

    /**
     * Trimmed reference number, or null when absent or shorter than three characters.
     */
    public static String cleanReferenceNumber(String referenceNumber) {
        if (referenceNumber == null) {
            return null;
        }
        String trimmed = referenceNumber.trim();
        return trimmed.length() < 3 ? null : trimmed;
    }

    /**
     * ASCII control characters (0x00-0x1F, 0x7F) other than tab, newline and carriage return.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
