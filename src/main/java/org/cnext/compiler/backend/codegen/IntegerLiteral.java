package org.cnext.compiler.backend.codegen;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed C-Next integer literal.
 *
 * @param magnitude The unsigned value as written.
 * @param radix     10, 16 or 2.
 * @param typeSuffix The C-Next type suffix ({@code u8}, {@code i32}, ...), or {@code null}.
 */
public record IntegerLiteral(BigInteger magnitude, int radix, String typeSuffix) {

    private static final Pattern TYPE_SUFFIX = Pattern.compile("([ui](?:8|16|32|64))$");

    /**
     * Parses literal text such as {@code 42}, {@code 0xFF}, {@code 0b1010}, {@code 1_000} or {@code 200u8}.
     *
     * @return the literal, or empty if the text is not a valid integer literal.
     */
    public static Optional<IntegerLiteral> parse(String text) {
        String cleaned = text.replace("_", "").trim();
        String suffix = null;
        Matcher matcher = TYPE_SUFFIX.matcher(cleaned);
        if (matcher.find()) {
            suffix = matcher.group(1);
            cleaned = cleaned.substring(0, matcher.start());
        } else {
            cleaned = cleaned.replaceAll("[uUlL]+$", "");
        }
        int radix = 10;
        String digits = cleaned;
        String lower = cleaned.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            radix = 16;
            digits = cleaned.substring(2);
        } else if (lower.startsWith("0b")) {
            radix = 2;
            digits = cleaned.substring(2);
        }
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new IntegerLiteral(new BigInteger(digits, radix), radix, suffix));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
