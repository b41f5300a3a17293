package org.cnext.compiler.frontend.headers;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Recursive-descent evaluator for the integer constant expressions found in array
 * dimensions, bit-field widths and enumerator values. Unknown names and casts evaluate
 * leniently: names resolve through the lookup or to 0, type casts are ignored.
 */
final class ConstantEvaluator {

    private final List<HeaderToken> tokens;
    private final Function<String, Optional<Long>> lookup;
    private int current = 0;

    ConstantEvaluator(List<HeaderToken> tokens, Function<String, Optional<Long>> lookup) {
        this.tokens = tokens;
        this.lookup = lookup;
    }

    long evaluate() {
        if (tokens.isEmpty()) {
            return 0L;
        }
        return bitOr();
    }

    private long bitOr() {
        long value = shift();
        while (match("|")) {
            value |= shift();
        }
        return value;
    }

    private long shift() {
        long value = additive();
        while (true) {
            if (match("<<")) {
                value <<= additive();
            } else if (match(">>")) {
                value >>= additive();
            } else {
                return value;
            }
        }
    }

    private long additive() {
        long value = multiplicative();
        while (true) {
            if (match("+")) {
                value += multiplicative();
            } else if (match("-")) {
                value -= multiplicative();
            } else {
                return value;
            }
        }
    }

    private long multiplicative() {
        long value = unary();
        while (true) {
            if (match("*")) {
                value *= unary();
            } else if (match("/")) {
                long divisor = unary();
                value = divisor == 0 ? 0 : value / divisor;
            } else {
                return value;
            }
        }
    }

    private long unary() {
        if (match("-")) {
            return -unary();
        }
        if (match("~")) {
            return ~unary();
        }
        if (match("+")) {
            return unary();
        }
        return primary();
    }

    private long primary() {
        if (current >= tokens.size()) {
            return 0L;
        }
        HeaderToken token = tokens.get(current++);
        if (token.is("(")) {
            // A parenthesized type name is a cast and contributes nothing.
            if (current + 1 < tokens.size() && tokens.get(current).type() == HeaderToken.Type.IDENTIFIER
                    && tokens.get(current + 1).is(")") && lookup.apply(tokens.get(current).text()).isEmpty()) {
                current += 2;
                return unary();
            }
            long value = bitOr();
            match(")");
            return value;
        }
        return switch (token.type()) {
            case NUMBER, CHAR -> parseLiteral(token.text()).orElse(0L);
            case IDENTIFIER -> lookup.apply(token.text()).orElse(0L);
            default -> 0L;
        };
    }

    private boolean match(String text) {
        if (current < tokens.size() && tokens.get(current).is(text)) {
            current++;
            return true;
        }
        return false;
    }

    /**
     * Parses a C integer or character literal, ignoring integer suffixes.
     *
     * @return the value, or empty if the text is not such a literal.
     */
    static Optional<Long> parseLiteral(String text) {
        String value = text.trim();
        boolean negative = value.startsWith("-");
        if (negative || value.startsWith("+")) {
            value = value.substring(1).trim();
        }
        while (value.startsWith("(") && value.endsWith(")")) {
            value = value.substring(1, value.length() - 1).trim();
        }
        try {
            long parsed;
            if (value.length() >= 3 && value.startsWith("'") && value.endsWith("'")) {
                String body = value.substring(1, value.length() - 1);
                parsed = body.startsWith("\\") ? escapeValue(body.charAt(1)) : body.charAt(0);
            } else {
                String digits = value.replaceAll("[uUlL]+$", "").replace("'", "");
                if (digits.startsWith("0x") || digits.startsWith("0X")) {
                    parsed = Long.parseUnsignedLong(digits.substring(2), 16);
                } else if (digits.startsWith("0b") || digits.startsWith("0B")) {
                    parsed = Long.parseUnsignedLong(digits.substring(2), 2);
                } else if (digits.length() > 1 && digits.startsWith("0")) {
                    parsed = Long.parseUnsignedLong(digits.substring(1), 8);
                } else {
                    parsed = Long.parseUnsignedLong(digits);
                }
            }
            return Optional.of(negative ? -parsed : parsed);
        } catch (NumberFormatException | StringIndexOutOfBoundsException e) {
            return Optional.empty();
        }
    }

    private static long escapeValue(char escape) {
        return switch (escape) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            case '0' -> 0;
            default -> escape;
        };
    }
}
