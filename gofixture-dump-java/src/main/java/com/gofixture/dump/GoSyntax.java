package com.gofixture.dump;

import com.gofixture.dump.value.Complex;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Go lexical forms for scalar literals.
 */
public final class GoSyntax {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private GoSyntax() {}

    // -------------------------------------------------------------------------
    // Strings
    // -------------------------------------------------------------------------

    /**
     * String literal for a Go string value. Multi-line text without carriage returns becomes
     * a raw (backquoted) literal; everything else is double-quoted.
     */
    public static String stringLiteral(String s) {
        if (s.indexOf('\n') >= 0 && canBeRaw(s)) {
            return rawLiteral(s);
        }
        return quote(s);
    }

    /** Raw literal; backquotes are spliced in as {@code `+"`"+`}. */
    public static String rawLiteral(String s) {
        return "`" + s.replace("`", "`+\"`\"+`") + "`";
    }

    /** Characters a raw literal cannot carry: CR is dropped by the Go lexer, NUL and BOM are rejected. */
    static boolean canBeRaw(String s) {
        return s.indexOf('\r') < 0 && s.indexOf('\0') < 0 && s.indexOf('\uFEFF') < 0;
    }

    /** Double-quoted literal with Go escapes, equivalent to {@code strconv.Quote}. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case 0x07 -> sb.append("\\a");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case 0x0B -> sb.append("\\v");
                default -> {
                    if (isPrint(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (cp < 0x80) {
                        sb.append("\\x").append(HEX[cp >> 4]).append(HEX[cp & 0xF]);
                    } else if (Character.getType(cp) == Character.SURROGATE) {
                        sb.append("\\ufffd");
                    } else if (cp < 0x10000) {
                        sb.append("\\u").append(hex(cp, 4));
                    } else {
                        sb.append("\\U").append(hex(cp, 8));
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /** Mirrors {@code unicode.IsPrint}: graphic characters plus the ASCII space. */
    static boolean isPrint(int cp) {
        if (cp == ' ') {
            return true;
        }
        return switch (Character.getType(cp)) {
            case Character.SPACE_SEPARATOR, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                    Character.CONTROL, Character.FORMAT, Character.PRIVATE_USE, Character.SURROGATE,
                    Character.UNASSIGNED -> false;
            default -> true;
        };
    }

    private static String hex(int value, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int shift = (width - 1) * 4; shift >= 0; shift -= 4) {
            sb.append(HEX[(value >> shift) & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Literal for the contents of a byte block. Valid UTF-8 is written raw; anything else is
     * double-quoted with {@code \xNN} escapes so the exact bytes survive.
     */
    public static String byteLiteral(byte[] bytes) {
        String text = decodeUtf8(bytes);
        if (text != null && canBeRaw(text)) {
            return rawLiteral(text);
        }
        if (text != null) {
            return quote(text);
        }
        StringBuilder sb = new StringBuilder(bytes.length + 2).append('"');
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c == '"' || c == '\\') {
                sb.append('\\').append((char) c);
            } else if (c >= 0x20 && c < 0x7F) {
                sb.append((char) c);
            } else {
                sb.append("\\x").append(HEX[c >> 4]).append(HEX[c & 0xF]);
            }
        }
        return sb.append('"').toString();
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    // -------------------------------------------------------------------------
    // Numbers
    // -------------------------------------------------------------------------

    /**
     * Shortest decimal form that round-trips at the given bit size, laid out like Go's
     * {@code strconv.FormatFloat(f, 'g', -1, bitSize)}: exponent form for decimal exponents
     * below -4 or from 6 up, fixed form otherwise.
     */
    public static String formatFloat(double f, int bitSize) {
        if (Double.isNaN(f)) {
            return "NaN";
        }
        if (Double.isInfinite(f)) {
            return f > 0 ? "+Inf" : "-Inf";
        }
        if (f == 0) {
            return 1 / f < 0 ? "-0" : "0";
        }
        BigDecimal d = shortestDecimal(f, bitSize);
        String digits = d.unscaledValue().abs().toString();
        int nd = digits.length();
        int dp = nd - d.scale();
        int exp = dp - 1;

        StringBuilder sb = new StringBuilder();
        if (d.signum() < 0) {
            sb.append('-');
        }
        if (exp < -4 || exp >= 6) {
            appendExponentForm(sb, digits, exp);
        } else if (dp <= 0) {
            sb.append("0.").append("0".repeat(-dp)).append(digits);
        } else if (dp >= nd) {
            sb.append(digits).append("0".repeat(dp - nd));
        } else {
            sb.append(digits, 0, dp).append('.').append(digits, dp, nd);
        }
        return sb.toString();
    }

    /**
     * Fewest significant digits that parse back to the same value, rounded from the exact
     * binary value so the closest candidate wins. {@code Double.toString} is not shortest
     * for every input before JDK 19.
     */
    static BigDecimal shortestDecimal(double f, int bitSize) {
        BigDecimal exact = bitSize == 32 ? new BigDecimal((float) f) : new BigDecimal(f);
        int maxDigits = bitSize == 32 ? 9 : 17;
        for (int precision = 1; precision < maxDigits; precision++) {
            BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
            boolean roundTrips = bitSize == 32
                    ? candidate.floatValue() == (float) f
                    : candidate.doubleValue() == f;
            if (roundTrips) {
                return candidate.stripTrailingZeros();
            }
        }
        return exact.round(new MathContext(maxDigits, RoundingMode.HALF_EVEN)).stripTrailingZeros();
    }

    private static void appendExponentForm(StringBuilder sb, String digits, int exp) {
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exp < 0 ? '-' : '+');
        int abs = Math.abs(exp);
        if (abs < 10) {
            sb.append('0');
        }
        sb.append(abs);
    }

    /** {@code (re+imi)}, both parts formatted as float64. */
    public static String formatComplex(Complex c) {
        String imag = formatFloat(c.imag(), 64);
        char first = imag.charAt(0);
        String sign = first == '-' || first == '+' ? "" : "+";
        return "(" + formatFloat(c.real(), 64) + sign + imag + "i)";
    }

    /** Stand-in for the address of a chan or func: its identity hash in hex. */
    public static String hexAddress(Object o) {
        return "0x" + Integer.toHexString(System.identityHashCode(o));
    }
}
