package difftree;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public class Util {

    private static final String[] DECIMAL_UNITS = {"kB", "MB", "GB", "TB", "PB"};

    /**
     * Converts a size printed by the backup tool into bytes. The units are decimal, 1 kB is 1000 B.
     * Fractions of a byte are cut off.
     */
    public static long sizeToBytes(String significand, String unit) {
        BigDecimal multiplier = switch (unit) {
            case "B" -> BigDecimal.ONE;
            case "kB", "KB" -> BigDecimal.TEN.pow(3);
            case "MB" -> BigDecimal.TEN.pow(6);
            case "GB" -> BigDecimal.TEN.pow(9);
            case "TB" -> BigDecimal.TEN.pow(12);
            default -> throw new DiffParseException("Unknown unit", unit);
        };
        try {
            return new BigDecimal(significand).multiply(multiplier).setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (NumberFormatException e) {
            throw new DiffParseException("Invalid size", significand, e);
        } catch (ArithmeticException e) {
            throw new DiffParseException("Size out of range", significand + " " + unit, e);
        }
    }

    /**
     * Formats a (signed) amount of bytes with decimal units, e.g. {@code -77.8 kB}.
     */
    public static String bytesToHumanReadableFormat(long bytes) {
        if (Math.abs(bytes) < 1000) {
            return bytes + " B";
        }
        double value = bytes;
        int unit = -1;
        while (Math.abs(value) >= 1000 && unit < DECIMAL_UNITS.length - 1) {
            value /= 1000;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, DECIMAL_UNITS[unit]);
    }

    public static String readDiffOutput(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    public static String readDiffOutput(InputStream inputStream) throws IOException {
        return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
    }
}
