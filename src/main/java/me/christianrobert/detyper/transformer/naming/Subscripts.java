package me.christianrobert.detyper.transformer.naming;

import java.math.BigInteger;

/**
 * Identifier subscripts: {@code x}, {@code x0}, {@code x1}, ...
 *
 * <p>A subscript is the maximal run of trailing digits of an identifier, of
 * any length; an identifier without one has subscript {@link #NONE}, whose
 * successor is 0. The first character always belongs to the stem, so a stem
 * followed by any rendered subscript splits back into the same stem.</p>
 */
public final class Subscripts {

    public static final BigInteger NONE = BigInteger.ONE.negate();

    private Subscripts() {
    }

    public static String stem(String id) {
        return id.substring(0, digitStart(id));
    }

    public static BigInteger subscript(String id) {
        int cut = digitStart(id);
        return cut == id.length() ? NONE : new BigInteger(id.substring(cut));
    }

    public static String withSubscript(String stem, BigInteger subscript) {
        return subscript.signum() < 0 ? stem : stem + subscript;
    }

    /**
     * Returns the next identifier in the sequence of {@code id}'s stem.
     */
    public static String increment(String id) {
        return withSubscript(stem(id), subscript(id).add(BigInteger.ONE));
    }

    private static int digitStart(String id) {
        int i = id.length();
        while (i > 1 && Character.isDigit(id.charAt(i - 1))) {
            i--;
        }
        return i;
    }
}
