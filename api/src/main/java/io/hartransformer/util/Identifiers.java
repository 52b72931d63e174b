package io.hartransformer.util;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import java.util.zip.Adler32;

/**
 * Turns arbitrary strings (file names, host names, URL paths) into valid Python identifiers.
 * <p>
 * Invalid characters are replaced by <code>_</code> and a checksum of the original input is appended
 * whenever the input had to be altered, so that two different inputs never map to the same identifier
 * just because they differ in replaced characters only.
 */
public final class Identifiers {
   private static final Pattern INVALID_CHARS = Pattern.compile("[^_a-zA-Z0-9]");
   private static final Pattern CHECKSUM_SUFFIX = Pattern.compile(".*_[0-9]+$", Pattern.DOTALL);

   private Identifiers() {
   }

   public static String toIdentifier(String input) {
      String result = INVALID_CHARS.matcher(input).replaceAll("_");
      if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
         result = "_" + result;
      }
      // An input that looks like it already carries a checksum gets its own to stay distinct from the real one.
      if (!result.equals(input) || CHECKSUM_SUFFIX.matcher(input).matches()) {
         result = result + "_" + checksum(input);
      }
      return result;
   }

   public static boolean isIdentifier(String input) {
      return !input.isEmpty() && !Character.isDigit(input.charAt(0)) && !INVALID_CHARS.matcher(input).find();
   }

   static long checksum(String input) {
      Adler32 adler = new Adler32();
      adler.update(input.getBytes(StandardCharsets.UTF_8));
      return adler.getValue();
   }
}
