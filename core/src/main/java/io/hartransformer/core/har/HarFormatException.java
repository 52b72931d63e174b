package io.hartransformer.core.har;

/**
 * The trace is readable but its content does not follow the HAR structure.
 */
public class HarFormatException extends RuntimeException {
   public HarFormatException(String msg) {
      super(msg);
   }

   public HarFormatException(String msg, Throwable cause) {
      super(msg, cause);
   }
}
