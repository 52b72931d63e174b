package io.hartransformer.api.request;

import java.util.Locale;

public enum HttpMethod {
   GET,
   POST,
   PUT,
   OPTIONS,
   DELETE;

   /**
    * Lower-case name, as used by the Locust client methods.
    */
   public String clientMethod() {
      return name().toLowerCase(Locale.ROOT);
   }

   public static HttpMethod parse(String method) {
      if (method == null) {
         throw new IllegalArgumentException("Missing HTTP method");
      }
      try {
         return valueOf(method.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
         throw new IllegalArgumentException("Unsupported HTTP method: " + method, e);
      }
   }
}
