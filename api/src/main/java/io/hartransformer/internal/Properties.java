package io.hartransformer.internal;

import java.util.function.Function;

public interface Properties {
   String STACKTRACE = "transformer.stacktrace";
   String INPUT_PATHS = "transformer.input.paths";
   String PLUGINS = "transformer.plugins";
   String DENYLIST = "transformer.denylist";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static String envName(String property) {
      return property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase();
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(envName(property));
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
