package io.hartransformer.api.scenario;

/**
 * Base of all errors raised while building the scenario tree from its source listing.
 */
public class ScenarioDefinitionException extends RuntimeException {
   private final String origin;

   public ScenarioDefinitionException(String origin, String msg) {
      super(getMessage(origin, msg));
      this.origin = origin;
   }

   public ScenarioDefinitionException(String origin, String msg, Throwable cause) {
      super(getMessage(origin, msg), cause);
      this.origin = origin;
   }

   /**
    * @return Path of the file or directory the failing scenario comes from.
    */
   public String origin() {
      return origin;
   }

   private static String getMessage(String origin, String msg) {
      return origin == null ? msg : String.format("Scenario %s: %s", origin, msg);
   }
}
