package io.hartransformer.api.scenario;

/**
 * The scenario cannot be built but the enclosing group may continue without it.
 * Whether it actually does is decided by the {@link SkipHandler} in use.
 */
public class SkippableScenarioException extends ScenarioDefinitionException {
   public SkippableScenarioException(String origin, String msg) {
      super(origin, msg);
   }

   public SkippableScenarioException(String origin, String msg, Throwable cause) {
      super(origin, msg, cause);
   }
}
