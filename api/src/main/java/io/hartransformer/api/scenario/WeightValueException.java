package io.hartransformer.api.scenario;

public class WeightValueException extends ScenarioDefinitionException {
   public WeightValueException(String origin, String reason) {
      super(origin, "invalid weight: " + reason);
   }

   public WeightValueException(String origin, String reason, Throwable cause) {
      super(origin, "invalid weight: " + reason, cause);
   }
}
