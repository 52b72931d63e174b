package io.hartransformer.api.scenario;

import java.util.List;

/**
 * A weight declaration refers to an item that does not exist in the same group.
 */
public class DanglingWeightException extends ScenarioDefinitionException {
   private final List<String> weightFiles;

   public DanglingWeightException(String origin, List<String> weightFiles) {
      super(origin, "weight declarations without a matching scenario: " + weightFiles);
      this.weightFiles = List.copyOf(weightFiles);
   }

   public List<String> weightFiles() {
      return weightFiles;
   }
}
