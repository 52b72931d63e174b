package io.hartransformer.api.scenario;

/**
 * Two siblings ended up with the same name, e.g. <code>a.har</code> and <code>a.json</code>.
 */
public class CollidingScenariosException extends ScenarioDefinitionException {
   private final String name;

   public CollidingScenariosException(String origin, String name) {
      super(origin, "multiple scenarios named '" + name + "'");
      this.name = name;
   }

   public String name() {
      return name;
   }
}
