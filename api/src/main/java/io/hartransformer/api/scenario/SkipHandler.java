package io.hartransformer.api.scenario;

/**
 * Decides what happens with scenarios that cannot be built.
 */
@FunctionalInterface
public interface SkipHandler {
   /**
    * Called for every skipped scenario. Throwing (e.g. rethrowing <code>e</code>) aborts the whole conversion.
    */
   void skipped(SkippableScenarioException e);

   static SkipHandler strict() {
      return e -> {
         throw e;
      };
   }
}
