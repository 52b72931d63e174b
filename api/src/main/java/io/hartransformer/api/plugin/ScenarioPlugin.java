package io.hartransformer.api.plugin;

import io.hartransformer.api.scenario.Scenario;

public interface ScenarioPlugin extends Plugin {
   /**
    * Invoked once for every node of the scenario tree, after all its children were transformed.
    */
   Scenario onScenario(Scenario scenario);
}
