package io.hartransformer.core.plugins;

import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.kohsuke.MetaInfServices;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.Name;
import io.hartransformer.api.plugin.Plugin;
import io.hartransformer.api.plugin.ScenarioPlugin;
import io.hartransformer.api.scenario.Scenario;
import io.hartransformer.api.task.Task;

/**
 * Logs the URL of the first request of every scenario; groups report the first request of their first leaf.
 */
@MetaInfServices(Plugin.class)
@Name(LogFirstRequestPlugin.NAME)
public class LogFirstRequestPlugin implements ScenarioPlugin {
   private static final Logger log = LogManager.getLogger(LogFirstRequestPlugin.class);
   public static final String NAME = "log-first-request";

   @Override
   public Set<Contract> contracts() {
      return Contract.union(Contract.ON_SCENARIO);
   }

   @Override
   public Scenario onScenario(Scenario scenario) {
      Task first = firstTask(scenario);
      if (first == null) {
         log.info("Scenario {} has no requests", scenario.name());
      } else {
         log.info("First request of scenario {}: {} {}", scenario.name(), first.request().method(), first.request().url());
      }
      return scenario;
   }

   private static Task firstTask(Scenario scenario) {
      if (!scenario.isGroup()) {
         return scenario.tasks().isEmpty() ? null : scenario.tasks().get(0);
      }
      for (Scenario child : scenario.children()) {
         Task task = firstTask(child);
         if (task != null) {
            return task;
         }
      }
      return null;
   }
}
