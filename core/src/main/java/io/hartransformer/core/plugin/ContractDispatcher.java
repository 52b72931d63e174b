package io.hartransformer.core.plugin;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.PluginException;
import io.hartransformer.api.plugin.ProgramPlugin;
import io.hartransformer.api.plugin.ScenarioPlugin;
import io.hartransformer.api.plugin.TaskPlugin;
import io.hartransformer.api.scenario.Scenario;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.api.task.Task;

/**
 * Invokes registered plugins at the stage matching their contracts, in registration order.
 */
public class ContractDispatcher {
   private static final Logger log = LogManager.getLogger(ContractDispatcher.class);

   private final List<RegisteredPlugin> plugins;

   public ContractDispatcher(List<RegisteredPlugin> plugins) {
      this.plugins = List.copyOf(plugins);
   }

   public List<RegisteredPlugin> plugins() {
      return plugins;
   }

   /**
    * Threads the tasks of every leaf through all {@link Contract#ON_TASK} plugins.
    */
   public Scenario applyTaskPlugins(Scenario root) {
      if (plugins.stream().noneMatch(p -> p.has(Contract.ON_TASK))) {
         return root;
      }
      return applyTaskPlugins(root, root.name(), new IdentityHashMap<>());
   }

   private Scenario applyTaskPlugins(Scenario scenario, String path, Map<Scenario, Scenario> visited) {
      Scenario done = visited.get(scenario);
      if (done != null) {
         return done;
      }
      Scenario result;
      if (scenario.isGroup()) {
         List<Scenario> children = new ArrayList<>(scenario.children().size());
         for (Scenario child : scenario.children()) {
            children.add(applyTaskPlugins(child, path + "/" + child.name(), visited));
         }
         result = scenario.withChildren(children);
      } else {
         List<Task> tasks = scenario.tasks();
         for (RegisteredPlugin plugin : plugins) {
            if (plugin.has(Contract.ON_TASK)) {
               tasks = invokeTaskPlugin(plugin, tasks, path);
            }
         }
         result = scenario.withTasks(tasks);
      }
      visited.put(scenario, result);
      return result;
   }

   private static List<Task> invokeTaskPlugin(RegisteredPlugin plugin, List<Task> tasks, String path) {
      String target = "tasks of scenario " + path;
      List<Task> result;
      try {
         result = ((TaskPlugin) plugin.plugin()).onTasks(tasks);
      } catch (RuntimeException e) {
         throw wrap(plugin, Contract.ON_TASK, target, tasks, e);
      }
      if (result == null) {
         throw new PluginException(plugin.name(), Contract.ON_TASK, target, tasks, "returned null");
      }
      for (int i = 0; i < result.size(); ++i) {
         if (result.get(i) == null) {
            throw new PluginException(plugin.name(), Contract.ON_TASK, target + ", task #" + i, tasks, "returned null task");
         }
      }
      if (result.size() != tasks.size()) {
         log.debug("Plugin {} changed the number of tasks in {} from {} to {}", plugin.name(), path, tasks.size(), result.size());
      }
      return result;
   }

   /**
    * Hands every node of the tree to all {@link Contract#ON_SCENARIO} plugins, children before parents.
    * Each node is transformed once, even if the same instance appears under several parents.
    */
   public Scenario applyScenarioPlugins(Scenario root) {
      if (plugins.stream().noneMatch(p -> p.has(Contract.ON_SCENARIO))) {
         return root;
      }
      return applyScenarioPlugins(root, root.name(), new IdentityHashMap<>());
   }

   private Scenario applyScenarioPlugins(Scenario scenario, String path, Map<Scenario, Scenario> visited) {
      Scenario done = visited.get(scenario);
      if (done != null) {
         return done;
      }
      Scenario current = scenario;
      if (scenario.isGroup()) {
         List<Scenario> children = new ArrayList<>(scenario.children().size());
         for (Scenario child : scenario.children()) {
            children.add(applyScenarioPlugins(child, path + "/" + child.name(), visited));
         }
         current = scenario.withChildren(children);
      }
      for (RegisteredPlugin plugin : plugins) {
         if (!plugin.has(Contract.ON_SCENARIO)) {
            continue;
         }
         Scenario next;
         try {
            next = ((ScenarioPlugin) plugin.plugin()).onScenario(current);
         } catch (RuntimeException e) {
            throw wrap(plugin, Contract.ON_SCENARIO, "scenario " + path, current, e);
         }
         if (next == null) {
            throw new PluginException(plugin.name(), Contract.ON_SCENARIO, "scenario " + path, current, "returned null");
         }
         current = next;
      }
      visited.put(scenario, current);
      return current;
   }

   /**
    * Folds all {@link Contract#ON_PROGRAM} plugins over the program: <code>Pn(...P2(P1(program)))</code>.
    */
   public Program applyProgramPlugins(Program program) {
      Program current = program;
      for (RegisteredPlugin plugin : plugins) {
         if (!plugin.has(Contract.ON_PROGRAM)) {
            continue;
         }
         Program next;
         try {
            next = ((ProgramPlugin) plugin.plugin()).onProgram(current);
         } catch (RuntimeException e) {
            throw wrap(plugin, Contract.ON_PROGRAM, "program", current, e);
         }
         if (next == null) {
            throw new PluginException(plugin.name(), Contract.ON_PROGRAM, "program", current, "returned null");
         }
         current = next;
      }
      return current;
   }

   /**
    * A {@link PluginException} already raised for this plugin and contract is kept as is; anything else,
    * including an exception naming a different plugin, is attributed to <code>plugin</code>.
    */
   private static PluginException wrap(RegisteredPlugin plugin, Contract contract, String target, Object subject, RuntimeException e) {
      if (e instanceof PluginException) {
         PluginException pe = (PluginException) e;
         if (plugin.name().equals(pe.plugin()) && contract == pe.contract()) {
            return pe;
         }
      }
      return new PluginException(plugin.name(), contract, target, subject, e);
   }
}
