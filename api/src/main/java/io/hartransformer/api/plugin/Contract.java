package io.hartransformer.api.plugin;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Stage of the conversion a plugin hooks into. Every contract requires the plugin to implement
 * the matching interface.
 */
public enum Contract {
   /**
    * Transforms the task list of every leaf scenario.
    */
   ON_TASK(TaskPlugin.class),
   /**
    * Transforms every scenario node, children first.
    */
   ON_SCENARIO(ScenarioPlugin.class),
   /**
    * Transforms the complete generated program.
    */
   ON_PROGRAM(ProgramPlugin.class);

   private final Class<? extends Plugin> shape;

   Contract(Class<? extends Plugin> shape) {
      this.shape = shape;
   }

   public Class<? extends Plugin> shape() {
      return shape;
   }

   public boolean isImplementedBy(Plugin plugin) {
      return shape.isInstance(plugin);
   }

   public static Set<Contract> union(Contract... contracts) {
      if (contracts.length == 0) {
         return Collections.unmodifiableSet(EnumSet.noneOf(Contract.class));
      }
      return Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(contracts)));
   }
}
