package io.hartransformer.core.plugin;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.Plugin;

/**
 * A plugin together with the name it was registered under and its validated contracts.
 */
public final class RegisteredPlugin {
   private final String name;
   private final Plugin plugin;
   private final Set<Contract> contracts;

   RegisteredPlugin(String name, Plugin plugin, Set<Contract> contracts) {
      this.name = name;
      this.plugin = plugin;
      this.contracts = Collections.unmodifiableSet(EnumSet.copyOf(contracts));
   }

   public String name() {
      return name;
   }

   public Plugin plugin() {
      return plugin;
   }

   public Set<Contract> contracts() {
      return contracts;
   }

   public boolean has(Contract contract) {
      return contracts.contains(contract);
   }

   @Override
   public String toString() {
      return name + contracts;
   }
}
