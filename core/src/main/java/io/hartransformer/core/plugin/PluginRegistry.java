package io.hartransformer.core.plugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.InvalidContractException;
import io.hartransformer.api.plugin.Name;
import io.hartransformer.api.plugin.Plugin;

/**
 * Maps plugin names to plugins with validated contracts.
 * <p>
 * Contracts are checked when a plugin is registered, so that a misdeclared plugin fails before any input
 * is read. The registry is populated at startup and only read afterwards.
 */
public class PluginRegistry {
   private static final Logger log = LogManager.getLogger(PluginRegistry.class);

   private final Map<String, RegisteredPlugin> plugins = new LinkedHashMap<>();

   /**
    * Creates a registry with all plugins found through {@link ServiceLoader} on the class path.
    */
   public static PluginRegistry load() {
      return load(Thread.currentThread().getContextClassLoader());
   }

   public static PluginRegistry load(ClassLoader classLoader) {
      PluginRegistry registry = new PluginRegistry();
      ServiceLoader.load(Plugin.class, classLoader).stream().forEach(provider -> {
         Name name = provider.type().getAnnotation(Name.class);
         if (name == null || name.value().isEmpty()) {
            log.error("Service-loaded plugin {} is missing @Name annotation!", provider.type());
         } else if (registry.plugins.containsKey(name.value())) {
            log.warn("Plugin {} is provided by both {} and {}; keeping the first one.",
                  name.value(), registry.plugins.get(name.value()).plugin().getClass(), provider.type());
         } else {
            registry.register(name.value(), provider.get());
         }
      });
      log.debug("Loaded plugins {}", registry.plugins.keySet());
      return registry;
   }

   public RegisteredPlugin register(String name, Plugin plugin) {
      return register(name, plugin, plugin.contracts());
   }

   /**
    * @throws InvalidContractException if the contract set is empty, contains <code>null</code> or a contract
    *                                  whose interface <code>plugin</code> does not implement.
    */
   public RegisteredPlugin register(String name, Plugin plugin, Set<Contract> contracts) {
      RegisteredPlugin registered = validate(name, plugin, contracts);
      RegisteredPlugin previous = plugins.put(name, registered);
      if (previous != null) {
         log.warn("Plugin {} replaced {}", name, previous.plugin().getClass().getName());
      }
      return registered;
   }

   public static RegisteredPlugin validate(String name, Plugin plugin, Set<Contract> contracts) {
      if (name == null || name.isEmpty()) {
         throw new InvalidContractException("Plugin " + plugin + " must have a name.");
      }
      if (plugin == null) {
         throw new InvalidContractException("Plugin " + name + " is null.");
      }
      if (contracts == null || contracts.isEmpty()) {
         throw new InvalidContractException("Plugin " + name + " does not declare any contract.");
      }
      for (Contract contract : contracts) {
         if (contract == null) {
            throw new InvalidContractException("Plugin " + name + " declares an unrecognized contract: " + contracts);
         }
         if (!contract.isImplementedBy(plugin)) {
            throw new InvalidContractException(String.format("Plugin %s declares %s but %s does not implement %s",
                  name, contract, plugin.getClass().getName(), contract.shape().getSimpleName()));
         }
      }
      for (Contract contract : Contract.values()) {
         if (!contracts.contains(contract) && contract.isImplementedBy(plugin)) {
            log.debug("Plugin {} implements {} but does not declare {}; it won't be invoked at that stage.",
                  name, contract.shape().getSimpleName(), contract);
         }
      }
      return new RegisteredPlugin(name, plugin, contracts);
   }

   /**
    * @throws InvalidContractException if no plugin is registered under <code>name</code>.
    */
   public RegisteredPlugin resolve(String name) {
      RegisteredPlugin plugin = plugins.get(name);
      if (plugin == null) {
         throw new InvalidContractException("Unknown plugin '" + name + "'; available plugins: " + plugins.keySet());
      }
      return plugin;
   }

   public List<RegisteredPlugin> resolve(Collection<String> names) {
      List<RegisteredPlugin> resolved = new ArrayList<>(names.size());
      for (String name : names) {
         resolved.add(resolve(name));
      }
      return resolved;
   }

   public Set<String> names() {
      return Collections.unmodifiableSet(plugins.keySet());
   }
}
