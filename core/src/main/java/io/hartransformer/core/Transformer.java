package io.hartransformer.core;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.api.plugin.Plugin;
import io.hartransformer.api.scenario.Scenario;
import io.hartransformer.api.scenario.SkipHandler;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.core.codegen.CodeGenerator;
import io.hartransformer.core.denylist.Denylist;
import io.hartransformer.core.locust.LocustProgramBuilder;
import io.hartransformer.core.plugin.ContractDispatcher;
import io.hartransformer.core.plugin.PluginRegistry;
import io.hartransformer.core.plugin.RegisteredPlugin;
import io.hartransformer.core.plugins.SanitizeHeadersPlugin;
import io.hartransformer.core.scenario.FileSystemScenarioSource;
import io.hartransformer.core.scenario.ScenarioSource;
import io.hartransformer.core.scenario.ScenarioTreeBuilder;
import io.hartransformer.core.scenario.SourceNode;

/**
 * Entry point of the conversion: scenario locations in, Locust program out.
 * <p>
 * A conversion completes every stage before the first line is emitted, so a failure never leaves
 * a partial program behind.
 */
public class Transformer {
   private static final Logger log = LogManager.getLogger(Transformer.class);

   private final ScenarioSource source;
   private final ScenarioTreeBuilder treeBuilder;
   private final ContractDispatcher dispatcher;
   private final LocustProgramBuilder programBuilder;
   private final CodeGenerator codeGenerator;

   private Transformer(Builder builder, List<RegisteredPlugin> plugins) {
      this.source = builder.source;
      this.treeBuilder = new ScenarioTreeBuilder(builder.denylist, builder.skipHandler);
      this.dispatcher = new ContractDispatcher(plugins);
      this.programBuilder = new LocustProgramBuilder();
      this.codeGenerator = new CodeGenerator();
   }

   public static Builder builder() {
      return new Builder();
   }

   public List<RegisteredPlugin> plugins() {
      return dispatcher.plugins();
   }

   public Program program(Collection<String> locations) throws IOException {
      List<Scenario> roots = new ArrayList<>(locations.size());
      for (String location : locations) {
         SourceNode listing = source.list(location);
         Scenario root = treeBuilder.build(listing);
         root = dispatcher.applyTaskPlugins(root);
         root = dispatcher.applyScenarioPlugins(root);
         log.debug("Built scenario {} from {}", root.name(), location);
         roots.add(root);
      }
      return dispatcher.applyProgramPlugins(programBuilder.build(roots));
   }

   public String dumps(Collection<String> locations) throws IOException {
      return codeGenerator.toText(program(locations));
   }

   public void dump(Writer writer, Collection<String> locations) throws IOException {
      codeGenerator.write(program(locations), writer);
   }

   public static class Builder {
      private final List<String> pluginNames = new ArrayList<>();
      private final List<RegisteredPlugin> extraPlugins = new ArrayList<>();
      private boolean withDefaultPlugins = true;
      private PluginRegistry registry;
      private ScenarioSource source = new FileSystemScenarioSource();
      private Denylist denylist = Denylist.empty();
      private SkipHandler skipHandler = ScenarioTreeBuilder.LOG_AND_CONTINUE;

      /**
       * Plugins to resolve in the {@link #registry(PluginRegistry) registry}, run in the given order
       * after the default plugins.
       */
      public Builder plugins(Collection<String> names) {
         pluginNames.addAll(names);
         return this;
      }

      public Builder plugin(String name) {
         pluginNames.add(name);
         return this;
      }

      /**
       * Adds a plugin instance directly, validating its contracts immediately.
       */
      public Builder plugin(String name, Plugin plugin) {
         extraPlugins.add(PluginRegistry.validate(name, plugin, plugin.contracts()));
         return this;
      }

      public Builder withDefaultPlugins(boolean withDefaultPlugins) {
         this.withDefaultPlugins = withDefaultPlugins;
         return this;
      }

      public Builder registry(PluginRegistry registry) {
         this.registry = registry;
         return this;
      }

      public Builder source(ScenarioSource source) {
         this.source = source;
         return this;
      }

      public Builder denylist(Denylist denylist) {
         this.denylist = denylist;
         return this;
      }

      public Builder skipHandler(SkipHandler skipHandler) {
         this.skipHandler = skipHandler;
         return this;
      }

      /**
       * @throws io.hartransformer.api.plugin.InvalidContractException if a plugin name cannot be resolved.
       */
      public Transformer build() {
         List<RegisteredPlugin> plugins = new ArrayList<>();
         if (withDefaultPlugins) {
            SanitizeHeadersPlugin sanitizeHeaders = new SanitizeHeadersPlugin();
            plugins.add(PluginRegistry.validate(SanitizeHeadersPlugin.NAME, sanitizeHeaders, sanitizeHeaders.contracts()));
         }
         if (!pluginNames.isEmpty()) {
            PluginRegistry registry = this.registry == null ? PluginRegistry.load() : this.registry;
            plugins.addAll(registry.resolve(pluginNames));
         }
         plugins.addAll(extraPlugins);
         log.debug("Using plugins {}", plugins);
         return new Transformer(this, plugins);
      }
   }
}
