package io.hartransformer.core.plugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.junit.jupiter.api.Test;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.InvalidContractException;
import io.hartransformer.api.plugin.Plugin;
import io.hartransformer.core.plugins.LogFirstRequestPlugin;
import io.hartransformer.core.plugins.SanitizeHeadersPlugin;

public class PluginRegistryTest {
   @Test
   public void testLoadFindsBundledPlugins() {
      PluginRegistry registry = PluginRegistry.load();
      assertThat(registry.names()).contains(SanitizeHeadersPlugin.NAME, LogFirstRequestPlugin.NAME);
      assertThat(registry.resolve(SanitizeHeadersPlugin.NAME).contracts()).containsExactly(Contract.ON_TASK);
      assertThat(registry.resolve(LogFirstRequestPlugin.NAME).plugin()).isInstanceOf(LogFirstRequestPlugin.class);
   }

   @Test
   public void testRegister() {
      PluginRegistry registry = new PluginRegistry();
      RegisteredPlugin registered = registry.register("identity", new TestPlugins.Tasks(UnaryOperator.identity()));
      assertThat(registered.name()).isEqualTo("identity");
      assertThat(registered.has(Contract.ON_TASK)).isTrue();
      assertThat(registered.has(Contract.ON_PROGRAM)).isFalse();
      assertThat(registry.resolve("identity")).isSameAs(registered);
   }

   @Test
   public void testUnknownName() {
      PluginRegistry registry = new PluginRegistry();
      assertThatThrownBy(() -> registry.resolve(Collections.singletonList("nope")))
            .isInstanceOf(InvalidContractException.class)
            .hasMessageContaining("nope");
   }

   @Test
   public void testNoContracts() {
      Plugin plugin = Collections::emptySet;
      assertThatThrownBy(() -> new PluginRegistry().register("empty", plugin))
            .isInstanceOf(InvalidContractException.class)
            .hasMessageContaining("does not declare any contract");
   }

   @Test
   public void testContractNotImplemented() {
      TestPlugins.Tasks plugin = new TestPlugins.Tasks(UnaryOperator.identity());
      assertThatThrownBy(() -> new PluginRegistry().register("liar", plugin, EnumSet.of(Contract.ON_TASK, Contract.ON_PROGRAM)))
            .isInstanceOf(InvalidContractException.class)
            .hasMessageContaining("ProgramPlugin");
   }

   @Test
   public void testNullContract() {
      Set<Contract> contracts = new HashSet<>(Arrays.asList(Contract.ON_TASK, null));
      TestPlugins.Tasks plugin = new TestPlugins.Tasks(UnaryOperator.identity());
      assertThatThrownBy(() -> PluginRegistry.validate("weird", plugin, contracts))
            .isInstanceOf(InvalidContractException.class)
            .hasMessageContaining("unrecognized contract");
   }

   @Test
   public void testMissingName() {
      TestPlugins.Tasks plugin = new TestPlugins.Tasks(UnaryOperator.identity());
      assertThatThrownBy(() -> PluginRegistry.validate("", plugin, plugin.contracts()))
            .isInstanceOf(InvalidContractException.class);
   }
}
