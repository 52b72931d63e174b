package io.hartransformer.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.InvalidContractException;
import io.hartransformer.api.plugin.ProgramPlugin;
import io.hartransformer.api.scenario.SkipHandler;
import io.hartransformer.api.scenario.SkippableScenarioException;
import io.hartransformer.api.syntax.OpaqueBlock;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.core.denylist.Denylist;
import io.hartransformer.core.plugins.LogFirstRequestPlugin;
import io.hartransformer.core.plugins.SanitizeHeadersPlugin;
import io.hartransformer.core.test.HarFixtures;

public class TransformerTest {
   @TempDir
   Path dir;

   private static class Appending implements ProgramPlugin {
      private final String text;

      Appending(String text) {
         this.text = text;
      }

      @Override
      public Set<Contract> contracts() {
         return Contract.union(Contract.ON_PROGRAM);
      }

      @Override
      public Program onProgram(Program program) {
         return program.append(new OpaqueBlock(text));
      }
   }

   private void writeTraces() throws IOException {
      HarFixtures.writeHar(dir.resolve("a.har"), "https://example.com/a");
      HarFixtures.writeHar(dir.resolve("b.har"), "https://example.com/b1", "https://www.google.com/b2");
      HarFixtures.write(dir.resolve("b.weight"), "3\n");
   }

   @Test
   public void testWeightedDirectory() throws IOException {
      writeTraces();
      String text = Transformer.builder().build().dumps(List.of(dir.toString()));
      assertThat(text)
            .contains("from locust import HttpUser")
            .contains("@task(1)\n    class a(SequentialTaskSet):")
            .contains("@task(3)\n    class b(SequentialTaskSet):")
            .contains("headers={'accept': '*/*'}")
            .contains("wait_time = between(0, 10)")
            .doesNotEndWith("\n");
   }

   @Test
   public void testDeterministic() throws IOException {
      writeTraces();
      Transformer transformer = Transformer.builder().build();
      assertThat(transformer.dumps(List.of(dir.toString()))).isEqualTo(transformer.dumps(List.of(dir.toString())));
   }

   @Test
   public void testDump() throws IOException {
      writeTraces();
      Transformer transformer = Transformer.builder().build();
      StringWriter writer = new StringWriter();
      transformer.dump(writer, List.of(dir.toString()));
      assertThat(writer.toString()).isEqualTo(transformer.dumps(List.of(dir.toString())));
   }

   @Test
   public void testDenylist() throws IOException {
      writeTraces();
      String text = Transformer.builder().denylist(Denylist.of("google")).build().dumps(List.of(dir.toString()));
      assertThat(text).contains("https://example.com/b1").doesNotContain("google");
   }

   @Test
   public void testWithoutDefaultPlugins() throws IOException {
      writeTraces();
      Transformer transformer = Transformer.builder().withDefaultPlugins(false).build();
      assertThat(transformer.plugins()).isEmpty();
      assertThat(transformer.dumps(List.of(dir.toString()))).contains("headers={'Accept': '*/*'}");
   }

   @Test
   public void testProgramPluginOrder() throws IOException {
      writeTraces();
      String text = Transformer.builder()
            .plugin("first", new Appending("# first"))
            .plugin("second", new Appending("# second"))
            .build().dumps(List.of(dir.toString()));
      assertThat(text).endsWith("# first\n\n# second");
   }

   @Test
   public void testNamedPlugins() {
      Transformer transformer = Transformer.builder().plugin(LogFirstRequestPlugin.NAME).build();
      assertThat(transformer.plugins()).extracting(p -> p.name())
            .containsExactly(SanitizeHeadersPlugin.NAME, LogFirstRequestPlugin.NAME);
   }

   @Test
   public void testUnknownPlugin() {
      assertThatThrownBy(() -> Transformer.builder().plugin("no-such-plugin").build())
            .isInstanceOf(InvalidContractException.class);
   }

   @Test
   public void testMultipleRoots() throws IOException {
      Path first = HarFixtures.writeHar(dir.resolve("one/x.har"), "https://example.com/1");
      Path second = HarFixtures.writeHar(dir.resolve("two.har"), "https://example.com/2");
      String text = Transformer.builder().build().dumps(List.of(first.getParent().toString(), second.toString()));
      assertThat(text.split("\n")).filteredOn(line -> line.startsWith("class LocustFor")).hasSize(2);
   }

   @Test
   public void testStrictSkipHandler() throws IOException {
      writeTraces();
      HarFixtures.write(dir.resolve("broken.har"), "not json");
      Transformer lenient = Transformer.builder().build();
      assertThat(lenient.dumps(List.of(dir.toString()))).doesNotContain("class broken");

      Transformer strict = Transformer.builder().skipHandler(SkipHandler.strict()).build();
      assertThatThrownBy(() -> strict.dumps(List.of(dir.toString())))
            .isInstanceOf(SkippableScenarioException.class)
            .hasMessageContaining("broken.har");
   }
}
