package io.hartransformer.core.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.hartransformer.api.request.HttpMethod;
import io.hartransformer.api.request.Request;
import io.hartransformer.api.scenario.CollidingScenariosException;
import io.hartransformer.api.scenario.DanglingWeightException;
import io.hartransformer.api.scenario.Scenario;
import io.hartransformer.api.scenario.SkipHandler;
import io.hartransformer.api.scenario.SkippableScenarioException;
import io.hartransformer.api.scenario.WeightValueException;
import io.hartransformer.api.task.Task;
import io.hartransformer.core.denylist.Denylist;
import io.hartransformer.core.har.HarFormatException;

public class ScenarioTreeBuilderTest {
   private final List<SkippableScenarioException> skipped = new ArrayList<>();
   private final ScenarioTreeBuilder builder = new ScenarioTreeBuilder(Denylist.empty(), skipped::add);

   private static Request get(String url, int second) {
      return Request.builder().timestamp(Instant.ofEpochSecond(second)).method(HttpMethod.GET).url(URI.create(url)).build();
   }

   private static SourceNode trace(String dir, String file, String... urls) {
      List<Request> requests = new ArrayList<>();
      for (int i = 0; i < urls.length; ++i) {
         requests.add(get(urls[i], i));
      }
      return SourceNode.trace(file, dir + "/" + file, () -> requests);
   }

   private static SourceNode group(String origin, SourceNode... children) {
      return group(origin, Collections.emptyMap(), children);
   }

   private static SourceNode group(String origin, Map<String, String> weights, SourceNode... children) {
      Map<String, SourceNode.WeightReader> readers = new LinkedHashMap<>();
      weights.forEach((stem, value) -> readers.put(stem, () -> value));
      String name = origin.substring(origin.lastIndexOf('/') + 1);
      return SourceNode.group(name, origin, Arrays.asList(children), readers);
   }

   private static List<String> names(List<Scenario> scenarios) {
      return scenarios.stream().map(Scenario::name).collect(Collectors.toList());
   }

   @Test
   public void testSingleTrace() {
      Scenario root = builder.build(trace("in", "shop.har", "https://example.com/a", "https://example.com/b"));
      assertThat(root.isGroup()).isFalse();
      assertThat(root.name()).startsWith("in_shop_har_").matches("in_shop_har_[0-9]+");
      assertThat(root.weight()).isEqualTo(Scenario.DEFAULT_WEIGHT);
      assertThat(root.tasks()).extracting(t -> t.request().url().getPath()).containsExactly("/a", "/b");
      assertThat(skipped).isEmpty();
   }

   @Test
   public void testGroupNamesAndWeights() {
      Map<String, String> weights = new LinkedHashMap<>();
      weights.put("a", "1\n");
      weights.put("b", " 3 ");
      Scenario root = builder.build(group("traces", weights,
            trace("traces", "a.har", "https://example.com/a"),
            trace("traces", "b.har", "https://example.com/b")));
      assertThat(root.isGroup()).isTrue();
      assertThat(names(root.children())).containsExactly("a", "b");
      assertThat(root.children()).extracting(Scenario::weight).containsExactly(1, 3);
      assertThat(root.weight()).isEqualTo(Scenario.DEFAULT_WEIGHT);
   }

   @Test
   public void testCollisionAtDepth() {
      SourceNode inner = group("root/inner",
            trace("root/inner", "x.har", "https://example.com/1"),
            trace("root/inner", "x.json", "https://example.com/2"));
      assertThatThrownBy(() -> builder.build(group("root", inner)))
            .isInstanceOf(CollidingScenariosException.class)
            .hasMessageContaining("root/inner")
            .hasMessageContaining("'x'");
   }

   @Test
   public void testDanglingWeight() {
      SourceNode root = group("root", Collections.singletonMap("missing", "2"),
            trace("root", "present.har", "https://example.com/1"));
      assertThatThrownBy(() -> builder.build(root))
            .isInstanceOfSatisfying(DanglingWeightException.class,
                  e -> assertThat(e.weightFiles()).containsExactly("missing"));
   }

   @Test
   public void testWeightOfSkippedChildIsNotDangling() {
      Map<String, String> weights = new LinkedHashMap<>();
      weights.put("broken", "2");
      SourceNode broken = SourceNode.trace("broken.har", "root/broken.har", () -> {
         throw new IOException("unreadable");
      });
      Scenario root = builder.build(group("root", weights, broken, trace("root", "ok.har", "https://example.com")));
      assertThat(names(root.children())).containsExactly("ok");
      assertThat(skipped).singleElement().satisfies(e -> {
         assertThat(e.origin()).isEqualTo("root/broken.har");
         assertThat(e.getMessage()).contains("cannot read trace").contains("unreadable");
      });
   }

   @Test
   public void testInvalidWeights() {
      for (String value : Arrays.asList("0", "abc", "-1", "1.5", "", "99999999999")) {
         SourceNode root = group("root", Collections.singletonMap("a", value), trace("root", "a.har", "https://example.com"));
         assertThatThrownBy(() -> builder.build(root)).as(value).isInstanceOf(WeightValueException.class);
      }
   }

   @Test
   public void testLargeWeight() {
      assertThat(ScenarioTreeBuilder.parseWeight("x", "2147483647")).isEqualTo(Integer.MAX_VALUE);
      assertThat(ScenarioTreeBuilder.parseWeight("x", "007")).isEqualTo(7);
   }

   @Test
   public void testDenylist() {
      ScenarioTreeBuilder denying = new ScenarioTreeBuilder(Denylist.of("google"), skipped::add);
      Scenario root = denying.build(trace("in", "t.har", "https://www.google.com", "https://example.com"));
      assertThat(root.tasks()).extracting(Task::request).extracting(r -> r.url().toString())
            .containsExactly("https://example.com");
      assertThat(skipped).isEmpty();
   }

   @Test
   public void testEmptyLeafKeptAndReported() {
      ScenarioTreeBuilder denying = new ScenarioTreeBuilder(Denylist.of("google"), skipped::add);
      Scenario root = denying.build(group("root",
            trace("root", "denied.har", "https://www.google.com"),
            trace("root", "empty.har")));
      assertThat(names(root.children())).containsExactly("denied", "empty");
      assertThat(root.children()).allSatisfy(child -> assertThat(child.tasks()).isEmpty());
      assertThat(skipped).extracting(Throwable::getMessage).satisfiesExactly(
            m -> assertThat(m).contains("all requests are denylisted"),
            m -> assertThat(m).contains("trace contains no requests"));
   }

   @Test
   public void testStrictHandlerAborts() {
      ScenarioTreeBuilder strict = new ScenarioTreeBuilder(Denylist.empty(), SkipHandler.strict());
      SourceNode broken = SourceNode.trace("broken.har", "root/broken.har", () -> {
         throw new HarFormatException("no log.entries");
      });
      assertThatThrownBy(() -> strict.build(group("root", broken, trace("root", "ok.har", "https://example.com"))))
            .isInstanceOf(SkippableScenarioException.class)
            .hasMessageContaining("root/broken.har");
   }

   @Test
   public void testAllChildrenSkipped() {
      SourceNode inner = group("root/inner", SourceNode.trace("bad.har", "root/inner/bad.har", () -> {
         throw new IOException("gone");
      }));
      Scenario root = builder.build(group("root", inner, trace("root", "ok.har", "https://example.com")));
      assertThat(names(root.children())).containsExactly("ok");
      assertThat(skipped).extracting(SkippableScenarioException::origin).containsExactly("root/inner/bad.har", "root/inner");
   }

   @Test
   public void testEmptyRootGroup() {
      assertThatThrownBy(() -> builder.build(group("root")))
            .isInstanceOf(SkippableScenarioException.class)
            .hasMessageContaining("no scenarios");
   }

   @Test
   public void testTasksSortedByTimestamp() {
      List<Request> requests = Arrays.asList(get("https://example.com/late", 5), get("https://example.com/early", 1));
      Scenario root = builder.build(SourceNode.trace("t.har", "t.har", () -> requests));
      assertThat(root.tasks()).extracting(t -> t.request().url().getPath()).containsExactly("/early", "/late");
   }
}
