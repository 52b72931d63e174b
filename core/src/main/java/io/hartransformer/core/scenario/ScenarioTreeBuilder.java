package io.hartransformer.core.scenario;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

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
import io.hartransformer.util.Identifiers;

/**
 * Builds the validated scenario tree from a listing.
 * <p>
 * Children are built before their parent; a child that cannot be built is reported to the {@link SkipHandler}
 * and left out, while naming and weight errors abort the whole build.
 */
public class ScenarioTreeBuilder {
   private static final Logger log = LogManager.getLogger(ScenarioTreeBuilder.class);

   public static final SkipHandler LOG_AND_CONTINUE = e -> log.warn("{}", e.getMessage());

   private final Denylist denylist;
   private final SkipHandler skipHandler;

   public ScenarioTreeBuilder() {
      this(Denylist.empty(), LOG_AND_CONTINUE);
   }

   public ScenarioTreeBuilder(Denylist denylist, SkipHandler skipHandler) {
      this.denylist = denylist;
      this.skipHandler = skipHandler;
   }

   /**
    * Builds a root scenario, named after the origin of <code>root</code>. Roots always have the default weight.
    *
    * @throws SkippableScenarioException if the root itself yields no scenario.
    */
   public Scenario build(SourceNode root) {
      return build(root, Identifiers.toIdentifier(root.origin()));
   }

   private Scenario build(SourceNode node, String name) {
      if (node instanceof SourceNode.Group) {
         return buildGroup((SourceNode.Group) node, name);
      } else {
         return buildTrace((SourceNode.Trace) node, name);
      }
   }

   private Scenario buildGroup(SourceNode.Group group, String name) {
      List<Scenario> children = new ArrayList<>();
      List<String> stems = new ArrayList<>();
      for (SourceNode child : group.children()) {
         try {
            children.add(build(child, Identifiers.toIdentifier(child.stem())));
            stems.add(child.stem());
         } catch (SkippableScenarioException e) {
            log.debug("Skipping {}", child.origin(), e);
            skipHandler.skipped(e);
         }
      }
      checkDanglingWeights(group);
      if (children.isEmpty()) {
         throw new SkippableScenarioException(group.origin(), "no scenarios inside the directory");
      }
      checkNameCollisions(group, children);
      for (int i = 0; i < children.size(); ++i) {
         SourceNode.WeightReader weight = group.weights().get(stems.get(i));
         if (weight != null) {
            Scenario child = children.get(i);
            children.set(i, child.withWeight(readWeight(child.origin(), weight)));
         }
      }
      return Scenario.group(name, group.origin(), children);
   }

   private Scenario buildTrace(SourceNode.Trace trace, String name) {
      List<Request> requests;
      try {
         requests = trace.read();
      } catch (IOException | HarFormatException e) {
         throw new SkippableScenarioException(trace.origin(), "cannot read trace: " + e.getMessage(), e);
      }
      List<Task> tasks = new ArrayList<>();
      for (Task task : Task.fromRequests(requests)) {
         if (denylist.isDenied(task.request().url().toString())) {
            log.debug("{}: dropping denylisted request {}", trace.origin(), task.request().url());
         } else {
            tasks.add(task);
         }
      }
      Scenario scenario = Scenario.leaf(name, trace.origin(), tasks);
      if (tasks.isEmpty()) {
         String reason = requests.isEmpty() ? "trace contains no requests" : "all requests are denylisted";
         skipHandler.skipped(new SkippableScenarioException(trace.origin(), "empty scenario kept: " + reason));
      }
      return scenario;
   }

   private static void checkDanglingWeights(SourceNode.Group group) {
      List<String> listed = group.children().stream().map(SourceNode::stem).collect(Collectors.toList());
      List<String> dangling = group.weights().keySet().stream()
            .filter(stem -> !listed.contains(stem))
            .collect(Collectors.toList());
      if (!dangling.isEmpty()) {
         log.info("For any X, a weight declaration X.weight needs either a trace X.<ext> or a group X next to it.");
         throw new DanglingWeightException(group.origin(), dangling);
      }
   }

   private static void checkNameCollisions(SourceNode.Group group, List<Scenario> children) {
      Map<String, List<String>> byName = new LinkedHashMap<>();
      for (Scenario child : children) {
         byName.computeIfAbsent(child.name(), n -> new ArrayList<>()).add(child.origin());
      }
      for (Map.Entry<String, List<String>> entry : byName.entrySet()) {
         if (entry.getValue().size() > 1) {
            log.error("{} contains scenarios with colliding names: {}", group.origin(), String.join(" vs ", entry.getValue()));
            throw new CollidingScenariosException(group.origin(), entry.getKey());
         }
      }
   }

   static int readWeight(String origin, SourceNode.WeightReader reader) {
      String content;
      try {
         content = reader.read();
      } catch (IOException e) {
         throw new WeightValueException(origin, "cannot read weight declaration", e);
      }
      return parseWeight(origin, content);
   }

   static int parseWeight(String origin, String content) {
      String weight = content == null ? "" : content.strip();
      if (weight.isEmpty() || !weight.chars().allMatch(Character::isDigit)) {
         throw new WeightValueException(origin, "weights must be positive integers, got '" + weight + "'");
      }
      BigInteger value = new BigInteger(weight);
      if (value.signum() == 0) {
         throw new WeightValueException(origin, "weight must not be zero");
      } else if (value.bitLength() > 31) {
         throw new WeightValueException(origin, "weight " + weight + " is too large");
      }
      return value.intValue();
   }
}
