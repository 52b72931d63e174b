package io.hartransformer.api.scenario;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.hartransformer.api.task.Task;

/**
 * A node in the scenario tree: either a group of uniquely named child scenarios, or a leaf
 * holding the ordered tasks recorded in one trace.
 * <p>
 * Scenarios are immutable; modifications produce new nodes.
 */
public final class Scenario {
   public static final int DEFAULT_WEIGHT = 1;

   private final String name;
   private final String origin;
   private final int weight;
   private final List<Scenario> children;
   private final List<Task> tasks;

   private Scenario(String name, String origin, int weight, List<Scenario> children, List<Task> tasks) {
      if (weight < 1) {
         throw new IllegalArgumentException("Weight of scenario " + name + " must be positive: " + weight);
      }
      this.name = Objects.requireNonNull(name, "name");
      this.origin = origin;
      this.weight = weight;
      this.children = children;
      this.tasks = tasks;
   }

   public static Scenario group(String name, String origin, List<Scenario> children) {
      return new Scenario(name, origin, DEFAULT_WEIGHT, checkUnique(origin, children), null);
   }

   public static Scenario leaf(String name, String origin, List<Task> tasks) {
      return new Scenario(name, origin, DEFAULT_WEIGHT, null, List.copyOf(tasks));
   }

   private static List<Scenario> checkUnique(String origin, List<Scenario> children) {
      Set<String> names = new HashSet<>();
      for (Scenario child : children) {
         if (!names.add(child.name)) {
            throw new CollidingScenariosException(origin, child.name);
         }
      }
      return List.copyOf(children);
   }

   public String name() {
      return name;
   }

   /**
    * @return The file or directory this scenario was built from, or <code>null</code>.
    */
   public String origin() {
      return origin;
   }

   public int weight() {
      return weight;
   }

   public boolean isGroup() {
      return children != null;
   }

   /**
    * @return Child scenarios; empty for a leaf.
    */
   public List<Scenario> children() {
      return children == null ? Collections.emptyList() : children;
   }

   /**
    * @return Tasks of this scenario; empty for a group.
    */
   public List<Task> tasks() {
      return tasks == null ? Collections.emptyList() : tasks;
   }

   public Scenario withName(String name) {
      return new Scenario(name, origin, weight, children, tasks);
   }

   public Scenario withWeight(int weight) {
      return new Scenario(name, origin, weight, children, tasks);
   }

   public Scenario withChildren(List<Scenario> children) {
      if (!isGroup()) {
         throw new IllegalStateException("Scenario " + name + " holds tasks, cannot set children.");
      }
      return new Scenario(name, origin, weight, checkUnique(origin, children), null);
   }

   public Scenario withTasks(List<Task> tasks) {
      if (isGroup()) {
         throw new IllegalStateException("Scenario " + name + " is a group, cannot set tasks.");
      }
      return new Scenario(name, origin, weight, null, List.copyOf(tasks));
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Scenario)) {
         return false;
      }
      Scenario other = (Scenario) o;
      return weight == other.weight && name.equals(other.name) && Objects.equals(origin, other.origin)
            && Objects.equals(children, other.children) && Objects.equals(tasks, other.tasks);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, origin, weight, children, tasks);
   }

   @Override
   public String toString() {
      return "Scenario{" + name + ", weight=" + weight + (isGroup() ? ", children=" + children.size() : ", tasks=" + tasks.size()) + '}';
   }
}
