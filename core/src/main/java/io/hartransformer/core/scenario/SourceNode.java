package io.hartransformer.core.scenario;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.hartransformer.api.request.Request;

/**
 * Entry of a scenario listing, as produced by a {@link ScenarioSource}: either a group of further entries
 * with optional weight declarations, or a trace of recorded requests.
 * <p>
 * Content is read lazily through the supplied readers so that the listing itself carries no data.
 */
public abstract class SourceNode {
   private final String name;
   private final String origin;

   SourceNode(String name, String origin) {
      this.name = Objects.requireNonNull(name);
      this.origin = Objects.requireNonNull(origin);
   }

   /**
    * File name of this entry, including any extension.
    */
   public String name() {
      return name;
   }

   /**
    * Location of this entry as given by the source, used in messages and as the name of root scenarios.
    */
   public String origin() {
      return origin;
   }

   /**
    * Name without its last extension; weight declarations refer to items by this name.
    */
   public String stem() {
      return stem(name);
   }

   static String stem(String fileName) {
      int dot = fileName.lastIndexOf('.');
      return dot > 0 ? fileName.substring(0, dot) : fileName;
   }

   public static Group group(String name, String origin, List<SourceNode> children, Map<String, WeightReader> weights) {
      return new Group(name, origin, children, weights);
   }

   public static Trace trace(String name, String origin, TraceReader reader) {
      return new Trace(name, origin, reader);
   }

   @FunctionalInterface
   public interface TraceReader {
      List<Request> read() throws IOException;
   }

   @FunctionalInterface
   public interface WeightReader {
      String read() throws IOException;
   }

   public static final class Group extends SourceNode {
      private final List<SourceNode> children;
      private final Map<String, WeightReader> weights;

      private Group(String name, String origin, List<SourceNode> children, Map<String, WeightReader> weights) {
         super(name, origin);
         this.children = List.copyOf(children);
         this.weights = weights == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(weights));
      }

      public List<SourceNode> children() {
         return children;
      }

      /**
       * Weight declarations keyed by the {@link #stem() stem} of the item they apply to.
       */
      public Map<String, WeightReader> weights() {
         return weights;
      }

      @Override
      public String toString() {
         return "Group{" + origin() + ", " + children.size() + " children}";
      }
   }

   public static final class Trace extends SourceNode {
      private final TraceReader reader;

      private Trace(String name, String origin, TraceReader reader) {
         super(name, origin);
         this.reader = Objects.requireNonNull(reader);
      }

      public List<Request> read() throws IOException {
         return reader.read();
      }

      @Override
      public String toString() {
         return "Trace{" + origin() + "}";
      }
   }
}
