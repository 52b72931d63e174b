package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Import statement: <code>import X</code>, <code>import X as A</code>, <code>from M import X</code>
 * or <code>from M import X as A</code>. With several targets, one line is produced per target.
 */
public final class Import extends Statement {
   private final List<String> targets;
   private final String source;
   private final String alias;

   public Import(List<String> targets) {
      this(targets, null, null, Collections.emptyList());
   }

   public Import(List<String> targets, String source) {
      this(targets, source, null, Collections.emptyList());
   }

   public Import(List<String> targets, String source, String alias, List<String> comments) {
      super(comments);
      if (targets == null || targets.isEmpty()) {
         throw new IllegalArgumentException("Import needs at least one target.");
      }
      if (alias != null && targets.size() > 1) {
         throw new IllegalArgumentException("Cannot use alias '" + alias + "' when importing multiple targets " + targets);
      }
      this.targets = List.copyOf(targets);
      this.source = source;
      this.alias = alias;
   }

   public static Import of(String target) {
      return new Import(Collections.singletonList(target));
   }

   public static Import from(String source, String... targets) {
      return new Import(List.of(targets), source);
   }

   public List<String> targets() {
      return targets;
   }

   public String source() {
      return source;
   }

   public String alias() {
      return alias;
   }

   @Override
   public Import withComments(List<String> comments) {
      return new Import(targets, source, alias, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      String prefix = source == null ? "" : "from " + source + " ";
      String suffix = alias == null ? "" : " as " + alias;
      List<Line> lines = new ArrayList<>();
      if (comments) {
         lines.addAll(commentLines(indentLevel));
      }
      for (String target : targets) {
         lines.add(new Line(prefix + "import " + target + suffix, indentLevel));
      }
      return lines;
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      Import other = (Import) o;
      return targets.equals(other.targets) && Objects.equals(source, other.source) && Objects.equals(alias, other.alias);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), targets, source, alias);
   }

   @Override
   public String toString() {
      return "Import(" + targets + (source == null ? "" : " from " + source) + ")";
   }
}
