package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function or class definition with a decorator applied, e.g. <code>@task(3)</code>.
 */
public final class Decoration extends Statement {
   private final String decorator;
   private final Statement target;

   public Decoration(String decorator, Statement target) {
      this(decorator, target, Collections.emptyList());
   }

   public Decoration(String decorator, Statement target, List<String> comments) {
      super(comments);
      this.decorator = Objects.requireNonNull(decorator);
      this.target = Objects.requireNonNull(target);
   }

   public String decorator() {
      return decorator;
   }

   public Statement target() {
      return target;
   }

   public Decoration withTarget(Statement target) {
      return new Decoration(decorator, target, comments());
   }

   @Override
   public Decoration withComments(List<String> comments) {
      return new Decoration(decorator, target, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      Line top = new Line("@" + decorator, indentLevel);
      List<Line> lines = new ArrayList<>(comments ? attachComment(top) : Collections.singletonList(top));
      lines.addAll(target.lines(indentLevel, comments));
      return lines;
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      Decoration other = (Decoration) o;
      return decorator.equals(other.decorator) && target.equals(other.target);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), decorator, target);
   }

   @Override
   public String toString() {
      return "Decoration(@" + decorator + ", " + target + ")";
   }
}
