package io.hartransformer.api.syntax;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Assignment of a value to a variable: <code>lhs = rhs</code>. Chained assignments are not supported.
 */
public final class Assignment extends Statement {
   private final String lhs;
   private final Expression rhs;

   public Assignment(String lhs, Expression rhs) {
      this(lhs, rhs, Collections.emptyList());
   }

   public Assignment(String lhs, Expression rhs, List<String> comments) {
      super(comments);
      this.lhs = Objects.requireNonNull(lhs);
      this.rhs = Objects.requireNonNull(rhs);
   }

   public String lhs() {
      return lhs;
   }

   public Expression rhs() {
      return rhs;
   }

   public Assignment withRhs(Expression rhs) {
      return new Assignment(lhs, rhs, comments());
   }

   @Override
   public Assignment withComments(List<String> comments) {
      return new Assignment(lhs, rhs, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      Line line = new Line(lhs + " = " + rhs, indentLevel);
      return comments ? attachComment(line) : Collections.singletonList(line);
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      Assignment other = (Assignment) o;
      return lhs.equals(other.lhs) && rhs.equals(other.rhs);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), lhs, rhs);
   }

   @Override
   public String toString() {
      return "Assignment(" + lhs + " = " + rhs + ")";
   }
}
