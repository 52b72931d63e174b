package io.hartransformer.api.syntax;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An {@link Expression} used as a {@link Statement}, i.e. for its side effects.
 */
public final class Standalone extends Statement {
   private final Expression expression;

   public Standalone(Expression expression) {
      this(expression, Collections.emptyList());
   }

   public Standalone(Expression expression, List<String> comments) {
      super(comments);
      this.expression = Objects.requireNonNull(expression);
   }

   public Expression expression() {
      return expression;
   }

   @Override
   public Standalone withComments(List<String> comments) {
      return new Standalone(expression, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      Line line = new Line(expression.toString(), indentLevel);
      return comments ? attachComment(line) : Collections.singletonList(line);
   }

   @Override
   public boolean equals(Object o) {
      return super.equals(o) && expression.equals(((Standalone) o).expression);
   }

   @Override
   public int hashCode() {
      return 31 * super.hashCode() + expression.hashCode();
   }

   @Override
   public String toString() {
      return "Standalone(" + expression + ")";
   }
}
