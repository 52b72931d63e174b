package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chain of <code>if</code>, <code>elif</code> and <code>else</code> blocks.
 * The first condition produces the <code>if</code>, following ones the <code>elif</code>s.
 */
public final class IfElse extends Statement {
   private final List<Branch> branches;
   private final List<Statement> elseBlock;

   public IfElse(List<Branch> branches, List<Statement> elseBlock) {
      this(branches, elseBlock, Collections.emptyList());
   }

   public IfElse(List<Branch> branches, List<Statement> elseBlock, List<String> comments) {
      super(comments);
      if (branches == null || branches.isEmpty()) {
         throw new IllegalArgumentException("At least one condition block is required.");
      }
      this.branches = List.copyOf(branches);
      this.elseBlock = elseBlock == null ? null : List.copyOf(elseBlock);
   }

   public static IfElse of(Expression condition, List<Statement> statements) {
      return new IfElse(Collections.singletonList(new Branch(condition, statements)), null);
   }

   public List<Branch> branches() {
      return branches;
   }

   /**
    * @return Statements of the <code>else</code> block or <code>null</code> if there is none.
    */
   public List<Statement> elseBlock() {
      return elseBlock;
   }

   @Override
   public IfElse withComments(List<String> comments) {
      return new IfElse(branches, elseBlock, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      List<Line> lines = new ArrayList<>();
      for (int i = 0; i < branches.size(); ++i) {
         Branch branch = branches.get(i);
         Line top = new Line((i == 0 ? "if " : "elif ") + branch.condition + ":", indentLevel);
         if (i == 0 && comments) {
            lines.addAll(attachComment(top));
         } else {
            lines.add(top);
         }
         lines.addAll(body(branch.statements, indentLevel + 1, comments));
      }
      if (elseBlock != null) {
         lines.add(new Line("else:", indentLevel));
         lines.addAll(body(elseBlock, indentLevel + 1, comments));
      }
      return lines;
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      IfElse other = (IfElse) o;
      return branches.equals(other.branches) && Objects.equals(elseBlock, other.elseBlock);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), branches, elseBlock);
   }

   @Override
   public String toString() {
      return "IfElse(" + branches + ", else=" + elseBlock + ")";
   }

   public static final class Branch {
      private final Expression condition;
      private final List<Statement> statements;

      public Branch(Expression condition, List<Statement> statements) {
         this.condition = Objects.requireNonNull(condition);
         this.statements = List.copyOf(statements);
      }

      public Expression condition() {
         return condition;
      }

      public List<Statement> statements() {
         return statements;
      }

      @Override
      public boolean equals(Object o) {
         if (this == o) {
            return true;
         }
         if (!(o instanceof Branch)) {
            return false;
         }
         Branch other = (Branch) o;
         return condition.equals(other.condition) && statements.equals(other.statements);
      }

      @Override
      public int hashCode() {
         return Objects.hash(condition, statements);
      }

      @Override
      public String toString() {
         return condition + " -> " + statements;
      }
   }
}
