package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A function definition: <code>def name(params):</code> followed by its body.
 */
public final class FunctionDef extends Statement {
   private final String name;
   private final List<String> params;
   private final List<Statement> statements;

   public FunctionDef(String name, List<String> params, List<Statement> statements) {
      this(name, params, statements, Collections.emptyList());
   }

   public FunctionDef(String name, List<String> params, List<Statement> statements, List<String> comments) {
      super(comments);
      this.name = Objects.requireNonNull(name);
      this.params = List.copyOf(params);
      this.statements = List.copyOf(statements);
   }

   public String name() {
      return name;
   }

   public List<String> params() {
      return params;
   }

   public List<Statement> statements() {
      return statements;
   }

   public FunctionDef withStatements(List<Statement> statements) {
      return new FunctionDef(name, params, statements, comments());
   }

   @Override
   public FunctionDef withComments(List<String> comments) {
      return new FunctionDef(name, params, statements, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      Line top = new Line("def " + name + "(" + String.join(", ", params) + "):", indentLevel);
      List<Line> lines = new ArrayList<>(comments ? attachComment(top) : Collections.singletonList(top));
      lines.addAll(body(statements, indentLevel + 1, comments));
      return lines;
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      FunctionDef other = (FunctionDef) o;
      return name.equals(other.name) && params.equals(other.params) && statements.equals(other.statements);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), name, params, statements);
   }

   @Override
   public String toString() {
      return "FunctionDef(" + name + params + ", " + statements.size() + " statements)";
   }
}
