package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A class definition. Superclasses are opaque strings, so anything accepted in the argument list of a
 * class definition (e.g. keyword arguments) can be used.
 */
public final class ClassDef extends Statement {
   private final String name;
   private final List<Statement> statements;
   private final List<String> superclasses;

   public ClassDef(String name, List<Statement> statements, List<String> superclasses) {
      this(name, statements, superclasses, Collections.emptyList());
   }

   public ClassDef(String name, List<Statement> statements, List<String> superclasses, List<String> comments) {
      super(comments);
      this.name = Objects.requireNonNull(name);
      this.statements = List.copyOf(statements);
      this.superclasses = List.copyOf(superclasses);
   }

   public String name() {
      return name;
   }

   public List<Statement> statements() {
      return statements;
   }

   public List<String> superclasses() {
      return superclasses;
   }

   public ClassDef withStatements(List<Statement> statements) {
      return new ClassDef(name, statements, superclasses, comments());
   }

   @Override
   public ClassDef withComments(List<String> comments) {
      return new ClassDef(name, statements, superclasses, comments);
   }

   @Override
   public List<Line> lines(int indentLevel, boolean comments) {
      String parents = superclasses.isEmpty() ? "" : "(" + String.join(", ", superclasses) + ")";
      Line top = new Line("class " + name + parents + ":", indentLevel);
      List<Line> lines = new ArrayList<>(comments ? attachComment(top) : Collections.singletonList(top));
      lines.addAll(body(statements, indentLevel + 1, comments));
      return lines;
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      ClassDef other = (ClassDef) o;
      return name.equals(other.name) && statements.equals(other.statements) && superclasses.equals(other.superclasses);
   }

   @Override
   public int hashCode() {
      return Objects.hash(super.hashCode(), name, statements, superclasses);
   }

   @Override
   public String toString() {
      return "ClassDef(" + name + superclasses + ", " + statements.size() + " statements)";
   }
}
