package io.hartransformer.api.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered sequence of top-level statements forming the generated module. Immutable.
 */
public final class Program {
   private static final Program EMPTY = new Program(Collections.emptyList());

   private final List<Statement> statements;

   public Program(List<Statement> statements) {
      this.statements = List.copyOf(statements);
   }

   public static Program empty() {
      return EMPTY;
   }

   public List<Statement> statements() {
      return statements;
   }

   public int size() {
      return statements.size();
   }

   public Program append(Statement... added) {
      List<Statement> copy = new ArrayList<>(statements);
      Collections.addAll(copy, added);
      return new Program(copy);
   }

   public Program prepend(Statement... added) {
      return insert(0, added);
   }

   public Program insert(int index, Statement... added) {
      List<Statement> copy = new ArrayList<>(statements);
      copy.addAll(index, List.of(added));
      return new Program(copy);
   }

   public Program replace(int index, Statement replacement) {
      List<Statement> copy = new ArrayList<>(statements);
      copy.set(index, replacement);
      return new Program(copy);
   }

   /**
    * Applies <code>transform</code> to every top-level statement.
    */
   public Program map(UnaryOperator<Statement> transform) {
      List<Statement> copy = new ArrayList<>(statements.size());
      for (Statement statement : statements) {
         copy.add(transform.apply(statement));
      }
      return new Program(copy);
   }

   @Override
   public boolean equals(Object o) {
      return o instanceof Program && statements.equals(((Program) o).statements);
   }

   @Override
   public int hashCode() {
      return statements.hashCode();
   }

   @Override
   public String toString() {
      return "Program(" + statements.size() + " statements)";
   }
}
