package io.hartransformer.api.syntax;

import java.util.Objects;

/**
 * Reference to a name: variable, function, class or a dotted attribute path (e.g. <code>self.client</code>).
 */
public final class Symbol extends Expression {
   private final String name;

   public Symbol(String name) {
      if (name == null || name.isEmpty()) {
         throw new IllegalArgumentException("Symbol name must not be empty");
      }
      this.name = name;
   }

   public String name() {
      return name;
   }

   @Override
   public String toString() {
      return name;
   }

   @Override
   public boolean equals(Object o) {
      return super.equals(o) && name.equals(((Symbol) o).name);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name);
   }
}
