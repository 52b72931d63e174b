package io.hartransformer.api.syntax;

/**
 * Anything producing a value in the generated program. Expressions always fit on a single line and
 * carry no comments; use {@link Standalone} to turn one into a {@link Statement}.
 * <p>
 * Subclasses render themselves in {@link #toString()}.
 */
public abstract class Expression {
   @Override
   public abstract String toString();

   @Override
   public boolean equals(Object o) {
      return o != null && o.getClass() == getClass();
   }

   @Override
   public int hashCode() {
      return getClass().hashCode();
   }
}
