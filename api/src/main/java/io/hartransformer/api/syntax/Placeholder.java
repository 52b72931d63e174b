package io.hartransformer.api.syntax;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Expression standing for a domain object that is converted to syntax only when rendered.
 * <p>
 * Plugins running after the program was built may swap the target (see {@link #withTarget(Supplier)})
 * without knowing how it is converted. The converter is applied on every rendering.
 *
 * @param <T> Type of the wrapped object.
 */
public final class Placeholder<T> extends Expression {
   private final String name;
   private final Supplier<T> target;
   private final Function<? super T, ? extends Expression> converter;

   public Placeholder(String name, Supplier<T> target, Function<? super T, ? extends Expression> converter) {
      this.name = Objects.requireNonNull(name);
      this.target = Objects.requireNonNull(target);
      this.converter = Objects.requireNonNull(converter);
   }

   public static <T> Placeholder<T> of(String name, T value, Function<? super T, ? extends Expression> converter) {
      return new Placeholder<>(name, () -> value, converter);
   }

   /**
    * Name used only for diagnostics.
    */
   public String name() {
      return name;
   }

   public T target() {
      return target.get();
   }

   public Placeholder<T> withTarget(Supplier<T> target) {
      return new Placeholder<>(name, target, converter);
   }

   public Expression expand() {
      Expression expression = converter.apply(target.get());
      if (expression == null) {
         throw new IllegalStateException("Placeholder '" + name + "' converted " + target.get() + " to null");
      }
      return expression;
   }

   @Override
   public String toString() {
      return expand().toString();
   }

   @Override
   public boolean equals(Object o) {
      if (!super.equals(o)) {
         return false;
      }
      Placeholder<?> other = (Placeholder<?>) o;
      return name.equals(other.name) && Objects.equals(target.get(), other.target.get())
            && converter.equals(other.converter);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, target.get());
   }
}
