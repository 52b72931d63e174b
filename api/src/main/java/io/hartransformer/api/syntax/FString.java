package io.hartransformer.api.syntax;

import java.util.Objects;

/**
 * Formatted string literal: <code>f'...'</code>. The content is not validated, so embedded
 * <code>{expression}</code> parts are kept as they are.
 */
public final class FString extends Expression {
   private final String value;

   public FString(String value) {
      this.value = Objects.requireNonNull(value);
   }

   public String value() {
      return value;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder("f");
      Literal.reprString(sb, value);
      return sb.toString();
   }

   @Override
   public boolean equals(Object o) {
      return super.equals(o) && value.equals(((FString) o).value);
   }

   @Override
   public int hashCode() {
      return value.hashCode();
   }
}
