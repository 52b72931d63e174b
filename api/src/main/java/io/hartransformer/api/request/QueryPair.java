package io.hartransformer.api.request;

import java.util.Objects;

/**
 * One <code>name=value</code> pair of the URL query string, as recorded in the trace.
 */
public final class QueryPair {
   private final String name;
   private final String value;

   public QueryPair(String name, String value) {
      this.name = Objects.requireNonNull(name);
      this.value = Objects.requireNonNull(value);
   }

   public String name() {
      return name;
   }

   public String value() {
      return value;
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof QueryPair)) {
         return false;
      }
      QueryPair that = (QueryPair) o;
      return name.equals(that.name) && value.equals(that.value);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, value);
   }

   @Override
   public String toString() {
      return name + "=" + value;
   }
}
