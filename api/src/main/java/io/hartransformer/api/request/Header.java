package io.hartransformer.api.request;

import java.util.Objects;

public final class Header {
   private final String name;
   private final String value;

   public Header(String name, String value) {
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
      if (!(o instanceof Header)) {
         return false;
      }
      Header header = (Header) o;
      return name.equals(header.name) && value.equals(header.value);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, value);
   }

   @Override
   public String toString() {
      return name + ": " + value;
   }
}
