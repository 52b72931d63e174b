package io.hartransformer.api.request;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Body of a request. Either the raw <code>text</code> or the decoded form <code>params</code> (or both)
 * may be present; which one is used depends on the method and MIME type.
 */
public final class PostData {
   public static final String JSON_MIME_TYPE = "application/json";

   private final String mimeType;
   private final String text;
   private final List<Param> params;

   /**
    * @param params Decoded form parameters or <code>null</code> if the trace did not record any.
    */
   public PostData(String mimeType, String text, List<Param> params) {
      this.mimeType = mimeType;
      this.text = text;
      this.params = params == null ? null : List.copyOf(params);
   }

   /**
    * @return MIME type or <code>null</code> when the trace did not record one.
    */
   public String mimeType() {
      return mimeType;
   }

   /**
    * @return Body text or <code>null</code>.
    */
   public String text() {
      return text;
   }

   public List<Param> params() {
      return params == null ? Collections.emptyList() : params;
   }

   /**
    * Distinguishes an absent <code>params</code> field from an empty one.
    */
   public boolean hasParams() {
      return params != null;
   }

   public boolean isJson() {
      return JSON_MIME_TYPE.equals(mimeType);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof PostData)) {
         return false;
      }
      PostData other = (PostData) o;
      return Objects.equals(mimeType, other.mimeType) && Objects.equals(text, other.text) && Objects.equals(params, other.params);
   }

   @Override
   public int hashCode() {
      return Objects.hash(mimeType, text, params);
   }

   @Override
   public String toString() {
      return "PostData{mimeType=" + mimeType + ", text=" + (text == null ? null : text.length() + " chars") + ", params=" + params + '}';
   }

   public static final class Param {
      private final String name;
      private final String value;

      public Param(String name, String value) {
         this.name = Objects.requireNonNull(name);
         this.value = value == null ? "" : value;
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
         if (!(o instanceof Param)) {
            return false;
         }
         Param param = (Param) o;
         return name.equals(param.name) && value.equals(param.value);
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
}
