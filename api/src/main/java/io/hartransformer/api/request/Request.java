package io.hartransformer.api.request;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import io.hartransformer.util.Identifiers;

/**
 * An HTTP request recorded in a session trace.
 * <p>
 * Instances are immutable; use {@link #toBuilder()} and the <code>with*</code> methods to derive modified copies.
 * The original trace entry is available through {@link #entry()} for read-only access and does not take part
 * in {@link #equals(Object)}.
 */
public final class Request {
   private final Instant timestamp;
   private final HttpMethod method;
   private final URI url;
   private final List<Header> headers;
   private final PostData postData;
   private final List<QueryPair> query;
   private final String name;
   private final JsonNode entry;

   private Request(Builder builder) {
      this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
      this.method = Objects.requireNonNull(builder.method, "method");
      this.url = Objects.requireNonNull(builder.url, "url");
      this.headers = List.copyOf(builder.headers);
      this.postData = builder.postData;
      this.query = List.copyOf(builder.query);
      this.name = builder.name;
      this.entry = builder.entry;
   }

   public static Builder builder() {
      return new Builder();
   }

   public Builder toBuilder() {
      return new Builder().timestamp(timestamp).method(method).url(url).headers(headers)
            .postData(postData).query(query).name(name).entry(entry);
   }

   public Instant timestamp() {
      return timestamp;
   }

   public HttpMethod method() {
      return method;
   }

   public URI url() {
      return url;
   }

   public List<Header> headers() {
      return headers;
   }

   /**
    * @return Request body or <code>null</code>.
    */
   public PostData postData() {
      return postData;
   }

   public List<QueryPair> query() {
      return query;
   }

   /**
    * @return Name grouping requests in Locust statistics or <code>null</code> to group by URL.
    */
   public String name() {
      return name;
   }

   /**
    * @return Trace entry this request was read from; <code>null</code> for synthesized requests.
    */
   public JsonNode entry() {
      return entry;
   }

   public Request withHeaders(List<Header> headers) {
      return toBuilder().headers(headers).build();
   }

   public Request withName(String name) {
      return toBuilder().name(name).build();
   }

   public Request withUrl(URI url) {
      return toBuilder().url(url).build();
   }

   /**
    * Name for the task issuing this request: <code>METHOD_scheme_host_path_hash</code>, with host and path
    * made safe as identifiers.
    */
   public String taskName() {
      String host = url.getHost() == null ? "" : url.getHost();
      String path = url.getRawPath() == null ? "" : url.getRawPath();
      return String.join("_", method.name(), String.valueOf(url.getScheme()),
            Identifiers.toIdentifier(host), Identifiers.toIdentifier(path),
            String.valueOf(hashCode() & Integer.MAX_VALUE));
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Request)) {
         return false;
      }
      Request other = (Request) o;
      return timestamp.equals(other.timestamp) && method == other.method && url.equals(other.url)
            && headers.equals(other.headers) && Objects.equals(postData, other.postData)
            && query.equals(other.query) && Objects.equals(name, other.name);
   }

   @Override
   public int hashCode() {
      // Enum and URI hash codes differ between JVM runs, names and strings do not.
      return Objects.hash(timestamp, method.name(), url.toString(), headers, postData, query);
   }

   @Override
   public String toString() {
      return "Request{" + method + " " + url + " @" + timestamp + '}';
   }

   public static class Builder {
      private Instant timestamp;
      private HttpMethod method;
      private URI url;
      private final List<Header> headers = new ArrayList<>();
      private PostData postData;
      private final List<QueryPair> query = new ArrayList<>();
      private String name;
      private JsonNode entry;

      public Builder timestamp(Instant timestamp) {
         this.timestamp = timestamp;
         return this;
      }

      public Builder method(HttpMethod method) {
         this.method = method;
         return this;
      }

      public Builder url(URI url) {
         this.url = url;
         return this;
      }

      public Builder url(String url) {
         return url(URI.create(url));
      }

      public Builder header(String name, String value) {
         headers.add(new Header(name, value));
         return this;
      }

      public Builder headers(List<Header> headers) {
         this.headers.clear();
         this.headers.addAll(headers == null ? Collections.emptyList() : headers);
         return this;
      }

      public Builder postData(PostData postData) {
         this.postData = postData;
         return this;
      }

      public Builder queryPair(String name, String value) {
         query.add(new QueryPair(name, value));
         return this;
      }

      public Builder query(List<QueryPair> query) {
         this.query.clear();
         this.query.addAll(query == null ? Collections.emptyList() : query);
         return this;
      }

      public Builder name(String name) {
         this.name = name;
         return this;
      }

      public Builder entry(JsonNode entry) {
         this.entry = entry;
         return this;
      }

      public Request build() {
         return new Request(this);
      }
   }
}
