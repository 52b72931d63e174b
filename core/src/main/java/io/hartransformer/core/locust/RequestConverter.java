package io.hartransformer.core.locust;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.hartransformer.api.request.Header;
import io.hartransformer.api.request.PostData;
import io.hartransformer.api.request.QueryPair;
import io.hartransformer.api.request.Request;
import io.hartransformer.api.syntax.Expression;
import io.hartransformer.api.syntax.FunctionCall;
import io.hartransformer.api.syntax.Literal;

/**
 * Renders a {@link Request} as a call on the Locust HTTP client, e.g.
 * <pre>
 * self.client.post(url='...', name='...', timeout=30, allow_redirects=False, headers={...}, json={...})
 * </pre>
 * The conversion is a pure function of the request.
 */
public class RequestConverter implements Function<Request, Expression> {
   public static final int TIMEOUT = 30;

   private final ObjectMapper mapper;

   public RequestConverter() {
      this(new ObjectMapper());
   }

   public RequestConverter(ObjectMapper mapper) {
      this.mapper = mapper;
   }

   /**
    * @throws IllegalArgumentException if the request body cannot be represented.
    */
   @Override
   public FunctionCall apply(Request request) {
      Literal url = new Literal(request.url().toString());
      Map<String, Expression> args = new LinkedHashMap<>();
      args.put("url", url);
      args.put("name", request.name() == null ? url : new Literal(request.name()));
      args.put("timeout", new Literal(TIMEOUT));
      args.put("allow_redirects", new Literal(false));
      if (!request.headers().isEmpty()) {
         Map<String, String> headers = new LinkedHashMap<>();
         for (Header header : request.headers()) {
            headers.put(header.name(), header.value());
         }
         args.put("headers", new Literal(headers));
      }
      switch (request.method()) {
         case POST:
            if (request.postData() != null) {
               args.putAll(postDataArgs(request.postData()));
            }
            break;
         case PUT:
            if (request.postData() != null) {
               args.putAll(postDataArgs(request.postData()));
            }
            List<Object> params = new ArrayList<>();
            Expression existing = args.get("params");
            if (existing != null) {
               params.addAll((List<?>) ((Literal) existing).value());
            }
            for (QueryPair pair : request.query()) {
               params.add(pair(pair.name(), pair.value()));
            }
            args.put("params", new Literal(params));
            break;
         case GET:
         case OPTIONS:
         case DELETE:
            break;
         default:
            throw new IllegalArgumentException("Unsupported HTTP method: " + request.method());
      }
      return new FunctionCall("self.client." + request.method().clientMethod(), List.of(), args);
   }

   /**
    * Translates the body into keyword arguments of the client call, in the order <code>data</code>,
    * <code>params</code>, <code>json</code>.
    */
   Map<String, Expression> postDataArgs(PostData postData) {
      try {
         return doPostDataArgs(postData);
      } catch (IllegalArgumentException e) {
         throw new IllegalArgumentException("Invalid request body " + postData + ": " + e.getMessage(), e);
      }
   }

   private Map<String, Expression> doPostDataArgs(PostData postData) {
      if (postData.mimeType() == null) {
         throw new IllegalArgumentException("missing 'mimeType' field");
      }
      if (postData.text() == null && !postData.hasParams()) {
         throw new IllegalArgumentException("should contain 'text' or 'params'");
      }
      Map<String, Expression> args = new LinkedHashMap<>();
      Literal json = null;
      if (postData.isJson()) {
         if (postData.text() == null) {
            throw new IllegalArgumentException("missing 'text' field for " + PostData.JSON_MIME_TYPE + " content");
         }
         try {
            json = new Literal(mapper.readValue(postData.text(), Object.class));
         } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unreadable JSON from field 'text'", e);
         }
      } else if (postData.text() != null) {
         args.put("data", new Literal(postData.text().getBytes(StandardCharsets.UTF_8)));
      }
      if (postData.hasParams()) {
         List<Object> params = new ArrayList<>();
         for (PostData.Param param : postData.params()) {
            params.add(pair(param.name(), param.value()));
         }
         args.put("params", new Literal(params));
      }
      if (json != null) {
         args.put("json", json);
      }
      return args;
   }

   private static Literal.Tuple pair(String name, String value) {
      return Literal.Tuple.of(name.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
   }
}
