package io.hartransformer.core.har;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.hartransformer.api.request.HttpMethod;
import io.hartransformer.api.request.PostData;
import io.hartransformer.api.request.Request;

/**
 * Reads the <code>log.entries</code> of a HAR document into {@link Request}s, in file order.
 */
public class HarReader {
   private static final Logger log = LogManager.getLogger(HarReader.class);
   // Local date, optionally followed by local time and then by an offset
   private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
         .append(DateTimeFormatter.ISO_LOCAL_DATE)
         .optionalStart().appendLiteral('T').append(DateTimeFormatter.ISO_LOCAL_TIME)
         .optionalStart().appendOffsetId()
         .toFormatter();

   private final ObjectMapper mapper;

   public HarReader() {
      this(new ObjectMapper());
   }

   public HarReader(ObjectMapper mapper) {
      this.mapper = mapper;
   }

   public List<Request> read(Path path) throws IOException {
      try (InputStream stream = Files.newInputStream(path)) {
         return read(stream, path.toString());
      }
   }

   /**
    * @param stream Source of the HAR document; not closed.
    * @param origin Used in error messages.
    * @throws IOException         if the stream cannot be read or does not contain JSON.
    * @throws HarFormatException if the JSON does not describe HAR entries.
    */
   public List<Request> read(InputStream stream, String origin) throws IOException {
      JsonNode root = mapper.readTree(stream);
      if (root == null || root.isMissingNode()) {
         throw new HarFormatException(origin + " is empty");
      }
      JsonNode entries = root.path("log").path("entries");
      if (!entries.isArray()) {
         throw new HarFormatException(origin + " has no log.entries array");
      }
      List<Request> requests = new ArrayList<>(entries.size());
      int index = 0;
      for (JsonNode entry : entries) {
         try {
            requests.add(toRequest(entry));
         } catch (HarFormatException e) {
            throw new HarFormatException(origin + ", entry " + index + ": " + e.getMessage(), e);
         }
         ++index;
      }
      log.debug("Read {} requests from {}", requests.size(), origin);
      return requests;
   }

   public Request toRequest(JsonNode entry) {
      JsonNode request = entry.path("request");
      if (!request.isObject()) {
         throw new HarFormatException("missing request");
      }
      Request.Builder builder = Request.builder()
            .timestamp(parseTimestamp(required(entry, "startedDateTime")))
            .method(parseMethod(required(request, "method")))
            .url(parseUrl(required(request, "url")))
            .entry(entry);
      for (JsonNode header : request.path("headers")) {
         builder.header(required(header, "name"), header.path("value").asText(""));
      }
      for (JsonNode pair : request.path("queryString")) {
         builder.queryPair(required(pair, "name"), pair.path("value").asText(""));
      }
      JsonNode postData = request.path("postData");
      if (postData.isObject()) {
         builder.postData(parsePostData(postData));
      }
      return builder.build();
   }

   private static PostData parsePostData(JsonNode node) {
      String mimeType = node.hasNonNull("mimeType") ? node.get("mimeType").asText() : null;
      String text = node.hasNonNull("text") ? node.get("text").asText() : null;
      List<PostData.Param> params = null;
      if (node.has("params")) {
         params = new ArrayList<>();
         for (JsonNode param : node.get("params")) {
            params.add(new PostData.Param(required(param, "name"), param.path("value").asText("")));
         }
      }
      return new PostData(mimeType, text, params);
   }

   private static String required(JsonNode node, String field) {
      JsonNode value = node.get(field);
      if (value == null || value.isNull()) {
         throw new HarFormatException("missing field '" + field + "'");
      }
      return value.asText();
   }

   private static HttpMethod parseMethod(String method) {
      try {
         return HttpMethod.parse(method);
      } catch (IllegalArgumentException e) {
         throw new HarFormatException(e.getMessage(), e);
      }
   }

   private static URI parseUrl(String url) {
      try {
         URI uri = new URI(url);
         if (!uri.isAbsolute()) {
            throw new HarFormatException("URL is not absolute: " + url);
         }
         return uri;
      } catch (URISyntaxException e) {
         throw new HarFormatException("invalid URL: " + url, e);
      }
   }

   static Instant parseTimestamp(String timestamp) {
      try {
         TemporalAccessor parsed = TIMESTAMP.parseBest(timestamp, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
         if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
         } else if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
         } else {
            return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
         }
      } catch (DateTimeParseException e) {
         throw new HarFormatException("cannot parse timestamp '" + timestamp + "'", e);
      }
   }
}
