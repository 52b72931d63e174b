package io.hartransformer.core.locust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.hartransformer.api.request.HttpMethod;
import io.hartransformer.api.request.PostData;
import io.hartransformer.api.request.Request;

public class RequestConverterTest {
   private final RequestConverter converter = new RequestConverter();

   private static Request.Builder request(HttpMethod method, String url) {
      return Request.builder().timestamp(Instant.EPOCH).method(method).url(URI.create(url));
   }

   @Test
   public void testGet() {
      Request request = request(HttpMethod.GET, "https://example.com/products?page=2")
            .header("accept", "text/html").queryPair("page", "2").build();
      assertThat(converter.apply(request).toString()).isEqualTo(
            "self.client.get(url='https://example.com/products?page=2', name='https://example.com/products?page=2', "
                  + "timeout=30, allow_redirects=False, headers={'accept': 'text/html'})");
   }

   @Test
   public void testNameOverridesUrl() {
      Request request = request(HttpMethod.DELETE, "https://example.com/item/17").name("item").build();
      assertThat(converter.apply(request).toString()).isEqualTo(
            "self.client.delete(url='https://example.com/item/17', name='item', timeout=30, allow_redirects=False)");
   }

   @Test
   public void testPostJson() {
      Request request = request(HttpMethod.POST, "https://example.com/api")
            .postData(new PostData("application/json", "{\"sku\": \"A-1\", \"qty\": 2, \"ok\": true, \"x\": null}", null))
            .build();
      assertThat(converter.apply(request).toString()).isEqualTo(
            "self.client.post(url='https://example.com/api', name='https://example.com/api', timeout=30, "
                  + "allow_redirects=False, json={'sku': 'A-1', 'qty': 2, 'ok': True, 'x': None})");
   }

   @Test
   public void testPostData() {
      Request request = request(HttpMethod.POST, "https://example.com/form")
            .postData(new PostData("text/plain", "it's", null)).build();
      assertThat(converter.apply(request).namedArgs()).containsOnlyKeys("url", "name", "timeout", "allow_redirects", "data");
      assertThat(converter.apply(request).namedArgs().get("data").toString()).isEqualTo("b\"it's\"");
   }

   @Test
   public void testPostParams() {
      Request request = request(HttpMethod.POST, "https://example.com/form")
            .postData(new PostData("application/x-www-form-urlencoded", "a=1&b=%C3%A9",
                  List.of(new PostData.Param("a", "1"), new PostData.Param("b", "é"))))
            .build();
      assertThat(converter.apply(request).toString()).endsWith(
            "data=b'a=1&b=%C3%A9', params=[(b'a', b'1'), (b'b', b'\\xc3\\xa9')])");
   }

   @Test
   public void testJsonWithParams() {
      Request request = request(HttpMethod.POST, "https://example.com/api")
            .postData(new PostData("application/json", "[1]", List.of(new PostData.Param("p", "v"))))
            .build();
      assertThat(converter.apply(request).toString()).endsWith("params=[(b'p', b'v')], json=[1])");
   }

   @Test
   public void testJsonMimeTypeWithCharsetIsData() {
      Request request = request(HttpMethod.POST, "https://example.com/api")
            .postData(new PostData("application/json; charset=utf-8", "{}", null)).build();
      assertThat(converter.apply(request).toString()).endsWith("data=b'{}')");
   }

   @Test
   public void testPutWithQuery() {
      Request request = request(HttpMethod.PUT, "https://example.com/profile?lang=en")
            .queryPair("lang", "en")
            .postData(new PostData("application/x-www-form-urlencoded", "name=Jo", List.of(new PostData.Param("name", "Jo"))))
            .build();
      assertThat(converter.apply(request).toString()).isEqualTo(
            "self.client.put(url='https://example.com/profile?lang=en', name='https://example.com/profile?lang=en', "
                  + "timeout=30, allow_redirects=False, data=b'name=Jo', params=[(b'name', b'Jo'), (b'lang', b'en')])");
   }

   @Test
   public void testPutWithoutBody() {
      Request request = request(HttpMethod.PUT, "https://example.com/x").build();
      assertThat(converter.apply(request).toString()).endsWith("allow_redirects=False, params=[])");
   }

   @Test
   public void testGetIgnoresBody() {
      Request request = request(HttpMethod.GET, "https://example.com")
            .postData(new PostData(null, null, null)).build();
      assertThat(converter.apply(request).namedArgs()).doesNotContainKeys("data", "params", "json");
   }

   @Test
   public void testInvalidPostData() {
      assertThatThrownBy(() -> converter.apply(request(HttpMethod.POST, "https://example.com")
            .postData(new PostData(null, "x", null)).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("mimeType");
      assertThatThrownBy(() -> converter.apply(request(HttpMethod.POST, "https://example.com")
            .postData(new PostData("text/plain", null, null)).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("'text' or 'params'");
      assertThatThrownBy(() -> converter.apply(request(HttpMethod.POST, "https://example.com")
            .postData(new PostData("application/json", null, List.of())).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("missing 'text'");
      assertThatThrownBy(() -> converter.apply(request(HttpMethod.POST, "https://example.com")
            .postData(new PostData("application/json", "{not json", null)).build()))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("unreadable JSON");
   }
}
