package io.hartransformer.core.plugins;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.kohsuke.MetaInfServices;

import io.hartransformer.api.plugin.Contract;
import io.hartransformer.api.plugin.Name;
import io.hartransformer.api.plugin.Plugin;
import io.hartransformer.api.plugin.TaskPlugin;
import io.hartransformer.api.request.Header;
import io.hartransformer.api.request.Request;
import io.hartransformer.api.task.Task;

/**
 * Lower-cases header names so that later plugins can override them reliably, removes the pseudo-headers
 * (starting with <code>:</code>) some browsers record, and drops <code>cookie</code> since the Locust
 * session manages cookies itself.
 * <p>
 * When a header name occurs several times, the last value wins at the position of the first occurrence.
 */
@MetaInfServices(Plugin.class)
@Name(SanitizeHeadersPlugin.NAME)
public class SanitizeHeadersPlugin implements TaskPlugin {
   public static final String NAME = "sanitize-headers";

   @Override
   public Set<Contract> contracts() {
      return Contract.union(Contract.ON_TASK);
   }

   @Override
   public List<Task> onTasks(List<Task> tasks) {
      List<Task> sanitized = new ArrayList<>(tasks.size());
      for (Task task : tasks) {
         sanitized.add(task.withRequest(sanitize(task.request())));
      }
      return sanitized;
   }

   static Request sanitize(Request request) {
      Map<String, String> headers = new LinkedHashMap<>();
      for (Header header : request.headers()) {
         String name = header.name().toLowerCase(Locale.ROOT);
         if (header.name().startsWith(":") || name.equals("cookie")) {
            continue;
         }
         headers.put(name, header.value());
      }
      List<Header> list = new ArrayList<>(headers.size());
      headers.forEach((name, value) -> list.add(new Header(name, value)));
      return request.withHeaders(list);
   }
}
