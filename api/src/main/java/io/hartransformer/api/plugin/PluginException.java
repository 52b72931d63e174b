package io.hartransformer.api.plugin;

/**
 * A plugin failed (threw or returned <code>null</code>) while transforming part of the conversion.
 * <p>
 * The object handed to the plugin is available through {@link #subject()}: the task list of a leaf,
 * a scenario or the program, depending on the {@link #contract()}.
 */
public class PluginException extends RuntimeException {
   private final String plugin;
   private final Contract contract;
   private final String target;
   private final transient Object subject;

   public PluginException(String plugin, Contract contract, String target, Object subject, String msg) {
      super(getMessage(plugin, contract, target, msg));
      this.plugin = plugin;
      this.contract = contract;
      this.target = target;
      this.subject = subject;
   }

   public PluginException(String plugin, Contract contract, String target, Object subject, Throwable cause) {
      super(getMessage(plugin, contract, target, String.valueOf(cause.getMessage())), cause);
      this.plugin = plugin;
      this.contract = contract;
      this.target = target;
      this.subject = subject;
   }

   public String plugin() {
      return plugin;
   }

   public Contract contract() {
      return contract;
   }

   /**
    * @return Description of what was processed, e.g. <code>scenario root/checkout</code>.
    */
   public String target() {
      return target;
   }

   /**
    * @return The object the plugin was given, or <code>null</code> if not known.
    */
   public Object subject() {
      return subject;
   }

   private static String getMessage(String plugin, Contract contract, String target, String msg) {
      return String.format("Plugin %s (%s) failed on %s: %s", plugin, contract, target, msg);
   }
}
