package io.hartransformer.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.aesh.command.AeshCommandRuntimeBuilder;
import org.aesh.command.CommandResult;
import org.aesh.command.CommandRuntime;
import org.aesh.command.impl.registry.AeshCommandRegistryBuilder;
import org.aesh.command.invocation.CommandInvocation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.cli.commands.Convert;
import io.hartransformer.internal.Properties;

/**
 * Command-line entry point. The locustfile goes to standard output (unless <code>-o</code> is used),
 * everything else to standard error.
 */
public class TransformerCli {
   private static final Logger log = LogManager.getLogger(TransformerCli.class);

   private final PrintStream out;
   private final PrintStream err;

   public TransformerCli(PrintStream out, PrintStream err) {
      this.out = out;
      this.err = err;
   }

   public static void main(String[] args) {
      System.exit(new TransformerCli(System.out, System.err).run(args));
   }

   public int run(String[] args) {
      CommandResult result = null;
      try {
         AeshCommandRuntimeBuilder<CommandInvocation> runtime = AeshCommandRuntimeBuilder.builder();
         @SuppressWarnings("unchecked")
         AeshCommandRegistryBuilder<CommandInvocation> registry =
               AeshCommandRegistryBuilder.<CommandInvocation>builder().command(new Convert(out, err));
         runtime.commandRegistry(registry.create());
         CommandRuntime<CommandInvocation> cr = runtime.build();
         // Arguments may contain spaces; these must be escaped for the aesh parser.
         String arguments = Stream.of(args).map(arg -> arg.replaceAll(" ", "\\\\ ")).collect(Collectors.joining(" "));
         result = cr.executeCommand(arguments.isEmpty() ? Convert.NAME : Convert.NAME + " " + arguments);
      } catch (Exception e) {
         err.println("Failed to execute command: " + e.getMessage());
         if (Properties.getBoolean(Properties.STACKTRACE)) {
            e.printStackTrace(err);
         }
         log.debug("Command line {} rejected", Arrays.toString(args), e);
         return Convert.EXIT_FAILURE;
      }
      return result == null ? Convert.EXIT_FAILURE : result.getResultValue();
   }
}
