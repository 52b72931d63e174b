package io.hartransformer.cli.commands;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.ServiceConfigurationError;

import org.aesh.command.Command;
import org.aesh.command.CommandDefinition;
import org.aesh.command.CommandException;
import org.aesh.command.CommandResult;
import org.aesh.command.invocation.CommandInvocation;
import org.aesh.command.option.Arguments;
import org.aesh.command.option.Option;
import org.aesh.command.option.OptionList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.hartransformer.api.Version;
import io.hartransformer.api.plugin.InvalidContractException;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.cli.TransformerConfig;
import io.hartransformer.core.Transformer;
import io.hartransformer.core.codegen.CodeGenerator;
import io.hartransformer.core.denylist.Denylist;
import io.hartransformer.internal.Properties;

@CommandDefinition(name = Convert.NAME, description = "Converts HAR files (or directories of them) into a Locust locustfile.")
public class Convert implements Command<CommandInvocation> {
   private static final Logger log = LogManager.getLogger(Convert.class);
   public static final String NAME = "transformer";

   public static final int EXIT_OK = 0;
   public static final int EXIT_NO_INPUT = 1;
   public static final int EXIT_PLUGIN_FAILURE = 2;
   public static final int EXIT_FAILURE = 3;

   @OptionList(shortName = 'p', name = "plugin", description = "Plugins to use, in order (comma-separated).")
   List<String> plugins;

   @Option(name = "no-default-plugins", hasValue = false, description = "Do not apply the default plugins.")
   boolean noDefaultPlugins;

   @Option(shortName = 'o', name = "output", description = "Write the locustfile to this file instead of standard output.")
   String output;

   @Option(name = "denylist", description = "File with URL fragments to ignore, one per line. Defaults to .urlignore in the working directory.")
   String denylist;

   @Option(name = "version", hasValue = false, description = "Print version information and exit.")
   boolean version;

   @Option(shortName = 'h', name = "help", hasValue = false, overrideRequired = true, description = "Print this help message and exit.")
   boolean help;

   @Arguments(description = "HAR files or scenario directories.")
   List<String> paths;

   private final PrintStream out;
   private final PrintStream err;

   public Convert(PrintStream out, PrintStream err) {
      this.out = out;
      this.err = err;
   }

   @Override
   public CommandResult execute(CommandInvocation invocation) throws CommandException, InterruptedException {
      if (help) {
         err.println(invocation.getHelpInfo(NAME));
         return CommandResult.valueOf(EXIT_OK);
      }
      if (version) {
         out.println("HAR Transformer " + Version.VERSION + " (" + Version.COMMIT_ID + ")");
         return CommandResult.valueOf(EXIT_OK);
      }
      return CommandResult.valueOf(convert(invocation));
   }

   private int convert(CommandInvocation invocation) {
      TransformerConfig config;
      try {
         config = TransformerConfig.read(paths, plugins);
      } catch (IllegalArgumentException e) {
         logFailure("Invalid configuration", e);
         return EXIT_FAILURE;
      }
      if (config.inputPaths().isEmpty()) {
         log.error("No input paths provided in environment nor command-line!");
         log.info("Did you mean to provide env {}=[...]?", Properties.envName(Properties.INPUT_PATHS));
         err.println(invocation.getHelpInfo(NAME));
         return EXIT_NO_INPUT;
      }
      Transformer transformer;
      try {
         transformer = Transformer.builder()
               .plugins(config.plugins())
               .withDefaultPlugins(!noDefaultPlugins)
               .denylist(loadDenylist())
               .build();
      } catch (InvalidContractException | ServiceConfigurationError e) {
         logFailure("Failed loading plugins", e);
         return EXIT_PLUGIN_FAILURE;
      }
      try {
         Program program = transformer.program(config.inputPaths());
         if (output == null) {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            new CodeGenerator().write(program, writer);
            out.println();
         } else {
            writeAtomically(program, Paths.get(output));
         }
         return EXIT_OK;
      } catch (Exception e) {
         logFailure("Conversion failed", e);
         return EXIT_FAILURE;
      }
   }

   private Denylist loadDenylist() {
      String file = denylist != null ? denylist : Properties.get(Properties.DENYLIST, null);
      return file == null ? Denylist.fromWorkingDirectory() : Denylist.fromFile(Paths.get(file));
   }

   private static void writeAtomically(Program program, Path target) throws IOException {
      Path absolute = target.toAbsolutePath();
      Path tmp = Files.createTempFile(absolute.getParent(), "." + absolute.getFileName(), ".tmp");
      try {
         try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            new CodeGenerator().write(program, writer);
            writer.write('\n');
         }
         try {
            Files.move(tmp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
         } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move to {} not supported, replacing", absolute);
            Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING);
         }
         log.info("Locustfile written to {}", absolute);
      } finally {
         Files.deleteIfExists(tmp);
      }
   }

   private static void logFailure(String msg, Throwable e) {
      if (Properties.getBoolean(Properties.STACKTRACE)) {
         log.error(msg, e);
      } else {
         log.error("{}: {}", msg, e.getMessage());
      }
   }
}
