package io.hartransformer.core.locust;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import io.hartransformer.api.Version;
import io.hartransformer.api.request.Request;
import io.hartransformer.api.scenario.Scenario;
import io.hartransformer.api.syntax.Assignment;
import io.hartransformer.api.syntax.ClassDef;
import io.hartransformer.api.syntax.Decoration;
import io.hartransformer.api.syntax.Expression;
import io.hartransformer.api.syntax.FunctionCall;
import io.hartransformer.api.syntax.FunctionDef;
import io.hartransformer.api.syntax.Import;
import io.hartransformer.api.syntax.Literal;
import io.hartransformer.api.syntax.OpaqueBlock;
import io.hartransformer.api.syntax.Placeholder;
import io.hartransformer.api.syntax.Program;
import io.hartransformer.api.syntax.Statement;
import io.hartransformer.api.syntax.Symbol;
import io.hartransformer.api.task.Task;

/**
 * Materializes scenario trees as a Locust program.
 * <p>
 * Every root scenario yields its task-set class followed by an <code>HttpUser</code> class running it.
 * Groups become <code>TaskSet</code>s whose children are nested classes decorated with <code>@task(weight)</code>;
 * leaves become <code>SequentialTaskSet</code>s with one <code>@task</code> method per task.
 */
public class LocustProgramBuilder {
   public static final String USER_PREFIX = "LocustFor";
   static final String RESPONSE_VARIABLE = "response";

   private final Function<Request, ? extends Expression> requestConverter;

   public LocustProgramBuilder() {
      this(new RequestConverter());
   }

   public LocustProgramBuilder(Function<Request, ? extends Expression> requestConverter) {
      this.requestConverter = requestConverter;
   }

   public Program build(List<Scenario> roots) {
      List<Statement> statements = new ArrayList<>();
      statements.add(new OpaqueBlock("# File automatically generated by HAR Transformer v" + Version.VERSION));
      statements.add(Import.from("locust", "HttpUser", "SequentialTaskSet", "TaskSet", "between", "task"));
      for (Scenario root : roots) {
         statements.add(taskSet(root));
         statements.add(user(root));
      }
      return new Program(statements);
   }

   ClassDef taskSet(Scenario scenario) {
      List<Statement> body = new ArrayList<>();
      if (scenario.isGroup()) {
         for (Scenario child : scenario.children()) {
            body.add(new Decoration("task(" + child.weight() + ")", taskSet(child)));
         }
         return new ClassDef(scenario.name(), body, List.of("TaskSet"));
      }
      for (Task task : scenario.tasks()) {
         body.add(new Decoration("task", taskMethod(task)));
      }
      return new ClassDef(scenario.name(), body, List.of("SequentialTaskSet"));
   }

   FunctionDef taskMethod(Task task) {
      List<Statement> body = new ArrayList<>(task.preSteps());
      body.add(new Assignment(RESPONSE_VARIABLE, new Placeholder<Request>(
            "request of " + task.name(), task::request, requestConverter)));
      body.addAll(task.postSteps());
      return new FunctionDef(task.name(), List.of("self"), body);
   }

   ClassDef user(Scenario root) {
      List<Statement> body = new ArrayList<>();
      body.add(new Assignment("tasks", new Literal(Collections.singletonList(new Symbol(root.name())))));
      body.add(new Assignment("weight", new Literal(root.weight())));
      body.add(new Assignment("wait_time", new FunctionCall("between", List.of(new Literal(0), new Literal(10)))));
      return new ClassDef(USER_PREFIX + root.name(), body, List.of("HttpUser"));
   }
}
