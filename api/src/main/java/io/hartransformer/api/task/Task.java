package io.hartransformer.api.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import io.hartransformer.api.request.Request;
import io.hartransformer.api.syntax.Expression;
import io.hartransformer.api.syntax.Standalone;
import io.hartransformer.api.syntax.Statement;

/**
 * A single request of a scenario together with code executed before and after it.
 * <p>
 * Tasks are values: every modification returns a new instance and leaves this one untouched.
 */
public final class Task {
   private final String name;
   private final Request request;
   private final List<Statement> preSteps;
   private final List<Statement> postSteps;

   public Task(String name, Request request) {
      this(name, request, Collections.emptyList(), Collections.emptyList());
   }

   public Task(String name, Request request, List<Statement> preSteps, List<Statement> postSteps) {
      this.name = Objects.requireNonNull(name, "name");
      this.request = Objects.requireNonNull(request, "request");
      this.preSteps = List.copyOf(preSteps);
      this.postSteps = List.copyOf(postSteps);
   }

   /**
    * Creates one task per request, ordered by increasing request timestamp. Requests sharing a timestamp
    * keep their relative order.
    */
   public static List<Task> fromRequests(Iterable<Request> requests) {
      List<Request> sorted = new ArrayList<>();
      requests.forEach(sorted::add);
      sorted.sort(Comparator.comparing(Request::timestamp));
      List<Task> tasks = new ArrayList<>(sorted.size());
      for (Request request : sorted) {
         tasks.add(new Task(request.taskName(), request));
      }
      return tasks;
   }

   public String name() {
      return name;
   }

   public Request request() {
      return request;
   }

   public List<Statement> preSteps() {
      return preSteps;
   }

   public List<Statement> postSteps() {
      return postSteps;
   }

   public Task withName(String name) {
      return new Task(name, request, preSteps, postSteps);
   }

   public Task withRequest(Request request) {
      return new Task(name, request, preSteps, postSteps);
   }

   public Task withPreSteps(List<Statement> preSteps) {
      return new Task(name, request, preSteps, postSteps);
   }

   public Task withPostSteps(List<Statement> postSteps) {
      return new Task(name, request, preSteps, postSteps);
   }

   public Task addPreStep(Statement step) {
      List<Statement> steps = new ArrayList<>(preSteps);
      steps.add(step);
      return withPreSteps(steps);
   }

   public Task addPreStep(Expression step) {
      return addPreStep(new Standalone(step));
   }

   public Task addPostStep(Statement step) {
      List<Statement> steps = new ArrayList<>(postSteps);
      steps.add(step);
      return withPostSteps(steps);
   }

   public Task addPostStep(Expression step) {
      return addPostStep(new Standalone(step));
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (!(o instanceof Task)) {
         return false;
      }
      Task other = (Task) o;
      return name.equals(other.name) && request.equals(other.request)
            && preSteps.equals(other.preSteps) && postSteps.equals(other.postSteps);
   }

   @Override
   public int hashCode() {
      return Objects.hash(name, request, preSteps, postSteps);
   }

   @Override
   public String toString() {
      return "Task{" + name + ", " + request + '}';
   }
}
