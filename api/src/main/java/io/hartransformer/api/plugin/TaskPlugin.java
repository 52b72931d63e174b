package io.hartransformer.api.plugin;

import java.util.List;

import io.hartransformer.api.task.Task;

public interface TaskPlugin extends Plugin {
   /**
    * @param tasks Tasks of a single leaf scenario, in execution order.
    * @return Replacement task list; may be longer or shorter than the input but never <code>null</code>.
    */
   List<Task> onTasks(List<Task> tasks);
}
