package io.hartransformer.api.plugin;

import java.util.Set;

/**
 * Extension point of the conversion pipeline.
 * <p>
 * Implementations declare the stages they take part in through {@link #contracts()} and implement the
 * corresponding interfaces ({@link TaskPlugin}, {@link ScenarioPlugin}, {@link ProgramPlugin}).
 * To be found by service loading, annotate the implementation with {@link Name} and register it
 * in <code>META-INF/services/io.hartransformer.api.plugin.Plugin</code>.
 */
public interface Plugin {
   Set<Contract> contracts();
}
