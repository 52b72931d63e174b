package io.hartransformer.core.scenario;

import java.io.IOException;

/**
 * Produces the listing of traces, groups and weight declarations found at a location.
 */
public interface ScenarioSource {
   SourceNode list(String location) throws IOException;
}
