package io.hartransformer.api.plugin;

import io.hartransformer.api.syntax.Program;

public interface ProgramPlugin extends Plugin {
   Program onProgram(Program program);
}
