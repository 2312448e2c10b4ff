package io.github.drompincen.sreflow.runtime.agent;

/**
 * Output of the solution agent. {@code text} is normally a JSON object but is passed
 * through verbatim either way.
 */
public record SolutionResult(String solThreadId, String text) {}
