package io.github.drompincen.sreflow.runtime.agent;

public interface SolutionAgent {

    SolutionResult solve(SolutionRequest request);
}
