package com.company.decommissioning.exception;

import java.util.List;

/**
 * Malformed or inconsistent policy input. Rejects the whole load; the previous registry
 * stays in force.
 */
public class PolicyConfigException extends RuntimeException {

    private final List<String> problems;

    public PolicyConfigException(List<String> problems) {
        super("Invalid decommissioning policy: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public PolicyConfigException(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
