package com.example.routing.config;

/**
 * A rule/route/policy table could not be read as a whole. Individual bad
 * entries never raise this; they are skipped by the component that compiles them.
 */
public class RuleLoadException extends RuntimeException {

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
