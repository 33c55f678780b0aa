package com.siafu;

/**
 * The unit of work a job runs. Returning normally counts as success; any exception
 * marks the execution as failed, with the exception's message as the failure reason.
 * Implementations may block or take arbitrarily long.
 */
@FunctionalInterface
public interface JobHandler {

    void run() throws Exception;
}
