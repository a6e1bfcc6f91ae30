package com.phonepe.conclave.core.utils;

import com.phonepe.conclave.core.agent.Agent;
import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.agent.RunOptions;
import com.phonepe.conclave.core.errors.AgentInvocationException;
import com.phonepe.conclave.core.errors.ErrorType;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Various small utilities to invoke agents and deal with their failures.
 */
@UtilityClass
public class AgentUtils {

    /**
     * Run the agent and block till the response is available. Failures are rethrown as raised by the agent, with
     * future wrappers removed. Checked exceptions get wrapped in {@link AgentInvocationException}.
     *
     * @param agent   Agent to run
     * @param input   Input text
     * @param options Run options
     * @return Response from agent
     */
    public static AgentResponse runAndWait(@NonNull Agent agent, String input, RunOptions options) {
        final var future = Objects.requireNonNull(agent.run(input, Objects.requireNonNullElse(options,
                                                                                            RunOptions.none())),
                                                  () -> "Agent " + agent.name() + " returned a null future");
        try {
            return future.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentInvocationException(ErrorType.AGENT_INTERRUPTED, agent.name(), e);
        }
        catch (ExecutionException e) {
            throw propagate(agent.name(), e);
        }
    }

    /**
     * Strip {@link CompletionException} and {@link ExecutionException} layers added by futures
     */
    public static Throwable unwrap(final Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Convert a failure into something that can be thrown without declaration. Runtime exceptions and errors are
     * returned as is so that callers see the same instance the agent raised.
     *
     * @param agentName Name of the failed agent
     * @param error     Error (possibly wrapped by a future)
     * @return The exception to throw
     */
    public static RuntimeException propagate(String agentName, Throwable error) {
        final var cause = unwrap(error);
        if (cause instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new AgentInvocationException(agentName, cause);
    }

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * @return Message of the error, or the class name if the error has no message
     */
    public static String errorMessage(final Throwable error) {
        return Objects.requireNonNullElseGet(error.getMessage(), () -> error.getClass().getSimpleName());
    }
}
