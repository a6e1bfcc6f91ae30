/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.conclave.team;

import com.phonepe.conclave.core.tracing.Span;
import com.phonepe.conclave.core.tracing.SpanStatus;
import com.phonepe.conclave.core.tracing.Trace;
import com.phonepe.conclave.core.tracing.Tracer;
import com.phonepe.conclave.core.utils.AgentUtils;
import com.phonepe.conclave.team.modes.CustomRunner;
import com.phonepe.conclave.team.modes.DebateRunner;
import com.phonepe.conclave.team.modes.ParallelRunner;
import com.phonepe.conclave.team.modes.SequentialRunner;
import com.phonepe.conclave.team.modes.SupervisorRunner;
import com.phonepe.conclave.team.modes.TeamRunContext;
import com.phonepe.conclave.team.settings.CustomSettings;
import com.phonepe.conclave.team.settings.DebateSettings;
import com.phonepe.conclave.team.settings.ModeSettingsVisitor;
import com.phonepe.conclave.team.settings.ParallelSettings;
import com.phonepe.conclave.team.settings.SequentialSettings;
import com.phonepe.conclave.team.settings.SupervisorSettings;
import com.phonepe.conclave.team.tracing.TracingTeamHooks;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A group of agents run together under one coordination mode. Every run is independent of the others, so a team
 * can be run concurrently. Create instances using {@link Teams#create(TeamConfig)}.
 */
@Slf4j
public class Team {
    public static final String ROOT_SPAN = "team-run";
    public static final String TRACE_PREFIX = "team:";

    private static final SequentialRunner SEQUENTIAL = new SequentialRunner();
    private static final ParallelRunner PARALLEL = new ParallelRunner();
    private static final DebateRunner DEBATE = new DebateRunner();
    private static final SupervisorRunner SUPERVISOR = new SupervisorRunner();
    private static final CustomRunner CUSTOM = new CustomRunner();

    @Getter
    private final TeamConfig config;
    @Getter
    private final List<AgentRole> agents;
    private final ExecutorService executorService;

    Team(@NonNull TeamConfig config) {
        config.validate();
        this.config = config;
        this.agents = List.copyOf(config.getAgents());
        this.executorService = Objects.requireNonNullElseGet(config.getExecutorService(),
                                                             Executors::newCachedThreadPool);
    }

    public String getName() {
        return config.getName();
    }

    public CoordinationMode getCoordinationMode() {
        return config.getCoordinationMode();
    }

    public TeamResult execute(String input) {
        return execute(input, TeamRunOptions.none());
    }

    /**
     * Run the team on the calling thread
     *
     * @param input   Task for the team
     * @param options Run options
     * @return Result of the run
     * @throws RuntimeException the exception raised by the failing agent or hook, as is
     */
    public TeamResult execute(@NonNull String input, TeamRunOptions options) {
        final var runOptions = Objects.requireNonNullElse(options, TeamRunOptions.none());
        final var tracer = config.getTracer();
        log.info("Running team {} in {} mode", getName(), getCoordinationMode().getValue());
        final var result = null == tracer
                           ? dispatch(input, runOptions, hooks())
                           : traced(tracer, input, runOptions);
        log.info("Team {} finished in {} round(s) using {} tokens",
                 getName(), result.getRounds(), result.getTotalUsage().getTotalTokens());
        return result;
    }

    public CompletableFuture<TeamResult> run(String input) {
        return run(input, TeamRunOptions.none());
    }

    /**
     * Run the team on the team executor. A failed run completes the future exceptionally with the original
     * exception as cause.
     */
    public CompletableFuture<TeamResult> run(@NonNull String input, TeamRunOptions options) {
        return CompletableFuture.supplyAsync(() -> execute(input, options), executorService);
    }

    private TeamResult traced(Tracer tracer, String input, TeamRunOptions options) {
        final var attributes = new LinkedHashMap<String, Object>();
        attributes.put("team", getName());
        attributes.put("coordinationMode", getCoordinationMode().getValue());
        attributes.put("input", input);
        final Trace trace;
        try {
            trace = tracer.startTrace(TRACE_PREFIX + getName(), attributes);
        }
        catch (RuntimeException e) {
            log.warn("Could not start trace for team {}, running untraced: {}", getName(), AgentUtils.errorMessage(e));
            return dispatch(input, options, hooks());
        }
        final Span rootSpan;
        try {
            rootSpan = tracer.startSpan(trace.getId(), ROOT_SPAN);
        }
        catch (RuntimeException e) {
            log.warn("Could not start root span for team {}, running untraced: {}",
                     getName(), AgentUtils.errorMessage(e));
            closeTrace(trace, () -> tracer.endTrace(trace.getId()));
            return dispatch(input, options, hooks());
        }
        final var tracingHooks = new TracingTeamHooks(hooks(), tracer, trace.getId(), rootSpan.getId());
        final TeamResult result;
        try {
            result = dispatch(input, options, tracingHooks);
        }
        catch (RuntimeException | Error e) {
            tracingHooks.closeOpenSpans(SpanStatus.ERROR);
            closeTrace(trace, () -> tracer.endSpan(trace.getId(), rootSpan.getId(), SpanStatus.ERROR,
                                                   Map.of("error", AgentUtils.errorMessage(e))))
                    .ifPresent(e::addSuppressed);
            closeTrace(trace, () -> tracer.endTrace(trace.getId()))
                    .ifPresent(e::addSuppressed);
            throw e;
        }
        closeTrace(trace, () -> tracer.endSpan(trace.getId(), rootSpan.getId(), SpanStatus.OK,
                                               Map.of("rounds", result.getRounds(),
                                                      "totalTokens", result.getTotalUsage().getTotalTokens())));
        closeTrace(trace, () -> tracer.endTrace(trace.getId()));
        return result;
    }

    /**
     * Tracer failures while closing a trace are logged and handed back, the run outcome stays as it is
     */
    private Optional<RuntimeException> closeTrace(Trace trace, Runnable action) {
        try {
            action.run();
            return Optional.empty();
        }
        catch (RuntimeException e) {
            log.warn("Could not close trace {} for team {}: {}", trace.getId(), getName(), AgentUtils.errorMessage(e));
            return Optional.of(e);
        }
    }

    private TeamResult dispatch(String input, TeamRunOptions options, TeamHooks hooks) {
        final var context = TeamRunContext.builder()
                .agents(agents)
                .input(input)
                .maxRounds(config.getMaxRounds())
                .hooks(hooks)
                .signal(options.getSignal())
                .build();
        return config.getModeSettings().accept(new ModeSettingsVisitor<TeamResult>() {
            @Override
            public TeamResult visit(SequentialSettings sequentialSettings) {
                return SEQUENTIAL.run(context, sequentialSettings);
            }

            @Override
            public TeamResult visit(ParallelSettings parallelSettings) {
                return PARALLEL.run(context, parallelSettings);
            }

            @Override
            public TeamResult visit(DebateSettings debateSettings) {
                return DEBATE.run(context, debateSettings);
            }

            @Override
            public TeamResult visit(SupervisorSettings supervisorSettings) {
                return SUPERVISOR.run(context, supervisorSettings);
            }

            @Override
            public TeamResult visit(CustomSettings customSettings) {
                return CUSTOM.run(context, customSettings);
            }
        });
    }

    private TeamHooks hooks() {
        return Objects.requireNonNullElse(config.getHooks(), TeamHooks.NONE);
    }
}
