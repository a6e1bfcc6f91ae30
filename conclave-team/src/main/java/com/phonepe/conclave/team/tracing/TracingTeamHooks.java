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

package com.phonepe.conclave.team.tracing;

import com.phonepe.conclave.core.agent.AgentResponse;
import com.phonepe.conclave.core.tracing.SpanStatus;
import com.phonepe.conclave.core.tracing.Tracer;
import com.phonepe.conclave.core.utils.AgentUtils;
import com.phonepe.conclave.team.TeamHooks;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Decorates the caller's hooks so that rounds and agent invocations show up as nested spans under the run's root
 * span. Created per run; span ids are dropped as soon as the spans close. Tracer failures are logged and never
 * interrupt the run.
 */
@Slf4j
public class TracingTeamHooks implements TeamHooks {
    public static final String ROUND_SPAN_PREFIX = "round-";
    public static final String AGENT_SPAN_PREFIX = "agent:";

    private final TeamHooks delegate;
    private final Tracer tracer;
    private final String traceId;
    private final String rootSpanId;

    private final Map<Integer, String> roundSpans = new ConcurrentHashMap<>();
    private final Deque<Integer> openRounds = new ConcurrentLinkedDeque<>();
    private final Map<String, Deque<String>> agentSpans = new ConcurrentHashMap<>();

    public TracingTeamHooks(TeamHooks delegate,
                            @NonNull Tracer tracer,
                            @NonNull String traceId,
                            @NonNull String rootSpanId) {
        this.delegate = Objects.requireNonNullElse(delegate, TeamHooks.NONE);
        this.tracer = tracer;
        this.traceId = traceId;
        this.rootSpanId = rootSpanId;
    }

    @Override
    public void onRoundStart(int round) {
        safely(() -> {
            final var span = tracer.startSpan(traceId, ROUND_SPAN_PREFIX + round, rootSpanId, Map.of("round", round));
            roundSpans.put(round, span.getId());
            openRounds.push(round);
        });
        delegate.onRoundStart(round);
    }

    @Override
    public void onAgentStart(String agentName, int round) {
        safely(() -> {
            final var parent = Objects.requireNonNullElse(roundSpans.get(round), rootSpanId);
            final var span = tracer.startSpan(traceId,
                                              AGENT_SPAN_PREFIX + agentName,
                                              parent,
                                              Map.of("agent", agentName, "round", round));
            agentSpans.computeIfAbsent(agentKey(round, agentName), key -> new ConcurrentLinkedDeque<>())
                    .addLast(span.getId());
        });
        delegate.onAgentStart(agentName, round);
    }

    @Override
    public void onAgentEnd(String agentName, AgentResponse response, int round) {
        final var spanId = takeAgentSpan(round, agentName);
        if (null != spanId) {
            safely(() -> {
                tracer.endSpan(traceId, spanId, SpanStatus.OK,
                               Map.of("totalTokens", null == response.getUsage()
                                                     ? 0
                                                     : response.getUsage().getTotalTokens()));
            });
        }
        delegate.onAgentEnd(agentName, response, round);
    }

    @Override
    public void onAgentError(String agentName, Throwable error, int round) {
        final var spanId = takeAgentSpan(round, agentName);
        if (null != spanId) {
            safely(() -> tracer.endSpan(traceId, spanId, SpanStatus.ERROR,
                                        Map.of("error", AgentUtils.errorMessage(error))));
        }
        delegate.onAgentError(agentName, error, round);
    }

    @Override
    public void onRoundEnd(int round, List<AgentResponse> results) {
        final var prefix = round + ":";
        agentSpans.keySet()
                .stream()
                .filter(key -> key.startsWith(prefix))
                .toList()
                .forEach(key -> closeAgentSpans(key, SpanStatus.ERROR));
        final var spanId = roundSpans.remove(round);
        openRounds.remove(round);
        if (null != spanId) {
            safely(() -> tracer.endSpan(traceId, spanId, SpanStatus.OK, Map.of("agentCount", results.size())));
        }
        delegate.onRoundEnd(round, results);
    }

    @Override
    public void onConsensus(int round, String output) {
        safely(() -> tracer.addEvent(traceId, rootSpanId, "consensus", Map.of("round", round, "output", output)));
        delegate.onConsensus(round, output);
    }

    @Override
    public void onError(Throwable error) {
        safely(() -> {
            final var currentRound = openRounds.peek();
            final var spanId = null == currentRound
                               ? rootSpanId
                               : Objects.requireNonNullElse(roundSpans.get(currentRound), rootSpanId);
            tracer.addEvent(traceId, spanId, "error", Map.of("error", AgentUtils.errorMessage(error)));
        });
        delegate.onError(error);
    }

    /**
     * Close every span this decorator still has open. Used when a run fails midway.
     */
    public void closeOpenSpans(@NonNull SpanStatus status) {
        List.copyOf(agentSpans.keySet()).forEach(key -> closeAgentSpans(key, status));
        final var rounds = new ArrayDeque<>(openRounds);
        openRounds.clear();
        rounds.forEach(round -> {
            final var spanId = roundSpans.remove(round);
            if (null != spanId) {
                safely(() -> tracer.endSpan(traceId, spanId, status));
            }
        });
    }

    /**
     * @return Number of spans this decorator still tracks as open
     */
    public int openSpanCount() {
        return roundSpans.size() + agentSpans.values().stream().mapToInt(Deque::size).sum();
    }

    /**
     * Failed calls give their span back through {@link #onAgentError(String, Throwable, int)} and runners report
     * overlapping calls in start order, so the oldest open span belongs to the call ending now
     */
    private String takeAgentSpan(int round, String agentName) {
        final var key = agentKey(round, agentName);
        final var spans = agentSpans.get(key);
        if (null == spans) {
            return null;
        }
        final var spanId = spans.pollFirst();
        if (spans.isEmpty()) {
            agentSpans.remove(key);
        }
        return spanId;
    }

    private void closeAgentSpans(String key, SpanStatus status) {
        final var spans = agentSpans.remove(key);
        if (null == spans) {
            return;
        }
        spans.forEach(spanId -> safely(() -> tracer.endSpan(traceId, spanId, status)));
    }

    private static String agentKey(int round, String agentName) {
        return round + ":" + agentName;
    }

    private void safely(Runnable action) {
        try {
            action.run();
        }
        catch (RuntimeException e) {
            log.warn("Error recording trace {}: {}", traceId, AgentUtils.errorMessage(e));
        }
    }
}
