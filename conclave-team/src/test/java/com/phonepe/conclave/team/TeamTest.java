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

import com.phonepe.conclave.core.agent.CancellationSignal;
import com.phonepe.conclave.core.tracing.InMemoryTracer;
import com.phonepe.conclave.core.tracing.Span;
import com.phonepe.conclave.core.tracing.SpanStatus;
import com.phonepe.conclave.core.tracing.Trace;
import com.phonepe.conclave.core.tracing.Tracer;
import com.phonepe.conclave.core.tracing.exporters.CollectingTraceExporter;
import com.phonepe.conclave.team.aggregation.AggregationStrategy;
import com.phonepe.conclave.team.settings.CustomSettings;
import com.phonepe.conclave.team.settings.DebateSettings;
import com.phonepe.conclave.team.settings.ParallelSettings;
import com.phonepe.conclave.team.settings.SupervisorSettings;
import com.phonepe.conclave.team.utils.RecordingHooks;
import com.phonepe.conclave.team.utils.ScriptedAgent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TeamTest {

    @Test
    void emptyTeamIsRejected() {
        final var config = TeamConfig.builder().name("empty").build();
        final var thrown = assertThrows(IllegalArgumentException.class, () -> Teams.create(config));
        assertEquals("A team requires at least one agent.", thrown.getMessage());
    }

    @Test
    void customTeamWithoutFunctionIsRejected() {
        final var agent = ScriptedAgent.replying("a", "x");
        final var config = TeamConfig.builder()
                .name("custom")
                .agent(agent)
                .modeSettings(CustomSettings.of(null))
                .build();
        final var thrown = assertThrows(IllegalArgumentException.class, () -> Teams.create(config));
        assertEquals("Custom coordination mode requires a \"coordinationFn\" in the config.", thrown.getMessage());
        assertEquals(0, agent.invocations());
    }

    @Test
    void parallelMergeAllEndToEnd() {
        final var team = Teams.create(TeamConfig.builder()
                                              .name("pair")
                                              .agent(ScriptedAgent.replying("A", "Result A"))
                                              .agent(ScriptedAgent.replying("B", "Result B"))
                                              .modeSettings(ParallelSettings.of(AggregationStrategy.MERGE_ALL))
                                              .build());
        final var result = team.execute("task");
        assertAll(
                () -> assertEquals("pair", team.getName()),
                () -> assertEquals(CoordinationMode.PARALLEL, team.getCoordinationMode()),
                () -> assertTrue(result.getFinalOutput().contains("[A]: Result A")),
                () -> assertTrue(result.getFinalOutput().contains("[B]: Result B")),
                () -> assertEquals(1, result.getRounds())
                 );
    }

    @Test
    void executeRethrowsSameInstance() {
        final var error = new IllegalStateException("agent exploded");
        final var team = Teams.create(TeamConfig.builder()
                                              .name("seq")
                                              .agent(ScriptedAgent.failing("a", error))
                                              .build());
        assertSame(error, assertThrows(IllegalStateException.class, () -> team.execute("task")));
    }

    @Test
    void asyncRunCompletesWithResultOrOriginalError() {
        final var executor = Executors.newSingleThreadExecutor();
        try {
            final var ok = Teams.create(TeamConfig.builder()
                                                .name("ok")
                                                .agent(ScriptedAgent.delayed("a", "late", Duration.ofMillis(50)))
                                                .executorService(executor)
                                                .build())
                    .run("task");
            await().atMost(Duration.ofSeconds(5)).until(ok::isDone);
            assertEquals("late", ok.join().getFinalOutput());

            final var error = new IllegalStateException("failed");
            final var failed = Teams.create(TeamConfig.builder()
                                                    .name("failed")
                                                    .agent(ScriptedAgent.failing("a", error))
                                                    .executorService(executor)
                                                    .build())
                    .run("task");
            await().atMost(Duration.ofSeconds(5)).until(failed::isDone);
            assertSame(error, assertThrows(CompletionException.class, failed::join).getCause());
        }
        finally {
            executor.shutdownNow();
        }
    }

    @Test
    void signalIsForwardedToAgents() {
        final var signal = new CancellationSignal();
        final var agent = ScriptedAgent.replying("a", "x");
        Teams.create(TeamConfig.builder().name("t").agent(agent).build())
                .execute("task", TeamRunOptions.of(signal));
        assertSame(signal, agent.getOptions().get(0).getSignal());
    }

    @Test
    void hooksAreCalledInOrder() {
        final var hooks = mock(TeamHooks.class);
        Teams.create(TeamConfig.builder()
                             .name("t")
                             .agent(ScriptedAgent.replying("a", "x"))
                             .hooks(hooks)
                             .build())
                .execute("task");
        final var order = inOrder(hooks);
        order.verify(hooks).onRoundStart(1);
        order.verify(hooks).onAgentStart("a", 1);
        order.verify(hooks).onAgentEnd(eq("a"), any(), eq(1));
        order.verify(hooks).onRoundEnd(eq(1), anyList());
    }

    @Test
    void tracedRunRecordsNestedSpans() {
        final var collector = new CollectingTraceExporter();
        final var hooks = new RecordingHooks();
        final var team = Teams.create(TeamConfig.builder()
                                              .name("debaters")
                                              .agent(ScriptedAgent.replying("a", "Yes"))
                                              .agent(ScriptedAgent.replying("b", "No"))
                                              .modeSettings(DebateSettings.builder()
                                                                    .rounds(2)
                                                                    .judge(ScriptedAgent.replying("judge", "J"))
                                                                    .build())
                                              .hooks(hooks)
                                              .tracer(new InMemoryTracer(collector))
                                              .build());
        final var result = team.execute("Q?");

        final var trace = collector.last().orElseThrow();
        final var root = single(trace, Team.ROOT_SPAN);
        final var round1 = single(trace, "round-1");
        final var round2 = single(trace, "round-2");
        final var agentSpans = trace.spansNamed("agent:a");
        final var judgeSpan = single(trace, "agent:judge");
        assertAll(
                () -> assertEquals("team:debaters", trace.getName()),
                () -> assertEquals("debaters", trace.getAttributes().get("team")),
                () -> assertEquals("debate", trace.getAttributes().get("coordinationMode")),
                () -> assertEquals("Q?", trace.getAttributes().get("input")),
                () -> assertEquals(SpanStatus.OK, root.getStatus()),
                () -> assertEquals(2, root.getAttributes().get("rounds")),
                () -> assertEquals(result.getTotalUsage().getTotalTokens(), root.getAttributes().get("totalTokens")),
                () -> assertEquals(root.getId(), round1.getParentId()),
                () -> assertEquals(root.getId(), round2.getParentId()),
                () -> assertEquals(2, agentSpans.size()),
                () -> assertEquals(round1.getId(), agentSpans.get(0).getParentId()),
                () -> assertEquals(round2.getId(), agentSpans.get(1).getParentId()),
                () -> assertEquals(root.getId(), judgeSpan.getParentId()),
                () -> assertTrue(trace.getSpans().stream().noneMatch(Span::isOpen)),
                () -> assertTrue(trace.getSpans().stream().allMatch(span -> span.getStatus() == SpanStatus.OK)),
                () -> assertEquals(1, hooks.count("agentEnd:judge")),
                () -> assertTrue(team.getConfig().getTracer().activeTraces().isEmpty())
                 );
    }

    @Test
    void tracedFailureClosesSpansAndRethrowsSameError() {
        final var collector = new CollectingTraceExporter();
        final var error = new IllegalStateException("boss down");
        final var team = Teams.create(TeamConfig.builder()
                                              .name("sup")
                                              .agent(ScriptedAgent.failing("boss", error))
                                              .agent(ScriptedAgent.replying("worker", "w"))
                                              .modeSettings(SupervisorSettings.builder().build())
                                              .tracer(new InMemoryTracer(collector))
                                              .build());

        assertSame(error, assertThrows(IllegalStateException.class, () -> team.execute("task")));

        final var trace = collector.last().orElseThrow();
        final var root = single(trace, Team.ROOT_SPAN);
        assertAll(
                () -> assertNotNull(trace.getEndTime()),
                () -> assertEquals(SpanStatus.ERROR, root.getStatus()),
                () -> assertEquals("boss down", root.getAttributes().get("error")),
                () -> assertEquals(SpanStatus.ERROR, single(trace, "round-1").getStatus()),
                () -> assertEquals(SpanStatus.ERROR, single(trace, "agent:boss").getStatus()),
                () -> assertTrue(trace.getSpans().stream().noneMatch(Span::isOpen)),
                () -> assertEquals("error", single(trace, "round-1").getEvents().get(0).getName())
                 );
    }

    @Test
    void parallelFailuresShowUpAsErrorSpans() {
        final var collector = new CollectingTraceExporter();
        Teams.create(TeamConfig.builder()
                             .name("fanout")
                             .agent(ScriptedAgent.replying("a", "A"))
                             .agent(ScriptedAgent.failing("b", new IllegalStateException("nope")))
                             .modeSettings(ParallelSettings.builder().build())
                             .tracer(new InMemoryTracer(collector))
                             .build())
                .execute("task");
        final var trace = collector.last().orElseThrow();
        assertAll(
                () -> assertEquals(SpanStatus.OK, single(trace, "agent:a").getStatus()),
                () -> assertEquals(SpanStatus.ERROR, single(trace, "agent:b").getStatus()),
                () -> assertEquals(1, single(trace, "round-1").getAttributes().get("agentCount")),
                () -> assertEquals(SpanStatus.OK, single(trace, Team.ROOT_SPAN).getStatus())
                 );
    }

    @Test
    void tracerFailuresDoNotMaskResult() {
        final var tracer = spy(new InMemoryTracer());
        doThrow(new IllegalStateException("tracer broken"))
                .when(tracer).startSpan(anyString(), eq("round-1"), anyString(), any());
        final var result = Teams.create(TeamConfig.builder()
                                                .name("t")
                                                .agent(ScriptedAgent.replying("a", "fine"))
                                                .tracer(tracer)
                                                .build())
                .execute("task");
        assertEquals("fine", result.getFinalOutput());
        verify(tracer, times(1)).endTrace(anyString());
    }

    @Test
    void successfulRunSurvivesTracerFailingToClose() {
        final var tracer = spy(new InMemoryTracer());
        doThrow(new IllegalStateException("tracer broken"))
                .when(tracer).endTrace(anyString(), any());
        doThrow(new IllegalStateException("span broken"))
                .when(tracer).endSpan(anyString(), anyString(), eq(SpanStatus.OK), any());
        final var result = Teams.create(TeamConfig.builder()
                                                .name("t")
                                                .agent(ScriptedAgent.replying("a", "fine"))
                                                .tracer(tracer)
                                                .build())
                .execute("task");
        assertEquals("fine", result.getFinalOutput());
        verify(tracer, times(1)).endTrace(anyString(), any());
    }

    @Test
    void failedRunKeepsItsErrorWhenTracerFailsToClose() {
        final var tracer = spy(new InMemoryTracer());
        doThrow(new IllegalStateException("tracer broken"))
                .when(tracer).endTrace(anyString(), any());
        final var error = new IllegalStateException("agent down");
        final var team = Teams.create(TeamConfig.builder()
                                              .name("t")
                                              .agent(ScriptedAgent.failing("a", error))
                                              .tracer(tracer)
                                              .build());
        final var thrown = assertThrows(IllegalStateException.class, () -> team.execute("task"));
        assertSame(error, thrown);
        assertEquals("tracer broken", thrown.getSuppressed()[0].getMessage());
    }

    @Test
    void runsUntracedWhenTraceCannotStart() {
        final var tracer = spy(new InMemoryTracer());
        doThrow(new IllegalStateException("tracer broken"))
                .when(tracer).startTrace(anyString(), any());
        final var hooks = new RecordingHooks();
        final var result = Teams.create(TeamConfig.builder()
                                                .name("t")
                                                .agent(ScriptedAgent.replying("a", "fine"))
                                                .hooks(hooks)
                                                .tracer(tracer)
                                                .build())
                .execute("task");
        assertAll(
                () -> assertEquals("fine", result.getFinalOutput()),
                () -> assertEquals(List.of("roundStart:1", "agentStart:a:1", "agentEnd:a:1", "roundEnd:1:1"),
                                   hooks.getEvents()),
                () -> assertTrue(tracer.activeTraces().isEmpty())
                 );
    }

    @Test
    void traceIsClosedWhenRootSpanCannotStart() {
        final var collector = new CollectingTraceExporter();
        final var tracer = spy(new InMemoryTracer(collector));
        doThrow(new IllegalStateException("span broken"))
                .when(tracer).startSpan(anyString(), eq(Team.ROOT_SPAN), any(), any());
        final var result = Teams.create(TeamConfig.builder()
                                                .name("t")
                                                .agent(ScriptedAgent.replying("a", "fine"))
                                                .tracer(tracer)
                                                .build())
                .execute("task");
        assertAll(
                () -> assertEquals("fine", result.getFinalOutput()),
                () -> assertTrue(tracer.activeTraces().isEmpty()),
                () -> assertTrue(collector.last().orElseThrow().getSpans().isEmpty())
                 );
    }

    @Test
    void repeatedWorkerSpansKeepTheirOwnStatus() {
        final var collector = new CollectingTraceExporter();
        final var worker = new ScriptedAgent("w", input -> "one".equals(input)
                                                           ? CompletableFuture.failedFuture(
                                                                   new IllegalStateException("first call failed"))
                                                           : CompletableFuture.completedFuture(
                                                                   ScriptedAgent.response("w", "second")));
        final var result = Teams.create(TeamConfig.builder()
                                                .name("sup")
                                                .agent(ScriptedAgent.scripted("boss",
                                                                              "[DELEGATE: w] one\n[DELEGATE: w] two",
                                                                              "[FINAL] done"))
                                                .agent(worker)
                                                .modeSettings(SupervisorSettings.builder().build())
                                                .tracer(new InMemoryTracer(collector))
                                                .build())
                .execute("task");
        assertEquals("done", result.getFinalOutput());

        final var workerSpans = collector.last().orElseThrow().spansNamed("agent:w");
        assertAll(
                () -> assertEquals(2, workerSpans.size()),
                () -> assertEquals(SpanStatus.ERROR, workerSpans.get(0).getStatus()),
                () -> assertEquals("first call failed", workerSpans.get(0).getAttributes().get("error")),
                () -> assertFalse(workerSpans.get(0).getAttributes().containsKey("totalTokens")),
                () -> assertEquals(SpanStatus.OK, workerSpans.get(1).getStatus()),
                () -> assertEquals(15, workerSpans.get(1).getAttributes().get("totalTokens"))
                 );
    }

    @Test
    void failedParallelAgentSpanEndsBeforeSlowerAgents() {
        final var collector = new CollectingTraceExporter();
        Teams.create(TeamConfig.builder()
                             .name("fanout")
                             .agent(ScriptedAgent.failing("fast", new IllegalStateException("nope")))
                             .agent(ScriptedAgent.delayed("slow", "S", Duration.ofMillis(400)))
                             .modeSettings(ParallelSettings.builder().build())
                             .tracer(new InMemoryTracer(collector))
                             .build())
                .execute("task");
        final var trace = collector.last().orElseThrow();
        final var failed = single(trace, "agent:fast");
        final var round = single(trace, "round-1");
        assertAll(
                () -> assertEquals(SpanStatus.ERROR, failed.getStatus()),
                () -> assertEquals("nope", failed.getAttributes().get("error")),
                () -> assertTrue(failed.getEndTime() + 200 <= round.getEndTime(),
                                 () -> "Failed span ended at " + failed.getEndTime()
                                         + ", round ended at " + round.getEndTime())
                 );
    }

    @Test
    void callerHooksStillRunWhenTraced() {
        final var hooks = mock(TeamHooks.class);
        final Tracer tracer = new InMemoryTracer();
        Teams.create(TeamConfig.builder()
                             .name("t")
                             .agent(ScriptedAgent.replying("a", "x"))
                             .agent(ScriptedAgent.replying("b", "x"))
                             .modeSettings(DebateSettings.builder().build())
                             .hooks(hooks)
                             .tracer(tracer)
                             .build())
                .execute("task");
        verify(hooks).onConsensus(1, "x");
        verify(hooks, times(2)).onAgentStart(anyString(), anyInt());
        verify(hooks).onRoundEnd(eq(1), eq(List.of(ScriptedAgent.response("a", "x"),
                                                   ScriptedAgent.response("b", "x"))));
    }

    private static Span single(Trace trace, String name) {
        final var spans = trace.spansNamed(name);
        assertEquals(1, spans.size(), () -> "Expected one span named " + name);
        return spans.get(0);
    }
}
