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

package com.phonepe.conclave.team.modes;

import com.phonepe.conclave.core.agent.CancellationSignal;
import com.phonepe.conclave.core.errors.UnknownAgentException;
import com.phonepe.conclave.team.settings.SupervisorSettings;
import com.phonepe.conclave.team.utils.RecordingHooks;
import com.phonepe.conclave.team.utils.ScriptedAgent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phonepe.conclave.team.utils.TestUtils.context;
import static org.junit.jupiter.api.Assertions.*;

class SupervisorRunnerTest {
    private final SupervisorRunner runner = new SupervisorRunner();
    private final SupervisorSettings defaults = SupervisorSettings.builder().build();

    @Test
    void delegatesThenFinishes() {
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: researcher] find facts", "[FINAL] done");
        final var researcher = ScriptedAgent.replying("researcher", "facts");
        final var hooks = new RecordingHooks();

        final var result = runner.run(context("write report", hooks, boss, researcher), defaults);
        assertAll(
                () -> assertEquals(3, result.getAgentResults().size()),
                () -> assertEquals("done", result.getFinalOutput()),
                () -> assertEquals(2, result.getRounds()),
                () -> assertEquals(45, result.getTotalUsage().getTotalTokens()),
                () -> assertEquals(List.of("find facts"), researcher.getInputs()),
                () -> assertEquals("You are the supervisor. Delegate tasks to your worker agents or provide a final "
                                           + "answer.\n\n"
                                           + "Available workers: researcher\n\n"
                                           + "To delegate, use: [DELEGATE: agentName] task description\n"
                                           + "To give the final answer, use: [FINAL] your final answer\n\n"
                                           + "Task: write report",
                                   boss.getInputs().get(0)),
                () -> assertEquals("Worker results from round 1:\n\n"
                                           + "[researcher]: facts\n\n"
                                           + "Original task: write report\n\n"
                                           + "Continue delegating or provide [FINAL] answer.",
                                   boss.getInputs().get(1)),
                () -> assertEquals(List.of("roundStart:1",
                                           "agentStart:boss:1", "agentEnd:boss:1",
                                           "agentStart:researcher:1", "agentEnd:researcher:1",
                                           "roundEnd:1:2",
                                           "roundStart:2",
                                           "agentStart:boss:2", "agentEnd:boss:2",
                                           "roundEnd:2:1"),
                                   hooks.getEvents())
                 );
    }

    @Test
    void unknownWorkerBecomesFeedback() {
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: ghost] do it", "[FINAL] gave up");
        final var worker = ScriptedAgent.replying("worker", "w");
        final var hooks = new RecordingHooks();

        final var result = runner.run(context("task", hooks, 3, null, boss, worker), defaults);
        assertAll(
                () -> assertEquals("gave up", result.getFinalOutput()),
                () -> assertEquals(2, result.getAgentResults().size()),
                () -> assertEquals(1, hooks.getErrors().size()),
                () -> assertInstanceOf(UnknownAgentException.class, hooks.getErrors().get(0)),
                () -> assertTrue(boss.getInputs().get(1)
                                         .contains("[ghost]: Error: Agent \"ghost\" not found. Available: worker")),
                () -> assertEquals(0, worker.invocations())
                 );
    }

    @Test
    void workerFailureBecomesFeedback() {
        final var error = new IllegalStateException("worker crashed");
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: worker] do it", "[FINAL] ok");
        final var hooks = new RecordingHooks();

        final var result = runner.run(context("task", hooks, boss, ScriptedAgent.failing("worker", error)),
                                      defaults);
        assertAll(
                () -> assertEquals("ok", result.getFinalOutput()),
                () -> assertEquals(2, result.getAgentResults().size()),
                () -> assertEquals(List.of(error), hooks.getErrors()),
                () -> assertTrue(boss.getInputs().get(1).contains("[worker]: Error: worker crashed"))
                 );
    }

    @Test
    void coordinatorFailureFailsRun() {
        final var error = new IllegalStateException("boss down");
        final var hooks = new RecordingHooks();
        final var thrown = assertThrows(IllegalStateException.class,
                                        () -> runner.run(context("task", hooks,
                                                                 ScriptedAgent.failing("boss", error),
                                                                 ScriptedAgent.replying("worker", "w")),
                                                         defaults));
        assertSame(error, thrown);
        assertEquals(List.of(error), hooks.getErrors());
    }

    @Test
    void finalWinsOverDelegation() {
        final var worker = ScriptedAgent.replying("worker", "w");
        final var result = runner.run(context("task", new RecordingHooks(),
                                              ScriptedAgent.replying("boss",
                                                                     "[DELEGATE: worker] more\n[FINAL] answer\nline 2"),
                                              worker),
                                      defaults);
        assertAll(
                () -> assertEquals("answer\nline 2", result.getFinalOutput()),
                () -> assertEquals(1, result.getRounds()),
                () -> assertEquals(0, worker.invocations())
                 );
    }

    @Test
    void plainAnswerIsFinal() {
        final var result = runner.run(context("task", new RecordingHooks(),
                                              ScriptedAgent.replying("boss", "just the answer"),
                                              ScriptedAgent.replying("worker", "w")),
                                      defaults);
        assertEquals("just the answer", result.getFinalOutput());
        assertEquals(1, result.getRounds());
    }

    @Test
    void maxRoundsReturnsLatestCoordinatorText() {
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: worker] step 1", "[DELEGATE: worker] step 2");
        final var result = runner.run(context("task", new RecordingHooks(), 2, null,
                                              boss, ScriptedAgent.replying("worker", "w")),
                                      defaults);
        assertAll(
                () -> assertEquals("[DELEGATE: worker] step 2", result.getFinalOutput()),
                () -> assertEquals(2, result.getRounds()),
                () -> assertEquals(4, result.getAgentResults().size())
                 );
    }

    @Test
    void multipleDelegationsInOneRound() {
        final var boss = ScriptedAgent.scripted("boss",
                                                "[DELEGATE: a] task for a\n[DELEGATE:b]task for b",
                                                "[FINAL] merged");
        final var a = ScriptedAgent.replying("a", "from a");
        final var b = ScriptedAgent.replying("b", "from b");

        final var result = runner.run(context("task", new RecordingHooks(), boss, a, b), defaults);
        assertAll(
                () -> assertEquals(List.of("task for a"), a.getInputs()),
                () -> assertEquals(List.of("task for b"), b.getInputs()),
                () -> assertEquals(4, result.getAgentResults().size()),
                () -> assertTrue(boss.getInputs().get(1).contains("[a]: from a\n\n[b]: from b"))
                 );
    }

    @Test
    void externalSupervisorMakesEveryMemberAWorker() {
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: first] go", "[FINAL] fin");
        final var first = ScriptedAgent.replying("first", "1");
        final var result = runner.run(context("task", new RecordingHooks(), first,
                                              ScriptedAgent.replying("second", "2")),
                                      SupervisorSettings.builder().supervisor(boss).build());
        assertAll(
                () -> assertEquals("fin", result.getFinalOutput()),
                () -> assertEquals(1, first.invocations()),
                () -> assertTrue(boss.getInputs().get(0).contains("Available workers: first, second"))
                 );
    }

    @Test
    void abortStopsBeforeNextRound() {
        final var signal = new CancellationSignal();
        final var boss = ScriptedAgent.scripted("boss", "[DELEGATE: worker] go", "[FINAL] never");
        final var worker = ScriptedAgent.answering("worker", input -> {
            signal.abort("enough");
            return "w";
        });
        final var result = runner.run(context("task", new RecordingHooks(), 5, signal, boss, worker), defaults);
        assertAll(
                () -> assertEquals("[DELEGATE: worker] go", result.getFinalOutput()),
                () -> assertEquals(1, result.getRounds()),
                () -> assertEquals(1, boss.invocations())
                 );
    }

    @Test
    void directiveParsing() {
        assertEquals(List.of(new SupervisorRunner.Delegation("x y", "do: this")),
                     SupervisorRunner.parseDelegations("intro [DELEGATE:  x y ]  do: this  "));
        assertTrue(SupervisorRunner.parseFinal("nothing here").isEmpty());
        assertEquals("", SupervisorRunner.parseFinal("[FINAL]").orElseThrow());
    }
}
