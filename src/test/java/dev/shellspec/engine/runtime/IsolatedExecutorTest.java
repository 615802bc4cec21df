package dev.shellspec.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.shellspec.engine.discovery.DeclarationLoader;
import dev.shellspec.engine.discovery.TestPlanner;
import dev.shellspec.engine.substitution.SubstitutionEntry;
import dev.shellspec.engine.support.ShellTestSupport;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IsolatedExecutorTest {
    @TempDir
    Path dir;

    private RunWorkspace workspace;
    private ShellProcess shell;

    @BeforeEach
    void setUp() {
        ShellTestSupport.assumeBash();
        workspace = RunWorkspace.create();
        shell = new ShellProcess(ShellTestSupport.BASH);
    }

    @AfterEach
    void tearDown() {
        if (workspace != null) {
            workspace.close();
        }
    }

    private List<ExecutionResult> run(String fileName, String content) {
        return run(fileName, content, Optional.empty(), List.of());
    }

    private List<ExecutionResult> run(String fileName, String content, Optional<Duration> timeout, List<SubstitutionEntry> host) {
        ShellTestSupport.write(dir, fileName, content);
        var plan = new TestPlanner(new DeclarationLoader(shell, Optional.empty())).plan(dir, fileName, "test_");
        var executor = IsolatedExecutor.builder()
            .shell(shell)
            .workspace(workspace)
            .runtime(RuntimeLibrary.extract(workspace))
            .workingDirectory(dir)
            .timeout(timeout)
            .hostSubstitutions(host)
            .build();
        List<ExecutionResult> results = new ArrayList<>();
        plan.cases().forEach(testCase -> results.add(executor.execute(testCase)));
        return results;
    }

    @Test
    void passingAndFailingTestsAreDistinguished() {
        var results = run("math_test.sh", """
            add() { echo $(( $1 + $2 )); }
            test_add() {
                assert_equals 3 "$(add 1 2)"
            }
            test_sub() {
                assert_equals 0 "$(add 1 2)" "subtraction"
            }
            """);

        assertEquals(2, results.size());
        assertEquals(ExecutionState.PASSED, results.get(0).state());
        assertEquals(OptionalInt.of(0), results.get(0).exitCode());
        assertEquals(ExecutionState.FAILED, results.get(1).state());
        assertTrue(results.get(1).output().contains("FAIL: assert_equals: subtraction"), results.get(1).output());
        assertTrue(results.get(1).output().contains("expected: '0'"));
        assertTrue(results.get(1).output().contains("actual:   '3'"));
    }

    @Test
    void failedAssertionFailsTestEvenWhenFunctionReturnsZero() {
        var results = run("late_test.sh", """
            test_keeps_going() {
                assert_equals a b
                echo "still running"
                return 0
            }
            """);

        assertEquals(ExecutionState.FAILED, results.get(0).state());
        assertTrue(results.get(0).output().contains("still running"));
    }

    @Test
    void stateDoesNotLeakBetweenTests() {
        var results = run("leak_test.sh", """
            test_first() {
                export LEAKED=yes
                declared_later() { :; }
                mock_command curl 'echo mocked'
                touch_marker=1
            }
            test_second() {
                assert_equals "" "${LEAKED:-}"
                assert_fail declare -F declared_later
                assert_fail is_mocked curl
                assert_equals "" "${touch_marker:-}"
            }
            """);

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
        assertEquals(ExecutionState.PASSED, results.get(1).state(), results.get(1).output());
    }

    @Test
    void stubRoundTripRestoresOriginalOutput() {
        var results = run("stub_test.sh", """
            greet() { echo "hello from original"; }
            test_stub_round_trip() {
                local before during after
                before="$(greet)"
                stub_function greet 'echo "stubbed $*"'
                during="$(greet world)"
                unstub_function greet
                after="$(greet)"
                assert_equals "stubbed world" "$during"
                assert_equals "$before" "$after"
                assert_equals "hello from original" "$after"
            }
            """);

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
    }

    @Test
    void mockRoundTripRestoresPathResolution() {
        var results = run("mock_test.sh", """
            test_mock_round_trip() {
                local before after
                before="$(type -t uname)"
                mock_command uname 'echo fake-os'
                assert_equals fake-os "$(uname)"
                assert_output_equals fake-os bash -c uname
                unmock_command uname
                after="$(type -t uname)"
                assert_equals "$before" "$after"
                assert_not_equals fake-os "$(uname)"
            }
            """);

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
    }

    @Test
    void duplicateMockIsRejectedAndFirstKept() {
        var results = run("dup_test.sh", """
            test_duplicate() {
                mock_command fetch 'echo first'
                assert_fail mock_command fetch 'echo second'
                assert_equals first "$(fetch)"
                mock_command fetch 'echo third' 2>&1 | grep -q 'already mocked'
            }
            """);

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
    }

    @Test
    void builtinsCannotBeMocked() {
        var results = run("builtin_test.sh", """
            test_builtin() {
                mock_command cd 'echo nope'
            }
            """);

        assertEquals(ExecutionState.FAILED, results.get(0).state());
        assertTrue(results.get(0).output().contains("mock_command: cannot mock shell builtin 'cd'"));
    }

    @Test
    void directivesSkipAndRemap() {
        var results = run("directive_test.sh", """
            # @SKIP would delete things
            test_skipped() {
                rm -rf /definitely/not/run
            }
            # @TODO not implemented
            test_todo_fails() {
                return 1
            }
            # @TODO flaky
            test_todo_passes() {
                return 0
            }
            """);

        assertEquals(ExecutionState.SKIPPED, results.get(0).state());
        assertTrue(results.get(0).exitCode().isEmpty());
        assertEquals(ExecutionState.EXPECTED_FAIL, results.get(1).state());
        assertEquals(ExecutionState.UNEXPECTED_PASS, results.get(2).state());
        assertTrue(results.stream().allMatch(ExecutionResult::countsAsPassing));
    }

    @Test
    void exitInsideTestStillRestoresAndReportsStatus() {
        var results = run("exit_test.sh", """
            test_exits() {
                mock_command curl 'echo mocked'
                exit 7
            }
            """);

        assertEquals(ExecutionState.FAILED, results.get(0).state());
        assertEquals(OptionalInt.of(7), results.get(0).exitCode());
    }

    @Test
    void failedAssertionOutweighsExitZero() {
        var results = run("exit_zero_test.sh", """
            test_exits_cleanly() {
                assert_equals 1 2
                exit 0
            }
            """);

        assertEquals(ExecutionState.FAILED, results.get(0).state());
        assertEquals(OptionalInt.of(1), results.get(0).exitCode());
        assertTrue(results.get(0).output().contains("FAIL: assert_equals"), results.get(0).output());
    }

    @Test
    void errexitInTestFileIsHonoured() {
        var results = run("strict_test.sh", """
            set -euo pipefail
            test_strict() {
                false
                echo unreachable
            }
            test_strict_passing() {
                assert_success true
                assert_output_contains lo echo hello
            }
            """);

        assertEquals(ExecutionState.FAILED, results.get(0).state());
        assertFalse(results.get(0).output().contains("unreachable"));
        assertEquals(ExecutionState.PASSED, results.get(1).state(), results.get(1).output());
    }

    @Test
    void timeoutKillsTheTest() {
        var results = run("slow_test.sh", """
            test_slow() {
                sleep 30
            }
            """, Optional.of(Duration.ofMillis(500)), List.of());

        var result = results.get(0);
        assertEquals(ExecutionState.FAILED, result.state());
        assertTrue(result.timedOut());
        assertEquals(OptionalInt.of(ProcessOutcome.TIMEOUT_EXIT_CODE), result.exitCode());
        assertTrue(result.output().contains("timed out after 500ms"), result.output());
        assertTrue(result.duration().compareTo(Duration.ofSeconds(20)) < 0);
    }

    @Test
    void hostSubstitutionsAreInstalledInEveryTest() {
        var results = run("host_test.sh", """
            log_line() { echo "real log"; }
            test_uses_mock() {
                assert_equals offline "$(curl https://example.invalid)"
                assert_success is_mocked curl
            }
            test_uses_stub() {
                assert_equals quiet "$(log_line)"
                unstub_function log_line
                assert_equals "real log" "$(log_line)"
            }
            """, Optional.empty(), List.of(
                SubstitutionEntry.command("curl", "echo offline"),
                SubstitutionEntry.procedure("log_line", "echo quiet", Optional.empty())
            ));

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
        assertEquals(ExecutionState.PASSED, results.get(1).state(), results.get(1).output());
    }

    @Test
    void contextDirectoriesAreRemovedAfterEachTest() throws Exception {
        run("clean_test.sh", "test_a() { :; }\ntest_b() { return 1; }\n");

        try (var remaining = Files.list(workspace.root().resolve("contexts"))) {
            assertEquals(0, remaining.count());
        }
    }

    @Test
    void fileAndVariableAssertions() {
        var results = run("fs_test.sh", """
            test_paths() {
                local tmp
                tmp="$(mktemp)"
                assert_file_exists "$tmp"
                rm -f "$tmp"
                assert_file_not_exists "$tmp"
                SOME_VALUE=""
                assert_is_variable_set SOME_VALUE
                assert_fail test -n "${NEVER_SET_ANYWHERE+x}"
                assert_is_function test_paths
                assert_success "echo 'hello'"
            }
            """);

        assertEquals(ExecutionState.PASSED, results.get(0).state(), results.get(0).output());
    }
}
