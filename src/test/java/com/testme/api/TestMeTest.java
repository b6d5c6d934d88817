package com.testme.api;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static com.testme.api.TestMe.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * The static facade with passing checks only; a failing check would end the JVM.
 * Failures are covered in-process by {@link CheckEngineTest} and end-to-end by
 * {@link TestMeProcessTest}.
 */
public class TestMeTest {

    private PrintStream originalOut;
    private ByteArrayOutputStream captured;

    @BeforeMethod
    public void redirectStdout() {
        originalOut = System.out;
        captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
    }

    @AfterMethod(alwaysRun = true)
    public void restoreStdout() {
        System.setOut(originalOut);
    }

    private List<String> lines() {
        String text = captured.toString(StandardCharsets.UTF_8);
        return text.isEmpty() ? List.of() : Arrays.asList(text.split("\n"));
    }

    @Test
    public void everyCategoryPrintsOneLinePerPassingCheck() {
        int iVal = 42;
        long lVal = 1234567L;
        long llVal = 9876543210L;
        long zVal = 1024;
        int uVal = 0xFF;
        Object ptr = new Object();

        teqi(iVal, 42, "Integer equality test");
        tneqi(iVal, 0, "Integer inequality test");
        teql(lVal, 1234567L, "Long equality test");
        tneql(lVal, 0L);
        teqll(llVal, 9876543210L);
        tneqll(llVal, 0L);
        teqz(zVal, 1024);
        tneqz(zVal, 0);
        tequ(uVal, 0xFF);
        tnequ(uVal, 0);
        teqp(null, null, "Pointer NULL equality test");
        tneqp(ptr, null);

        assertThat(lines()).hasSize(12).allMatch(line -> line.startsWith("✓ "));
        assertThat(lines().get(0)).isEqualTo("✓ Integer equality test");
    }

    @Test
    public void orderingConstructs() {
        tgti(42, 0);
        tgtl(1234567L, 1000000L);
        tgtll(9876543210L, 1L);
        tgtz(1024, 512);
        tgtu(-1, 1);
        tgtei(42, 42);
        tgtel(1234567L, 1234567L);
        tgtez(1024, 1024);
        tlti(42, 100);
        tltl(1234567L, 10000000L);
        tltz(1024, 2048);
        tltu(1, -1);
        tltei(42, 42);
        tltel(1234567L, 1234567L);
        tltez(1024, 1024);
        tlteu(7, 7, "unsigned %s", "equal");

        assertThat(lines()).hasSize(16);
        assertThat(lines().get(15)).isEqualTo("✓ unsigned equal");
    }

    @Test
    public void stringReferenceAndTruthConstructs() {
        tmatch("hello", "hello", "String match test");
        tmatch(null, null);
        tcontains("hello world", "world", "String contains test");
        tnull(null, "Pointer should be NULL");
        tnotnull(new Object(), "Pointer should not be NULL");
        ttrue(true, "True test");
        tfalse(false, "False test");

        assertThat(lines()).containsExactly(
            "✓ String match test",
            lines().get(1),
            "✓ String contains test",
            "✓ Pointer should be NULL",
            "✓ Pointer should not be NULL",
            "✓ True test",
            "✓ False test");
        assertThat(lines().get(1)).startsWith("✓ Test passed at TestMeTest.java@");
    }

    @Test
    public void legacyAliases() {
        teq(42, 42, "Legacy teq test");
        tneq(42, 0, "Legacy tneq test");
        tassert(true);

        assertThat(lines()).hasSize(3);
    }

    @Test
    public void defaultMessageLocatesTheTestLine() {
        int line = new Throwable().getStackTrace()[0].getLineNumber() + 1;
        teqi(2 + 3, 5);

        assertThat(lines()).containsExactly("✓ Test passed at TestMeTest.java@" + line);
    }

    @Test
    public void sideEffectsRunOnce() {
        int[] calls = { 0 };

        teqi(++calls[0], 1, "first call");

        assertThat(calls[0]).isEqualTo(1);
    }

    @Test
    public void environmentAccessorsFallBackWhenUnset() {
        assertThat(tget("TESTME_UNLIKELY_VARIABLE_NAME", "fallback")).isEqualTo("fallback");
        assertThat(tgeti("TESTME_UNLIKELY_VARIABLE_NAME", 17)).isEqualTo(17);
        assertThat(thas("TESTME_UNLIKELY_VARIABLE_NAME")).isFalse();
        assertThat(tdepth()).isEqualTo(tgeti("TESTME_DEPTH", 0));
    }

    @Test
    public void traceOutput() {
        tinfo("info %d", 1);
        twrite("write");
        tskip("skipping: %s", "no network");

        assertThat(lines()).startsWith("info 1", "write", "skipping: no network");
    }
}
