package com.testme.report;

import com.testme.core.TestMeConfig;
import com.testme.support.FakeEnvironment;
import com.testme.support.RecordingProcessControl;
import com.testme.support.RecordingProcessControl.SimulatedExit;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class FailureDispositionTest {

    private FakeEnvironment env;
    private RecordingProcessControl process;
    private FailureDisposition disposition;

    @BeforeMethod
    public void setUp() {
        env = FakeEnvironment.empty();
        process = new RecordingProcessControl();
        disposition = new FailureDisposition(new TestMeConfig(env), process);
    }

    @Test
    public void withoutSleepVariable_terminatesWithStatusOne() {
        assertThat(disposition.decide()).isEqualTo(FailureDisposition.Action.TERMINATE);

        assertThatThrownBy(disposition::apply)
            .isInstanceOf(SimulatedExit.class)
            .extracting(e -> ((SimulatedExit) e).getStatus())
            .isEqualTo(1);
        assertThat(process.getExits()).containsExactly(1);
        assertThat(process.getSleeps()).isEmpty();
    }

    @Test
    public void withSleepVariable_suspendsForFiveMinutesAndReturns() {
        env.set(TestMeConfig.SLEEP_VAR, "1");

        FailureDisposition.Action action = disposition.apply();

        assertThat(action).isEqualTo(FailureDisposition.Action.SUSPEND);
        assertThat(process.getSleeps()).containsExactly(Duration.ofMinutes(5));
        assertThat(process.getExits()).isEmpty();
    }

    @Test
    public void sleepVariable_anyValueCounts() {
        env.set(TestMeConfig.SLEEP_VAR, "");

        assertThat(disposition.decide()).isEqualTo(FailureDisposition.Action.SUSPEND);
    }

    @Test
    public void decision_isReevaluatedOnEveryFailure() {
        env.set(TestMeConfig.SLEEP_VAR, "1");
        disposition.apply();

        env.unset(TestMeConfig.SLEEP_VAR);
        assertThatThrownBy(disposition::apply).isInstanceOf(SimulatedExit.class);

        assertThat(process.getSleeps()).hasSize(1);
        assertThat(process.getExits()).containsExactly(1);
    }
}
