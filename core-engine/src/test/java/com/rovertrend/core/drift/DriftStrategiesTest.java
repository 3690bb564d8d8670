package com.rovertrend.core.drift;

import com.rovertrend.core.config.DriftDetectorConfig;
import com.rovertrend.core.model.DriftMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the individual {@link DriftMethodStrategy} implementations.
 */
class DriftStrategiesTest {

    @Test
    @DisplayName("Should accumulate CUSUM sums by z minus the allowance")
    void shouldAccumulateCusum() {
        CusumStrategy cusum = new CusumStrategy(1.0);
        DriftMethodState state = cusum.initialState();
        DriftStep step = null;
        for (int i = 0; i < 10; i++) {
            step = cusum.step(state, 0.0, 1.0);
            state = step.getState();
        }

        assertThat(step.getStatistic()).isCloseTo(5.0, within(1e-12));
        assertThat(step.getSignal()).isEqualTo(DriftSignal.WARNING);
        assertThat(((CusumStrategy.State) state).getDown()).isZero();

        step = cusum.step(state, 0.0, 1.0);
        assertThat(step.getSignal()).isEqualTo(DriftSignal.DRIFT);
        assertThat(step.getConfidence()).isCloseTo(0.55, within(1e-9));
    }

    @Test
    @DisplayName("Should flag a Page-Hinkley drift on the fifth sample of a three sigma jump")
    void shouldDetectPageHinkleyJump() {
        PageHinkleyStrategy ph = new PageHinkleyStrategy(0.5);
        DriftMethodState state = ph.initialState();
        for (int i = 0; i < 20; i++) {
            DriftStep step = ph.step(state, 0.0, 0.0);
            assertThat(step.getStatistic()).isZero();
            state = step.getState();
        }

        DriftSignal[] expected = {
                DriftSignal.NONE, DriftSignal.NONE, DriftSignal.WARNING, DriftSignal.WARNING, DriftSignal.DRIFT };
        for (DriftSignal signal : expected) {
            DriftStep step = ph.step(state, 0.0, 3.0);
            assertThat(step.getSignal()).isEqualTo(signal);
            state = step.getState();
        }
    }

    @Test
    @DisplayName("Should shrink the ADWIN window to the post-change values on drift")
    void shouldCutAdwinWindow() {
        AdwinStrategy adwin = new AdwinStrategy(0.5, 50);
        DriftMethodState state = adwin.initialState();
        for (int i = 0; i < 20; i++) {
            DriftStep step = adwin.step(state, 0.0, 0.0);
            assertThat(step.getSignal()).isEqualTo(DriftSignal.NONE);
            state = step.getState();
        }

        DriftStep step = null;
        int steps = 0;
        while (steps < 60) {
            step = adwin.step(state, 10.0, 0.0);
            state = step.getState();
            steps++;
            if (step.getSignal() == DriftSignal.DRIFT) {
                break;
            }
        }

        assertThat(step.getSignal()).isEqualTo(DriftSignal.DRIFT);
        assertThat(step.getStatistic()).isGreaterThan(1.0);
        double[] kept = ((AdwinStrategy.State) state).getWindow();
        assertThat(kept).hasSize(steps).containsOnly(10.0);
        assertThat(adwin.retainedValues(state)).containsExactly(kept);
        assertThat(adwin.afterDrift(state)).isSameAs(state);
    }

    @Test
    @DisplayName("Should stay silent in ADWIN on a constant stream")
    void shouldIgnoreConstantAdwin() {
        AdwinStrategy adwin = new AdwinStrategy(0.5, 10);
        DriftMethodState state = adwin.initialState();
        DriftStep step = null;
        for (int i = 0; i < 200; i++) {
            step = adwin.step(state, 3.0, 0.0);
            state = step.getState();
        }

        assertThat(step.getStatistic()).isZero();
        assertThat(((AdwinStrategy.State) state).size()).isEqualTo(100);
    }

    @Test
    @DisplayName("Should wait for thirty samples before DDM tests the error rate")
    void shouldWarmUpDdm() {
        DdmStrategy ddm = new DdmStrategy(0.5);
        DriftMethodState state = ddm.initialState();
        for (int i = 0; i < DdmStrategy.MIN_SAMPLES - 1; i++) {
            DriftStep step = ddm.step(state, 0.0, 5.0);
            assertThat(step.getSignal()).isEqualTo(DriftSignal.NONE);
            state = step.getState();
        }
        assertThat(((DdmStrategy.State) state).getErrors()).isEqualTo(DdmStrategy.MIN_SAMPLES - 1);
    }

    @Test
    @DisplayName("Should flag DDM drift when errors appear after a clean history")
    void shouldDetectDdmErrorBurst() {
        DdmStrategy ddm = new DdmStrategy(0.5);
        DriftMethodState state = ddm.initialState();
        for (int i = 0; i < 129; i++) {
            state = ddm.step(state, 0.0, 0.0).getState();
        }

        DriftStep first = ddm.step(state, 0.0, 3.0);
        DriftStep second = ddm.step(first.getState(), 0.0, 3.0);

        assertThat(first.getSignal()).isEqualTo(DriftSignal.WARNING);
        assertThat(second.getSignal()).isEqualTo(DriftSignal.DRIFT);
    }

    @Test
    @DisplayName("Should leave EDDM idle until errors occur")
    void shouldKeepEddmIdleWithoutErrors() {
        EddmStrategy eddm = new EddmStrategy(0.5);
        DriftMethodState state = eddm.initialState();
        DriftStep step = null;
        for (int i = 0; i < 100; i++) {
            step = eddm.step(state, 0.0, 0.5);
            state = step.getState();
        }

        assertThat(step.getSignal()).isEqualTo(DriftSignal.NONE);
        assertThat(step.getStatistic()).isZero();
        assertThat(((EddmStrategy.State) state).getErrors()).isZero();
        assertThat(eddm.threshold()).isCloseTo(0.1, within(1e-12));
    }

    @Test
    @DisplayName("Should drift at once on a raw sample far outside the EWMA control limit")
    void shouldDetectEwmaShift() {
        EwmaStrategy ewma = new EwmaStrategy(0.5);
        DriftMethodState state = ewma.initialState();
        for (int i = 0; i < 50; i++) {
            DriftStep step = ewma.step(state, 0.0, 0.0);
            assertThat(step.getPValue()).isCloseTo(1.0, within(1e-9));
            state = step.getState();
        }

        DriftStep near = ewma.step(state, 0.0, 1.5);
        DriftStep far = ewma.step(state, 0.0, 4.0);

        // smoothed variance sits on its 0.25 floor, so the raw limit is 3.5 * 0.5
        assertThat(near.getSignal()).isEqualTo(DriftSignal.NONE);
        assertThat(near.getStatistic()).isCloseTo(3.0, within(1e-9));
        assertThat(far.getSignal()).isEqualTo(DriftSignal.DRIFT);
        assertThat(far.getStatistic()).isCloseTo(8.0, within(1e-9));
        assertThat(far.getPValue()).isBetween(0.0, 0.01);
    }

    @Test
    @DisplayName("Should warn and then drift when the EWMA creeps past its control band")
    void shouldDetectGradualEwmaShift() {
        EwmaStrategy ewma = new EwmaStrategy(0.5);
        DriftMethodState state = ewma.initialState();
        for (int i = 0; i < 50; i++) {
            state = ewma.step(state, 0.0, i % 2 == 0 ? 1.0 : -1.0).getState();
        }

        List<DriftSignal> signals = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            DriftStep step = ewma.step(state, 0.0, 1.5);
            signals.add(step.getSignal());
            state = step.getState();
        }

        assertThat(signals.get(0)).isEqualTo(DriftSignal.NONE);
        assertThat(signals).contains(DriftSignal.DRIFT);
        assertThat(signals.subList(0, signals.indexOf(DriftSignal.DRIFT))).contains(DriftSignal.WARNING);
    }

    @Test
    @DisplayName("Should map confidence linearly below the threshold and saturate at twice it")
    void shouldScaleConfidence() {
        assertThat(AbstractDriftStrategy.confidence(0.0, 10.0)).isZero();
        assertThat(AbstractDriftStrategy.confidence(5.0, 10.0)).isCloseTo(0.25, within(1e-12));
        assertThat(AbstractDriftStrategy.confidence(10.0, 10.0)).isCloseTo(0.5, within(1e-12));
        assertThat(AbstractDriftStrategy.confidence(15.0, 10.0)).isCloseTo(0.75, within(1e-12));
        assertThat(AbstractDriftStrategy.confidence(40.0, 10.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject a state produced by another strategy")
    void shouldRejectForeignState() {
        CusumStrategy cusum = new CusumStrategy(0.5);
        DriftMethodState foreign = new EwmaStrategy(0.5).initialState();

        assertThatThrownBy(() -> cusum.step(foreign, 0.0, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("CUSUM");
    }

    @Test
    @DisplayName("Should build a strategy for every drift method")
    void shouldCreateEveryMethod() {
        for (DriftMethod method : DriftMethod.values()) {
            DriftMethodStrategy strategy = DriftStrategyFactory.create(new DriftDetectorConfig(method, 0.5, 20));
            assertThat(strategy.method()).isEqualTo(method);
            assertThat(strategy.threshold()).isPositive();
        }
    }

    @Test
    @DisplayName("Should grade severity by standardized shift")
    void shouldGradeSeverity() {
        assertThat(DriftSeverity.fromShift(0.4)).isEqualTo(DriftSeverity.LOW);
        assertThat(DriftSeverity.fromShift(-1.0)).isEqualTo(DriftSeverity.MEDIUM);
        assertThat(DriftSeverity.fromShift(2.9)).isEqualTo(DriftSeverity.MEDIUM);
        assertThat(DriftSeverity.fromShift(3.0)).isEqualTo(DriftSeverity.HIGH);
        assertThat(DriftSeverity.fromShift(Double.POSITIVE_INFINITY)).isEqualTo(DriftSeverity.HIGH);
    }
}
