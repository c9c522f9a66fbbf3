package com.ttennebkram.trackpipe.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterTest {

    @Test
    void defaultBelowMinIsClampedToMin() {
        Parameter p = ParameterSpec.of("size", 0, 10, -5).instantiate();

        assertThat(p.getValue()).isZero();
        assertThat(p.getObservedPosition()).isZero();
    }

    @Test
    void newParameterStartsDirty() {
        Parameter p = ParameterSpec.of("size", 0, 10, 5).instantiate();

        assertThat(p.isDirty()).isTrue();
        assertThat(p.getValue()).isEqualTo(5);
    }

    @Test
    void unchangedPositionIsClean() {
        Parameter p = ParameterSpec.of("size", 0, 10, 5).instantiate();

        p.synchronize(5);

        assertThat(p.isDirty()).isFalse();
        assertThat(p.getValue()).isEqualTo(5);
    }

    @Test
    void movedPositionIsDirtyUntilReadAgain() {
        Parameter p = ParameterSpec.of("size", 0, 10, 5).instantiate();

        p.synchronize(8);
        assertThat(p.isDirty()).isTrue();
        assertThat(p.getValue()).isEqualTo(8);

        p.synchronize(8);
        assertThat(p.isDirty()).isFalse();
    }

    @Test
    void positionBelowMinIsClampedToMin() {
        Parameter p = ParameterSpec.of("size", 3, 10, 5).instantiate();

        p.synchronize(1);

        assertThat(p.getValue()).isEqualTo(3);
        assertThat(p.getObservedPosition()).isEqualTo(1);
    }

    @Test
    void maxDoesNotClampTheValue() {
        Parameter p = ParameterSpec.of("size", 0, 10, 5).instantiate();

        p.synchronize(20);

        assertThat(p.getValue()).isEqualTo(20);
    }

    @Test
    void adjustRunsBeforeMinClamp() {
        Parameter p = ParameterSpec.of("ksize", 3, 31, 4).withAdjust(ParameterSpec.ODD_UP).instantiate();
        assertThat(p.getValue()).isEqualTo(5);
        assertThat(p.getObservedPosition()).isEqualTo(4);

        p.synchronize(0);
        assertThat(p.getValue()).isEqualTo(3);

        p.synchronize(10);
        assertThat(p.getValue()).isEqualTo(11);
    }

    @Test
    void instancesFromOneSpecDoNotShareState() {
        ParameterSpec spec = ParameterSpec.of("size", 0, 10, 5);
        Parameter a = spec.instantiate();
        Parameter b = spec.instantiate();

        a.synchronize(9);

        assertThat(b.getValue()).isEqualTo(5);
        assertThat(b.getObservedPosition()).isEqualTo(5);
    }

    @Test
    void stockSpecUsesDefaultBounds() {
        ParameterSpec spec = ParameterSpec.of("amount");

        assertThat(spec.getMin()).isZero();
        assertThat(spec.getMax()).isEqualTo(100);
        assertThat(spec.getDefaultValue()).isEqualTo(1);
        assertThat(spec.getAdjust()).isNull();
    }

    @Test
    void blankLabelIsRejected() {
        assertThatThrownBy(() -> ParameterSpec.of(" ", 0, 1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
