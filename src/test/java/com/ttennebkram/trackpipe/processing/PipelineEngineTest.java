package com.ttennebkram.trackpipe.processing;

import com.ttennebkram.trackpipe.config.TrackpipeConfig;
import com.ttennebkram.trackpipe.model.ParameterSpec;
import com.ttennebkram.trackpipe.model.PipelineItem;
import com.ttennebkram.trackpipe.model.Window;
import com.ttennebkram.trackpipe.model.WindowNamer;
import com.ttennebkram.trackpipe.testutil.FakeImage;
import com.ttennebkram.trackpipe.testutil.FakeImageOps;
import com.ttennebkram.trackpipe.testutil.FakeUi;
import com.ttennebkram.trackpipe.testutil.TagTransform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineEngineTest {

    private final WindowNamer namer = new WindowNamer();
    private final FakeUi ui = new FakeUi();
    private final FakeImageOps ops = new FakeImageOps();
    private TrackpipeConfig config;

    private TagTransform t0;
    private TagTransform t1;
    private TagTransform t2;
    private Window<FakeImage> w0;
    private Window<FakeImage> w1;
    private Window<FakeImage> w2;

    @BeforeEach
    void setUp() throws Exception {
        config = TrackpipeConfig.defaults();
        t0 = TagTransform.withParam("t0", "size");
        t1 = TagTransform.withParam("t1", "size");
        t2 = TagTransform.withParam("t2", "size");
        w0 = new Window<>(List.of(t0), "w0", namer);
        w1 = new Window<>(List.of(t1), "w1", namer);
        w2 = new Window<>(List.of(t2), "w2", namer);
    }

    private PipelineEngine<FakeImage> engine(List<? extends PipelineItem<FakeImage>> items) {
        return new PipelineEngine<>(items, ops, ui, ui, ui, config, namer);
    }

    private PipelineEngine<FakeImage> threeWindowEngine() {
        return engine(List.of(w0, w1, w2));
    }

    @Test
    void invalidDeclarationFailsBeforeAnyWindowIsCreated() {
        List<PipelineItem<FakeImage>> mixed = List.of(w0, new TagTransform("bare"));

        assertThatThrownBy(() -> engine(mixed)).isInstanceOf(MixedGroupingException.class);
        assertThat(ui.surfaces).isEmpty();
    }

    @Test
    void initializeCreatesSurfacesAndSlidersThenRendersEverything() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        FakeImage source = new FakeImage("src");

        engine.initialize(source);

        assertThat(engine.getState()).isEqualTo(PipelineEngine.State.RUNNING);
        assertThat(ui.surfaces).containsExactly("w0", "w1", "w2");
        assertThat(ui.controlMax).containsKeys("w0/size", "w1/size", "w2/size");
        assertThat(ui.controlMax.get("w0/size")).isEqualTo(100);
        assertThat(ui.position("w0", "size")).isEqualTo(10);
        assertThat(w2.getLastOutput().content()).isEqualTo("src>t0>t1>t2");
        assertThat(t0.inputs.get(0)).isNotSameAs(source);
        assertThat(ui.shown).containsKeys("w0", "w1", "w2");
    }

    @Test
    void tickWithoutSliderChangesRendersNothing() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));
        FakeImage cached = w2.getLastOutput();

        assertThat(engine.tick()).isTrue();
        assertThat(engine.tick()).isTrue();

        assertThat(t0.renders).isEqualTo(1);
        assertThat(t1.renders).isEqualTo(1);
        assertThat(t2.renders).isEqualTo(1);
        assertThat(w2.getLastOutput()).isSameAs(cached);
    }

    @Test
    void changeInMiddleWindowRendersOnlyThatWindowAndAfter() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));
        FakeImage upstream = w0.getLastOutput();

        ui.move("w1", "size", 42);
        engine.tick();

        assertThat(t0.renders).isEqualTo(1);
        assertThat(t1.renders).isEqualTo(2);
        assertThat(t2.renders).isEqualTo(2);
        assertThat(t1.inputs.get(1)).isSameAs(upstream);
        assertThat(w0.getLastOutput()).isSameAs(upstream);
        assertThat(t1.valueOf("size")).isEqualTo(42);
        assertThat(t1.isDirty()).isFalse();
    }

    @Test
    void changeInLastWindowRendersOnlyTheLastWindow() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));

        ui.move("w2", "size", 5);
        engine.tick();

        assertThat(t0.renders).isEqualTo(1);
        assertThat(t1.renders).isEqualTo(1);
        assertThat(t2.renders).isEqualTo(2);
        assertThat(t2.inputs.get(1)).isSameAs(w1.getLastOutput());
    }

    @Test
    void changeInFirstWindowStartsFromAFreshCopyOfTheSource() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        FakeImage source = new FakeImage("src");
        engine.initialize(source);
        int copiesAfterInit = ops.copies;

        ui.move("w0", "size", 3);
        engine.tick();

        assertThat(ops.copies).isEqualTo(copiesAfterInit + 1);
        assertThat(t0.inputs.get(1)).isNotSameAs(source).isNotSameAs(t0.inputs.get(0));
        assertThat(t0.inputs.get(1).content()).isEqualTo("src");
        assertThat(t2.renders).isEqualTo(2);
    }

    @Test
    void earliestDirtyWindowWinsWhenSeveralChanged() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));

        ui.move("w2", "size", 1);
        ui.move("w1", "size", 2);
        engine.tick();

        assertThat(t0.renders).isEqualTo(1);
        assertThat(t1.renders).isEqualTo(2);
        assertThat(t2.renders).isEqualTo(2);
        assertThat(t2.valueOf("size")).isEqualTo(1);
    }

    @Test
    void failingTransformDoesNotStopLaterWindows() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));
        t1.failing = true;

        ui.move("w1", "size", 0);
        assertThat(engine.tick()).isTrue();

        assertThat(w1.getLastOutput()).isSameAs(w0.getLastOutput());
        assertThat(t2.renders).isEqualTo(2);
        assertThat(w2.getLastOutput().content()).isEqualTo("src>t0>t2");

        // Fixing the parameter on a later tick renders again
        t1.failing = false;
        ui.move("w1", "size", 7);
        engine.tick();
        assertThat(w2.getLastOutput().content()).isEqualTo("src>t0>t1>t2");
    }

    @Test
    void cancelKeyTerminatesAndClosesWindows() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));
        ui.cancelPressed = true;
        ui.move("w0", "size", 99);

        assertThat(engine.tick()).isFalse();

        assertThat(engine.getState()).isEqualTo(PipelineEngine.State.TERMINATED);
        assertThat(ui.destroyCalls).isEqualTo(1);
        assertThat(t0.renders).isEqualTo(1);
    }

    @Test
    void closingEveryWindowTerminates() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));

        ui.visible.put("w0", false);
        ui.visible.put("w1", false);
        assertThat(engine.tick()).isTrue();

        ui.visible.put("w2", false);
        assertThat(engine.tick()).isFalse();
        assertThat(engine.getState()).isEqualTo(PipelineEngine.State.TERMINATED);
    }

    @Test
    void runLoopsUntilCancelled() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        ui.cancelOnPoll = 3;

        engine.run(new FakeImage("src"));

        assertThat(ui.polls).isEqualTo(3);
        assertThat(engine.getState()).isEqualTo(PipelineEngine.State.TERMINATED);
        assertThat(ui.destroyCalls).isEqualTo(1);
    }

    @Test
    void failedInitializationStillClosesOpenedWindows() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        ui.failingSurface = "w1";

        assertThatThrownBy(() -> engine.run(new FakeImage("src")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("w1");

        assertThat(ui.surfaces).containsExactly("w0");
        assertThat(ui.destroyCalls).isEqualTo(1);
        assertThat(engine.getState()).isEqualTo(PipelineEngine.State.TERMINATED);
        assertThat(ui.polls).isZero();
    }

    @Test
    void firstTransformMayLoadItsOwnInput() {
        TagTransform source = new TagTransform("loader");
        TagTransform blur = new TagTransform("blur", ParameterSpec.of("ksize", 1, 31, 5));
        PipelineEngine<FakeImage> engine = engine(List.of(source, blur));

        engine.initialize(null);

        assertThat(source.inputs).containsExactly((FakeImage) null);
        Window<FakeImage> only = engine.getWindows().get(0);
        assertThat(only.getLastOutput().content()).isEqualTo("loader>blur");

        ui.move(only.getName(), "ksize", 9);
        engine.tick();
        assertThat(source.renders).isEqualTo(2);
        assertThat(source.inputs.get(1)).isNull();
    }

    @Test
    void tickBeforeInitializeIsRejected() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();

        assertThatThrownBy(engine::tick).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void terminateIsIdempotent() {
        PipelineEngine<FakeImage> engine = threeWindowEngine();
        engine.initialize(new FakeImage("src"));

        engine.terminate();
        engine.terminate();

        assertThat(ui.destroyCalls).isEqualTo(1);
    }
}
