package com.ttennebkram.trackpipe.model;

import com.ttennebkram.trackpipe.testutil.FakeImage;
import com.ttennebkram.trackpipe.testutil.FakeImageOps;
import com.ttennebkram.trackpipe.testutil.FakeUi;
import com.ttennebkram.trackpipe.testutil.TagTransform;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class WindowTest {

    private static FakeUi controlsFor(Window<FakeImage> window) {
        FakeUi ui = new FakeUi();
        for (Transform<FakeImage> t : window.getTransforms()) {
            for (Parameter p : t.getParameters().values()) {
                ui.createControl(p.getLabel(), window.getName(), p.getObservedPosition(), p.getMax());
            }
        }
        return ui;
    }

    @Test
    void unnamedWindowsAreNumberedInOrderRegardlessOfNamedOnes() {
        WindowNamer namer = new WindowNamer();

        Window<FakeImage> first = new Window<>(List.of(), null, namer);
        Window<FakeImage> named = new Window<>(List.of(), "Blur", namer);
        Window<FakeImage> second = new Window<>(List.of(), "", namer);
        Window<FakeImage> alsoNamed = new Window<>(List.of(), "Edges", namer);
        Window<FakeImage> third = new Window<>(List.of(), null, namer);

        assertThat(first.getName()).isEqualTo("Step 1");
        assertThat(named.getName()).isEqualTo("Blur");
        assertThat(second.getName()).isEqualTo("Step 2");
        assertThat(alsoNamed.getName()).isEqualTo("Edges");
        assertThat(third.getName()).isEqualTo("Step 3");
    }

    @Test
    void sharedNamerKeepsCounting() {
        String a = WindowNamer.shared().nextName();
        String b = WindowNamer.shared().nextName();

        int na = Integer.parseInt(a.substring("Step ".length()));
        int nb = Integer.parseInt(b.substring("Step ".length()));
        assertThat(nb).isGreaterThan(na);
    }

    @Test
    void cleanWindowReportsNoDirtyTransform() {
        TagTransform a = TagTransform.withParam("a", "x");
        TagTransform b = TagTransform.withParam("b", "y");
        Window<FakeImage> window = new Window<>(List.of(a, b), "w", new WindowNamer());
        FakeUi ui = controlsFor(window);
        window.render(new FakeImage("src"), new FakeImageOps(), ui);

        assertThat(window.firstDirtyIndex(ui)).isEqualTo(OptionalInt.empty());
    }

    @Test
    void reportsFirstDirtyTransform() {
        TagTransform a = TagTransform.withParam("a", "x");
        TagTransform b = TagTransform.withParam("b", "y");
        TagTransform c = TagTransform.withParam("c", "z");
        Window<FakeImage> window = new Window<>(List.of(a, b, c), "w", new WindowNamer());
        FakeUi ui = controlsFor(window);
        window.render(new FakeImage("src"), new FakeImageOps(), ui);

        ui.move("w", "y", 50);

        assertThat(window.firstDirtyIndex(ui)).isEqualTo(OptionalInt.of(1));
    }

    @Test
    void freshWindowIsCleanWhileSlidersSitAtInitialPositions() {
        TagTransform a = TagTransform.withParam("a", "x");
        Window<FakeImage> window = new Window<>(List.of(a), "w", new WindowNamer());
        FakeUi ui = controlsFor(window);

        // Starts dirty, but the sliders still sit at the initial positions
        assertThat(a.isDirty()).isTrue();
        assertThat(window.firstDirtyIndex(ui)).isEqualTo(OptionalInt.empty());
    }

    @Test
    void synchronizesTransformsAfterTheFirstDirtyOne() {
        TagTransform a = TagTransform.withParam("a", "x");
        TagTransform b = TagTransform.withParam("b", "y");
        Window<FakeImage> window = new Window<>(List.of(a, b), "w", new WindowNamer());
        FakeUi ui = controlsFor(window);
        window.render(new FakeImage("src"), new FakeImageOps(), ui);

        ui.move("w", "x", 20);
        ui.move("w", "y", 30);

        assertThat(window.firstDirtyIndex(ui)).isEqualTo(OptionalInt.of(0));
        assertThat(b.isDirty()).isTrue();
        assertThat(b.valueOf("y")).isEqualTo(30);
    }

    @Test
    void renderThreadsOutputsAndShowsTheResult() {
        TagTransform a = new TagTransform("a");
        TagTransform b = new TagTransform("b");
        Window<FakeImage> window = new Window<>(List.of(a, b), "w", new WindowNamer());
        FakeUi ui = new FakeUi();

        FakeImage out = window.render(new FakeImage("src"), new FakeImageOps(), ui);

        assertThat(out.content()).isEqualTo("src>a>b");
        assertThat(window.getLastOutput()).isSameAs(out);
        assertThat(b.inputs).containsExactly(a.getLastOutput());
        assertThat(ui.shown.get("w")).containsExactly(out);
    }

    @Test
    void failingTransformPassesItsInputToTheNextOne() {
        TagTransform a = new TagTransform("a");
        TagTransform broken = new TagTransform("broken");
        broken.failing = true;
        TagTransform c = new TagTransform("c");
        Window<FakeImage> window = new Window<>(List.of(a, broken, c), "w", new WindowNamer());

        FakeImage out = window.render(new FakeImage("src"), new FakeImageOps(), new FakeUi());

        assertThat(out.content()).isEqualTo("src>a>c");
        assertThat(broken.getLastOutput()).isSameAs(a.getLastOutput());
        assertThat(c.renders).isEqualTo(1);
    }

    @Test
    void emptyWindowPassesInputThrough() {
        Window<FakeImage> window = new Window<>(List.of(), "w", new WindowNamer());
        FakeImage input = new FakeImage("src");

        assertThat(window.render(input, new FakeImageOps(), new FakeUi())).isSameAs(input);
        assertThat(window.firstDirtyIndex(new FakeUi())).isEmpty();
    }
}
