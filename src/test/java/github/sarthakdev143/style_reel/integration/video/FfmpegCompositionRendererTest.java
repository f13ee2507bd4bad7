package github.sarthakdev143.style_reel.integration.video;

import github.sarthakdev143.style_reel.model.AudioPolicy;
import github.sarthakdev143.style_reel.model.composition.CompositionFramePlan;
import github.sarthakdev143.style_reel.model.composition.CompositionTransitionPlan;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FfmpegCompositionRendererTest {

    private final FfmpegCompositionRenderer renderer = new FfmpegCompositionRenderer(new FfmpegCommandRunner());

    @Test
    void buildFrameClipCommandLoopsTheStillForItsClipLength() {
        CompositionFramePlan frame = new CompositionFramePlan(
                "img-1",
                Path.of("/tmp/frame-0.png"),
                3.0,
                3.6,
                CompositionTransitionPlan.cut());

        List<String> command = renderer.buildFrameClipCommand(frame, 1280, 720, 30, Path.of("/tmp/clip-0.mp4"));

        assertThat(command).containsSequence("-loop", "1", "-i", "/tmp/frame-0.png");
        assertThat(command).containsSequence("-t", "3.600");
        assertThat(command).containsSequence("-r", "30");
        assertThat(command).contains("-an");
        assertThat(valueAfter(command, "-vf")).contains("scale=1280:720").contains("pad=1280:720");
        assertThat(command.get(command.size() - 1)).isEqualTo("/tmp/clip-0.mp4");
    }

    @Test
    void buildVisualConcatCommandUsesConcatFilter() {
        List<String> command = renderer.buildVisualConcatCommand(
                List.of(Path.of("a.mp4"), Path.of("b.mp4"), Path.of("c.mp4")),
                Path.of("merged.mp4"));

        String filter = valueAfter(command, "-filter_complex");
        assertThat(filter).contains("concat=n=3:v=1:a=0");
        assertThat(filter).doesNotContain("xfade");
    }

    @Test
    void buildVisualTransitionCommandPlacesXfadesOnFrameBoundaries() {
        List<CompositionFramePlan> frames = List.of(
                new CompositionFramePlan("a", Path.of("a.png"), 3.0, 3.6, CompositionTransitionPlan.cut()),
                new CompositionFramePlan("b", Path.of("b.png"), 3.0, 3.6, new CompositionTransitionPlan("slideleft", 0.6)),
                new CompositionFramePlan("c", Path.of("c.png"), 3.0, 3.0, new CompositionTransitionPlan("slideright", 0.6)));

        List<String> command = renderer.buildVisualTransitionCommand(
                List.of(Path.of("a.mp4"), Path.of("b.mp4"), Path.of("c.mp4")),
                frames,
                Path.of("merged.mp4"));

        String filter = valueAfter(command, "-filter_complex");
        assertThat(filter).contains("[0:v][1:v]xfade=transition=slideleft:duration=0.600:offset=3.000[xf1]");
        assertThat(filter).contains("[xf1][2:v]xfade=transition=slideright:duration=0.600:offset=6.000[xf2]");
        assertThat(valueAfter(command, "-map")).isEqualTo("[xf2]");
    }

    @Test
    void cutInsideATransitionChainBecomesAnInstantFade() {
        List<CompositionFramePlan> frames = List.of(
                new CompositionFramePlan("a", Path.of("a.png"), 2.0, 2.0, CompositionTransitionPlan.cut()),
                new CompositionFramePlan("b", Path.of("b.png"), 2.0, 2.5, CompositionTransitionPlan.cut()),
                new CompositionFramePlan("c", Path.of("c.png"), 2.0, 2.0, new CompositionTransitionPlan("fade", 0.5)));

        List<String> command = renderer.buildVisualTransitionCommand(
                List.of(Path.of("a.mp4"), Path.of("b.mp4"), Path.of("c.mp4")),
                frames,
                Path.of("merged.mp4"));

        assertThat(valueAfter(command, "-filter_complex"))
                .contains("xfade=transition=fade:duration=0.001:offset=1.999[xf1]");
    }

    @Test
    void silencePadMuxPadsAudioAndCutsToVisualLength() {
        List<String> command = renderer.buildAudioMuxCommand(
                Path.of("song.mp3"),
                AudioPolicy.SILENCE_PAD,
                Path.of("visual.mp4"),
                12.5,
                Path.of("out.mp4"));

        assertThat(command).containsSequence("-af", "apad");
        assertThat(command).doesNotContain("-stream_loop");
        assertThat(command).containsSequence("-t", "12.500");
        assertThat(command).containsSequence("-c:v", "copy");
    }

    @Test
    void loopMuxRepeatsTheAudioInput() {
        List<String> command = renderer.buildAudioMuxCommand(
                Path.of("song.mp3"),
                AudioPolicy.LOOP,
                Path.of("visual.mp4"),
                30.0,
                Path.of("out.mp4"));

        assertThat(command).containsSequence("-stream_loop", "-1", "-i", "song.mp3");
        assertThat(command).doesNotContain("apad");
        assertThat(command).containsSequence("-t", "30.000");
    }

    private String valueAfter(List<String> command, String flag) {
        int index = command.indexOf(flag);
        assertThat(index).isGreaterThanOrEqualTo(0);
        return command.get(index + 1);
    }
}
