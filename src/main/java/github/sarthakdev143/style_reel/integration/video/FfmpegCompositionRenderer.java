package github.sarthakdev143.style_reel.integration.video;

import github.sarthakdev143.style_reel.model.AudioPolicy;
import github.sarthakdev143.style_reel.model.composition.CompositionFramePlan;
import github.sarthakdev143.style_reel.model.composition.CompositionRenderPlan;
import github.sarthakdev143.style_reel.service.CompositionProgressListener;
import github.sarthakdev143.style_reel.service.CompositionRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FfmpegCompositionRenderer implements CompositionRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCompositionRenderer.class);
    private static final double CUT_TRANSITION_DURATION_SECONDS = 0.001;
    private static final Duration STAGE_TIMEOUT = Duration.ofMinutes(10);

    private final FfmpegCommandRunner commandRunner;

    public FfmpegCompositionRenderer(FfmpegCommandRunner commandRunner) {
        this.commandRunner = commandRunner;
    }

    @Override
    public void renderComposition(
            CompositionRenderPlan plan,
            Path outputVideoPath,
            CompositionProgressListener progressListener) throws IOException, InterruptedException {
        if (plan.frames().isEmpty()) {
            throw new IllegalArgumentException("Composition render plan must include at least one frame.");
        }

        int frameCount = plan.frames().size();
        int totalStages = frameCount + (frameCount > 1 ? 1 : 0) + 1;
        int completedStages = 0;

        Path workDir = Files.createTempDirectory("style-reel-render-");
        List<Path> frameClips = new ArrayList<>();
        Path visualTrack = workDir.resolve("visual.mp4");

        try {
            for (int index = 0; index < frameCount; index++) {
                CompositionFramePlan frame = plan.frames().get(index);
                Path frameClip = workDir.resolve("frame-" + index + ".mp4");
                runStage(buildFrameClipCommand(frame, plan.width(), plan.height(), plan.fps(), frameClip), "render frame " + index);
                frameClips.add(frameClip);
                progressListener.onProgress((double) ++completedStages / totalStages);
            }

            if (frameClips.size() == 1) {
                Files.copy(frameClips.get(0), visualTrack, StandardCopyOption.REPLACE_EXISTING);
            } else {
                boolean allCuts = plan.frames()
                        .stream()
                        .skip(1)
                        .allMatch(frame -> frame.transitionIn().isCut());

                List<String> combineCommand = allCuts
                        ? buildVisualConcatCommand(frameClips, visualTrack)
                        : buildVisualTransitionCommand(frameClips, plan.frames(), visualTrack);
                runStage(combineCommand, "combine frame clips");
                progressListener.onProgress((double) ++completedStages / totalStages);
            }

            if (plan.audioPath() == null) {
                Files.copy(visualTrack, outputVideoPath, StandardCopyOption.REPLACE_EXISTING);
            } else {
                runStage(
                        buildAudioMuxCommand(plan.audioPath(), plan.audioPolicy(), visualTrack, plan.totalDurationSec(), outputVideoPath),
                        "mux audio and visual tracks");
            }
            progressListener.onProgress(1.0);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> buildFrameClipCommand(
            CompositionFramePlan frame,
            int width,
            int height,
            int fps,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.resolveBinary());
        command.add("-y");
        command.add("-loop");
        command.add("1");
        command.add("-i");
        command.add(frame.imagePath().toString());
        command.add("-t");
        command.add(formatSeconds(frame.clipSec()));
        command.add("-vf");
        command.add(buildFrameFilter(width, height));
        command.add("-r");
        command.add(Integer.toString(fps));
        command.add("-an");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVisualConcatCommand(List<Path> frameClips, Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.resolveBinary());
        command.add("-y");
        for (Path frameClip : frameClips) {
            command.add("-i");
            command.add(frameClip.toString());
        }

        StringBuilder filterBuilder = new StringBuilder();
        for (int index = 0; index < frameClips.size(); index++) {
            filterBuilder.append("[").append(index).append(":v]");
        }
        filterBuilder.append("concat=n=").append(frameClips.size()).append(":v=1:a=0[v]");

        command.add("-filter_complex");
        command.add(filterBuilder.toString());
        command.add("-map");
        command.add("[v]");
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    List<String> buildVisualTransitionCommand(
            List<Path> frameClips,
            List<CompositionFramePlan> frames,
            Path outputPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.resolveBinary());
        command.add("-y");
        for (Path frameClip : frameClips) {
            command.add("-i");
            command.add(frameClip.toString());
        }

        String currentLabel = "[0:v]";
        double accumulatedDuration = frames.get(0).clipSec();
        StringBuilder filterComplex = new StringBuilder();

        for (int index = 1; index < frames.size(); index++) {
            CompositionFramePlan frame = frames.get(index);
            boolean cut = frame.transitionIn().isCut();
            String transitionName = cut ? "fade" : frame.transitionIn().transitionId();
            double transitionDuration = cut ? CUT_TRANSITION_DURATION_SECONDS : frame.transitionIn().durationSec();
            double offset = Math.max(accumulatedDuration - transitionDuration, 0.0);

            String outputLabel = "[xf" + index + "]";
            if (filterComplex.length() > 0) {
                filterComplex.append(";");
            }

            filterComplex.append(currentLabel)
                    .append("[").append(index).append(":v]")
                    .append("xfade=transition=").append(transitionName)
                    .append(":duration=").append(formatSeconds(transitionDuration))
                    .append(":offset=").append(formatSeconds(offset))
                    .append(outputLabel);

            currentLabel = outputLabel;
            accumulatedDuration = accumulatedDuration + frame.clipSec() - transitionDuration;
        }

        command.add("-filter_complex");
        command.add(filterComplex.toString());
        command.add("-map");
        command.add(currentLabel);
        appendVideoEncoding(command);
        command.add(outputPath.toString());
        return command;
    }

    // Output is cut to the visual length. Short audio is padded or looped, long audio is truncated.
    List<String> buildAudioMuxCommand(
            Path audioPath,
            AudioPolicy audioPolicy,
            Path visualTrackPath,
            double totalDurationSec,
            Path outputVideoPath) {
        List<String> command = new ArrayList<>();
        command.add(commandRunner.resolveBinary());
        command.add("-y");
        command.add("-i");
        command.add(visualTrackPath.toString());
        if (audioPolicy == AudioPolicy.LOOP) {
            command.add("-stream_loop");
            command.add("-1");
        }
        command.add("-i");
        command.add(audioPath.toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("1:a:0");
        command.add("-c:v");
        command.add("copy");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        if (audioPolicy == AudioPolicy.SILENCE_PAD) {
            command.add("-af");
            command.add("apad");
        }
        command.add("-t");
        command.add(formatSeconds(totalDurationSec));
        command.add(outputVideoPath.toString());
        return command;
    }

    String buildFrameFilter(int width, int height) {
        return "scale="
                + width
                + ":"
                + height
                + ":force_original_aspect_ratio=decrease,pad="
                + width
                + ":"
                + height
                + ":(ow-iw)/2:(oh-ih)/2:black,setsar=1,format=yuv420p";
    }

    private void appendVideoEncoding(List<String> command) {
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
    }

    private void runStage(List<String> command, String stage) throws IOException, InterruptedException {
        commandRunner.run(command, stage, STAGE_TIMEOUT);
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private void deleteRecursively(Path directory) {
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            logger.warn("Could not remove render work directory {}", directory, e);
        }
    }
}
