package github.sarthakdev143.style_reel.integration.video;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegCommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegCommandRunner.class);
    static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int OUTPUT_TAIL_LINES = 40;

    public String resolveBinary() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        return configuredPath == null || configuredPath.isBlank() ? DEFAULT_FFMPEG_BINARY : configuredPath;
    }

    // Returns the last lines printed. Failures carry the same tail in the exception message.
    public List<String> run(List<String> command, String stage, Duration timeout) throws IOException, InterruptedException {
        logger.info("FFmpeg stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        Deque<String> tail = new ArrayDeque<>(OUTPUT_TAIL_LINES);
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (tail.size() == OUTPUT_TAIL_LINES) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                }
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IOException("FFmpeg stage " + stage + " did not finish within " + timeout + ".");
            }
        } catch (IOException | InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }

        if (process.exitValue() != 0) {
            throw new IOException("FFmpeg stage " + stage + " exited with code " + process.exitValue()
                    + ". Last output:" + System.lineSeparator() + String.join(System.lineSeparator(), tail));
        }
        return List.copyOf(tail);
    }
}
