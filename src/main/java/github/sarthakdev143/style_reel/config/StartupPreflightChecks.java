package github.sarthakdev143.style_reel.config;

import github.sarthakdev143.style_reel.integration.video.FfmpegCommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Component
@Order(0)
@ConditionalOnProperty(name = "style-reel.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final StyleReelProperties properties;
    private final FfmpegCommandRunner commandRunner;

    public StartupPreflightChecks(StyleReelProperties properties, FfmpegCommandRunner commandRunner) {
        this.properties = properties;
        this.commandRunner = commandRunner;
    }

    @Override
    public void run(ApplicationArguments args) {
        verifyRenderer();
        verifyStorageRoot();
    }

    void verifyRenderer() {
        String binary = commandRunner.resolveBinary();
        if (binary.contains("/") || binary.contains("\\")) {
            Path binaryPath = Path.of(binary);
            if (!Files.isRegularFile(binaryPath) || !Files.isExecutable(binaryPath)) {
                throw new IllegalStateException("FFmpeg binary " + binaryPath.toAbsolutePath()
                        + " is not an executable file. Point FFMPEG_PATH at a working ffmpeg.");
            }
        }

        List<String> output;
        try {
            output = commandRunner.run(List.of(binary, "-version"), "version check", VERSION_CHECK_TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking FFmpeg.", e);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Cannot run '" + binary + " -version'. Install FFmpeg or set FFMPEG_PATH.", e);
        }
        logger.info("Rendering with {}", output.isEmpty() ? binary : output.get(0));
    }

    void verifyStorageRoot() {
        Path root = properties.storage().root();
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            throw new IllegalStateException(
                    "Storage root " + root.toAbsolutePath() + " is not a writable directory. Set style-reel.storage.root.");
        }
    }
}
