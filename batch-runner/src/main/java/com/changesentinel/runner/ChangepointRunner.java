package com.changesentinel.runner;

import com.changesentinel.core.config.ProfilesConfig;
import com.changesentinel.core.config.ProfilesLoader;
import com.changesentinel.core.detection.CancellationSignal;
import com.changesentinel.core.detection.ChangepointDetector;
import com.changesentinel.core.detection.DetectorFactory;
import com.changesentinel.core.model.SegmentationResult;
import com.changesentinel.core.model.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: runs every configured detection profile over one
 * series and writes a JSON report.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series file (one number per line)
 *     → SeriesReader → Series
 *     → one ChangepointDetector per profile
 *     → RunReport → JSON (file or stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Paths and the optional run timeout come from {@link RunnerConfig}; profiles
 * are loaded by {@link ProfilesLoader}. Any failure aborts the run before the
 * report is written.
 * </p>
 *
 * @since 1.0.0
 */
public final class ChangepointRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ChangepointRunner.class);

    private ChangepointRunner() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) throws IOException {
        RunnerConfig config = RunnerConfig.fromEnvironment(args);
        LOG.info("Starting Change Sentinel with config: {}", config);

        RunReport report = run(config, Clock.systemUTC());

        ReportSerializer serializer = new ReportSerializer();
        if (config.writesToStdout()) {
            System.out.println(serializer.toJson(report));
        } else {
            Path output = Path.of(config.getOutputPath());
            try (OutputStream out = Files.newOutputStream(output)) {
                serializer.write(report, out);
            }
            LOG.info("Report written to {}", output);
        }
    }

    /**
     * Load profiles and the series, then run every detector.
     *
     * @throws IllegalStateException if no profiles are configured
     */
    static RunReport run(RunnerConfig config, Clock clock) throws IOException {
        ProfilesConfig profiles = ProfilesLoader.load(config.getProfilesPath());
        if (profiles.getProfiles().isEmpty()) {
            throw new IllegalStateException(
                    "No detection profiles defined. Provide profiles via "
                            + ProfilesLoader.ENV_PROFILES_PATH + ", "
                            + RunnerConfig.ENV_PROFILES_FILE + " or a classpath "
                            + ProfilesLoader.DEFAULT_RESOURCE + " file.");
        }

        Series series = SeriesReader.read(Path.of(config.getInputPath()));
        Duration timeout = config.getTimeout();
        CancellationSignal signal = timeout != null
                ? CancellationSignal.withDeadline(timeout)
                : CancellationSignal.none();

        List<ChangepointDetector> detectors = DetectorFactory.createAll(profiles.getProfiles(), signal);
        List<RunReport.ProfileReport> results = new ArrayList<>(detectors.size());
        for (ChangepointDetector detector : detectors) {
            signal.throwIfCancelled("Batch run");
            SegmentationResult result = detector.detect(series);
            LOG.info("Profile '{}' ({}): changepoints {}", detector.getProfileName(),
                    result.getMethod(), result.getChangepoints().asList());
            results.add(RunReport.ProfileReport.of(detector.getProfileName(), result));
        }
        return new RunReport(Instant.now(clock), config.getInputPath(), series.length(), results);
    }
}
