package com.phillippitts.sessionscribe.cli;

import com.phillippitts.sessionscribe.config.properties.HydrationProperties;
import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.exception.HydrationException;
import com.phillippitts.sessionscribe.exception.PersistenceException;
import com.phillippitts.sessionscribe.persistence.JournalRecordingStore;
import com.phillippitts.sessionscribe.service.hydration.AudioToolchain;
import com.phillippitts.sessionscribe.service.hydration.FfmpegRunner;
import com.phillippitts.sessionscribe.service.hydration.HydrationReconstructor;
import com.phillippitts.sessionscribe.service.hydration.HydrationReport;
import com.phillippitts.sessionscribe.service.hydration.TrackHydration;
import com.phillippitts.sessionscribe.service.process.DefaultProcessFactory;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.ResourcePropertySource;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Offline entry point: {@code hydrate <sessionId> [--mix] [--no-clamp]}.
 *
 * <p>Reads the same {@code recording.*} and {@code hydration.*} settings as the recorder, but never
 * starts the application context, so it can run while the recorder is live.
 *
 * <p>Exit codes: 0 on success; 1 on usage error, missing ffmpeg, unknown session, no tracks, or
 * nothing hydrated.
 */
public final class HydrationCli {

    private static final Logger LOG = LogManager.getLogger(HydrationCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final String USAGE = "Usage: hydrate <session-id> [--mix] [--no-clamp]";

    private final RecordingStore store;
    private final AudioToolchain tools;
    private final Path dataDir;
    private final HydrationProperties props;
    private final PrintStream out;
    private final PrintStream err;

    HydrationCli(RecordingStore store,
                 AudioToolchain tools,
                 Path dataDir,
                 HydrationProperties props,
                 PrintStream out,
                 PrintStream err) {
        this.store = Objects.requireNonNull(store, "store");
        this.tools = Objects.requireNonNull(tools, "tools");
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        this.props = Objects.requireNonNull(props, "props");
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(launch(args));
    }

    static int launch(String[] args) {
        StandardEnvironment env = new StandardEnvironment();
        ClassPathResource defaults = new ClassPathResource("application.properties");
        if (defaults.exists()) {
            try {
                env.getPropertySources().addLast(new ResourcePropertySource(defaults));
            } catch (IOException e) {
                LOG.warn("Could not read application.properties: {}", e.toString());
            }
        }
        ConfigurationPropertySources.attach(env);
        Binder binder = Binder.get(env);
        RecordingProperties recording = binder.bind("recording", RecordingProperties.class)
                .orElseGet(RecordingProperties::new);
        HydrationProperties hydration = binder.bind("hydration", HydrationProperties.class)
                .orElseGet(HydrationProperties::new);

        JournalRecordingStore store;
        try {
            store = new JournalRecordingStore(Path.of(recording.getJournalFile()));
        } catch (PersistenceException e) {
            System.err.println("Cannot read recording journal: " + e.getMessage());
            return EXIT_FAILURE;
        }
        try {
            FfmpegRunner ffmpeg = new FfmpegRunner(new DefaultProcessFactory(), hydration.getFfmpegPath(),
                    hydration.isLowPriority());
            return new HydrationCli(store, ffmpeg, Path.of(recording.getDataDir()), hydration,
                    System.out, System.err).run(args);
        } finally {
            try {
                store.close();
            } catch (IOException e) {
                LOG.warn("Error closing journal: {}", e.toString());
            }
        }
    }

    int run(String... args) {
        String sessionId = null;
        boolean mix = false;
        boolean clamp = true;
        for (String arg : args) {
            switch (arg) {
                case "--mix" -> mix = true;
                case "--no-clamp" -> clamp = false;
                default -> {
                    if (arg.startsWith("-") || sessionId != null) {
                        err.println("Unexpected argument: " + arg);
                        err.println(USAGE);
                        return EXIT_FAILURE;
                    }
                    sessionId = arg;
                }
            }
        }
        if (sessionId == null) {
            err.println(USAGE);
            return EXIT_FAILURE;
        }
        if (!clamp) {
            out.println("--no-clamp: silence gaps will not be capped (files may be very large)");
        }
        if (!tools.isAvailable()) {
            err.println("ffmpeg is required but was not found at '" + props.getFfmpegPath()
                    + "'. Install it or set hydration.ffmpeg-path.");
            return EXIT_FAILURE;
        }

        HydrationReconstructor reconstructor = new HydrationReconstructor(store, tools, dataDir, props.getMaxSilence());
        try {
            HydrationReport report = reconstructor.hydrate(sessionId, mix, clamp);
            out.println("Hydrated session " + sessionId + " into " + report.outputDir());
            for (TrackHydration track : report.tracks()) {
                out.printf("  %s: %d burst(s), %.1fs%n", track.output().getFileName(), track.burstsWritten(),
                        track.duration().toMillis() / 1000.0);
            }
            if (report.mixFile() != null) {
                out.println("  mix: " + report.mixFile().getFileName());
            }
            return EXIT_OK;
        } catch (HydrationException e) {
            err.println(e.getMessage());
            LOG.debug("Hydration failed", e);
            return e.getExitCode();
        }
    }
}
