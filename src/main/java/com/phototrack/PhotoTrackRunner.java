package com.phototrack;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import com.phototrack.exception.PhotoTrackException;
import com.phototrack.service.PhotoSyncService;
import com.phototrack.service.TrackGenerationService;

/**
 * Command line entry point.
 *
 * <pre>
 *   generate &lt;photoDir&gt; [outDir] [--anonymize|-a]
 *   sync &lt;trackFile&gt; &lt;photoDir&gt; [--backup] [--dry-run]
 * </pre>
 *
 * Exit codes: 0 success, 1 fatal error, 2 bad usage.
 */
@Component
public class PhotoTrackRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String RULE = "======================================================================";

    private final TrackGenerationService trackGenerationService;
    private final PhotoSyncService photoSyncService;

    private int exitCode = EXIT_OK;

    public PhotoTrackRunner(TrackGenerationService trackGenerationService, PhotoSyncService photoSyncService) {
        this.trackGenerationService = trackGenerationService;
        this.photoSyncService = photoSyncService;
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] sourceArgs = args.getSourceArgs();
        if (sourceArgs.length == 0) {
            usage("Missing command");
            return;
        }

        String command = sourceArgs[0];
        List<String> positional = new ArrayList<>();
        List<String> flags = new ArrayList<>();
        for (int i = 1; i < sourceArgs.length; i++) {
            if (sourceArgs[i].startsWith("-")) {
                flags.add(sourceArgs[i]);
            } else {
                positional.add(sourceArgs[i]);
            }
        }

        try {
            switch (command) {
                case "generate":
                    runGenerate(positional, flags);
                    break;
                case "sync":
                    runSync(positional, flags);
                    break;
                default:
                    usage("Unknown command: " + command);
            }
        } catch (PhotoTrackException e) {
            System.out.println();
            System.out.println("❌ Error: " + e.getMessage());
            exitCode = EXIT_FAILURE;
        }
    }

    private void runGenerate(List<String> positional, List<String> flags) {
        boolean anonymize = false;
        for (String flag : flags) {
            if ("--anonymize".equals(flag) || "-a".equals(flag)) {
                anonymize = true;
            } else {
                usage("Unknown option for generate: " + flag);
                return;
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            usage("generate expects <photoDir> [outDir]");
            return;
        }

        System.out.println(RULE);
        System.out.println("🗺️  PHOTO GPS TO GPX TRACKER v2.0");
        if (anonymize) {
            System.out.println("🔒 ANONYMIZATION MODE ENABLED");
        }
        System.out.println(RULE);

        Path photoDir = Path.of(positional.get(0));
        Path outDir = positional.size() > 1 ? Path.of(positional.get(1)) : null;
        trackGenerationService.generate(photoDir, outDir, anonymize);

        System.out.println();
        System.out.println("🎉 Done! You can open the GPX file with:");
        System.out.println("   - Google Earth");
        System.out.println("   - https://gpx.studio/");
        System.out.println("   - QGIS");
        System.out.println("   - Garmin BaseCamp");
        exitCode = EXIT_OK;
    }

    private void runSync(List<String> positional, List<String> flags) {
        boolean backup = false;
        boolean dryRun = false;
        for (String flag : flags) {
            if ("--backup".equals(flag)) {
                backup = true;
            } else if ("--dry-run".equals(flag)) {
                dryRun = true;
            } else {
                usage("Unknown option for sync: " + flag);
                return;
            }
        }
        if (positional.size() != 2) {
            usage("sync expects <trackFile> <photoDir>");
            return;
        }

        System.out.println(RULE);
        System.out.println("📷 SYNC GPX → PHOTOS (RAW/JPEG)");
        if (dryRun) {
            System.out.println("🔍 DRY-RUN MODE (simulation)");
        }
        if (backup) {
            System.out.println("💾 BACKUP MODE enabled");
        }
        System.out.println(RULE);

        photoSyncService.sync(Path.of(positional.get(0)), Path.of(positional.get(1)), backup, dryRun);
        exitCode = EXIT_OK;
    }

    private void usage(String problem) {
        System.out.println("❌ " + problem);
        System.out.println();
        System.out.println("Usage:");
        System.out.println("  generate <photoDir> [outDir] [--anonymize|-a]");
        System.out.println("      Build a GPX track from the geotagged photos of a folder");
        System.out.println("  sync <trackFile> <photoDir> [--backup] [--dry-run]");
        System.out.println("      Write GPX positions and place names into photos by capture time");
        exitCode = EXIT_USAGE;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
