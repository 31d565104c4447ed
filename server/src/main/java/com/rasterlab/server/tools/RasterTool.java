package com.rasterlab.server.tools;

import com.rasterlab.server.service.RasterProcessingService;
import com.rasterlab.server.util.PipelineConfig;
import com.rasterlab.server.util.PipelineConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;

/**
 * Offline tool running the pipeline over .ppm files.
 * Usage: RasterTool <command> <args...>
 */
public class RasterTool {

    private static final Logger logger = LoggerFactory.getLogger(RasterTool.class);

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: RasterTool <command> <args...>",
            "  edges <in.ppm> <out.ppm> [threshold]",
            "  rotate <in.ppm> <out.ppm> <degrees>",
            "  vconcat <top.ppm> <bottom.ppm> <out.ppm>",
            "  hconcat <left.ppm> <right.ppm> <out.ppm>",
            "  pascal <out.ppm> <modulus> <size> [palette]");

    public static void main(String[] args) {
        int status = execute(args, PipelineConfigResolver::resolve);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Builds the service from the supplied config and runs one command.
     *
     * @return process exit status, 0 on success
     */
    static int execute(String[] args, Supplier<PipelineConfig> configSource) {
        if (args.length < 1) {
            System.err.println(USAGE);
            return 1;
        }
        try {
            RasterProcessingService service = new RasterProcessingService(configSource.get());
            run(service, args);
            return 0;
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 1;
        } catch (Exception e) {
            logger.error("{} failed", args[0], e);
            return 1;
        }
    }

    static void run(RasterProcessingService service, String[] args) throws IOException {
        String command = args[0];
        logger.info("Running {}", command);
        switch (command) {
            case "edges": {
                requireArgs(args, 3, 4);
                Double threshold = args.length > 3 ? parseDouble(args[3], "threshold") : null;
                write(args[2], service.detectEdges(read(args[1]), threshold));
                break;
            }
            case "rotate":
                requireArgs(args, 4, 4);
                write(args[2], service.rotate(read(args[1]), parseInt(args[3], "degrees")));
                break;
            case "vconcat":
                requireArgs(args, 4, 4);
                write(args[3], service.concatVertical(read(args[1]), read(args[2])));
                break;
            case "hconcat":
                requireArgs(args, 4, 4);
                write(args[3], service.concatHorizontal(read(args[1]), read(args[2])));
                break;
            case "pascal": {
                requireArgs(args, 4, 5);
                String palette = args.length > 4 ? args[4] : null;
                write(args[1], service.pascal(parseInt(args[2], "modulus"), parseInt(args[3], "size"), palette));
                break;
            }
            default:
                throw new UsageException("Unknown command: " + command);
        }
        logger.info("{} complete", command);
    }

    private static String read(String file) throws IOException {
        return new String(Files.readAllBytes(Paths.get(file)), StandardCharsets.US_ASCII);
    }

    private static void write(String file, String ppm) throws IOException {
        Path path = Paths.get(file);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, ppm.getBytes(StandardCharsets.US_ASCII));
        logger.info("Wrote {}", path.toAbsolutePath());
    }

    private static void requireArgs(String[] args, int min, int max) {
        if (args.length < min || args.length > max) {
            throw new UsageException("Wrong number of arguments for " + args[0]);
        }
    }

    private static int parseInt(String s, String what) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid " + what + ": " + s);
        }
    }

    private static double parseDouble(String s, String what) {
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new UsageException("Invalid " + what + ": " + s);
        }
    }

    static class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }
}
